package com.teambind.lottery.adapter.in.web;

import com.teambind.lottery.domain.model.ErrorKind;
import com.teambind.lottery.domain.model.FailureReason;
import org.springframework.http.HttpStatus;

/**
 * 실패 분류 → HTTP 상태 코드
 */
final class ResultStatusMapper {

    private ResultStatusMapper() {
    }

    static HttpStatus toStatus(ErrorKind kind, FailureReason reason) {
        if (reason == FailureReason.COUPON_EXPIRED) {
            return HttpStatus.GONE;
        }
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_STATE, CONFLICT -> HttpStatus.CONFLICT;
            case INCONSISTENT -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
