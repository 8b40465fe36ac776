package com.teambind.lottery.common.exceptions;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 공통 에러 코드
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    INVALID_INPUT("INVALID_INPUT", HttpStatus.BAD_REQUEST, "잘못된 입력입니다"),
    MISSING_ADMIN_ID("MISSING_ADMIN_ID", HttpStatus.BAD_REQUEST, "관리자 ID가 필요합니다"),
    RATE_LIMIT_EXCEEDED("RATE_LIMIT_EXCEEDED", HttpStatus.TOO_MANY_REQUESTS, "요청 속도 제한을 초과했습니다"),
    INCONSISTENT_STATE("INCONSISTENT_STATE", HttpStatus.INTERNAL_SERVER_ERROR, "데이터 정합성 오류가 발생했습니다"),
    INTERNAL_ERROR("INTERNAL_ERROR", HttpStatus.INTERNAL_SERVER_ERROR, "서버 내부 오류가 발생했습니다");

    private final String errCode;
    private final HttpStatus status;
    private final String defaultMessage;
}
