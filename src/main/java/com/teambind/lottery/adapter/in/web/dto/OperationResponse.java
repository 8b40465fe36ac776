package com.teambind.lottery.adapter.in.web.dto;

import com.teambind.lottery.domain.model.ErrorKind;
import com.teambind.lottery.domain.model.FailureReason;
import lombok.Builder;
import lombok.Value;

/**
 * 상태 변경 요청 공통 응답
 */
@Value
@Builder
public class OperationResponse<T> {
    boolean success;
    String code;
    ErrorKind errorKind;
    String message;
    T data;

    public static <T> OperationResponse<T> success(T data) {
        return OperationResponse.<T>builder()
                .success(true)
                .code("OK")
                .data(data)
                .build();
    }

    public static <T> OperationResponse<T> failure(FailureReason reason, ErrorKind kind, String message) {
        return OperationResponse.<T>builder()
                .success(false)
                .code(reason.name())
                .errorKind(kind)
                .message(message)
                .build();
    }
}
