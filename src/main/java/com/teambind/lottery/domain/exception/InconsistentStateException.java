package com.teambind.lottery.domain.exception;

import lombok.Getter;

/**
 * 두 번째 저장소 변경이 첫 번째 변경 이후 실패하는 등 내부 불변식이 깨졌을 때 발생
 * 트랜잭션 단위 전체를 롤백시키며 절대 삼키지 않는다
 */
@Getter
public class InconsistentStateException extends RuntimeException {

    private final String operation;
    private final Long targetId;

    public InconsistentStateException(String operation, Long targetId, String message) {
        super(message);
        this.operation = operation;
        this.targetId = targetId;
    }

    public InconsistentStateException(String operation, Long targetId, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.targetId = targetId;
    }
}
