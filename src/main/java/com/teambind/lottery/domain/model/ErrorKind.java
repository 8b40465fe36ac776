package com.teambind.lottery.domain.model;

/**
 * 실패 분류
 * CONFLICT 는 동시 요청 경쟁에서 진 경우로 정상 부하에서도 발생한다
 * INCONSISTENT 는 내부 불변식이 깨진 경우로 운영자 알림 대상이다
 */
public enum ErrorKind {
    NOT_FOUND,
    INVALID_STATE,
    CONFLICT,
    INCONSISTENT
}
