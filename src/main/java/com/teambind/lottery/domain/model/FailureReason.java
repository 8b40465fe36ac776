package com.teambind.lottery.domain.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 유스케이스 실패 사유
 */
@Getter
@RequiredArgsConstructor
public enum FailureReason {
    COUPON_NOT_FOUND(ErrorKind.NOT_FOUND, "쿠폰을 찾을 수 없습니다"),
    COUPON_NOT_ACTIVE(ErrorKind.INVALID_STATE, "사용할 수 없는 상태의 쿠폰입니다"),
    COUPON_EXPIRED(ErrorKind.INVALID_STATE, "만료된 쿠폰입니다"),
    ALREADY_REDEEMED(ErrorKind.INVALID_STATE, "이미 사용된 쿠폰입니다"),
    SUBMISSION_NOT_FOUND(ErrorKind.NOT_FOUND, "응모 내역을 찾을 수 없습니다"),
    REWARD_ACCOUNT_NOT_FOUND(ErrorKind.NOT_FOUND, "리워드 계정을 찾을 수 없습니다"),
    ALREADY_ASSIGNED(ErrorKind.INVALID_STATE, "이미 리워드가 배정된 응모입니다"),
    NOT_ASSIGNED(ErrorKind.INVALID_STATE, "배정된 리워드가 없는 응모입니다"),
    REWARD_NOT_AVAILABLE(ErrorKind.INVALID_STATE, "배정 가능한 상태의 리워드 계정이 아닙니다"),
    NOT_HELD_BY_EXPECTED_HOLDER(ErrorKind.INVALID_STATE, "리워드 계정의 보유자가 일치하지 않습니다"),
    INCONSISTENT_STATE(ErrorKind.INCONSISTENT, "데이터 정합성이 깨졌습니다");

    private final ErrorKind defaultKind;
    private final String message;
}
