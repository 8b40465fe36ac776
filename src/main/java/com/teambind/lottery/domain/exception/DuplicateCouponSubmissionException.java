package com.teambind.lottery.domain.exception;

import lombok.Getter;

/**
 * 이미 응모 내역이 존재하는 쿠폰으로 다시 응모를 생성하려 할 때 발생
 */
@Getter
public class DuplicateCouponSubmissionException extends RuntimeException {

    private final Long couponId;

    public DuplicateCouponSubmissionException(Long couponId) {
        super("이미 응모 내역이 존재하는 쿠폰입니다 - couponId: " + couponId);
        this.couponId = couponId;
    }

    public DuplicateCouponSubmissionException(Long couponId, Throwable cause) {
        super("이미 응모 내역이 존재하는 쿠폰입니다 - couponId: " + couponId, cause);
        this.couponId = couponId;
    }
}
