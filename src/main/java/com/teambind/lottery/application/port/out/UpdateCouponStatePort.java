package com.teambind.lottery.application.port.out;

import java.time.LocalDateTime;

/**
 * 쿠폰 상태 전이 포트
 * 모든 전이는 "status = ACTIVE 인 경우에만" 적용되는 단일 조건부 업데이트이다
 */
public interface UpdateCouponStatePort {

    /**
     * ACTIVE → REDEEMED
     */
    RedeemMark tryMarkRedeemed(Long couponId, String redeemedBy, LocalDateTime redeemedAt);

    /**
     * ACTIVE 이고 expiresAt <= asOf 인 단일 쿠폰을 EXPIRED 로 전이
     */
    boolean tryMarkExpired(Long couponId, LocalDateTime asOf);

    /**
     * ACTIVE 이고 expiresAt <= asOf 인 모든 쿠폰을 EXPIRED 로 전이
     *
     * @return 전이된 건수
     */
    int markExpiredBatch(LocalDateTime asOf);

    /**
     * ACTIVE → DEACTIVATED
     */
    boolean tryDeactivate(Long couponId);

    enum RedeemMark {
        MARKED,
        ALREADY_CONSUMED,
        NOT_ACTIVE
    }
}
