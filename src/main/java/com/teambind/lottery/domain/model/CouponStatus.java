package com.teambind.lottery.domain.model;

/**
 * 쿠폰 상태
 * ACTIVE 에서만 다른 상태로 전이되며 나머지는 모두 종료 상태
 */
public enum CouponStatus {
    ACTIVE,
    REDEEMED,
    EXPIRED,
    DEACTIVATED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
