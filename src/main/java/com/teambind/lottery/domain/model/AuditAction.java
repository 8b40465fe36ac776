package com.teambind.lottery.domain.model;

public enum AuditAction {
    COUPON_REDEEMED,
    COUPON_EXPIRED,
    COUPON_DEACTIVATED,
    COUPON_EXPIRY_SWEEP,
    REWARD_ASSIGNED,
    REWARD_UNASSIGNED,
    REWARD_EXPIRED,
    SUBMISSION_DELETED
}
