package com.teambind.lottery.domain.model;

public enum AuditTargetType {
    COUPON,
    SUBMISSION,
    REWARD_ACCOUNT
}
