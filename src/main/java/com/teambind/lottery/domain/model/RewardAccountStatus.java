package com.teambind.lottery.domain.model;

/**
 * 리워드 계정 상태
 * AVAILABLE ↔ ASSIGNED, EXPIRED 는 종료 상태
 */
public enum RewardAccountStatus {
    AVAILABLE,
    ASSIGNED,
    EXPIRED
}
