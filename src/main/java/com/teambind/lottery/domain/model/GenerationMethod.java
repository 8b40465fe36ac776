package com.teambind.lottery.domain.model;

/**
 * 쿠폰 생성 방식
 */
public enum GenerationMethod {
    SINGLE,
    BATCH
}
