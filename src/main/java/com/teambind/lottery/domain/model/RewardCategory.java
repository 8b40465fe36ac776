package com.teambind.lottery.domain.model;

public enum RewardCategory {
    STREAMING_SERVICE,
    GIFT_CARD,
    SUBSCRIPTION,
    DIGITAL_PRODUCT,
    OTHER
}
