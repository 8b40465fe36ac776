package com.teambind.lottery.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 리워드 재고 현황 (상태별, 카테고리별 상태 건수)
 */
@Value
@Builder
public class RewardInventorySummary {
    long total;
    Map<RewardAccountStatus, Long> byStatus;
    Map<RewardCategory, Map<RewardAccountStatus, Long>> byCategory;

    public long countOf(RewardAccountStatus status) {
        return byStatus.getOrDefault(status, 0L);
    }

    public long countOf(RewardCategory category, RewardAccountStatus status) {
        return byCategory.getOrDefault(category, Map.of()).getOrDefault(status, 0L);
    }
}
