package com.teambind.lottery.application.port.in;

import com.teambind.lottery.domain.model.CouponStatus;
import com.teambind.lottery.domain.model.RewardAccountStatus;
import com.teambind.lottery.domain.model.RewardCategory;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 재고 현황 조회 유스케이스
 * 현재 엔티티 상태별 건수만 제공하며 별도의 집계 로직은 없다
 */
public interface GetInventoryStatisticsUseCase {

    InventoryStatistics getInventoryStatistics();

    @Value
    @Builder
    class InventoryStatistics {
        Map<CouponStatus, Long> couponsByStatus;
        Map<RewardAccountStatus, Long> rewardAccountsByStatus;
        Map<RewardCategory, Map<RewardAccountStatus, Long>> rewardAccountsByCategory;
        long totalSubmissions;
        long submissionsWithAssignment;
        long submissionsWithoutAssignment;
        double assignmentRate;
    }
}
