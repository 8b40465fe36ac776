package com.teambind.lottery.application.service;

import com.teambind.lottery.application.port.in.GetInventoryStatisticsUseCase;
import com.teambind.lottery.application.port.in.QuerySubmissionUseCase;
import com.teambind.lottery.application.port.out.LoadCouponPort;
import com.teambind.lottery.application.port.out.LoadRewardAccountPort;
import com.teambind.lottery.application.port.out.LoadSubmissionPort;
import com.teambind.lottery.domain.model.RewardInventorySummary;
import com.teambind.lottery.domain.model.Submission;
import com.teambind.lottery.domain.model.SubmissionSearchCondition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * 응모 내역 및 재고 현황 조회 서비스
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class InventoryQueryService implements QuerySubmissionUseCase, GetInventoryStatisticsUseCase {

    private static final int MAX_RECENT_LIMIT = 100;

    private final LoadCouponPort loadCouponPort;
    private final LoadRewardAccountPort loadRewardAccountPort;
    private final LoadSubmissionPort loadSubmissionPort;

    @Override
    public Optional<Submission> findById(Long submissionId) {
        return loadSubmissionPort.loadSubmission(submissionId);
    }

    @Override
    public List<Submission> findWithoutAssignment() {
        return loadSubmissionPort.loadWithoutAssignment();
    }

    @Override
    public Optional<Submission> findByAssignedReward(Long rewardAccountId) {
        return loadSubmissionPort.loadByAssignedReward(rewardAccountId);
    }

    @Override
    public Page<Submission> search(SubmissionSearchCondition condition, Pageable pageable) {
        return loadSubmissionPort.search(condition, pageable);
    }

    @Override
    public List<Submission> findRecent(int limit) {
        return loadSubmissionPort.loadRecent(Math.max(1, Math.min(limit, MAX_RECENT_LIMIT)));
    }

    @Override
    public InventoryStatistics getInventoryStatistics() {
        log.info("재고 현황 조회");

        RewardInventorySummary rewardSummary = loadRewardAccountPort.getInventorySummary();
        long total = loadSubmissionPort.countAll();
        long withAssignment = loadSubmissionPort.countWithAssignment();

        return InventoryStatistics.builder()
                .couponsByStatus(loadCouponPort.countByStatus())
                .rewardAccountsByStatus(rewardSummary.getByStatus())
                .rewardAccountsByCategory(rewardSummary.getByCategory())
                .totalSubmissions(total)
                .submissionsWithAssignment(withAssignment)
                .submissionsWithoutAssignment(total - withAssignment)
                .assignmentRate(total == 0 ? 0.0 : Math.round(withAssignment * 10000.0 / total) / 100.0)
                .build();
    }
}
