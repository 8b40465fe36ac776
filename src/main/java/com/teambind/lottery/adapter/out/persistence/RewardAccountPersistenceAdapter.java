package com.teambind.lottery.adapter.out.persistence;

import com.teambind.lottery.adapter.out.persistence.mapper.RewardAccountMapper;
import com.teambind.lottery.adapter.out.persistence.repository.RewardAccountRepository;
import com.teambind.lottery.application.port.out.LoadRewardAccountPort;
import com.teambind.lottery.application.port.out.RewardInventoryPort;
import com.teambind.lottery.domain.model.RewardAccount;
import com.teambind.lottery.domain.model.RewardAccountStatus;
import com.teambind.lottery.domain.model.RewardCategory;
import com.teambind.lottery.domain.model.RewardInventorySummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 리워드 계정 영속성 어댑터
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RewardAccountPersistenceAdapter implements LoadRewardAccountPort, RewardInventoryPort {

    private final RewardAccountRepository rewardAccountRepository;
    private final RewardAccountMapper rewardAccountMapper;
    private final Clock clock;

    @Override
    public Optional<RewardAccount> loadRewardAccount(Long rewardAccountId) {
        return rewardAccountRepository.findById(rewardAccountId)
                .map(rewardAccountMapper::toDomain);
    }

    @Override
    public RewardInventorySummary getInventorySummary() {
        Map<RewardAccountStatus, Long> byStatus = new EnumMap<>(RewardAccountStatus.class);
        for (RewardAccountStatus status : RewardAccountStatus.values()) {
            byStatus.put(status, 0L);
        }
        Map<RewardCategory, Map<RewardAccountStatus, Long>> byCategory = new EnumMap<>(RewardCategory.class);
        long total = 0;

        for (Object[] row : rewardAccountRepository.countGroupByCategoryAndStatus()) {
            RewardCategory category = (RewardCategory) row[0];
            RewardAccountStatus status = (RewardAccountStatus) row[1];
            long count = (Long) row[2];

            byStatus.merge(status, count, Long::sum);
            byCategory.computeIfAbsent(category, c -> new EnumMap<>(RewardAccountStatus.class))
                    .merge(status, count, Long::sum);
            total += count;
        }

        return RewardInventorySummary.builder()
                .total(total)
                .byStatus(byStatus)
                .byCategory(byCategory)
                .build();
    }

    @Override
    public Reservation tryReserve(Long rewardAccountId, Long holderSubmissionId, LocalDateTime reservedAt) {
        int updated = rewardAccountRepository.reserveIfAvailable(
                rewardAccountId, holderSubmissionId,
                RewardAccountStatus.AVAILABLE, RewardAccountStatus.ASSIGNED, reservedAt);

        if (updated == 0) {
            log.debug("리워드 점유 조건부 업데이트 미적용 - rewardAccountId: {}, holder: {}",
                    rewardAccountId, holderSubmissionId);
            return Reservation.NOT_AVAILABLE;
        }
        return Reservation.RESERVED;
    }

    @Override
    public Release release(Long rewardAccountId, Long expectedHolderSubmissionId) {
        int updated = rewardAccountRepository.releaseIfHeldBy(
                rewardAccountId, expectedHolderSubmissionId,
                RewardAccountStatus.ASSIGNED, RewardAccountStatus.AVAILABLE, LocalDateTime.now(clock));

        if (updated == 0) {
            log.debug("리워드 해제 조건부 업데이트 미적용 - rewardAccountId: {}, expectedHolder: {}",
                    rewardAccountId, expectedHolderSubmissionId);
            return Release.NOT_HELD_BY_EXPECTED_HOLDER;
        }
        return Release.RELEASED;
    }

    @Override
    public boolean tryExpire(Long rewardAccountId) {
        return rewardAccountRepository.transitionIfStatus(
                rewardAccountId, RewardAccountStatus.AVAILABLE, RewardAccountStatus.EXPIRED,
                LocalDateTime.now(clock)) == 1;
    }
}
