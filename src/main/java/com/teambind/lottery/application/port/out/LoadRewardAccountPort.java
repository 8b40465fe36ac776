package com.teambind.lottery.application.port.out;

import com.teambind.lottery.domain.model.RewardAccount;
import com.teambind.lottery.domain.model.RewardInventorySummary;

import java.util.Optional;

/**
 * 리워드 계정 조회 포트
 */
public interface LoadRewardAccountPort {

    Optional<RewardAccount> loadRewardAccount(Long rewardAccountId);

    RewardInventorySummary getInventorySummary();
}
