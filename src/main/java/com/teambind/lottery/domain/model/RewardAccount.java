package com.teambind.lottery.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * 리워드 계정 도메인 모델
 * status == ASSIGNED 인 경우에만 holderSubmissionId 가 존재한다
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
public class RewardAccount {

    private final Long id;
    private final String serviceType;
    private final RewardCategory category;
    private final String subscriptionDuration;
    private final String description;
    private final RewardAccountStatus status;
    private final Long holderSubmissionId;
    private final LocalDateTime assignedAt;
    private final Long createdBy;
    private final LocalDateTime createdAt;

    public boolean isAvailable() {
        return status == RewardAccountStatus.AVAILABLE;
    }

    public boolean isHeldBy(Long submissionId) {
        return status == RewardAccountStatus.ASSIGNED
                && holderSubmissionId != null
                && holderSubmissionId.equals(submissionId);
    }
}
