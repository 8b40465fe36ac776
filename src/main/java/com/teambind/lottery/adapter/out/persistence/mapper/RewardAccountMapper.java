package com.teambind.lottery.adapter.out.persistence.mapper;

import com.teambind.lottery.adapter.out.persistence.entity.RewardAccountEntity;
import com.teambind.lottery.domain.model.RewardAccount;
import org.springframework.stereotype.Component;

/**
 * 리워드 계정 Entity ↔ Domain 변환
 */
@Component
public class RewardAccountMapper {

    public RewardAccount toDomain(RewardAccountEntity entity) {
        if (entity == null) {
            return null;
        }
        return RewardAccount.builder()
                .id(entity.getId())
                .serviceType(entity.getServiceType())
                .category(entity.getCategory())
                .subscriptionDuration(entity.getSubscriptionDuration())
                .description(entity.getDescription())
                .status(entity.getStatus())
                .holderSubmissionId(entity.getHolderSubmissionId())
                .assignedAt(entity.getAssignedAt())
                .createdBy(entity.getCreatedBy())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
