package com.teambind.lottery.adapter.out.persistence.mapper;

import com.teambind.lottery.adapter.out.persistence.entity.SubmissionEntity;
import com.teambind.lottery.domain.model.ClientMeta;
import com.teambind.lottery.domain.model.Submission;
import com.teambind.lottery.domain.model.SubmissionFields;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 응모 Entity ↔ Domain 변환
 */
@Component
public class SubmissionMapper {

    public Submission toDomain(SubmissionEntity entity) {
        if (entity == null) {
            return null;
        }
        return Submission.builder()
                .id(entity.getId())
                .couponId(entity.getCouponId())
                .name(entity.getName())
                .email(entity.getEmail())
                .phone(entity.getPhone())
                .address(entity.getAddress())
                .productExperience(entity.getProductExperience())
                .selectedRewardId(entity.getSelectedRewardId())
                .ipAddress(entity.getIpAddress())
                .userAgent(entity.getUserAgent())
                .additionalData(entity.getAdditionalData())
                .submittedAt(entity.getSubmittedAt())
                .assignedRewardId(entity.getAssignedRewardId())
                .rewardAssignedAt(entity.getRewardAssignedAt())
                .rewardAssignedBy(entity.getRewardAssignedBy())
                .assignmentNotes(entity.getAssignmentNotes())
                .build();
    }

    public SubmissionEntity toNewEntity(Long couponId, SubmissionFields fields, ClientMeta clientMeta,
                                        LocalDateTime submittedAt) {
        return SubmissionEntity.builder()
                .couponId(couponId)
                .name(fields.getName())
                .email(fields.getEmail())
                .phone(fields.getPhone())
                .address(fields.getAddress())
                .productExperience(fields.getProductExperience())
                .selectedRewardId(fields.getSelectedRewardId())
                .additionalData(fields.getAdditionalData())
                .ipAddress(clientMeta.getIpAddress())
                .userAgent(clientMeta.getUserAgent())
                .submittedAt(submittedAt)
                .build();
    }
}
