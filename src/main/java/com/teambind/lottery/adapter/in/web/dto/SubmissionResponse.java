package com.teambind.lottery.adapter.in.web.dto;

import com.teambind.lottery.domain.model.Submission;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 응모 응답 DTO
 */
@Value
@Builder
public class SubmissionResponse {
    Long id;
    Long couponId;
    String name;
    String email;
    String phone;
    Long selectedRewardId;
    LocalDateTime submittedAt;
    Long assignedRewardId;
    LocalDateTime rewardAssignedAt;
    Long rewardAssignedBy;
    String assignmentNotes;

    public static SubmissionResponse from(Submission submission) {
        if (submission == null) {
            return null;
        }
        return SubmissionResponse.builder()
                .id(submission.getId())
                .couponId(submission.getCouponId())
                .name(submission.getName())
                .email(submission.getEmail())
                .phone(submission.getPhone())
                .selectedRewardId(submission.getSelectedRewardId())
                .submittedAt(submission.getSubmittedAt())
                .assignedRewardId(submission.getAssignedRewardId())
                .rewardAssignedAt(submission.getRewardAssignedAt())
                .rewardAssignedBy(submission.getRewardAssignedBy())
                .assignmentNotes(submission.getAssignmentNotes())
                .build();
    }
}
