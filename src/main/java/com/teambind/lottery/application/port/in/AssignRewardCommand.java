package com.teambind.lottery.application.port.in;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.*;

/**
 * 리워드 배정 커맨드
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor
@Builder
@EqualsAndHashCode
public class AssignRewardCommand {

    @NotNull(message = "응모 ID는 필수입니다")
    @Positive(message = "응모 ID는 양수여야 합니다")
    private Long submissionId;

    @NotNull(message = "리워드 계정 ID는 필수입니다")
    @Positive(message = "리워드 계정 ID는 양수여야 합니다")
    private Long rewardAccountId;

    @NotNull(message = "배정 관리자 ID는 필수입니다")
    private Long assignedBy;

    private String notes;

    public static AssignRewardCommand of(Long submissionId, Long rewardAccountId, Long assignedBy) {
        return of(submissionId, rewardAccountId, assignedBy, null);
    }

    public static AssignRewardCommand of(Long submissionId, Long rewardAccountId, Long assignedBy, String notes) {
        return AssignRewardCommand.builder()
                .submissionId(submissionId)
                .rewardAccountId(rewardAccountId)
                .assignedBy(assignedBy)
                .notes(notes)
                .build();
    }
}
