package com.teambind.lottery.application.port.in;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.List;

/**
 * 리워드 일괄 배정 커맨드
 * 각 쌍은 서로 독립적으로 목록 순서대로 처리된다
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor
@Builder
@EqualsAndHashCode
public class BulkAssignRewardCommand {

    @NotEmpty(message = "배정 목록은 비어 있을 수 없습니다")
    @Valid
    private List<Pair> pairs;

    @NotNull(message = "배정 관리자 ID는 필수입니다")
    private Long assignedBy;

    private String notes;

    public static BulkAssignRewardCommand of(List<Pair> pairs, Long assignedBy, String notes) {
        return BulkAssignRewardCommand.builder()
                .pairs(pairs)
                .assignedBy(assignedBy)
                .notes(notes)
                .build();
    }

    @Getter
    @AllArgsConstructor(staticName = "of")
    @EqualsAndHashCode
    public static class Pair {
        @NotNull
        private final Long submissionId;
        @NotNull
        private final Long rewardAccountId;
    }
}
