package com.teambind.lottery.adapter.in.web.dto;

import com.teambind.lottery.application.port.in.BulkAssignRewardCommand;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 리워드 일괄 배정 요청 DTO
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class BulkAssignRewardRequest {

    @NotEmpty(message = "배정 목록은 비어 있을 수 없습니다")
    @Size(max = 500, message = "한 번에 최대 500건까지 배정할 수 있습니다")
    @Valid
    private List<Assignment> assignments;

    @Size(max = 1000)
    private String notes;

    public BulkAssignRewardCommand toCommand(Long adminId) {
        List<BulkAssignRewardCommand.Pair> pairs = assignments.stream()
                .map(a -> BulkAssignRewardCommand.Pair.of(a.getSubmissionId(), a.getRewardAccountId()))
                .toList();
        return BulkAssignRewardCommand.of(pairs, adminId, notes);
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Assignment {
        @NotNull
        private Long submissionId;
        @NotNull
        private Long rewardAccountId;
    }
}
