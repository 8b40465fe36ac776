package com.teambind.lottery.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 리워드 배정 요청 DTO
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AssignRewardRequest {

    @NotNull(message = "리워드 계정 ID는 필수입니다")
    @Positive
    private Long rewardAccountId;

    @Size(max = 1000)
    private String notes;
}
