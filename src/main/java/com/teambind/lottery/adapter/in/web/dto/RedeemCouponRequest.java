package com.teambind.lottery.adapter.in.web.dto;

import com.teambind.lottery.domain.model.SubmissionFields;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 쿠폰 사용(응모) 요청 DTO
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RedeemCouponRequest {

    @NotBlank(message = "이름은 필수입니다")
    @Size(max = 100)
    private String name;

    @NotBlank(message = "이메일은 필수입니다")
    @Email(message = "이메일 형식이 올바르지 않습니다")
    private String email;

    @Size(max = 30)
    private String phone;

    @Size(max = 500)
    private String address;

    private String productExperience;

    private Long selectedRewardId;

    private Map<String, Object> additionalData;

    public SubmissionFields toFields() {
        return SubmissionFields.builder()
                .name(name)
                .email(email)
                .phone(phone)
                .address(address)
                .productExperience(productExperience)
                .selectedRewardId(selectedRewardId)
                .additionalData(additionalData)
                .build();
    }
}
