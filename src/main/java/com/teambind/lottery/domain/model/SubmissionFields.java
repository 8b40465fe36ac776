package com.teambind.lottery.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 응모자가 입력한 항목 (형식 검증은 요청 계층에서 끝난 상태로 전달된다)
 */
@Value
@Builder
public class SubmissionFields {
    String name;
    String email;
    String phone;
    String address;
    String productExperience;
    Long selectedRewardId;
    Map<String, Object> additionalData;
}
