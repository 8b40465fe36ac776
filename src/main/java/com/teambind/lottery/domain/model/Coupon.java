package com.teambind.lottery.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 쿠폰 도메인 모델
 * 코드는 생성 후 변경되지 않으며, 상태 전이는 저장소의 조건부 업데이트로만 일어난다
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
public class Coupon {

    private final Long id;
    private final String code;
    private final String batchId;
    private final CouponStatus status;
    private final LocalDateTime createdAt;
    private final LocalDateTime expiresAt;
    private final Long createdBy;
    private final GenerationMethod generationMethod;
    private final Map<String, Object> metadata;
    private final LocalDateTime redeemedAt;
    private final String redeemedBy;

    public boolean isActive() {
        return status == CouponStatus.ACTIVE;
    }

    /**
     * 만료 시각이 지났는지 확인 (상태가 아직 EXPIRED 로 바뀌지 않았더라도)
     */
    public boolean isExpiredAt(LocalDateTime now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
