package com.teambind.lottery.adapter.out.persistence.mapper;

import com.teambind.lottery.adapter.out.persistence.entity.CouponEntity;
import com.teambind.lottery.domain.model.Coupon;
import org.springframework.stereotype.Component;

/**
 * 쿠폰 Entity ↔ Domain 변환
 */
@Component
public class CouponMapper {

    public Coupon toDomain(CouponEntity entity) {
        if (entity == null) {
            return null;
        }
        return Coupon.builder()
                .id(entity.getId())
                .code(entity.getCode())
                .batchId(entity.getBatchId())
                .status(entity.getStatus())
                .createdAt(entity.getCreatedAt())
                .expiresAt(entity.getExpiresAt())
                .createdBy(entity.getCreatedBy())
                .generationMethod(entity.getGenerationMethod())
                .metadata(entity.getMetadata())
                .redeemedAt(entity.getRedeemedAt())
                .redeemedBy(entity.getRedeemedBy())
                .build();
    }
}
