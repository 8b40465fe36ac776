package com.teambind.lottery.adapter.out.persistence.entity;

import com.teambind.lottery.domain.model.CouponStatus;
import com.teambind.lottery.domain.model.GenerationMethod;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 쿠폰 JPA 엔티티
 */
@Entity
@Table(name = "coupons",
        indexes = {
                @Index(name = "idx_coupon_status_expires", columnList = "status, expires_at"),
                @Index(name = "idx_coupon_batch", columnList = "batch_id")
        })
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class CouponEntity extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, updatable = false, length = 12)
    private String code;

    @Column(length = 64)
    private String batchId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CouponStatus status;

    private LocalDateTime expiresAt;

    private Long createdBy;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private GenerationMethod generationMethod;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> metadata;

    private LocalDateTime redeemedAt;

    @Column(length = 255)
    private String redeemedBy;
}
