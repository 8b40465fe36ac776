package com.teambind.lottery.adapter.out.persistence.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 응모 JPA 엔티티
 * coupon_id 유니크 제약으로 쿠폰당 응모 1건을 보장
 */
@Entity
@Table(name = "submissions",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_submission_coupon", columnNames = "coupon_id"),
                @UniqueConstraint(name = "uk_submission_assigned_reward", columnNames = "assigned_reward_id")
        },
        indexes = {
                @Index(name = "idx_submission_email", columnList = "email"),
                @Index(name = "idx_submission_submitted_at", columnList = "submitted_at")
        })
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class SubmissionEntity extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long couponId;

    @Column(length = 100)
    private String name;

    @Column(length = 255)
    private String email;

    @Column(length = 30)
    private String phone;

    @Column(length = 500)
    private String address;

    @Column(columnDefinition = "text")
    private String productExperience;

    private Long selectedRewardId;

    @Column(length = 45)
    private String ipAddress;

    @Column(length = 500)
    private String userAgent;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> additionalData;

    @Column(nullable = false)
    private LocalDateTime submittedAt;

    private Long assignedRewardId;

    private LocalDateTime rewardAssignedAt;

    private Long rewardAssignedBy;

    @Column(length = 1000)
    private String assignmentNotes;
}
