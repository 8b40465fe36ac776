package com.teambind.lottery.adapter.out.persistence.entity;

import com.teambind.lottery.domain.model.RewardAccountStatus;
import com.teambind.lottery.domain.model.RewardCategory;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 리워드 계정 JPA 엔티티
 */
@Entity
@Table(name = "reward_accounts",
        indexes = {
                @Index(name = "idx_reward_status_category", columnList = "status, category"),
                @Index(name = "idx_reward_holder", columnList = "holder_submission_id")
        })
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class RewardAccountEntity extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String serviceType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private RewardCategory category;

    @Column(length = 50)
    private String subscriptionDuration;

    @Column(length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RewardAccountStatus status;

    private Long holderSubmissionId;

    private LocalDateTime assignedAt;

    private Long createdBy;
}
