package com.teambind.lottery.adapter.out.persistence.entity;

import com.teambind.lottery.domain.model.AuditAction;
import com.teambind.lottery.domain.model.AuditTargetType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 감사 로그 JPA 엔티티 (추가 전용)
 */
@Entity
@Immutable
@Table(name = "audit_logs",
        indexes = {
                @Index(name = "idx_audit_target", columnList = "target_type, target_id"),
                @Index(name = "idx_audit_created_at", columnList = "created_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class AuditLogEntity {

    @Id
    private Long id; // Snowflake ID

    @Column(nullable = false)
    private Long actorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private AuditAction action;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AuditTargetType targetType;

    private Long targetId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> beforeSnapshot;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> afterSnapshot;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
