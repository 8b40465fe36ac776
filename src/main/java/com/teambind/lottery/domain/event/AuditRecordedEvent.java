package com.teambind.lottery.domain.event;

import com.teambind.lottery.domain.model.AuditEntry;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 감사 로그 기록 이벤트
 * 커밋 이후 외부(Kafka)로 발행된다
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AuditRecordedEvent {

    private Long auditId;
    private Long actorId;
    private String action;
    private String targetType;
    private Long targetId;
    private Map<String, Object> before;
    private Map<String, Object> after;
    private LocalDateTime occurredAt;

    public static AuditRecordedEvent from(AuditEntry entry) {
        return new AuditRecordedEvent(
                entry.getId(),
                entry.getActorId(),
                entry.getAction().name(),
                entry.getTargetType().name(),
                entry.getTargetId(),
                entry.getBefore(),
                entry.getAfter(),
                entry.getCreatedAt()
        );
    }

    public String getPartitionKey() {
        return targetType + ":" + targetId;
    }
}
