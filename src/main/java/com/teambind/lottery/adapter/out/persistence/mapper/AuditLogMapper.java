package com.teambind.lottery.adapter.out.persistence.mapper;

import com.teambind.lottery.adapter.out.persistence.entity.AuditLogEntity;
import com.teambind.lottery.domain.model.AuditEntry;
import org.springframework.stereotype.Component;

@Component
public class AuditLogMapper {

    public AuditEntry toDomain(AuditLogEntity entity) {
        return AuditEntry.builder()
                .id(entity.getId())
                .actorId(entity.getActorId())
                .action(entity.getAction())
                .targetType(entity.getTargetType())
                .targetId(entity.getTargetId())
                .before(entity.getBeforeSnapshot())
                .after(entity.getAfterSnapshot())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    public AuditLogEntity toEntity(AuditEntry entry, Long id) {
        return AuditLogEntity.builder()
                .id(id)
                .actorId(entry.getActorId())
                .action(entry.getAction())
                .targetType(entry.getTargetType())
                .targetId(entry.getTargetId())
                .beforeSnapshot(entry.getBefore())
                .afterSnapshot(entry.getAfter())
                .createdAt(entry.getCreatedAt())
                .build();
    }
}
