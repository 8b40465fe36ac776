package com.teambind.lottery.adapter.out.persistence;

import com.teambind.lottery.adapter.out.persistence.entity.AuditLogEntity;
import com.teambind.lottery.adapter.out.persistence.mapper.AuditLogMapper;
import com.teambind.lottery.adapter.out.persistence.repository.AuditLogRepository;
import com.teambind.lottery.application.port.out.AppendAuditLogPort;
import com.teambind.lottery.common.util.SnowflakeIdGenerator;
import com.teambind.lottery.domain.model.AuditEntry;
import com.teambind.lottery.domain.model.AuditTargetType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 감사 로그 영속성 어댑터
 */
@Component
@RequiredArgsConstructor
public class AuditLogPersistenceAdapter implements AppendAuditLogPort {

    private final AuditLogRepository auditLogRepository;
    private final AuditLogMapper auditLogMapper;
    private final SnowflakeIdGenerator idGenerator;

    @Override
    public AuditEntry append(AuditEntry entry) {
        AuditLogEntity entity = auditLogMapper.toEntity(entry, idGenerator.nextId());
        return auditLogMapper.toDomain(auditLogRepository.save(entity));
    }

    @Override
    public List<AuditEntry> loadByTarget(AuditTargetType targetType, Long targetId) {
        return auditLogRepository.findByTargetTypeAndTargetIdOrderByIdAsc(targetType, targetId).stream()
                .map(auditLogMapper::toDomain)
                .toList();
    }
}
