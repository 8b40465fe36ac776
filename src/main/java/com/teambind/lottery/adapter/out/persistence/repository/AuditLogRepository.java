package com.teambind.lottery.adapter.out.persistence.repository;

import com.teambind.lottery.adapter.out.persistence.entity.AuditLogEntity;
import com.teambind.lottery.domain.model.AuditTargetType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLogEntity, Long> {

    List<AuditLogEntity> findByTargetTypeAndTargetIdOrderByIdAsc(AuditTargetType targetType, Long targetId);
}
