package com.teambind.lottery.adapter.out.persistence.repository;

import com.teambind.lottery.adapter.out.persistence.entity.RewardAccountEntity;
import com.teambind.lottery.domain.model.RewardAccountStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 리워드 계정 JPA Repository
 */
public interface RewardAccountRepository extends JpaRepository<RewardAccountEntity, Long> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RewardAccountEntity r " +
            "SET r.status = :assigned, r.holderSubmissionId = :holder, r.assignedAt = :at, r.updatedAt = :at " +
            "WHERE r.id = :id AND r.status = :available")
    int reserveIfAvailable(@Param("id") Long id,
                           @Param("holder") Long holderSubmissionId,
                           @Param("available") RewardAccountStatus available,
                           @Param("assigned") RewardAccountStatus assigned,
                           @Param("at") LocalDateTime at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RewardAccountEntity r " +
            "SET r.status = :available, r.holderSubmissionId = NULL, r.assignedAt = NULL, r.updatedAt = :at " +
            "WHERE r.id = :id AND r.status = :assigned AND r.holderSubmissionId = :holder")
    int releaseIfHeldBy(@Param("id") Long id,
                        @Param("holder") Long expectedHolderSubmissionId,
                        @Param("assigned") RewardAccountStatus assigned,
                        @Param("available") RewardAccountStatus available,
                        @Param("at") LocalDateTime at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RewardAccountEntity r SET r.status = :to, r.updatedAt = :at WHERE r.id = :id AND r.status = :from")
    int transitionIfStatus(@Param("id") Long id,
                           @Param("from") RewardAccountStatus from,
                           @Param("to") RewardAccountStatus to,
                           @Param("at") LocalDateTime at);

    @Query("SELECT r.category, r.status, COUNT(r) FROM RewardAccountEntity r GROUP BY r.category, r.status")
    List<Object[]> countGroupByCategoryAndStatus();
}
