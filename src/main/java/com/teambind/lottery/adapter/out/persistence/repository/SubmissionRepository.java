package com.teambind.lottery.adapter.out.persistence.repository;

import com.teambind.lottery.adapter.out.persistence.entity.SubmissionEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 응모 JPA Repository
 */
public interface SubmissionRepository extends JpaRepository<SubmissionEntity, Long>,
        JpaSpecificationExecutor<SubmissionEntity> {

    boolean existsByCouponId(Long couponId);

    Optional<SubmissionEntity> findByAssignedRewardId(Long assignedRewardId);

    List<SubmissionEntity> findByAssignedRewardIdIsNullOrderBySubmittedAtAsc();

    List<SubmissionEntity> findAllByOrderBySubmittedAtDesc(Pageable pageable);

    long countByAssignedRewardIdIsNotNull();

    @Query("SELECT s.id, s.assignedRewardId FROM SubmissionEntity s WHERE s.id = :id")
    List<Object[]> findAssignmentRow(@Param("id") Long id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE SubmissionEntity s " +
            "SET s.assignedRewardId = :rewardId, s.rewardAssignedAt = :at, s.rewardAssignedBy = :assignedBy, " +
            "    s.assignmentNotes = :notes, s.updatedAt = :at " +
            "WHERE s.id = :id AND s.assignedRewardId IS NULL")
    int assignIfEmpty(@Param("id") Long id,
                      @Param("rewardId") Long rewardAccountId,
                      @Param("assignedBy") Long assignedBy,
                      @Param("notes") String notes,
                      @Param("at") LocalDateTime at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE SubmissionEntity s " +
            "SET s.assignedRewardId = NULL, s.rewardAssignedAt = NULL, s.rewardAssignedBy = NULL, " +
            "    s.assignmentNotes = NULL, s.updatedAt = :at " +
            "WHERE s.id = :id AND s.assignedRewardId = :rewardId")
    int clearIfAssignedTo(@Param("id") Long id,
                          @Param("rewardId") Long expectedRewardAccountId,
                          @Param("at") LocalDateTime at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM SubmissionEntity s WHERE s.id = :id AND s.assignedRewardId IS NULL")
    int deleteUnassigned(@Param("id") Long id);
}
