package com.teambind.lottery.adapter.out.persistence;

import com.teambind.lottery.adapter.out.persistence.entity.SubmissionEntity;
import com.teambind.lottery.adapter.out.persistence.mapper.SubmissionMapper;
import com.teambind.lottery.adapter.out.persistence.repository.SubmissionRepository;
import com.teambind.lottery.adapter.out.persistence.repository.SubmissionSpecifications;
import com.teambind.lottery.application.port.out.LoadSubmissionPort;
import com.teambind.lottery.application.port.out.SaveSubmissionPort;
import com.teambind.lottery.domain.exception.DuplicateCouponSubmissionException;
import com.teambind.lottery.domain.model.ClientMeta;
import com.teambind.lottery.domain.model.Submission;
import com.teambind.lottery.domain.model.SubmissionFields;
import com.teambind.lottery.domain.model.SubmissionSearchCondition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 응모 영속성 어댑터
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubmissionPersistenceAdapter implements LoadSubmissionPort, SaveSubmissionPort {

    private final SubmissionRepository submissionRepository;
    private final SubmissionMapper submissionMapper;
    private final Clock clock;

    @Override
    public Optional<Submission> loadSubmission(Long submissionId) {
        return submissionRepository.findById(submissionId)
                .map(submissionMapper::toDomain);
    }

    @Override
    public Optional<AssignmentSnapshot> loadAssignmentSnapshot(Long submissionId) {
        return submissionRepository.findAssignmentRow(submissionId).stream()
                .findFirst()
                .map(row -> new AssignmentSnapshot((Long) row[0], (Long) row[1]));
    }

    @Override
    public List<Submission> loadWithoutAssignment() {
        return submissionRepository.findByAssignedRewardIdIsNullOrderBySubmittedAtAsc().stream()
                .map(submissionMapper::toDomain)
                .toList();
    }

    @Override
    public Optional<Submission> loadByAssignedReward(Long rewardAccountId) {
        return submissionRepository.findByAssignedRewardId(rewardAccountId)
                .map(submissionMapper::toDomain);
    }

    @Override
    public Page<Submission> search(SubmissionSearchCondition condition, Pageable pageable) {
        return submissionRepository.findAll(SubmissionSpecifications.matching(condition), pageable)
                .map(submissionMapper::toDomain);
    }

    @Override
    public List<Submission> loadRecent(int limit) {
        return submissionRepository.findAllByOrderBySubmittedAtDesc(PageRequest.of(0, limit)).stream()
                .map(submissionMapper::toDomain)
                .toList();
    }

    @Override
    public long countAll() {
        return submissionRepository.count();
    }

    @Override
    public long countWithAssignment() {
        return submissionRepository.countByAssignedRewardIdIsNotNull();
    }

    @Override
    public Submission create(Long couponId, SubmissionFields fields, ClientMeta clientMeta, LocalDateTime submittedAt) {
        if (submissionRepository.existsByCouponId(couponId)) {
            throw new DuplicateCouponSubmissionException(couponId);
        }

        SubmissionEntity entity = submissionMapper.toNewEntity(couponId, fields, clientMeta, submittedAt);
        try {
            SubmissionEntity saved = submissionRepository.saveAndFlush(entity);
            log.debug("응모 생성 - submissionId: {}, couponId: {}", saved.getId(), couponId);
            return submissionMapper.toDomain(saved);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateCouponSubmissionException(couponId, e);
        }
    }

    @Override
    public boolean setAssignment(Long submissionId, Long rewardAccountId, Long assignedBy, String notes,
                                 LocalDateTime assignedAt) {
        return submissionRepository.assignIfEmpty(submissionId, rewardAccountId, assignedBy, notes, assignedAt) == 1;
    }

    @Override
    public boolean clearAssignment(Long submissionId, Long expectedRewardAccountId) {
        return submissionRepository.clearIfAssignedTo(
                submissionId, expectedRewardAccountId, LocalDateTime.now(clock)) == 1;
    }

    @Override
    public boolean deleteIfUnassigned(Long submissionId) {
        return submissionRepository.deleteUnassigned(submissionId) == 1;
    }
}
