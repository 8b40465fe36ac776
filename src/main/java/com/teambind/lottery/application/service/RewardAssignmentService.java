package com.teambind.lottery.application.service;

import com.teambind.lottery.application.port.in.AssignRewardCommand;
import com.teambind.lottery.application.port.in.AssignRewardUseCase;
import com.teambind.lottery.application.port.out.LoadRewardAccountPort;
import com.teambind.lottery.application.port.out.LoadSubmissionPort;
import com.teambind.lottery.application.port.out.LoadSubmissionPort.AssignmentSnapshot;
import com.teambind.lottery.application.port.out.RewardInventoryPort;
import com.teambind.lottery.application.port.out.RewardInventoryPort.Release;
import com.teambind.lottery.application.port.out.RewardInventoryPort.Reservation;
import com.teambind.lottery.application.port.out.SaveSubmissionPort;
import com.teambind.lottery.domain.exception.InconsistentStateException;
import com.teambind.lottery.domain.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 리워드 배정 서비스
 * 리워드 점유와 응모 배정 기록을 하나의 트랜잭션으로 묶는다
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RewardAssignmentService implements AssignRewardUseCase {

    private final LoadSubmissionPort loadSubmissionPort;
    private final SaveSubmissionPort saveSubmissionPort;
    private final LoadRewardAccountPort loadRewardAccountPort;
    private final RewardInventoryPort rewardInventoryPort;
    private final AuditLogService auditLogService;
    private final Clock clock;

    @Override
    @Transactional
    public AssignmentResult assign(AssignRewardCommand command) {
        Long submissionId = command.getSubmissionId();
        Long rewardAccountId = command.getRewardAccountId();
        log.info("리워드 배정 시작 - submissionId: {}, rewardAccountId: {}, assignedBy: {}",
                submissionId, rewardAccountId, command.getAssignedBy());

        // 1. 대상 조회
        Optional<Submission> foundSubmission = loadSubmissionPort.loadSubmission(submissionId);
        if (foundSubmission.isEmpty()) {
            return AssignmentResult.failure(submissionId, rewardAccountId, FailureReason.SUBMISSION_NOT_FOUND);
        }
        Optional<RewardAccount> foundReward = loadRewardAccountPort.loadRewardAccount(rewardAccountId);
        if (foundReward.isEmpty()) {
            return AssignmentResult.failure(submissionId, rewardAccountId, FailureReason.REWARD_ACCOUNT_NOT_FOUND);
        }

        Submission submission = foundSubmission.get();
        RewardAccount rewardAccount = foundReward.get();

        // 2. 이미 배정된 응모는 점유 시도 없이 거절
        if (submission.hasAssignment()) {
            log.info("리워드 배정 실패 - 이미 배정된 응모 - submissionId: {}, assignedRewardId: {}",
                    submissionId, submission.getAssignedRewardId());
            return AssignmentResult.failure(submissionId, rewardAccountId, FailureReason.ALREADY_ASSIGNED);
        }

        // 3. 조건부 점유 (AVAILABLE → ASSIGNED)
        LocalDateTime now = LocalDateTime.now(clock);
        Reservation reservation = rewardInventoryPort.tryReserve(rewardAccountId, submissionId, now);
        if (reservation == Reservation.NOT_AVAILABLE) {
            ErrorKind kind = rewardAccount.isAvailable() ? ErrorKind.CONFLICT : ErrorKind.INVALID_STATE;
            log.debug("리워드 점유 실패 - rewardAccountId: {}, kind: {}", rewardAccountId, kind);
            return AssignmentResult.failure(submissionId, rewardAccountId, FailureReason.REWARD_NOT_AVAILABLE, kind);
        }

        // 4. 응모에 배정 기록, 실패 시 점유 해제
        boolean applied = saveSubmissionPort.setAssignment(
                submissionId, rewardAccountId, command.getAssignedBy(), command.getNotes(), now);
        if (!applied) {
            releaseOrFail(rewardAccountId, submissionId, "assign");
            log.debug("리워드 배정 경합 - 다른 요청이 먼저 배정 - submissionId: {}", submissionId);
            return AssignmentResult.conflict(submissionId, rewardAccountId, FailureReason.ALREADY_ASSIGNED);
        }

        // 5. 감사 로그
        Map<String, Object> after = new LinkedHashMap<>();
        after.put("assignedRewardId", rewardAccountId);
        after.put("rewardStatus", RewardAccountStatus.ASSIGNED.name());
        after.put("notes", command.getNotes());
        auditLogService.record(command.getAssignedBy(), AuditAction.REWARD_ASSIGNED, AuditTargetType.SUBMISSION,
                submissionId, Map.of("rewardStatus", rewardAccount.getStatus().name()), after);

        Submission assigned = submission.toBuilder()
                .assignedRewardId(rewardAccountId)
                .rewardAssignedAt(now)
                .rewardAssignedBy(command.getAssignedBy())
                .assignmentNotes(command.getNotes())
                .build();

        log.info("리워드 배정 완료 - submissionId: {}, rewardAccountId: {}", submissionId, rewardAccountId);
        return AssignmentResult.success(assigned, rewardAccountId);
    }

    @Override
    @Transactional
    public AssignmentResult remove(Long submissionId, Long removedBy) {
        log.info("리워드 배정 해제 시작 - submissionId: {}, removedBy: {}", submissionId, removedBy);

        Optional<Submission> found = loadSubmissionPort.loadSubmission(submissionId);
        if (found.isEmpty()) {
            return AssignmentResult.failure(submissionId, null, FailureReason.SUBMISSION_NOT_FOUND);
        }

        Submission submission = found.get();
        if (!submission.hasAssignment()) {
            return AssignmentResult.failure(submissionId, null, FailureReason.NOT_ASSIGNED);
        }

        Long rewardAccountId = submission.getAssignedRewardId();

        // 1. 리워드 해제를 먼저 수행
        Release release = rewardInventoryPort.release(rewardAccountId, submissionId);
        if (release == Release.NOT_HELD_BY_EXPECTED_HOLDER) {
            Optional<AssignmentSnapshot> current = loadSubmissionPort.loadAssignmentSnapshot(submissionId);
            if (current.isEmpty() || !current.get().isAssigned()) {
                log.debug("리워드 배정 해제 경합 - 다른 요청이 먼저 해제 - submissionId: {}", submissionId);
                return AssignmentResult.conflict(submissionId, rewardAccountId, FailureReason.NOT_ASSIGNED);
            }
            log.error("리워드 배정 정합성 오류 - 응모는 배정 상태이나 리워드 보유자가 다름 - submissionId: {}, rewardAccountId: {}",
                    submissionId, rewardAccountId);
            throw new InconsistentStateException("remove", submissionId,
                    "응모에 배정된 리워드를 해당 응모가 보유하고 있지 않습니다 - rewardAccountId: " + rewardAccountId);
        }

        // 2. 응모 배정 정보 삭제 (실패 시 해제까지 롤백)
        boolean cleared = saveSubmissionPort.clearAssignment(submissionId, rewardAccountId);
        if (!cleared) {
            log.error("리워드 배정 정합성 오류 - 리워드 해제 후 응모 배정 삭제 실패 - submissionId: {}, rewardAccountId: {}",
                    submissionId, rewardAccountId);
            throw new InconsistentStateException("remove", submissionId,
                    "리워드 해제 후 응모 배정 정보를 비우지 못했습니다 - rewardAccountId: " + rewardAccountId);
        }

        // 3. 감사 로그
        Map<String, Object> before = new LinkedHashMap<>();
        before.put("assignedRewardId", rewardAccountId);
        before.put("rewardStatus", RewardAccountStatus.ASSIGNED.name());
        auditLogService.record(removedBy, AuditAction.REWARD_UNASSIGNED, AuditTargetType.SUBMISSION, submissionId,
                before, Map.of("rewardStatus", RewardAccountStatus.AVAILABLE.name()));

        Submission removed = submission.toBuilder()
                .assignedRewardId(null)
                .rewardAssignedAt(null)
                .rewardAssignedBy(null)
                .assignmentNotes(null)
                .build();

        log.info("리워드 배정 해제 완료 - submissionId: {}, rewardAccountId: {}", submissionId, rewardAccountId);
        return AssignmentResult.success(removed, rewardAccountId);
    }

    /**
     * 점유한 리워드를 되돌린다. 되돌리지 못하면 고아 점유가 남으므로 트랜잭션 전체를 실패시킨다
     */
    private void releaseOrFail(Long rewardAccountId, Long submissionId, String operation) {
        Release release = rewardInventoryPort.release(rewardAccountId, submissionId);
        if (release != Release.RELEASED) {
            log.error("리워드 점유 롤백 실패 - rewardAccountId: {}, submissionId: {}", rewardAccountId, submissionId);
            throw new InconsistentStateException(operation, rewardAccountId,
                    "점유한 리워드를 해제하지 못했습니다 - rewardAccountId: " + rewardAccountId);
        }
    }
}
