package com.teambind.lottery.application.service;

import com.teambind.lottery.application.port.in.ManageInventoryUseCase;
import com.teambind.lottery.application.port.out.*;
import com.teambind.lottery.application.port.out.LoadSubmissionPort.AssignmentSnapshot;
import com.teambind.lottery.application.port.out.RewardInventoryPort.Release;
import com.teambind.lottery.domain.exception.InconsistentStateException;
import com.teambind.lottery.domain.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 관리자 재고 관리 서비스
 * 종료 상태(DEACTIVATED, EXPIRED)로의 전이만 제공하며 재활성화는 지원하지 않는다
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class InventoryManagementService implements ManageInventoryUseCase {

    private final LoadCouponPort loadCouponPort;
    private final UpdateCouponStatePort updateCouponStatePort;
    private final LoadRewardAccountPort loadRewardAccountPort;
    private final RewardInventoryPort rewardInventoryPort;
    private final LoadSubmissionPort loadSubmissionPort;
    private final SaveSubmissionPort saveSubmissionPort;
    private final AuditLogService auditLogService;

    @Override
    @Transactional
    public AdminActionResult deactivateCoupon(String code, Long adminId) {
        log.info("쿠폰 비활성화 시작 - code: {}, adminId: {}", code, adminId);

        Optional<Coupon> found = loadCouponPort.loadByCode(code);
        if (found.isEmpty()) {
            return AdminActionResult.failure(null, FailureReason.COUPON_NOT_FOUND);
        }

        Coupon coupon = found.get();
        if (!coupon.isActive()) {
            return AdminActionResult.failure(coupon.getId(), FailureReason.COUPON_NOT_ACTIVE);
        }

        if (!updateCouponStatePort.tryDeactivate(coupon.getId())) {
            log.debug("쿠폰 비활성화 경합 - code: {}", code);
            return AdminActionResult.failure(coupon.getId(), FailureReason.COUPON_NOT_ACTIVE, ErrorKind.CONFLICT);
        }

        auditLogService.record(adminId, AuditAction.COUPON_DEACTIVATED, AuditTargetType.COUPON, coupon.getId(),
                Map.of("status", CouponStatus.ACTIVE.name()),
                Map.of("status", CouponStatus.DEACTIVATED.name()));

        log.info("쿠폰 비활성화 완료 - code: {}", code);
        return AdminActionResult.success(coupon.getId());
    }

    @Override
    @Transactional
    public AdminActionResult expireRewardAccount(Long rewardAccountId, Long adminId) {
        log.info("리워드 계정 만료 시작 - rewardAccountId: {}, adminId: {}", rewardAccountId, adminId);

        Optional<RewardAccount> found = loadRewardAccountPort.loadRewardAccount(rewardAccountId);
        if (found.isEmpty()) {
            return AdminActionResult.failure(rewardAccountId, FailureReason.REWARD_ACCOUNT_NOT_FOUND);
        }

        RewardAccount rewardAccount = found.get();
        if (!rewardAccount.isAvailable()) {
            return AdminActionResult.failure(rewardAccountId, FailureReason.REWARD_NOT_AVAILABLE);
        }

        if (!rewardInventoryPort.tryExpire(rewardAccountId)) {
            log.debug("리워드 계정 만료 경합 - rewardAccountId: {}", rewardAccountId);
            return AdminActionResult.failure(rewardAccountId, FailureReason.REWARD_NOT_AVAILABLE, ErrorKind.CONFLICT);
        }

        auditLogService.record(adminId, AuditAction.REWARD_EXPIRED, AuditTargetType.REWARD_ACCOUNT, rewardAccountId,
                Map.of("status", RewardAccountStatus.AVAILABLE.name()),
                Map.of("status", RewardAccountStatus.EXPIRED.name()));

        log.info("리워드 계정 만료 완료 - rewardAccountId: {}", rewardAccountId);
        return AdminActionResult.success(rewardAccountId);
    }

    @Override
    @Transactional
    public AdminActionResult deleteSubmission(Long submissionId, Long adminId) {
        log.info("응모 삭제 시작 - submissionId: {}, adminId: {}", submissionId, adminId);

        Optional<Submission> found = loadSubmissionPort.loadSubmission(submissionId);
        if (found.isEmpty()) {
            return AdminActionResult.failure(submissionId, FailureReason.SUBMISSION_NOT_FOUND);
        }

        Submission submission = found.get();
        Long rewardAccountId = submission.getAssignedRewardId();

        // 1. 보유 중인 리워드를 먼저 해제하고 응모 배정을 비운다
        if (rewardAccountId != null) {
            Release release = rewardInventoryPort.release(rewardAccountId, submissionId);
            if (release == Release.NOT_HELD_BY_EXPECTED_HOLDER) {
                Optional<AssignmentSnapshot> current = loadSubmissionPort.loadAssignmentSnapshot(submissionId);
                if (current.isEmpty() || !rewardAccountId.equals(current.get().assignedRewardId())) {
                    log.debug("응모 삭제 경합 - 조회 이후 배정이 변경됨 - submissionId: {}", submissionId);
                    return AdminActionResult.failure(submissionId,
                            current.isEmpty() ? FailureReason.SUBMISSION_NOT_FOUND : FailureReason.ALREADY_ASSIGNED,
                            ErrorKind.CONFLICT);
                }
                log.error("응모 삭제 정합성 오류 - 배정된 리워드를 해제하지 못함 - submissionId: {}, rewardAccountId: {}",
                        submissionId, rewardAccountId);
                throw new InconsistentStateException("deleteSubmission", submissionId,
                        "삭제 대상 응모의 리워드를 해제하지 못했습니다 - rewardAccountId: " + rewardAccountId);
            }
            if (!saveSubmissionPort.clearAssignment(submissionId, rewardAccountId)) {
                log.error("응모 삭제 정합성 오류 - 리워드 해제 후 응모 배정 삭제 실패 - submissionId: {}, rewardAccountId: {}",
                        submissionId, rewardAccountId);
                throw new InconsistentStateException("deleteSubmission", submissionId,
                        "리워드 해제 후 응모 배정 정보를 비우지 못했습니다 - rewardAccountId: " + rewardAccountId);
            }
        }

        // 2. 배정이 비어 있는 경우에만 삭제
        if (!saveSubmissionPort.deleteIfUnassigned(submissionId)) {
            if (rewardAccountId != null) {
                log.error("응모 삭제 정합성 오류 - 배정 해제 후 삭제 실패 - submissionId: {}", submissionId);
                throw new InconsistentStateException("deleteSubmission", submissionId,
                        "배정을 비운 응모를 삭제하지 못했습니다");
            }
            Optional<AssignmentSnapshot> current = loadSubmissionPort.loadAssignmentSnapshot(submissionId);
            log.debug("응모 삭제 경합 - 조회 이후 배정 또는 삭제됨 - submissionId: {}", submissionId);
            return AdminActionResult.failure(submissionId,
                    current.isEmpty() ? FailureReason.SUBMISSION_NOT_FOUND : FailureReason.ALREADY_ASSIGNED,
                    ErrorKind.CONFLICT);
        }

        Map<String, Object> before = new LinkedHashMap<>();
        before.put("couponId", submission.getCouponId());
        before.put("email", submission.getEmail());
        before.put("assignedRewardId", submission.getAssignedRewardId());
        auditLogService.record(adminId, AuditAction.SUBMISSION_DELETED, AuditTargetType.SUBMISSION, submissionId,
                before, Map.of());

        log.info("응모 삭제 완료 - submissionId: {}", submissionId);
        return AdminActionResult.success(submissionId);
    }
}
