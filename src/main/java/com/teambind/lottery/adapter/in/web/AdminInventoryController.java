package com.teambind.lottery.adapter.in.web;

import com.teambind.lottery.adapter.in.web.dto.OperationResponse;
import com.teambind.lottery.adapter.in.web.dto.SubmissionResponse;
import com.teambind.lottery.application.port.in.*;
import com.teambind.lottery.application.port.in.GetInventoryStatisticsUseCase.InventoryStatistics;
import com.teambind.lottery.application.port.in.ManageInventoryUseCase.AdminActionResult;
import com.teambind.lottery.domain.model.AuditEntry;
import com.teambind.lottery.domain.model.AuditTargetType;
import com.teambind.lottery.domain.model.SubmissionSearchCondition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 관리자 재고/응모 관리 API
 */
@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminInventoryController {

    private final SweepExpiredCouponsUseCase sweepExpiredCouponsUseCase;
    private final ManageInventoryUseCase manageInventoryUseCase;
    private final QuerySubmissionUseCase querySubmissionUseCase;
    private final GetInventoryStatisticsUseCase getInventoryStatisticsUseCase;
    private final QueryAuditLogUseCase queryAuditLogUseCase;
    private final Clock clock;

    /**
     * 만료 쿠폰 즉시 처리
     */
    @PostMapping("/coupons/expiry-sweep")
    public ResponseEntity<Map<String, Object>> sweepExpired(@RequestHeader(AdminHeaders.ADMIN_ID) Long adminId) {
        log.info("만료 쿠폰 수동 처리 요청 - adminId: {}", adminId);
        int expired = sweepExpiredCouponsUseCase.sweepExpired(LocalDateTime.now(clock));
        return ResponseEntity.ok(Map.of("expiredCount", expired));
    }

    @PatchMapping("/coupons/{code}/deactivate")
    public ResponseEntity<OperationResponse<Long>> deactivateCoupon(
            @PathVariable String code,
            @RequestHeader(AdminHeaders.ADMIN_ID) Long adminId) {
        return toResponse(manageInventoryUseCase.deactivateCoupon(code.trim().toUpperCase(), adminId));
    }

    @PatchMapping("/reward-accounts/{rewardAccountId}/expire")
    public ResponseEntity<OperationResponse<Long>> expireRewardAccount(
            @PathVariable Long rewardAccountId,
            @RequestHeader(AdminHeaders.ADMIN_ID) Long adminId) {
        return toResponse(manageInventoryUseCase.expireRewardAccount(rewardAccountId, adminId));
    }

    @DeleteMapping("/submissions/{submissionId}")
    public ResponseEntity<OperationResponse<Long>> deleteSubmission(
            @PathVariable Long submissionId,
            @RequestHeader(AdminHeaders.ADMIN_ID) Long adminId) {
        return toResponse(manageInventoryUseCase.deleteSubmission(submissionId, adminId));
    }

    @GetMapping("/submissions/{submissionId}")
    public ResponseEntity<SubmissionResponse> getSubmission(@PathVariable Long submissionId) {
        return querySubmissionUseCase.findById(submissionId)
                .map(SubmissionResponse::from)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/submissions")
    public ResponseEntity<Page<SubmissionResponse>> searchSubmissions(
            @RequestParam(required = false) String email,
            @RequestParam(required = false) Long couponId,
            @RequestParam(required = false) Boolean assigned,
            @RequestParam(required = false) Long assignedRewardId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {

        SubmissionSearchCondition condition = SubmissionSearchCondition.builder()
                .email(email)
                .couponId(couponId)
                .assigned(assigned)
                .assignedRewardId(assignedRewardId)
                .submittedFrom(from)
                .submittedTo(to)
                .build();

        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 100),
                Sort.by(Sort.Direction.DESC, "submittedAt"));

        return ResponseEntity.ok(querySubmissionUseCase.search(condition, pageable).map(SubmissionResponse::from));
    }

    @GetMapping("/submissions/without-reward")
    public ResponseEntity<List<SubmissionResponse>> getSubmissionsWithoutReward() {
        return ResponseEntity.ok(querySubmissionUseCase.findWithoutAssignment().stream()
                .map(SubmissionResponse::from)
                .toList());
    }

    @GetMapping("/reward-accounts/{rewardAccountId}/submission")
    public ResponseEntity<SubmissionResponse> getSubmissionByReward(@PathVariable Long rewardAccountId) {
        return querySubmissionUseCase.findByAssignedReward(rewardAccountId)
                .map(SubmissionResponse::from)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/submissions/recent")
    public ResponseEntity<List<SubmissionResponse>> getRecentSubmissions(
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(querySubmissionUseCase.findRecent(limit).stream()
                .map(SubmissionResponse::from)
                .toList());
    }

    @GetMapping("/statistics/inventory")
    public ResponseEntity<InventoryStatistics> getInventoryStatistics() {
        return ResponseEntity.ok(getInventoryStatisticsUseCase.getInventoryStatistics());
    }

    @GetMapping("/audit-logs")
    public ResponseEntity<List<AuditEntry>> getAuditLogs(
            @RequestParam AuditTargetType targetType,
            @RequestParam Long targetId) {
        return ResponseEntity.ok(queryAuditLogUseCase.findByTarget(targetType, targetId));
    }

    private ResponseEntity<OperationResponse<Long>> toResponse(AdminActionResult result) {
        if (result.isSuccess()) {
            return ResponseEntity.ok(OperationResponse.success(result.getTargetId()));
        }
        return ResponseEntity.status(ResultStatusMapper.toStatus(result.getErrorKind(), result.getReason()))
                .body(OperationResponse.failure(result.getReason(), result.getErrorKind(), result.getMessage()));
    }
}
