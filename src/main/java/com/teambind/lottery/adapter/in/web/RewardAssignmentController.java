package com.teambind.lottery.adapter.in.web;

import com.teambind.lottery.adapter.in.web.dto.AssignRewardRequest;
import com.teambind.lottery.adapter.in.web.dto.BulkAssignRewardRequest;
import com.teambind.lottery.adapter.in.web.dto.OperationResponse;
import com.teambind.lottery.adapter.in.web.dto.SubmissionResponse;
import com.teambind.lottery.application.port.in.AssignRewardCommand;
import com.teambind.lottery.application.port.in.AssignRewardUseCase;
import com.teambind.lottery.application.port.in.AssignRewardUseCase.AssignmentResult;
import com.teambind.lottery.application.port.in.BulkAssignRewardUseCase;
import com.teambind.lottery.application.port.in.BulkAssignRewardUseCase.BulkAssignResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 관리자 리워드 배정 API
 */
@Slf4j
@RestController
@RequestMapping("/api/admin/submissions")
@RequiredArgsConstructor
public class RewardAssignmentController {

    private final AssignRewardUseCase assignRewardUseCase;
    private final BulkAssignRewardUseCase bulkAssignRewardUseCase;

    @PostMapping("/{submissionId}/reward")
    public ResponseEntity<OperationResponse<SubmissionResponse>> assign(
            @PathVariable Long submissionId,
            @RequestHeader(AdminHeaders.ADMIN_ID) Long adminId,
            @Valid @RequestBody AssignRewardRequest request) {

        AssignmentResult result = assignRewardUseCase.assign(AssignRewardCommand.of(
                submissionId, request.getRewardAccountId(), adminId, request.getNotes()));
        return toResponse(result);
    }

    @DeleteMapping("/{submissionId}/reward")
    public ResponseEntity<OperationResponse<SubmissionResponse>> remove(
            @PathVariable Long submissionId,
            @RequestHeader(AdminHeaders.ADMIN_ID) Long adminId) {

        return toResponse(assignRewardUseCase.remove(submissionId, adminId));
    }

    /**
     * 일괄 배정. 일부 항목이 실패해도 200 으로 항목별 결과를 반환한다
     */
    @PostMapping("/rewards/bulk")
    public ResponseEntity<BulkAssignResult> assignBulk(
            @RequestHeader(AdminHeaders.ADMIN_ID) Long adminId,
            @Valid @RequestBody BulkAssignRewardRequest request) {

        log.info("리워드 일괄 배정 요청 - adminId: {}, count: {}", adminId, request.getAssignments().size());
        return ResponseEntity.ok(bulkAssignRewardUseCase.assignBulk(request.toCommand(adminId)));
    }

    private ResponseEntity<OperationResponse<SubmissionResponse>> toResponse(AssignmentResult result) {
        if (result.isSuccess()) {
            return ResponseEntity.ok(OperationResponse.success(SubmissionResponse.from(result.getSubmission())));
        }
        return ResponseEntity.status(ResultStatusMapper.toStatus(result.getErrorKind(), result.getReason()))
                .body(OperationResponse.failure(result.getReason(), result.getErrorKind(), result.getMessage()));
    }
}
