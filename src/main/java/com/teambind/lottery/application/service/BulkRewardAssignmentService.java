package com.teambind.lottery.application.service;

import com.teambind.lottery.application.port.in.AssignRewardCommand;
import com.teambind.lottery.application.port.in.AssignRewardUseCase;
import com.teambind.lottery.application.port.in.AssignRewardUseCase.AssignmentResult;
import com.teambind.lottery.application.port.in.BulkAssignRewardCommand;
import com.teambind.lottery.application.port.in.BulkAssignRewardUseCase;
import com.teambind.lottery.domain.exception.InconsistentStateException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 리워드 일괄 배정 서비스
 * 항목마다 {@link AssignRewardUseCase#assign} 을 별도 트랜잭션으로 호출한다
 * 저장소 장애 같은 인프라 예외만 전체 호출을 중단시킨다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BulkRewardAssignmentService implements BulkAssignRewardUseCase {

    private final AssignRewardUseCase assignRewardUseCase;

    @Override
    public BulkAssignResult assignBulk(BulkAssignRewardCommand command) {
        List<BulkAssignRewardCommand.Pair> pairs = command.getPairs();
        log.info("리워드 일괄 배정 시작 - count: {}, assignedBy: {}", pairs.size(), command.getAssignedBy());

        List<ItemResult> items = new ArrayList<>(pairs.size());

        for (BulkAssignRewardCommand.Pair pair : pairs) {
            AssignRewardCommand itemCommand = AssignRewardCommand.of(
                    pair.getSubmissionId(), pair.getRewardAccountId(), command.getAssignedBy(), command.getNotes());
            try {
                AssignmentResult result = assignRewardUseCase.assign(itemCommand);
                items.add(ItemResult.from(result, pair.getSubmissionId(), pair.getRewardAccountId()));
            } catch (InconsistentStateException e) {
                // 해당 항목의 트랜잭션은 이미 롤백됨
                log.error("리워드 일괄 배정 중 정합성 오류 - submissionId: {}, rewardAccountId: {}, error: {}",
                        pair.getSubmissionId(), pair.getRewardAccountId(), e.getMessage(), e);
                items.add(ItemResult.inconsistent(pair.getSubmissionId(), pair.getRewardAccountId(), e.getMessage()));
            }
        }

        BulkAssignResult result = BulkAssignResult.of(items);
        log.info("리워드 일괄 배정 완료 - success: {}/{}, failure: {}",
                result.getSuccessCount(), result.getTotalRequested(), result.getFailureCount());
        return result;
    }
}
