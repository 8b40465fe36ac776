package com.teambind.lottery.application.service;

import com.teambind.lottery.application.port.in.AssignRewardCommand;
import com.teambind.lottery.application.port.in.AssignRewardUseCase;
import com.teambind.lottery.application.port.in.AssignRewardUseCase.AssignmentResult;
import com.teambind.lottery.application.port.in.BulkAssignRewardCommand;
import com.teambind.lottery.application.port.in.BulkAssignRewardCommand.Pair;
import com.teambind.lottery.application.port.in.BulkAssignRewardUseCase.BulkAssignResult;
import com.teambind.lottery.domain.exception.InconsistentStateException;
import com.teambind.lottery.domain.model.ErrorKind;
import com.teambind.lottery.domain.model.FailureReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static com.teambind.lottery.fixture.LotteryFixture.assignedSubmission;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("리워드 일괄 배정 서비스 테스트")
class BulkRewardAssignmentServiceTest {

    @Mock
    private AssignRewardUseCase assignRewardUseCase;

    @InjectMocks
    private BulkRewardAssignmentService service;

    @Test
    @DisplayName("각 항목을 입력 순서대로 독립 처리하고 결과를 집계한다")
    void processesEachPairIndependently() {
        // given
        when(assignRewardUseCase.assign(AssignRewardCommand.of(1L, 42L, 7L, "이벤트")))
                .thenReturn(AssignmentResult.success(assignedSubmission(1L, 100L, 42L), 42L));
        when(assignRewardUseCase.assign(AssignRewardCommand.of(2L, 42L, 7L, "이벤트")))
                .thenReturn(AssignmentResult.failure(2L, 42L, FailureReason.REWARD_NOT_AVAILABLE));
        when(assignRewardUseCase.assign(AssignRewardCommand.of(3L, 44L, 7L, "이벤트")))
                .thenReturn(AssignmentResult.failure(3L, 44L, FailureReason.SUBMISSION_NOT_FOUND));

        BulkAssignRewardCommand command = BulkAssignRewardCommand.of(
                List.of(Pair.of(1L, 42L), Pair.of(2L, 42L), Pair.of(3L, 44L)), 7L, "이벤트");

        // when
        BulkAssignResult result = service.assignBulk(command);

        // then
        assertThat(result.getTotalRequested()).isEqualTo(3);
        assertThat(result.getSuccessCount()).isEqualTo(1);
        assertThat(result.getFailureCount()).isEqualTo(2);
        assertThat(result.isCompleteSuccess()).isFalse();
        assertThat(result.getItems())
                .extracting(item -> item.getSubmissionId())
                .containsExactly(1L, 2L, 3L);
        assertThat(result.getItems().get(1).getError()).isEqualTo(FailureReason.REWARD_NOT_AVAILABLE);
        assertThat(result.getItems().get(2).getErrorKind()).isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("정합성 예외가 난 항목만 실패로 기록하고 다음 항목을 계속 처리한다")
    void inconsistentItemDoesNotStopBatch() {
        when(assignRewardUseCase.assign(AssignRewardCommand.of(1L, 42L, 7L, null)))
                .thenThrow(new InconsistentStateException("assign", 42L, "점유 해제 실패"));
        when(assignRewardUseCase.assign(AssignRewardCommand.of(2L, 43L, 7L, null)))
                .thenReturn(AssignmentResult.success(assignedSubmission(2L, 101L, 43L), 43L));

        BulkAssignResult result = service.assignBulk(
                BulkAssignRewardCommand.of(List.of(Pair.of(1L, 42L), Pair.of(2L, 43L)), 7L, null));

        assertThat(result.getSuccessCount()).isEqualTo(1);
        assertThat(result.getItems().get(0).getError()).isEqualTo(FailureReason.INCONSISTENT_STATE);
        assertThat(result.getItems().get(0).getErrorKind()).isEqualTo(ErrorKind.INCONSISTENT);
        assertThat(result.getItems().get(1).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("저장소 장애는 전체 호출을 중단시킨다")
    void infrastructureFailurePropagates() {
        when(assignRewardUseCase.assign(any())).thenThrow(new DataAccessResourceFailureException("연결 끊김"));

        assertThatThrownBy(() -> service.assignBulk(
                BulkAssignRewardCommand.of(List.of(Pair.of(1L, 42L), Pair.of(2L, 43L)), 7L, null)))
                .isInstanceOf(DataAccessResourceFailureException.class);
        verify(assignRewardUseCase, times(1)).assign(any());
    }
}
