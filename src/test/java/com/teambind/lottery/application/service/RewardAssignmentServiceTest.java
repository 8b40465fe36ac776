package com.teambind.lottery.application.service;

import com.teambind.lottery.application.port.in.AssignRewardCommand;
import com.teambind.lottery.application.port.in.AssignRewardUseCase.AssignmentResult;
import com.teambind.lottery.application.port.out.LoadRewardAccountPort;
import com.teambind.lottery.application.port.out.LoadSubmissionPort;
import com.teambind.lottery.application.port.out.LoadSubmissionPort.AssignmentSnapshot;
import com.teambind.lottery.application.port.out.RewardInventoryPort;
import com.teambind.lottery.application.port.out.RewardInventoryPort.Release;
import com.teambind.lottery.application.port.out.RewardInventoryPort.Reservation;
import com.teambind.lottery.application.port.out.SaveSubmissionPort;
import com.teambind.lottery.domain.exception.InconsistentStateException;
import com.teambind.lottery.domain.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Optional;

import static com.teambind.lottery.fixture.LotteryFixture.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * 리워드 배정 서비스 테스트
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("리워드 배정 서비스 테스트")
class RewardAssignmentServiceTest {

    private static final Long ADMIN_ID = 7L;

    @Mock
    private LoadSubmissionPort loadSubmissionPort;

    @Mock
    private SaveSubmissionPort saveSubmissionPort;

    @Mock
    private LoadRewardAccountPort loadRewardAccountPort;

    @Mock
    private RewardInventoryPort rewardInventoryPort;

    @Mock
    private AuditLogService auditLogService;

    private RewardAssignmentService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        service = new RewardAssignmentService(loadSubmissionPort, saveSubmissionPort, loadRewardAccountPort,
                rewardInventoryPort, auditLogService, clock);
    }

    @Nested
    @DisplayName("배정")
    class Assign {

        @Test
        @DisplayName("AVAILABLE 리워드를 미배정 응모에 배정한다")
        void assignAvailableReward() {
            // given
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.of(submission(1L, 100L)));
            when(loadRewardAccountPort.loadRewardAccount(42L)).thenReturn(Optional.of(availableReward(42L)));
            when(rewardInventoryPort.tryReserve(42L, 1L, NOW)).thenReturn(Reservation.RESERVED);
            when(saveSubmissionPort.setAssignment(1L, 42L, ADMIN_ID, "메모", NOW)).thenReturn(true);

            // when
            AssignmentResult result = service.assign(AssignRewardCommand.of(1L, 42L, ADMIN_ID, "메모"));

            // then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getSubmission().getAssignedRewardId()).isEqualTo(42L);
            assertThat(result.getSubmission().getRewardAssignedBy()).isEqualTo(ADMIN_ID);
            verify(auditLogService).record(eq(ADMIN_ID), eq(AuditAction.REWARD_ASSIGNED),
                    eq(AuditTargetType.SUBMISSION), eq(1L), anyMap(), anyMap());
        }

        @Test
        @DisplayName("응모가 없으면 SUBMISSION_NOT_FOUND")
        void submissionNotFound() {
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.empty());

            AssignmentResult result = service.assign(AssignRewardCommand.of(1L, 42L, ADMIN_ID));

            assertThat(result.getReason()).isEqualTo(FailureReason.SUBMISSION_NOT_FOUND);
            verifyNoInteractions(rewardInventoryPort);
        }

        @Test
        @DisplayName("리워드 계정이 없으면 REWARD_ACCOUNT_NOT_FOUND")
        void rewardNotFound() {
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.of(submission(1L, 100L)));
            when(loadRewardAccountPort.loadRewardAccount(42L)).thenReturn(Optional.empty());

            AssignmentResult result = service.assign(AssignRewardCommand.of(1L, 42L, ADMIN_ID));

            assertThat(result.getReason()).isEqualTo(FailureReason.REWARD_ACCOUNT_NOT_FOUND);
            assertThat(result.getErrorKind()).isEqualTo(ErrorKind.NOT_FOUND);
        }

        @Test
        @DisplayName("이미 배정된 응모는 리워드를 점유하지 않고 거절한다")
        void alreadyAssigned() {
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.of(assignedSubmission(1L, 100L, 42L)));
            when(loadRewardAccountPort.loadRewardAccount(43L)).thenReturn(Optional.of(availableReward(43L)));

            AssignmentResult result = service.assign(AssignRewardCommand.of(1L, 43L, ADMIN_ID));

            assertThat(result.getReason()).isEqualTo(FailureReason.ALREADY_ASSIGNED);
            verifyNoInteractions(rewardInventoryPort, saveSubmissionPort, auditLogService);
        }

        @Test
        @DisplayName("이미 다른 응모가 가진 리워드는 INVALID_STATE 로 거절한다")
        void rewardHeldByOther() {
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.of(submission(1L, 100L)));
            when(loadRewardAccountPort.loadRewardAccount(42L)).thenReturn(Optional.of(assignedReward(42L, 2L)));
            when(rewardInventoryPort.tryReserve(42L, 1L, NOW)).thenReturn(Reservation.NOT_AVAILABLE);

            AssignmentResult result = service.assign(AssignRewardCommand.of(1L, 42L, ADMIN_ID));

            assertThat(result.getReason()).isEqualTo(FailureReason.REWARD_NOT_AVAILABLE);
            assertThat(result.getErrorKind()).isEqualTo(ErrorKind.INVALID_STATE);
        }

        @Test
        @DisplayName("조회 시점에는 AVAILABLE 이었으나 점유에 실패하면 CONFLICT")
        void reserveLostRace() {
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.of(submission(1L, 100L)));
            when(loadRewardAccountPort.loadRewardAccount(42L)).thenReturn(Optional.of(availableReward(42L)));
            when(rewardInventoryPort.tryReserve(42L, 1L, NOW)).thenReturn(Reservation.NOT_AVAILABLE);

            AssignmentResult result = service.assign(AssignRewardCommand.of(1L, 42L, ADMIN_ID));

            assertThat(result.getReason()).isEqualTo(FailureReason.REWARD_NOT_AVAILABLE);
            assertThat(result.getErrorKind()).isEqualTo(ErrorKind.CONFLICT);
            verifyNoInteractions(saveSubmissionPort);
        }

        @Test
        @DisplayName("응모 배정 기록에서 경합에 지면 점유한 리워드를 되돌린다")
        void assignmentLostRaceReleasesReward() {
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.of(submission(1L, 100L)));
            when(loadRewardAccountPort.loadRewardAccount(42L)).thenReturn(Optional.of(availableReward(42L)));
            when(rewardInventoryPort.tryReserve(42L, 1L, NOW)).thenReturn(Reservation.RESERVED);
            when(saveSubmissionPort.setAssignment(anyLong(), anyLong(), anyLong(), any(), any())).thenReturn(false);
            when(rewardInventoryPort.release(42L, 1L)).thenReturn(Release.RELEASED);

            AssignmentResult result = service.assign(AssignRewardCommand.of(1L, 42L, ADMIN_ID));

            assertThat(result.getReason()).isEqualTo(FailureReason.ALREADY_ASSIGNED);
            assertThat(result.getErrorKind()).isEqualTo(ErrorKind.CONFLICT);
            verify(rewardInventoryPort).release(42L, 1L);
            verifyNoInteractions(auditLogService);
        }

        @Test
        @DisplayName("점유를 되돌리지 못하면 정합성 예외")
        void releaseFailureIsInconsistent() {
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.of(submission(1L, 100L)));
            when(loadRewardAccountPort.loadRewardAccount(42L)).thenReturn(Optional.of(availableReward(42L)));
            when(rewardInventoryPort.tryReserve(42L, 1L, NOW)).thenReturn(Reservation.RESERVED);
            when(saveSubmissionPort.setAssignment(anyLong(), anyLong(), anyLong(), any(), any())).thenReturn(false);
            when(rewardInventoryPort.release(42L, 1L)).thenReturn(Release.NOT_HELD_BY_EXPECTED_HOLDER);

            assertThatThrownBy(() -> service.assign(AssignRewardCommand.of(1L, 42L, ADMIN_ID)))
                    .isInstanceOf(InconsistentStateException.class);
        }
    }

    @Nested
    @DisplayName("해제")
    class Remove {

        @Test
        @DisplayName("배정된 리워드를 해제하고 응모 배정 정보를 비운다")
        void removeAssignment() {
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.of(assignedSubmission(1L, 100L, 42L)));
            when(rewardInventoryPort.release(42L, 1L)).thenReturn(Release.RELEASED);
            when(saveSubmissionPort.clearAssignment(1L, 42L)).thenReturn(true);

            AssignmentResult result = service.remove(1L, ADMIN_ID);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getRewardAccountId()).isEqualTo(42L);
            assertThat(result.getSubmission().hasAssignment()).isFalse();
            verify(auditLogService).record(eq(ADMIN_ID), eq(AuditAction.REWARD_UNASSIGNED),
                    eq(AuditTargetType.SUBMISSION), eq(1L), anyMap(), anyMap());
        }

        @Test
        @DisplayName("배정이 없는 응모는 NOT_ASSIGNED")
        void notAssigned() {
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.of(submission(1L, 100L)));

            AssignmentResult result = service.remove(1L, ADMIN_ID);

            assertThat(result.getReason()).isEqualTo(FailureReason.NOT_ASSIGNED);
            verifyNoInteractions(rewardInventoryPort);
        }

        @Test
        @DisplayName("다른 요청이 먼저 해제했으면 CONFLICT")
        void removedConcurrently() {
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.of(assignedSubmission(1L, 100L, 42L)));
            when(rewardInventoryPort.release(42L, 1L)).thenReturn(Release.NOT_HELD_BY_EXPECTED_HOLDER);
            when(loadSubmissionPort.loadAssignmentSnapshot(1L))
                    .thenReturn(Optional.of(new AssignmentSnapshot(1L, null)));

            AssignmentResult result = service.remove(1L, ADMIN_ID);

            assertThat(result.getReason()).isEqualTo(FailureReason.NOT_ASSIGNED);
            assertThat(result.getErrorKind()).isEqualTo(ErrorKind.CONFLICT);
            verify(saveSubmissionPort, never()).clearAssignment(anyLong(), anyLong());
        }

        @Test
        @DisplayName("응모는 배정 상태인데 리워드 보유자가 다르면 정합성 예외")
        void holderMismatch() {
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.of(assignedSubmission(1L, 100L, 42L)));
            when(rewardInventoryPort.release(42L, 1L)).thenReturn(Release.NOT_HELD_BY_EXPECTED_HOLDER);
            when(loadSubmissionPort.loadAssignmentSnapshot(1L))
                    .thenReturn(Optional.of(new AssignmentSnapshot(1L, 42L)));

            assertThatThrownBy(() -> service.remove(1L, ADMIN_ID))
                    .isInstanceOf(InconsistentStateException.class);
        }

        @Test
        @DisplayName("리워드 해제 후 응모 배정 정보를 비우지 못하면 정합성 예외")
        void clearFailure() {
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.of(assignedSubmission(1L, 100L, 42L)));
            when(rewardInventoryPort.release(42L, 1L)).thenReturn(Release.RELEASED);
            when(saveSubmissionPort.clearAssignment(1L, 42L)).thenReturn(false);

            assertThatThrownBy(() -> service.remove(1L, ADMIN_ID))
                    .isInstanceOf(InconsistentStateException.class)
                    .hasMessageContaining("42");
            verifyNoInteractions(auditLogService);
        }
    }
}
