package com.teambind.lottery.application.service;

import com.teambind.lottery.application.port.in.ManageInventoryUseCase.AdminActionResult;
import com.teambind.lottery.application.port.out.*;
import com.teambind.lottery.application.port.out.RewardInventoryPort.Release;
import com.teambind.lottery.domain.exception.InconsistentStateException;
import com.teambind.lottery.domain.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static com.teambind.lottery.fixture.LotteryFixture.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * 관리자 재고 관리 서비스 테스트
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("관리자 재고 관리 서비스 테스트")
class InventoryManagementServiceTest {

    @Mock
    private LoadCouponPort loadCouponPort;

    @Mock
    private UpdateCouponStatePort updateCouponStatePort;

    @Mock
    private LoadRewardAccountPort loadRewardAccountPort;

    @Mock
    private RewardInventoryPort rewardInventoryPort;

    @Mock
    private LoadSubmissionPort loadSubmissionPort;

    @Mock
    private SaveSubmissionPort saveSubmissionPort;

    @Mock
    private AuditLogService auditLogService;

    @InjectMocks
    private InventoryManagementService service;

    @Nested
    @DisplayName("쿠폰 비활성화")
    class DeactivateCoupon {

        @Test
        @DisplayName("ACTIVE 쿠폰을 DEACTIVATED 로 전이한다")
        void deactivate() {
            when(loadCouponPort.loadByCode("ABC23456")).thenReturn(Optional.of(activeCoupon(100L, "ABC23456")));
            when(updateCouponStatePort.tryDeactivate(100L)).thenReturn(true);

            AdminActionResult result = service.deactivateCoupon("ABC23456", 7L);

            assertThat(result.isSuccess()).isTrue();
            verify(auditLogService).record(eq(7L), eq(AuditAction.COUPON_DEACTIVATED), eq(AuditTargetType.COUPON),
                    eq(100L), anyMap(), anyMap());
        }

        @Test
        @DisplayName("사용된 쿠폰은 비활성화할 수 없다")
        void redeemedCoupon() {
            when(loadCouponPort.loadByCode("ABC23456"))
                    .thenReturn(Optional.of(couponWithStatus(100L, "ABC23456", CouponStatus.REDEEMED)));

            AdminActionResult result = service.deactivateCoupon("ABC23456", 7L);

            assertThat(result.getReason()).isEqualTo(FailureReason.COUPON_NOT_ACTIVE);
            verify(updateCouponStatePort, never()).tryDeactivate(anyLong());
        }

        @Test
        @DisplayName("조건부 전이에 실패하면 CONFLICT")
        void lostRace() {
            when(loadCouponPort.loadByCode("ABC23456")).thenReturn(Optional.of(activeCoupon(100L, "ABC23456")));
            when(updateCouponStatePort.tryDeactivate(100L)).thenReturn(false);

            AdminActionResult result = service.deactivateCoupon("ABC23456", 7L);

            assertThat(result.getErrorKind()).isEqualTo(ErrorKind.CONFLICT);
            verifyNoInteractions(auditLogService);
        }
    }

    @Nested
    @DisplayName("리워드 계정 만료")
    class ExpireReward {

        @Test
        @DisplayName("AVAILABLE 리워드 계정만 만료할 수 있다")
        void expireAvailable() {
            when(loadRewardAccountPort.loadRewardAccount(42L)).thenReturn(Optional.of(availableReward(42L)));
            when(rewardInventoryPort.tryExpire(42L)).thenReturn(true);

            AdminActionResult result = service.expireRewardAccount(42L, 7L);

            assertThat(result.isSuccess()).isTrue();
            verify(auditLogService).record(eq(7L), eq(AuditAction.REWARD_EXPIRED),
                    eq(AuditTargetType.REWARD_ACCOUNT), eq(42L), anyMap(), anyMap());
        }

        @Test
        @DisplayName("배정된 리워드 계정은 만료할 수 없다")
        void assignedRewardCannotExpire() {
            when(loadRewardAccountPort.loadRewardAccount(42L)).thenReturn(Optional.of(assignedReward(42L, 1L)));

            AdminActionResult result = service.expireRewardAccount(42L, 7L);

            assertThat(result.getReason()).isEqualTo(FailureReason.REWARD_NOT_AVAILABLE);
            assertThat(result.getErrorKind()).isEqualTo(ErrorKind.INVALID_STATE);
            verify(rewardInventoryPort, never()).tryExpire(anyLong());
        }

        @Test
        @DisplayName("존재하지 않는 리워드 계정")
        void notFound() {
            when(loadRewardAccountPort.loadRewardAccount(42L)).thenReturn(Optional.empty());

            assertThat(service.expireRewardAccount(42L, 7L).getReason())
                    .isEqualTo(FailureReason.REWARD_ACCOUNT_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("응모 삭제")
    class DeleteSubmission {

        @Test
        @DisplayName("배정된 리워드를 해제하고 배정을 비운 뒤 응모를 삭제한다")
        void releasesThenDeletes() {
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.of(assignedSubmission(1L, 100L, 42L)));
            when(rewardInventoryPort.release(42L, 1L)).thenReturn(Release.RELEASED);
            when(saveSubmissionPort.clearAssignment(1L, 42L)).thenReturn(true);
            when(saveSubmissionPort.deleteIfUnassigned(1L)).thenReturn(true);

            AdminActionResult result = service.deleteSubmission(1L, 7L);

            assertThat(result.isSuccess()).isTrue();
            var inOrder = inOrder(rewardInventoryPort, saveSubmissionPort);
            inOrder.verify(rewardInventoryPort).release(42L, 1L);
            inOrder.verify(saveSubmissionPort).clearAssignment(1L, 42L);
            inOrder.verify(saveSubmissionPort).deleteIfUnassigned(1L);
            verifyNoInteractions(updateCouponStatePort);
        }

        @Test
        @DisplayName("미배정 응모는 바로 삭제한다")
        void deleteUnassigned() {
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.of(submission(1L, 100L)));
            when(saveSubmissionPort.deleteIfUnassigned(1L)).thenReturn(true);

            assertThat(service.deleteSubmission(1L, 7L).isSuccess()).isTrue();

            verifyNoInteractions(rewardInventoryPort);
        }

        @Test
        @DisplayName("조회 이후 배정이 생기면 삭제하지 않고 CONFLICT 로 응답한다")
        void assignedAfterRead() {
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.of(submission(1L, 100L)));
            when(saveSubmissionPort.deleteIfUnassigned(1L)).thenReturn(false);
            when(loadSubmissionPort.loadAssignmentSnapshot(1L))
                    .thenReturn(Optional.of(new LoadSubmissionPort.AssignmentSnapshot(1L, 42L)));

            AdminActionResult result = service.deleteSubmission(1L, 7L);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getReason()).isEqualTo(FailureReason.ALREADY_ASSIGNED);
            assertThat(result.getErrorKind()).isEqualTo(ErrorKind.CONFLICT);
            verifyNoInteractions(rewardInventoryPort, auditLogService);
        }

        @Test
        @DisplayName("조회 이후 다른 요청이 배정을 해제했으면 CONFLICT 로 응답한다")
        void releasedByOtherRequest() {
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.of(assignedSubmission(1L, 100L, 42L)));
            when(rewardInventoryPort.release(42L, 1L)).thenReturn(Release.NOT_HELD_BY_EXPECTED_HOLDER);
            when(loadSubmissionPort.loadAssignmentSnapshot(1L))
                    .thenReturn(Optional.of(new LoadSubmissionPort.AssignmentSnapshot(1L, null)));

            AdminActionResult result = service.deleteSubmission(1L, 7L);

            assertThat(result.getErrorKind()).isEqualTo(ErrorKind.CONFLICT);
            verify(saveSubmissionPort, never()).deleteIfUnassigned(anyLong());
        }

        @Test
        @DisplayName("응모가 리워드를 가리키는데 리워드를 해제하지 못하면 정합성 예외로 삭제하지 않는다")
        void releaseFailure() {
            when(loadSubmissionPort.loadSubmission(1L)).thenReturn(Optional.of(assignedSubmission(1L, 100L, 42L)));
            when(rewardInventoryPort.release(42L, 1L)).thenReturn(Release.NOT_HELD_BY_EXPECTED_HOLDER);
            when(loadSubmissionPort.loadAssignmentSnapshot(1L))
                    .thenReturn(Optional.of(new LoadSubmissionPort.AssignmentSnapshot(1L, 42L)));

            assertThatThrownBy(() -> service.deleteSubmission(1L, 7L))
                    .isInstanceOf(InconsistentStateException.class);
            verify(saveSubmissionPort, never()).deleteIfUnassigned(anyLong());
        }
    }
}
