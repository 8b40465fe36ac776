package com.teambind.lottery.adapter.out.persistence;

import com.teambind.lottery.adapter.out.persistence.mapper.RewardAccountMapper;
import com.teambind.lottery.adapter.out.persistence.repository.RewardAccountRepository;
import com.teambind.lottery.application.port.out.RewardInventoryPort.Release;
import com.teambind.lottery.application.port.out.RewardInventoryPort.Reservation;
import com.teambind.lottery.domain.model.RewardAccountStatus;
import com.teambind.lottery.domain.model.RewardCategory;
import com.teambind.lottery.domain.model.RewardInventorySummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static com.teambind.lottery.fixture.LotteryFixture.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RewardAccountPersistenceAdapter 테스트")
class RewardAccountPersistenceAdapterTest {

    @Mock
    private RewardAccountRepository rewardAccountRepository;

    @Mock
    private RewardAccountMapper rewardAccountMapper;

    private RewardAccountPersistenceAdapter adapter;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        adapter = new RewardAccountPersistenceAdapter(rewardAccountRepository, rewardAccountMapper, clock);
    }

    @Test
    @DisplayName("AVAILABLE 조건 점유가 적용되면 RESERVED")
    void reserve() {
        when(rewardAccountRepository.reserveIfAvailable(42L, 1L,
                RewardAccountStatus.AVAILABLE, RewardAccountStatus.ASSIGNED, NOW)).thenReturn(1);

        assertThat(adapter.tryReserve(42L, 1L, NOW)).isEqualTo(Reservation.RESERVED);
    }

    @Test
    @DisplayName("점유 조건이 맞지 않으면 NOT_AVAILABLE")
    void reserveNotAvailable() {
        when(rewardAccountRepository.reserveIfAvailable(42L, 1L,
                RewardAccountStatus.AVAILABLE, RewardAccountStatus.ASSIGNED, NOW)).thenReturn(0);

        assertThat(adapter.tryReserve(42L, 1L, NOW)).isEqualTo(Reservation.NOT_AVAILABLE);
    }

    @Test
    @DisplayName("보유자가 다르면 해제하지 않는다")
    void releaseNotHeld() {
        when(rewardAccountRepository.releaseIfHeldBy(42L, 2L,
                RewardAccountStatus.ASSIGNED, RewardAccountStatus.AVAILABLE, NOW)).thenReturn(0);

        assertThat(adapter.release(42L, 2L)).isEqualTo(Release.NOT_HELD_BY_EXPECTED_HOLDER);
    }

    @Test
    @DisplayName("카테고리와 상태별 건수를 합산한다")
    void inventorySummary() {
        when(rewardAccountRepository.countGroupByCategoryAndStatus()).thenReturn(List.of(
                new Object[]{RewardCategory.STREAMING_SERVICE, RewardAccountStatus.AVAILABLE, 3L},
                new Object[]{RewardCategory.STREAMING_SERVICE, RewardAccountStatus.ASSIGNED, 1L},
                new Object[]{RewardCategory.GIFT_CARD, RewardAccountStatus.AVAILABLE, 2L}));

        RewardInventorySummary summary = adapter.getInventorySummary();

        assertThat(summary.getTotal()).isEqualTo(6);
        assertThat(summary.countOf(RewardAccountStatus.AVAILABLE)).isEqualTo(5);
        assertThat(summary.countOf(RewardAccountStatus.EXPIRED)).isZero();
        assertThat(summary.countOf(RewardCategory.STREAMING_SERVICE, RewardAccountStatus.ASSIGNED)).isEqualTo(1);
        assertThat(summary.countOf(RewardCategory.OTHER, RewardAccountStatus.AVAILABLE)).isZero();
    }
}
