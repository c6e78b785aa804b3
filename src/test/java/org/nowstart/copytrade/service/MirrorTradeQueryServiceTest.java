package org.nowstart.copytrade.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.copytrade.CopyTradeFixtures;
import org.nowstart.copytrade.data.dto.MirrorTradeDto;
import org.nowstart.copytrade.data.dto.MirrorTradeStatsDto;
import org.nowstart.copytrade.data.entity.MirrorTrade;
import org.nowstart.copytrade.data.type.MirrorTradeStatus;
import org.nowstart.copytrade.repository.MirrorTradeRepository;

@ExtendWith(MockitoExtension.class)
class MirrorTradeQueryServiceTest {

    @Mock
    private MirrorTradeRepository mirrorTradeRepository;

    @InjectMocks
    private MirrorTradeQueryService mirrorTradeQueryService;

    @Test
    void list_selectsQueryByFilters() {
        MirrorTrade executed = CopyTradeFixtures.executedMirror("m-1", "f-1", "ord-1");
        when(mirrorTradeRepository.findByFollowerIdAndStatusOrderByCreatedAtDesc("f-1", MirrorTradeStatus.EXECUTED))
                .thenReturn(List.of(executed));

        List<MirrorTradeDto> result = mirrorTradeQueryService.list("f-1", MirrorTradeStatus.EXECUTED);

        assertThat(result).hasSize(1);
        assertThat(result.get(0).id()).isEqualTo("m-1");
        assertThat(result.get(0).venueOrderId()).isEqualTo("ord-1");
    }

    @Test
    void list_withoutFiltersReturnsNewestFirst() {
        when(mirrorTradeRepository.findAllByOrderByCreatedAtDesc()).thenReturn(List.of());

        assertThat(mirrorTradeQueryService.list(" ", null)).isEmpty();
        verify(mirrorTradeRepository).findAllByOrderByCreatedAtDesc();
    }

    @Test
    void stats_aggregatesStatusesAndRealizedPnl() {
        MirrorTrade win = CopyTradeFixtures.executedMirror("m-1", "f-1", "ord-1");
        win.setPnl(new BigDecimal("12.5"));
        MirrorTrade loss = CopyTradeFixtures.executedMirror("m-2", "f-1", "ord-2");
        loss.setPnl(new BigDecimal("-2.5"));
        MirrorTrade failed = CopyTradeFixtures.pendingMirror("m-3", "f-1");
        failed.setStatus(MirrorTradeStatus.FAILED);
        when(mirrorTradeRepository.findByFollowerIdOrderByCreatedAtDesc("f-1")).thenReturn(List.of(win, loss, failed));

        MirrorTradeStatsDto stats = mirrorTradeQueryService.stats("f-1");

        assertThat(stats.totalTrades()).isEqualTo(3);
        assertThat(stats.executedTrades()).isEqualTo(2);
        assertThat(stats.failedTrades()).isEqualTo(1);
        assertThat(stats.pendingTrades()).isZero();
        assertThat(stats.successRate()).isEqualByComparingTo("66.67");
        assertThat(stats.realizedPnl()).isEqualByComparingTo("10");
    }

    @Test
    void stats_reportsZeroRateWithoutTrades() {
        when(mirrorTradeRepository.findAllByOrderByCreatedAtDesc()).thenReturn(List.of());

        MirrorTradeStatsDto stats = mirrorTradeQueryService.stats(null);

        assertThat(stats.totalTrades()).isZero();
        assertThat(stats.successRate()).isEqualByComparingTo("0.00");
    }
}
