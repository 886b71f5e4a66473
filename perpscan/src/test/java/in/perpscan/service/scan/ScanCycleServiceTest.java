package in.perpscan.service.scan;

import in.perpscan.application.port.output.AccountPort;
import in.perpscan.application.port.output.MarketDataPort;
import in.perpscan.application.port.output.WinRateSource;
import in.perpscan.config.ScanConfig;
import in.perpscan.config.ScannerConfig;
import in.perpscan.domain.model.AccountSnapshot;
import in.perpscan.domain.model.Horizon;
import in.perpscan.domain.model.NoSignalReason;
import in.perpscan.domain.model.RankedTrade;
import in.perpscan.service.filter.SignalFilterStage;
import in.perpscan.service.signal.SignalPipeline;
import in.perpscan.support.SyntheticBars;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScanCycleServiceTest {

    @Mock
    private MarketDataPort marketData;
    @Mock
    private AccountPort accountPort;
    @Mock
    private ScanMetrics metrics;

    private ScanCycleService service;

    private ScanCycleService service(ScanConfig scan) {
        ScannerConfig config = ScannerConfig.defaults().withScan(scan);
        SignalPipeline pipeline = new SignalPipeline(config, SignalFilterStage.create(config.filter(), WinRateSource.NONE));
        service = new ScanCycleService(scan, marketData, accountPort, pipeline, metrics);
        return service;
    }

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.close();
        }
    }

    private void stubUniverse(int topSymbols) {
        when(accountPort.currentAccount()).thenReturn(new AccountSnapshot(new BigDecimal("1000"), new BigDecimal("5")));
        when(marketData.topSymbolsByVolume(topSymbols)).thenReturn(List.of("BTCUSDT", "ETHUSDT", "USDCUSDT", "DEADUSDT"));
        when(marketData.bars(eq("BTCUSDT"), any(), anyInt()))
            .thenAnswer(inv -> SyntheticBars.uptrend(inv.getArgument(1, Horizon.class), 120, "100"));
        when(marketData.bars(eq("ETHUSDT"), any(), anyInt()))
            .thenAnswer(inv -> SyntheticBars.downtrend(inv.getArgument(1, Horizon.class), 120, "200"));
        when(marketData.bars(eq("USDCUSDT"), any(), anyInt()))
            .thenAnswer(inv -> SyntheticBars.constant(inv.getArgument(1, Horizon.class), 120, "1"));
        when(marketData.bars(eq("DEADUSDT"), any(), anyInt()))
            .thenThrow(new IllegalStateException("exchange returned 503"));
    }

    @Test
    void testCycleRanksAcceptedTradesAndSurvivesFailures() {
        stubUniverse(100);

        ScanReport report = service(ScanConfig.defaults()).runCycle();

        assertEquals(3, report.analyzed());
        assertEquals(1, report.failed(), "fetch failure is counted, not fatal");
        assertEquals(0, report.timedOut());
        assertEquals(2, report.accepted());
        assertEquals(1, report.countOf(NoSignalReason.NO_DIRECTION));
        Set<String> symbols = report.ranked().stream().map(RankedTrade::symbol).collect(Collectors.toSet());
        assertEquals(Set.of("BTCUSDT", "ETHUSDT"), symbols);

        verify(metrics, times(2)).recordAccepted();
        verify(metrics).recordRejected(NoSignalReason.NO_DIRECTION);
        verify(metrics).recordFailure(false);
        verify(metrics).recordCycle(any(Duration.class), eq(2));
    }

    @Test
    void testTopSignalsCut() {
        stubUniverse(100);

        ScanReport report = service(new ScanConfig(100, 1, 200, 2, 120, 3600)).runCycle();

        assertEquals(2, report.accepted());
        assertEquals(1, report.ranked().size());
        verify(metrics).recordCycle(any(Duration.class), eq(1));
    }

    @Test
    void testRequestsConfiguredBarLimitPerHorizon() {
        when(accountPort.currentAccount()).thenReturn(new AccountSnapshot(new BigDecimal("1000"), new BigDecimal("5")));
        when(marketData.topSymbolsByVolume(10)).thenReturn(List.of("BTCUSDT"));
        when(marketData.bars(eq("BTCUSDT"), any(), anyInt()))
            .thenAnswer(inv -> SyntheticBars.uptrend(inv.getArgument(1, Horizon.class), 120, "100"));

        service(new ScanConfig(10, 5, 150, 1, 120, 3600)).runCycle();

        for (Horizon h : Horizon.values()) {
            verify(marketData).bars("BTCUSDT", h, 150);
        }
    }

    @Test
    void testSlowSymbolIsCancelledAtTimeout() {
        when(accountPort.currentAccount()).thenReturn(new AccountSnapshot(new BigDecimal("1000"), new BigDecimal("5")));
        when(marketData.topSymbolsByVolume(100)).thenReturn(List.of("BTCUSDT", "SLOWUSDT"));
        when(marketData.bars(eq("BTCUSDT"), any(), anyInt()))
            .thenAnswer(inv -> SyntheticBars.uptrend(inv.getArgument(1, Horizon.class), 120, "100"));
        when(marketData.bars(eq("SLOWUSDT"), any(), anyInt())).thenAnswer(inv -> {
            Thread.sleep(10_000);
            return List.of();
        });

        ScanReport report = service(new ScanConfig(100, 5, 200, 2, 1, 3600)).runCycle();

        assertEquals(1, report.timedOut());
        assertEquals(1, report.failed());
        assertEquals(1, report.accepted());
        verify(metrics).recordFailure(true);
    }

    @Test
    void testEmptyUniverse() {
        when(accountPort.currentAccount()).thenReturn(new AccountSnapshot(new BigDecimal("1000"), new BigDecimal("5")));
        when(marketData.topSymbolsByVolume(100)).thenReturn(List.of());

        ScanReport report = service(ScanConfig.defaults()).runCycle();

        assertEquals(0, report.analyzed());
        assertTrue(report.ranked().isEmpty());
        verify(marketData, never()).bars(any(), any(), anyInt());
    }
}
