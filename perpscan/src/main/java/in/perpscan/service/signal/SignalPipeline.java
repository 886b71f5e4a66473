package in.perpscan.service.signal;

import in.perpscan.config.ScannerConfig;
import in.perpscan.domain.model.AccountSnapshot;
import in.perpscan.domain.model.Bar;
import in.perpscan.domain.model.Horizon;
import in.perpscan.domain.model.NoSignalReason;
import in.perpscan.domain.model.RankedTrade;
import in.perpscan.domain.model.Signal;
import in.perpscan.domain.signal.AlignmentResult;
import in.perpscan.domain.signal.RegimeClassification;
import in.perpscan.service.filter.FilterOutcome;
import in.perpscan.service.filter.SignalFilterStage;
import in.perpscan.service.indicator.IndicatorEngine;
import in.perpscan.service.mtf.TimeframeAligner;
import in.perpscan.service.regime.RegimeClassifier;
import in.perpscan.service.trade.TradeStructurer;
import in.perpscan.service.trade.TradeStructurer.StructuringResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-instrument flow from raw bars to an accepted trade or a reason for having none.
 *
 * align → prefilter → classify → score → agreement → filter → threshold → structure
 *
 * Stateless apart from immutable configuration; safe to share across threads.
 */
public final class SignalPipeline {
    private static final Logger log = LoggerFactory.getLogger(SignalPipeline.class);

    private final TimeframeAligner aligner;
    private final InstrumentPrefilter prefilter;
    private final RegimeClassifier regimeClassifier;
    private final ScoreModel scoreModel;
    private final SignalFilterStage filterStage;
    private final TradeStructurer structurer;
    private final BigDecimal minScore;
    private final BigDecimal minConfidence;
    private final Horizon structureHorizon;

    public SignalPipeline(ScannerConfig config, SignalFilterStage filterStage) {
        this.aligner = new TimeframeAligner(new IndicatorEngine(config.indicators()));
        this.prefilter = new InstrumentPrefilter(config.prefilter());
        this.regimeClassifier = new RegimeClassifier(config.regime());
        this.structureHorizon = config.risk().structureHorizon();
        this.scoreModel = new ScoreModel(config.scoring(), structureHorizon);
        this.filterStage = filterStage;
        this.structurer = new TradeStructurer(config.risk(), config.trailingStop());
        this.minScore = config.scoring().minScore();
        this.minConfidence = config.scoring().minConfidence();
    }

    public InstrumentOutcome evaluate(String symbol, Map<Horizon, List<Bar>> barsByHorizon, AccountSnapshot account) {
        AlignmentResult alignment = aligner.align(symbol, barsByHorizon);
        if (!alignment.ready()) {
            return InstrumentOutcome.rejected(symbol, NoSignalReason.INSUFFICIENT_DATA, false);
        }

        Optional<NoSignalReason> gate = prefilter.check(alignment.view(Horizon.MEDIUM));
        if (gate.isPresent()) {
            log.debug("[PIPELINE] {} prefilter: {}", symbol, gate.get());
            return InstrumentOutcome.rejected(symbol, gate.get(), false);
        }

        RegimeClassification regime = regimeClassifier.classify(
            alignment.view(Horizon.LONG), alignment.view(Horizon.MEDIUM));

        Optional<Signal> scored = scoreModel.score(alignment, regime);
        if (scored.isEmpty()) {
            return InstrumentOutcome.rejected(symbol, NoSignalReason.NO_DIRECTION, false);
        }
        Signal candidate = scored.get();
        if (!candidate.horizonsAgree()) {
            log.debug("[PIPELINE] {} horizons disagree: {}", symbol, candidate.horizonTrends());
            return InstrumentOutcome.rejected(symbol, NoSignalReason.HORIZON_DISAGREEMENT, false);
        }

        FilterOutcome filtered = filterStage.apply(candidate, alignment);
        boolean degraded = filtered.degraded();
        if (filtered.vetoed()) {
            return InstrumentOutcome.rejected(symbol, NoSignalReason.FILTER_VETO, degraded);
        }
        Signal signal = filtered.signal();

        if (!signal.meetsThresholds(minScore, minConfidence)) {
            log.debug("[PIPELINE] {} below threshold: score={} conf={}", symbol, signal.baseScore(), signal.confidence());
            return InstrumentOutcome.rejected(symbol, NoSignalReason.BELOW_THRESHOLD, degraded);
        }

        StructuringResult structured = structurer.structure(signal, account, alignment.view(structureHorizon).latest());
        if (!structured.isSuccess()) {
            log.debug("[PIPELINE] {} structuring failed: {} ({})", symbol, structured.failure(), structured.detail());
            return InstrumentOutcome.rejected(symbol, structured.failure(), degraded);
        }

        log.info("[PIPELINE] ✅ {} {} score={} conf={} regime={} style={} rr={}", symbol, signal.side(),
            signal.baseScore(), signal.confidence(), signal.regime(), signal.style(),
            structured.structure().rewardToRisk());
        return InstrumentOutcome.accepted(new RankedTrade(signal, structured.structure()), degraded);
    }

    /**
     * Result for one instrument: an accepted trade, or the reason there is none.
     */
    public record InstrumentOutcome(
        String symbol,
        RankedTrade trade,          // null unless accepted
        NoSignalReason reason,      // null when accepted
        boolean filterDegraded
    ) {
        public static InstrumentOutcome accepted(RankedTrade trade, boolean filterDegraded) {
            return new InstrumentOutcome(trade.symbol(), trade, null, filterDegraded);
        }

        public static InstrumentOutcome rejected(String symbol, NoSignalReason reason, boolean filterDegraded) {
            return new InstrumentOutcome(symbol, null, reason, filterDegraded);
        }

        public boolean isAccepted() {
            return trade != null;
        }

        public Optional<RankedTrade> tradeOpt() {
            return Optional.ofNullable(trade);
        }
    }
}
