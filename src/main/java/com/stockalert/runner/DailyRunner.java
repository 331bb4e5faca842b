package com.stockalert.runner;

import com.stockalert.config.Config;
import com.stockalert.config.RuleBook;
import com.stockalert.data.NfciClient;
import com.stockalert.data.http.HttpClientEx;
import com.stockalert.data.provider.DataUnavailableException;
import com.stockalert.data.provider.MarketDataFetcher;
import com.stockalert.indicator.IndicatorEngine;
import com.stockalert.indicator.IndicatorSet;
import com.stockalert.model.BarDaily;
import com.stockalert.model.ConditionsIndexSeries;
import com.stockalert.model.EligibilityResult;
import com.stockalert.model.OhlcvSeries;
import com.stockalert.model.Signal;
import com.stockalert.model.TriggerResult;
import com.stockalert.output.AlertReportBuilder;
import com.stockalert.output.Notifier;
import com.stockalert.output.RegimeLogWriter;
import com.stockalert.regime.RegimeClassifier;
import com.stockalert.regime.RegimeException;
import com.stockalert.regime.RegimeScoreResult;
import com.stockalert.regime.RegimeState;
import com.stockalert.strategy.EligibilityFilter;
import com.stockalert.strategy.TriggerEngine;
import com.stockalert.strategy.TriggerKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One daily scan: regime first, then every configured symbol in order, then a single
 * notification and a regime log row.
 */
public final class DailyRunner {
    private static final Logger LOG = LogManager.getLogger(DailyRunner.class);

    static final int DEFAULT_DD_WINDOW = 90;
    static final double DEFAULT_DD_MAX = 0.25;

    private final Config config;
    private final MarketDataFetcher fetcher;
    private final NfciClient nfciClient;
    private final Notifier notifier;
    private final RegimeLogWriter regimeLog;
    private final Clock clock;

    private final IndicatorEngine indicatorEngine = new IndicatorEngine();
    private final EligibilityFilter eligibilityFilter;
    private final TriggerEngine triggerEngine = new TriggerEngine();
    private final RegimeClassifier regimeClassifier = new RegimeClassifier();

    private final int ddWindow;
    private final double ddMax;

    public DailyRunner(
            Config config,
            RuleBook rules,
            MarketDataFetcher fetcher,
            NfciClient nfciClient,
            Notifier notifier,
            RegimeLogWriter regimeLog,
            Clock clock
    ) {
        this.config = config;
        this.fetcher = fetcher;
        this.nfciClient = nfciClient;
        this.notifier = notifier;
        this.regimeLog = regimeLog;
        this.clock = clock;
        this.eligibilityFilter = new EligibilityFilter(config);
        this.ddWindow = rules.intParam(TriggerEngine.DD_RULE_ID, "window_days", DEFAULT_DD_WINDOW);
        this.ddMax = rules.doubleParam(TriggerEngine.DD_RULE_ID, "dd_max", DEFAULT_DD_MAX);
    }

    public static DailyRunner create(Config config, RuleBook rules) throws IOException {
        HttpClientEx http = new HttpClientEx();
        return new DailyRunner(
                config,
                rules,
                MarketDataFetcher.fromConfig(config, System::getenv, http),
                new NfciClient(config, http),
                Notifier.fromConfig(config, http, System::getenv),
                RegimeLogWriter.fromConfig(config),
                Clock.systemUTC()
        );
    }

    public DailyRunOutcome run(LocalDate asOf) {
        LocalDate runDate = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        List<String> symbols = config.getList("symbols");
        System.out.println(String.format(
                Locale.US,
                "Daily scan start. as_of=%s symbols=%d benchmark=%s dd_window=%d dd_max=%.4f",
                asOf,
                symbols.size(),
                config.getString("benchmark.symbol"),
                ddWindow,
                ddMax
        ));

        RegimeScoreResult regime;
        try {
            regime = classifyRegime(asOf);
        } catch (RegimeException | DataUnavailableException | IOException | RuntimeException e) {
            return regimeFailure(asOf, runDate, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return regimeFailure(asOf, runDate, e);
        }

        List<Signal> signals = new ArrayList<>();
        List<String> eligible = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Map<String, Integer> rejected = new LinkedHashMap<>();
        for (String symbol : symbols) {
            try {
                OhlcvSeries series = fetcher.fetchDaily(symbol);
                SymbolEvaluation evaluation = evaluateSymbol(symbol, series);
                if (evaluation.reasons.isEmpty()) {
                    eligible.add(symbol);
                } else {
                    for (String reason : evaluation.reasons) {
                        rejected.merge(reason, 1, Integer::sum);
                    }
                }
                for (Signal signal : evaluation.signals) {
                    if (RegimeState.regimeAllows(regime.state, signal.trigger)) {
                        signals.add(signal);
                    }
                }
            } catch (DataUnavailableException | RuntimeException e) {
                LOG.warn("SKIP symbol=" + symbol + " reason=" + e.getMessage());
                skipped.add(symbol);
                if (Thread.currentThread().isInterrupted()) {
                    LOG.warn("Scan interrupted after symbol=" + symbol + ", remaining symbols not fetched");
                    break;
                }
            }
        }

        String title = AlertReportBuilder.title(runDate, regime);
        List<String> lines = new ArrayList<>(configSummary());
        lines.addAll(AlertReportBuilder.body(regime, signals, eligible, rejected, skipped));
        List<String> delivered = notifier.notifyBatch(title, lines);

        List<Signal> hits = regime.allowNewEntries ? signals : List.of();
        try {
            regimeLog.append(regime, hits);
        } catch (IOException | RuntimeException e) {
            LOG.warn("regime log append failed path=" + regimeLog.path() + " err=" + e.getMessage());
        }

        System.out.println(String.format(
                Locale.US,
                "Daily scan done. state=%s signals=%d eligible=%d skipped=%d",
                regime.state,
                signals.size(),
                eligible.size(),
                skipped.size()
        ));
        return DailyRunOutcome.builder()
                .asOf(asOf)
                .regime(regime)
                .signals(List.copyOf(signals))
                .eligibleSymbols(List.copyOf(eligible))
                .skippedSymbols(List.copyOf(skipped))
                .rejectedReasons(Collections.unmodifiableMap(new LinkedHashMap<>(rejected)))
                .title(title)
                .lines(List.copyOf(lines))
                .deliveredChannels(delivered)
                .build();
    }

    private RegimeScoreResult classifyRegime(LocalDate asOf)
            throws RegimeException, DataUnavailableException, IOException, InterruptedException {
        ConditionsIndexSeries nfci = nfciClient.fetchSeries();
        OhlcvSeries benchmark = fetcher.fetchDaily(config.getString("benchmark.symbol"));
        return regimeClassifier.classify(nfci, benchmark, asOf);
    }

    private DailyRunOutcome regimeFailure(LocalDate asOf, LocalDate runDate, Exception e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        LOG.error("Regime calculation failed: " + message, e);
        String title = AlertReportBuilder.errorTitle(runDate);
        List<String> lines = List.of("Regime calculation failed: " + message);
        List<String> delivered = notifier.notifyBatch(title, lines);
        return DailyRunOutcome.builder()
                .asOf(asOf)
                .regimeError(message)
                .signals(List.of())
                .eligibleSymbols(List.of())
                .skippedSymbols(List.of())
                .rejectedReasons(Map.of())
                .title(title)
                .lines(lines)
                .deliveredChannels(delivered)
                .build();
    }

    /**
     * Triggers run only for eligible symbols; every fired trigger becomes a signal at the
     * latest bar.
     */
    SymbolEvaluation evaluateSymbol(String symbol, OhlcvSeries series) {
        IndicatorSet indicators = indicatorEngine.compute(series);
        EligibilityResult eligibility = eligibilityFilter.check(series, indicators);
        if (!eligibility.eligible) {
            return new SymbolEvaluation(List.of(), eligibility.reasons);
        }

        double tol = config.getDouble("filters.tolerance");
        List<TriggerResult> fired = new ArrayList<>();
        if (config.getBoolean("triggers.pullback_25.enabled", true)) {
            addIfFired(fired, triggerEngine.pullback25Bounce(series, indicators, tol));
        }
        if (config.getBoolean("triggers.pullback_50.enabled", true)) {
            addIfFired(fired, triggerEngine.pullback50Bounce(series, indicators, tol, eligibilityFilter.drawdownMax()));
        }
        if (config.getBoolean("triggers.breakout_20d.enabled", true)) {
            addIfFired(fired, triggerEngine.breakout20d(
                    series,
                    indicators,
                    config.getDouble("triggers.breakout_volume_mult"),
                    ddWindow,
                    ddMax
            ));
        }

        BarDaily latest = series.latest();
        List<Signal> signals = new ArrayList<>();
        for (TriggerResult result : fired) {
            signals.add(new Signal(symbol, TriggerKind.fromCode(result.reason), latest.close, latest.tradeDate));
        }
        return new SymbolEvaluation(signals, List.of());
    }

    private List<String> configSummary() {
        return AlertReportBuilder.configSummary(
                eligibilityFilter.sma50Tolerance(),
                eligibilityFilter.drawdownMax(),
                ddWindow,
                ddMax,
                config.getBoolean("triggers.pullback_25.enabled", true),
                config.getBoolean("triggers.pullback_50.enabled", true),
                config.getBoolean("triggers.breakout_20d.enabled", true),
                config.getDouble("triggers.breakout_volume_mult")
        );
    }

    private static void addIfFired(List<TriggerResult> out, TriggerResult result) {
        if (result.fired) {
            out.add(result);
        }
    }

    static final class SymbolEvaluation {
        final List<Signal> signals;
        final List<String> reasons;

        SymbolEvaluation(List<Signal> signals, List<String> reasons) {
            this.signals = signals;
            this.reasons = reasons;
        }
    }
}
