package com.stockalert.runner;

import com.stockalert.config.Config;
import com.stockalert.config.RuleBook;
import com.stockalert.data.NfciClient;
import com.stockalert.data.http.FakeHttpClientEx;
import com.stockalert.data.provider.DailySeriesProvider;
import com.stockalert.data.provider.FakeTimeSource;
import com.stockalert.data.provider.MarketDataFetcher;
import com.stockalert.data.provider.ProviderException;
import com.stockalert.data.provider.ProviderKind;
import com.stockalert.data.provider.RequestThrottle;
import com.stockalert.data.provider.RetryPolicy;
import com.stockalert.model.EligibilityResult;
import com.stockalert.model.OhlcvSeries;
import com.stockalert.model.SeriesFixtures;
import com.stockalert.output.Mailer;
import com.stockalert.output.Notifier;
import com.stockalert.output.RegimeLogWriter;
import com.stockalert.regime.RegimeState;
import com.stockalert.strategy.TriggerKind;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DailyRunnerTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate AS_OF = LocalDate.of(2024, 11, 15);
    private static final int BENCHMARK_BARS = 230;

    @TempDir
    Path tempDir;

    private final FakeHttpClientEx http = new FakeHttpClientEx();
    private final Map<String, OhlcvSeries> market = new HashMap<>();

    private final Set<String> interruptOn = new HashSet<>();

    private DailyRunner runner() {
        return runner(List.of("AAA", "BBB", "BAD"));
    }

    private DailyRunner runner(List<String> symbols) {
        Config config = Config.fromMap(tempDir, Map.of(
                "symbols", symbols,
                "notifications", Map.of("email_enabled", "false"),
                "regime_log", Map.of("path", "out/regime_log.xlsx")
        ));
        FakeTimeSource time = new FakeTimeSource();
        MarketDataFetcher fetcher = new MarketDataFetcher(
                List.of(new FixtureProvider(market, interruptOn)),
                http,
                null,
                new RetryPolicy(1, 0.0, 0.0),
                RequestThrottle.disabled(time),
                time,
                () -> 0.0,
                30
        );
        return new DailyRunner(
                config,
                RuleBook.parse("{\"rules\":[{\"rule_id\":\"FILTER_DD_002\",\"params\":{\"window_days\":90,\"dd_max\":0.25}}]}"),
                fetcher,
                new NfciClient(http, "https://chicagofed.test/nfci.csv", "https://fred.test/graph.csv?id=NFCI",
                        "https://fred.test/graph.csv?id=ANFCI", 30),
                new Notifier(false, false, false, http, new Mailer(), k -> null, 20),
                RegimeLogWriter.fromConfig(config),
                Clock.fixed(Instant.parse("2024-11-16T12:00:00Z"), ZoneOffset.UTC)
        );
    }

    private void scriptMarket(double nfciStart, double nfciStep) {
        double[] close = new double[BENCHMARK_BARS];
        StringBuilder csv = new StringBuilder("DATE,NFCI\n");
        List<LocalDate> dates = SeriesFixtures.businessDates(START, BENCHMARK_BARS);
        for (int i = 0; i < BENCHMARK_BARS; i++) {
            close[i] = 100.0 + 0.1 * i;
            csv.append(dates.get(i)).append(',').append(nfciStart + nfciStep * i).append('\n');
        }
        http.on("id=NFCI", csv.toString());
        http.on("fixture.test/QQQ", "{}");
        http.on("fixture.test/AAA", "{}");
        http.on("fixture.test/BBB", "{}");
        market.put("QQQ", SeriesFixtures.businessDays("QQQ", START, close, 1_000.0));

        market.put("AAA", SeriesFixtures.daily("AAA", START, SeriesFixtures.repeat(10.0, 260),
                SeriesFixtures.repeat(9.9, 260), SeriesFixtures.repeat(10.1, 260), SeriesFixtures.repeat(100.0, 260)));

        double[] falling = SeriesFixtures.concat(SeriesFixtures.repeat(20.0, 200), SeriesFixtures.repeat(10.0, 60));
        double[] fallingHigh = new double[falling.length];
        double[] fallingLow = new double[falling.length];
        for (int i = 0; i < falling.length; i++) {
            fallingHigh[i] = falling[i] + 0.1;
            fallingLow[i] = falling[i] - 0.1;
        }
        market.put("BBB", SeriesFixtures.daily("BBB", START, falling, fallingLow, fallingHigh,
                SeriesFixtures.repeat(100.0, falling.length)));
    }

    @Test
    void run_shouldReportSignalsInRiskOnRegime() throws Exception {
        scriptMarket(-0.5, 0.0);

        DailyRunOutcome outcome = runner().run(AS_OF);

        assertFalse(outcome.regimeFailed());
        assertEquals(RegimeState.RISK_ON, outcome.regime.state);
        assertEquals("Stock Alerts 2024-11-16 UTC | Regime RISK_ON", outcome.title);
        assertEquals(2, outcome.signals.size());
        assertEquals(TriggerKind.PULLBACK_25_BOUNCE, outcome.signals.get(0).trigger);
        assertEquals(TriggerKind.PULLBACK_50_BOUNCE, outcome.signals.get(1).trigger);
        assertEquals(List.of("AAA"), outcome.eligibleSymbols);
        assertEquals(List.of("BAD"), outcome.skippedSymbols);
        assertEquals(Map.of(EligibilityResult.SMA50_BELOW_SMA200, 1), outcome.rejectedReasons);
        assertTrue(outcome.lines.contains("[PULLBACK_25_BOUNCE]"));
        assertTrue(outcome.lines.contains("- AAA close=10.00 date=2024-09-16"));
        assertTrue(outcome.lines.contains("triggered_symbols: AAA"));
        assertTrue(outcome.lines.contains("top_rejected_reasons: sma50_below_sma200:1"));
        assertTrue(outcome.lines.contains("Skipped symbols: BAD"));
        assertTrue(outcome.deliveredChannels.isEmpty());
        assertTrue(Files.exists(tempDir.resolve("out/regime_log.xlsx")));
    }

    @Test
    void run_shouldStopNewEntriesOnRiskOff() throws Exception {
        scriptMarket(0.0, 0.012);

        DailyRunOutcome outcome = runner().run(AS_OF);

        assertFalse(outcome.regime.allowNewEntries);
        assertTrue(outcome.regime.riskOffTrigger);
        assertTrue(outcome.signals.isEmpty());
        assertTrue(outcome.lines.contains("New entries stopped. max_exposure=0.05"));
        assertTrue(outcome.lines.contains("eligible_symbols: AAA"));
    }

    @Test
    void run_shouldNotifyAndStopWhenRegimeFails() throws Exception {
        http.on("id=NFCI", "DATE,NFCI\n2024-01-05,.\n");

        DailyRunOutcome outcome = runner().run(AS_OF);

        assertTrue(outcome.regimeFailed());
        assertNull(outcome.regime);
        assertEquals("NFCI series empty", outcome.regimeError);
        assertEquals("Stock Alerts 2024-11-16 UTC | Regime ERROR", outcome.title);
        assertEquals(List.of("Regime calculation failed: NFCI series empty"), outcome.lines);
        assertEquals(0, http.count("fixture.test"));
    }

    @Test
    void run_shouldFailRegimeWhenBenchmarkUnavailable() throws Exception {
        http.on("id=NFCI", "DATE,NFCI\n2024-01-05,0.1\n");

        DailyRunOutcome outcome = runner().run(AS_OF);

        assertTrue(outcome.regimeFailed());
        assertTrue(outcome.lines.get(0).startsWith("Regime calculation failed: "));
    }

    @Test
    void run_shouldKeepRejectedReasonsInFirstSeenOrder() throws Exception {
        scriptMarket(-0.5, 0.0);
        http.on("fixture.test/CCC", "{}");
        market.put("CCC", SeriesFixtures.businessDays("CCC", START, SeriesFixtures.repeat(10.0, 10), 100.0));

        DailyRunOutcome outcome = runner(List.of("CCC", "BBB")).run(AS_OF);

        assertEquals(List.of(EligibilityResult.INSUFFICIENT_HISTORY, EligibilityResult.SMA50_BELOW_SMA200),
                new ArrayList<>(outcome.rejectedReasons.keySet()));
        assertTrue(outcome.lines.contains("top_rejected_reasons: insufficient_history:1, sma50_below_sma200:1"));
    }

    @Test
    void run_shouldStopScanningWhenInterrupted() throws Exception {
        scriptMarket(-0.5, 0.0);
        interruptOn.add("AAA");

        DailyRunOutcome outcome;
        try {
            outcome = runner().run(AS_OF);
        } finally {
            Thread.interrupted();
        }

        assertEquals(List.of("AAA"), outcome.skippedSymbols);
        assertEquals(0, http.count("fixture.test/BBB"));
        assertEquals(0, http.count("fixture.test/BAD"));
        assertTrue(outcome.signals.isEmpty());
    }

    /**
     * Serves prepared series; the HTTP payload only decides whether the request succeeded.
     * Symbols in {@code interruptOn} fail with the thread's interrupt flag raised.
     */
    private static final class FixtureProvider implements DailySeriesProvider {
        private final Map<String, OhlcvSeries> market;
        private final Set<String> interruptOn;

        FixtureProvider(Map<String, OhlcvSeries> market, Set<String> interruptOn) {
            this.market = market;
            this.interruptOn = interruptOn;
        }

        @Override
        public ProviderKind kind() {
            return ProviderKind.TWELVE_DATA;
        }

        @Override
        public String requestUrl(String symbol) {
            return "https://fixture.test/" + symbol;
        }

        @Override
        public void validate(String symbol, JSONObject payload) {
        }

        @Override
        public OhlcvSeries parse(String symbol, JSONObject payload) throws ProviderException {
            if (interruptOn.contains(symbol)) {
                Thread.currentThread().interrupt();
                throw new ProviderException(kind(), "interrupted while reading " + symbol);
            }
            OhlcvSeries series = market.get(symbol);
            if (series == null) {
                throw new ProviderException(kind(), "no fixture for " + symbol);
            }
            return series;
        }
    }
}
