package com.stockalert.regime;

import com.stockalert.indicator.Rolling;
import com.stockalert.model.ConditionsIndexSeries;
import com.stockalert.model.OhlcvSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores the market regime from a financial-conditions index and a benchmark price series.
 */
public final class RegimeClassifier {
    private static final Logger LOG = LogManager.getLogger(RegimeClassifier.class);

    static final int WEEK_BARS = 5;
    static final int MONTH_BARS = 20;
    static final int MA_MID = 50;
    static final int MA_LONG = 200;

    static final double WEEKLY_TRIGGER = 0.05;
    static final double MONTHLY_TRIGGER = 0.10;

    static final String NOTE_RISK_OFF = "risk_off_trigger: max_exposure lowered";
    static final String NOTE_RISK_ON = "risk_on_trigger: no exposure boost";

    public RegimeScoreResult classify(
            ConditionsIndexSeries conditions,
            OhlcvSeries benchmark,
            LocalDate asOfDate
    ) throws RegimeException {
        if (benchmark == null || benchmark.isEmpty()) {
            throw new NoTradingDayException("benchmark series is empty");
        }
        int asOf = benchmark.indexOnOrBefore(asOfDate);
        if (asOf < 0) {
            throw new NoTradingDayException("no benchmark trading day on or before " + asOfDate);
        }
        if (conditions == null || conditions.isEmpty()) {
            throw new AlignmentException("conditions index series is empty");
        }

        double[] close = benchmark.closes();
        double[] ma50 = Rolling.mean(close, MA_MID);
        double[] ma200 = Rolling.mean(close, MA_LONG);

        double[] level = alignToCalendar(conditions, benchmark);
        double[] s1w = Rolling.diff(level, WEEK_BARS);
        double[] s4w = Rolling.diff(level, MONTH_BARS);
        double[] s1wPrev = Rolling.shift(s1w, WEEK_BARS);

        List<String> missing = new ArrayList<>();
        requireKnown(missing, "level", level[asOf]);
        requireKnown(missing, "s_1w", s1w[asOf]);
        requireKnown(missing, "s_4w", s4w[asOf]);
        requireKnown(missing, "s_1w_prev", s1wPrev[asOf]);
        requireKnown(missing, "ma50", ma50[asOf]);
        requireKnown(missing, "ma200", ma200[asOf]);
        if (!missing.isEmpty()) {
            throw new InsufficientHistoryException(
                    "insufficient history for regime score at " + benchmark.dateAt(asOf), missing);
        }

        double l = level[asOf];
        double w1 = s1w[asOf];
        double w4 = s4w[asOf];
        double w1Prev = s1wPrev[asOf];

        boolean riskOffTrigger = (w1 > WEEKLY_TRIGGER && w1Prev > WEEKLY_TRIGGER) || w4 > MONTHLY_TRIGGER;
        boolean riskOnTrigger = (w1 < -WEEKLY_TRIGGER && w1Prev < -WEEKLY_TRIGGER) || w4 < -MONTHLY_TRIGGER;

        double price = close[asOf];
        double ma50t = ma50[asOf];
        double ma200t = ma200[asOf];
        int priceScore = priceScore(price, ma50t, ma200t);
        double levelScore = levelScore(l);
        double trendScore = trendScore(w1, w4);
        double absPenalty = absPenalty(l);
        double totalScore = totalScore(levelScore, trendScore, priceScore, absPenalty);

        RegimeState state = RegimeState.fromScore(totalScore);
        ExposureLevel exposure = state.exposure();
        boolean allowNewEntries = state.allowsNewEntries();
        String notes = "";
        if (riskOffTrigger) {
            allowNewEntries = false;
            exposure = exposure.stepDown();
            notes = NOTE_RISK_OFF;
        } else if (riskOnTrigger) {
            notes = NOTE_RISK_ON;
        }

        LOG.info(String.format(
                Locale.US,
                "REGIME date=%s evaluation_date=%s state=%s score=%.2f max_exposure=%.2f allow_new_entries=%s risk_off=%s risk_on=%s",
                asOfDate,
                benchmark.dateAt(asOf),
                state,
                totalScore,
                exposure.cap(),
                allowNewEntries,
                riskOffTrigger,
                riskOnTrigger
        ));

        return RegimeScoreResult.builder()
                .date(asOfDate)
                .evaluationDate(benchmark.dateAt(asOf))
                .nfciLevel(l)
                .s1w(w1)
                .s4w(w4)
                .s1wPrev(w1Prev)
                .priceClose(price)
                .ma50(ma50t)
                .ma200(ma200t)
                .priceScore(priceScore)
                .levelScore(levelScore)
                .trendScore(trendScore)
                .absPenalty(absPenalty)
                .totalScore(totalScore)
                .riskOffTrigger(riskOffTrigger)
                .riskOnTrigger(riskOnTrigger)
                .state(state)
                .exposure(exposure)
                .allowNewEntries(allowNewEntries)
                .notes(notes)
                .build();
    }

    /**
     * Index values on the benchmark's trading days: exact-date matches, then each gap carries
     * the previous aligned value forward.
     */
    static double[] alignToCalendar(ConditionsIndexSeries conditions, OhlcvSeries benchmark) {
        double[] out = new double[benchmark.size()];
        double carry = Double.NaN;
        for (int i = 0; i < out.length; i++) {
            double v = conditions.valueOn(benchmark.dateAt(i));
            if (!Double.isNaN(v)) {
                carry = v;
            }
            out[i] = carry;
        }
        return out;
    }

    static int priceScore(double price, double ma50, double ma200) {
        if (price > ma50 && ma50 > ma200) {
            return 30;
        }
        if (price > ma50 && ma50 <= ma200) {
            return 15;
        }
        if (price <= ma50 && price > ma200) {
            return 5;
        }
        return 0;
    }

    static double levelScore(double level) {
        return 35.0 * clip01((-level + 0.5) / 1.2);
    }

    static double trendScore(double s1w, double s4w) {
        double trendRaw = 0.6 * s1w + 0.4 * (s4w / 4.0);
        return 35.0 * clip01((-trendRaw + 0.03) / 0.10);
    }

    static double absPenalty(double level) {
        return 15.0 * clip01((Math.abs(level) - 0.3) / 0.7);
    }

    static double totalScore(double levelScore, double trendScore, double priceScore, double absPenalty) {
        double total = levelScore + trendScore + priceScore - absPenalty;
        return Math.max(0.0, Math.min(100.0, total));
    }

    static double clip01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static void requireKnown(List<String> missing, String name, double value) {
        if (Double.isNaN(value)) {
            missing.add(name);
        }
    }
}
