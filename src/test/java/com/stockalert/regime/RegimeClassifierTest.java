package com.stockalert.regime;

import com.stockalert.model.ConditionsIndexSeries;
import com.stockalert.model.OhlcvSeries;
import com.stockalert.model.SeriesFixtures;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegimeClassifierTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private final RegimeClassifier classifier = new RegimeClassifier();

    private static ConditionsIndexSeries nfciOnBusinessDays(double[] values) {
        List<LocalDate> dates = SeriesFixtures.businessDates(START, values.length);
        Map<LocalDate, Double> map = new TreeMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(dates.get(i), values[i]);
        }
        return new ConditionsIndexSeries(map);
    }

    private static OhlcvSeries benchmark(double[] close) {
        return SeriesFixtures.businessDays("QQQ", START, close, 100.0);
    }

    @Test
    void priceScore_shouldCoverEveryBranch() {
        assertEquals(30, RegimeClassifier.priceScore(110.0, 100.0, 90.0));
        assertEquals(15, RegimeClassifier.priceScore(110.0, 100.0, 120.0));
        assertEquals(5, RegimeClassifier.priceScore(95.0, 100.0, 90.0));
        assertEquals(0, RegimeClassifier.priceScore(80.0, 100.0, 120.0));
    }

    @Test
    void subScoresShouldClipToTheirRanges() {
        assertEquals(35.0, RegimeClassifier.levelScore(-5.0), 1e-12);
        assertEquals(0.0, RegimeClassifier.levelScore(5.0), 1e-12);
        assertEquals(35.0, RegimeClassifier.trendScore(-1.0, -1.0), 1e-12);
        assertEquals(0.0, RegimeClassifier.trendScore(1.0, 1.0), 1e-12);
        assertEquals(0.0, RegimeClassifier.absPenalty(0.2), 1e-12);
        assertEquals(15.0, RegimeClassifier.absPenalty(-2.0), 1e-12);
        assertEquals(100.0, RegimeClassifier.totalScore(35.0, 35.0, 30.0, 0.0), 1e-12);
        assertEquals(0.0, RegimeClassifier.totalScore(0.0, 0.0, 0.0, 15.0), 1e-12);
    }

    @Test
    void classify_shouldKeepScoreWithinBounds() throws RegimeException {
        double[] close = SeriesFixtures.concat(SeriesFixtures.repeat(100.0, 200), SeriesFixtures.repeat(110.0, 30));
        OhlcvSeries qqq = benchmark(close);

        RegimeScoreResult result = classifier.classify(nfciOnBusinessDays(new double[close.length]), qqq, qqq.latest().tradeDate);

        assertTrue(result.totalScore >= 0.0 && result.totalScore <= 100.0);
        assertEquals(30, result.priceScore);
        assertEquals(RegimeState.fromScore(result.totalScore), result.state);
    }

    @Test
    void classify_shouldForceNoEntriesAndLowerExposureOnRiskOff() throws RegimeException {
        double[] close = SeriesFixtures.repeat(100.0, 220);
        double[] nfci = new double[close.length];
        for (int i = 0; i < nfci.length; i++) {
            nfci[i] = 0.012 * i;
        }

        RegimeScoreResult result = classifier.classify(nfciOnBusinessDays(nfci), benchmark(close), LocalDate.of(2024, 10, 31));

        assertTrue(result.riskOffTrigger);
        assertFalse(result.allowNewEntries);
        RegimeState base = RegimeState.fromScore(result.totalScore);
        assertEquals(base.exposure().stepDown(), result.exposure);
        assertEquals(base.exposure().stepDown().cap(), result.maxExposure(), 1e-12);
        assertEquals(RegimeClassifier.NOTE_RISK_OFF, result.notes);
        assertEquals(LocalDate.of(2024, 10, 31), result.evaluationDate);
    }

    @Test
    void classify_shouldNoteRiskOnWithoutRaisingExposure() throws RegimeException {
        double[] close = SeriesFixtures.repeat(100.0, 220);
        double[] nfci = new double[close.length];
        for (int i = 0; i < nfci.length; i++) {
            nfci[i] = -0.012 * i;
        }

        RegimeScoreResult result = classifier.classify(nfciOnBusinessDays(nfci), benchmark(close), LocalDate.of(2024, 10, 31));

        assertTrue(result.riskOnTrigger);
        assertFalse(result.riskOffTrigger);
        assertEquals(result.state.exposure(), result.exposure);
        assertEquals(RegimeClassifier.NOTE_RISK_ON, result.notes);
    }

    @Test
    void classify_shouldEvaluateLatestTradingDayOnOrBeforeRequest() throws RegimeException {
        OhlcvSeries qqq = benchmark(SeriesFixtures.repeat(100.0, 230));
        LocalDate saturday = LocalDate.of(2024, 11, 9);

        RegimeScoreResult result = classifier.classify(nfciOnBusinessDays(new double[230]), qqq, saturday);

        assertEquals(saturday, result.date);
        assertEquals(LocalDate.of(2024, 11, 8), result.evaluationDate);
    }

    @Test
    void classify_shouldForwardFillWeeklyIndex() throws RegimeException {
        OhlcvSeries qqq = benchmark(SeriesFixtures.repeat(100.0, 230));
        Map<LocalDate, Double> weekly = new TreeMap<>();
        for (LocalDate d : SeriesFixtures.businessDates(START, 230)) {
            if (d.getDayOfWeek() == java.time.DayOfWeek.FRIDAY) {
                weekly.put(d, 0.1);
            }
        }

        RegimeScoreResult result = classifier.classify(new ConditionsIndexSeries(weekly), qqq, qqq.latest().tradeDate);

        assertEquals(0.1, result.nfciLevel, 1e-12);
        assertEquals(0.0, result.s1w, 1e-12);
    }

    @Test
    void classify_shouldRejectDateBeforeFirstTradingDay() {
        OhlcvSeries qqq = benchmark(SeriesFixtures.repeat(100.0, 230));

        assertThrows(NoTradingDayException.class,
                () -> classifier.classify(nfciOnBusinessDays(new double[230]), qqq, LocalDate.of(2023, 12, 29)));
        assertThrows(NoTradingDayException.class,
                () -> classifier.classify(nfciOnBusinessDays(new double[230]), OhlcvSeries.empty("QQQ"), LocalDate.of(2024, 6, 3)));
    }

    @Test
    void classify_shouldRejectEmptyIndex() {
        OhlcvSeries qqq = benchmark(SeriesFixtures.repeat(100.0, 230));

        assertThrows(AlignmentException.class,
                () -> classifier.classify(new ConditionsIndexSeries(Map.of()), qqq, qqq.latest().tradeDate));
    }

    @Test
    void classify_shouldListMissingInputsOnShortHistory() {
        OhlcvSeries qqq = benchmark(SeriesFixtures.repeat(100.0, 120));

        InsufficientHistoryException e = assertThrows(InsufficientHistoryException.class,
                () -> classifier.classify(nfciOnBusinessDays(new double[120]), qqq, qqq.latest().tradeDate));

        assertEquals(List.of("ma200"), e.missing());
    }
}
