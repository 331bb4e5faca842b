package com.stockalert.regime;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import org.json.JSONObject;

import java.time.LocalDate;

/**
 * Everything the regime step computed for one evaluation date, including the sub-scores.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RegimeScoreResult {
    public final LocalDate date;
    public final LocalDate evaluationDate;
    public final double nfciLevel;
    public final double s1w;
    public final double s4w;
    public final double s1wPrev;
    public final double priceClose;
    public final double ma50;
    public final double ma200;
    public final int priceScore;
    public final double levelScore;
    public final double trendScore;
    public final double absPenalty;
    public final double totalScore;
    public final boolean riskOffTrigger;
    public final boolean riskOnTrigger;
    public final RegimeState state;
    public final ExposureLevel exposure;
    public final boolean allowNewEntries;
    public final String notes;

    public double maxExposure() {
        return exposure == null ? 0.0 : exposure.cap();
    }

    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("date", String.valueOf(date));
        root.put("evaluation_date", String.valueOf(evaluationDate));
        root.put("nfci_L", nfciLevel);
        root.put("s_1w", s1w);
        root.put("s_4w", s4w);
        root.put("s_1w_prev", s1wPrev);
        root.put("price_close", priceClose);
        root.put("ma50", ma50);
        root.put("ma200", ma200);
        root.put("price_score", priceScore);
        root.put("level_score", levelScore);
        root.put("trend_score", trendScore);
        root.put("abs_penalty", absPenalty);
        root.put("total_score", totalScore);
        root.put("risk_off_trigger", riskOffTrigger);
        root.put("risk_on_trigger", riskOnTrigger);
        root.put("state", state == null ? "" : state.name());
        root.put("max_exposure", maxExposure());
        root.put("allow_new_entries", allowNewEntries);
        root.put("notes", notes == null ? "" : notes);
        return root;
    }
}
