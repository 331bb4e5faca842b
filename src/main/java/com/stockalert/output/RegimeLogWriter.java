package com.stockalert.output;

import com.stockalert.config.Config;
import com.stockalert.model.Signal;
import com.stockalert.regime.RegimeScoreResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Appends one row per run to a local workbook, writing the header when the sheet is new.
 * Every cell is stored as text exactly as formatted here.
 */
public final class RegimeLogWriter {
    private static final Logger LOG = LogManager.getLogger(RegimeLogWriter.class);

    public static final List<String> HEADER = List.of(
            "date",
            "state",
            "total_score",
            "nfci_L",
            "s_1w",
            "s_4w",
            "price_close",
            "ma50",
            "ma200",
            "price_score",
            "level_score",
            "trend_score",
            "abs_penalty",
            "max_exposure",
            "allow_new_entries",
            "risk_off_trigger",
            "risk_on_trigger",
            "notes",
            "regime_json",
            "hits_json"
    );

    private final boolean enabled;
    private final Path path;
    private final String sheetName;

    public RegimeLogWriter(boolean enabled, Path path, String sheetName) {
        this.enabled = enabled;
        this.path = path;
        this.sheetName = sheetName == null || sheetName.isBlank() ? "regime" : sheetName;
    }

    public static RegimeLogWriter fromConfig(Config config) {
        return new RegimeLogWriter(
                config.getBoolean("regime_log.enabled", true),
                config.getPath("regime_log.path"),
                config.getString("regime_log.sheet")
        );
    }

    public Path path() {
        return path;
    }

    /**
     * @return {@code false} when logging is disabled
     */
    public boolean append(RegimeScoreResult result, List<Signal> hits) throws IOException {
        if (!enabled) {
            return false;
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        try (Workbook wb = openOrCreate()) {
            Sheet sheet = wb.getSheet(sheetName);
            if (sheet == null) {
                sheet = wb.createSheet(sheetName);
            }
            if (sheet.getPhysicalNumberOfRows() == 0) {
                writeRow(sheet.createRow(0), HEADER);
            }
            int next = sheet.getLastRowNum() + 1;
            writeRow(sheet.createRow(next), row(result, hits));
            try (OutputStream out = Files.newOutputStream(path)) {
                wb.write(out);
            }
            LOG.info("regime log appended path=" + path + " row=" + next);
        }
        return true;
    }

    static List<String> row(RegimeScoreResult r, List<Signal> hits) {
        List<String> cells = new ArrayList<>(HEADER.size());
        cells.add(String.valueOf(r.date));
        cells.add(r.state == null ? "" : r.state.name());
        cells.add(six(r.totalScore));
        cells.add(six(r.nfciLevel));
        cells.add(six(r.s1w));
        cells.add(six(r.s4w));
        cells.add(six(r.priceClose));
        cells.add(six(r.ma50));
        cells.add(six(r.ma200));
        cells.add(String.valueOf(r.priceScore));
        cells.add(six(r.levelScore));
        cells.add(six(r.trendScore));
        cells.add(six(r.absPenalty));
        cells.add(String.format(Locale.ROOT, "%.2f", r.maxExposure()));
        cells.add(String.valueOf(r.allowNewEntries));
        cells.add(String.valueOf(r.riskOffTrigger));
        cells.add(String.valueOf(r.riskOnTrigger));
        cells.add(r.notes == null ? "" : r.notes);
        cells.add(r.toJson().toString());
        cells.add(hitsJson(hits).toString());
        return cells;
    }

    static JSONArray hitsJson(List<Signal> hits) {
        JSONArray arr = new JSONArray();
        if (hits == null) {
            return arr;
        }
        for (Signal hit : hits) {
            JSONObject item = new JSONObject();
            item.put("symbol", hit.symbol);
            item.put("close", String.format(Locale.ROOT, "%.2f", hit.close));
            arr.put(item);
        }
        return arr;
    }

    private Workbook openOrCreate() throws IOException {
        if (!Files.exists(path)) {
            return new XSSFWorkbook();
        }
        byte[] bytes = Files.readAllBytes(path);
        return WorkbookFactory.create(new ByteArrayInputStream(bytes));
    }

    private static void writeRow(Row row, List<String> values) {
        for (int i = 0; i < values.size(); i++) {
            row.createCell(i).setCellValue(values.get(i));
        }
    }

    private static String six(double value) {
        return String.format(Locale.ROOT, "%.6f", value);
    }
}
