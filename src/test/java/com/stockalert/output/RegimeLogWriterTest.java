package com.stockalert.output;

import com.stockalert.model.Signal;
import com.stockalert.regime.RegimeFixtures;
import com.stockalert.regime.RegimeScoreResult;
import com.stockalert.regime.RegimeState;
import com.stockalert.strategy.TriggerKind;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegimeLogWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void append_shouldWriteHeaderOnceAndOneRowPerRun() throws Exception {
        Path file = tempDir.resolve("outputs").resolve("regime_log.xlsx");
        RegimeLogWriter writer = new RegimeLogWriter(true, file, "regime");
        RegimeScoreResult result = RegimeFixtures.result(RegimeState.RISK_ON, false);
        List<Signal> hits = List.of(new Signal("AAPL", TriggerKind.BREAKOUT_20D, 190.456, LocalDate.of(2024, 6, 3)));

        assertTrue(writer.append(result, hits));
        assertTrue(writer.append(result, List.of()));

        try (InputStream in = Files.newInputStream(file); Workbook wb = WorkbookFactory.create(in)) {
            Sheet sheet = wb.getSheet("regime");
            assertNotNull(sheet);
            assertEquals(2, sheet.getLastRowNum());

            Row header = sheet.getRow(0);
            assertEquals(RegimeLogWriter.HEADER.size(), header.getLastCellNum());
            assertEquals("date", header.getCell(0).getStringCellValue());
            assertEquals("hits_json", header.getCell(19).getStringCellValue());

            Row first = sheet.getRow(1);
            assertEquals("2024-06-03", first.getCell(0).getStringCellValue());
            assertEquals("RISK_ON", first.getCell(1).getStringCellValue());
            assertEquals("76.894048", first.getCell(2).getStringCellValue());
            assertEquals("30", first.getCell(9).getStringCellValue());
            assertEquals("0.70", first.getCell(13).getStringCellValue());
            assertEquals("true", first.getCell(14).getStringCellValue());
            assertEquals("RISK_ON", new JSONObject(first.getCell(18).getStringCellValue()).getString("state"));

            JSONArray hitsJson = new JSONArray(first.getCell(19).getStringCellValue());
            assertEquals("AAPL", hitsJson.getJSONObject(0).getString("symbol"));
            assertEquals("190.46", hitsJson.getJSONObject(0).getString("close"));
            assertEquals("[]", sheet.getRow(2).getCell(19).getStringCellValue());
        }
    }

    @Test
    void append_shouldDoNothingWhenDisabled() throws Exception {
        Path file = tempDir.resolve("regime_log.xlsx");
        RegimeLogWriter writer = new RegimeLogWriter(false, file, "regime");

        assertFalse(writer.append(RegimeFixtures.result(RegimeState.NEUTRAL, false), List.of()));
        assertFalse(Files.exists(file));
    }
}
