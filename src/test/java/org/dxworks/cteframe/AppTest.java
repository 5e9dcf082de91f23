package org.dxworks.cteframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.cteframe.model.SliceReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AppTest {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static final String TWO_CTES = "WITH a AS (SELECT 1), b AS (SELECT * FROM a) SELECT * FROM b;";

    @Test
    void fromHere_reportsDependencyOptions() {
        SliceReport report = App.analyzeSource(TWO_CTES, 59, ActionMode.FROM_HERE, CteframeConfig.defaults());

        assertEquals("ANALYZED", report.status);
        assertEquals("from-here", report.mode);
        assertEquals(List.of("a", "b"), report.ctes);
        assertEquals(List.of("a", "b"), report.requiredCtes);
        assertEquals("SELECT_STATEMENT", report.targetQuery.type);
        assertEquals(45, report.targetQuery.start);
        assertEquals(60, report.targetQuery.end);
        assertEquals(3, report.options.size());
        assertEquals(2, report.preselected);
        assertEquals("Current Query (2 CTEs)", report.options.get(2).displayName);
        assertEquals(0, report.syntaxErrors);
    }

    @Test
    void run_reportsProgressiveOptions() {
        SliceReport report = App.analyzeSource(TWO_CTES, 12, ActionMode.RUN, CteframeConfig.defaults());

        assertEquals(2, report.options.size());
        assertEquals(0, report.preselected);
        assertEquals("WITH a AS (SELECT 1)\nSELECT * FROM a;", report.options.get(0).sql);
        assertEquals(11, report.options.get(0).highlightSpans.get(0).start);
        assertEquals(19, report.options.get(0).highlightSpans.get(0).end);
    }

    @Test
    void edit_rewritesSqlForInsertion() {
        SliceReport report = App.analyzeSource(TWO_CTES, 12, ActionMode.EDIT, CteframeConfig.defaults());

        assertEquals("WITH a AS (SELECT 1)\nSELECT * FROM a\n;", report.options.get(0).sql);
        assertEquals("a: WITH a AS (SELECT 1) SELECT * FROM a;", report.options.get(0).preview);
    }

    @Test
    void previewLength_comesFromConfig() {
        SliceReport report = App.analyzeSource(TWO_CTES, 12, ActionMode.RUN,
                CteframeConfig.with(10, ActionMode.RUN));

        assertEquals("a: WITH a ...", report.options.get(0).preview);
    }

    @Test
    void noWithClause_reportsStatusOnly() {
        SliceReport report = App.analyzeSource("SELECT 1", 0, ActionMode.RUN, CteframeConfig.defaults());

        assertEquals("NO_SCOPE", report.status);
        assertTrue(report.options.isEmpty());
        assertNull(report.preselected);
        assertNull(report.targetQuery);
    }

    @Test
    void analyzeFile_stripsBomAndRecordsFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("query.sql");
        Files.writeString(file, "\uFEFF" + TWO_CTES, StandardCharsets.UTF_8);

        SliceReport report = App.analyzeFile(file, 59, ActionMode.FROM_HERE, CteframeConfig.defaults());

        assertEquals(file.toString(), report.file);
        assertEquals(45, report.targetQuery.start);
    }

    @Test
    void report_serializesToJson() throws Exception {
        SliceReport report = App.analyzeSource(TWO_CTES, 59, ActionMode.FROM_HERE, CteframeConfig.defaults());

        JsonNode json = MAPPER.readTree(MAPPER.writeValueAsString(report));

        assertEquals("slice", json.get("kind").asText());
        assertEquals("ANALYZED", json.get("status").asText());
        assertEquals(3, json.get("options").size());
        assertFalse(json.get("options").get(0).get("highlightSpans").get(0).has("type"));
        assertFalse(json.has("file"));
    }
}
