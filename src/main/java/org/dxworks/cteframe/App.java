package org.dxworks.cteframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.cteframe.analyzer.SqlDependencyAnalyzer;
import org.dxworks.cteframe.model.AnalysisOutcome;
import org.dxworks.cteframe.model.CteEntry;
import org.dxworks.cteframe.model.QueryOption;
import org.dxworks.cteframe.model.QueryOptionList;
import org.dxworks.cteframe.model.ScopeAnalysis;
import org.dxworks.cteframe.model.SliceReport;
import org.dxworks.cteframe.model.SourceRange;
import org.dxworks.cteframe.options.EditableSql;
import org.dxworks.cteframe.options.QueryOptionPlanner;
import org.dxworks.cteframe.options.SqlPreview;
import org.dxworks.cteframe.tree.antlr.AntlrSqlTree;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar cteframe.jar <sql-file> <caret-offset> [mode]");
            System.err.println("  <sql-file>:     Path to the SQL document");
            System.err.println("  <caret-offset>: Zero-based character offset of the cursor");
            System.err.println("  [mode]:         run | from-here | edit (default from cteframe-config.yml, else from-here)");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.isRegularFile(input)) {
            System.err.println("Error: Input file does not exist: " + input);
            System.exit(1);
        }

        CteframeConfig config = CteframeConfig.load();
        int caretOffset;
        ActionMode mode;
        try {
            caretOffset = Integer.parseInt(args[1].trim());
            mode = args.length > 2 ? ActionMode.fromName(args[2]) : config.getDefaultMode();
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(2);
            return;
        }

        try {
            SliceReport report = analyzeFile(input, caretOffset, mode, config);
            System.out.println(MAPPER.writeValueAsString(report));
        } catch (IOException e) {
            System.err.println("Error analyzing " + input.getFileName() + ": " + e.getMessage());
            System.exit(1);
        }
    }

    public static SliceReport analyzeFile(Path filePath, int caretOffset, ActionMode mode,
                                          CteframeConfig config) throws IOException {
        String sourceCode = Files.readString(filePath, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }

        SliceReport report = analyzeSource(sourceCode, caretOffset, mode, config);
        report.file = filePath.toString();
        return report;
    }

    public static SliceReport analyzeSource(String sourceCode, int caretOffset, ActionMode mode,
                                            CteframeConfig config) {
        AntlrSqlTree tree = AntlrSqlTree.parse(sourceCode);

        SliceReport report = new SliceReport();
        report.caretOffset = caretOffset;
        report.mode = mode.getName();
        report.syntaxErrors = tree.getSyntaxErrorCount();

        AnalysisOutcome outcome = new SqlDependencyAnalyzer(tree, caretOffset).analyze();
        report.status = outcome.getStatus().name();
        if (!outcome.isApplicable()) {
            return report;
        }

        ScopeAnalysis analysis = outcome.getAnalysis();
        for (CteEntry cte : analysis.getAllCtes()) {
            report.ctes.add(cte.getName());
        }
        for (CteEntry cte : analysis.getRequiredCtes()) {
            report.requiredCtes.add(cte.getName());
        }
        report.targetQuery = new SliceReport.SpanReport(
                analysis.getTargetQuery().getType().name(), analysis.getTargetQuery().getRange());

        QueryOptionList options = planOptions(analysis, caretOffset, mode);
        report.preselected = options.getPreselectedIndex();
        for (QueryOption option : options.getOptions()) {
            String sql = mode == ActionMode.EDIT
                    ? EditableSql.prepare(option.getSql(), tree.getSource())
                    : option.getSql();
            report.options.add(toReport(option, sql, config));
        }
        return report;
    }

    private static QueryOptionList planOptions(ScopeAnalysis analysis, int caretOffset, ActionMode mode) {
        switch (mode) {
            case FROM_HERE:
                return QueryOptionPlanner.executeFromHereOptions(analysis);
            case RUN:
            case EDIT:
            default:
                return QueryOptionPlanner.progressiveOptions(analysis, caretOffset);
        }
    }

    private static SliceReport.OptionReport toReport(QueryOption option, String sql, CteframeConfig config) {
        SliceReport.OptionReport out = new SliceReport.OptionReport();
        out.displayName = option.getDisplayName();
        out.preview = SqlPreview.format(option.getDisplayName(), option.getSql(), config.getPreviewLength());
        out.sql = sql;
        List<SliceReport.SpanReport> spans = new ArrayList<>();
        for (SourceRange range : option.getHighlightSpans()) {
            spans.add(new SliceReport.SpanReport(null, range));
        }
        out.highlightSpans = spans;
        return out;
    }
}
