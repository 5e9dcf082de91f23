package org.dxworks.cteframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * CLI output for one analysed cursor position.
 */
public class SliceReport {
    public String kind = "slice";
    public String file;
    public int caretOffset;
    public String mode;
    public String status;
    public int syntaxErrors;

    public List<String> ctes = new ArrayList<>();
    public List<String> requiredCtes = new ArrayList<>();
    public SpanReport targetQuery;

    public Integer preselected;
    public List<OptionReport> options = new ArrayList<>();

    public static class OptionReport {
        public String displayName;
        public String preview;
        public String sql;
        public List<SpanReport> highlightSpans = new ArrayList<>();
    }

    public static class SpanReport {
        public String type;
        public int start;
        public int end;

        public SpanReport(String type, SourceRange range) {
            this.type = type;
            this.start = range.getStart();
            this.end = range.getEnd();
        }
    }
}
