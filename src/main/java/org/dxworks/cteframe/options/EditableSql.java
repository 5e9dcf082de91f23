package org.dxworks.cteframe.options;

/**
 * Text to append to a document so a generated query can be edited in place before running it.
 */
public final class EditableSql {

    private EditableSql() {
        // utility class
    }

    /**
     * Moves the terminator onto its own line so clauses can be typed after the query, and terminates the
     * preceding document statement first when it is left open.
     */
    public static String prepare(String sql, String documentText) {
        String prepared = stripSemicolons(sql) + "\n;";
        if (!documentText.trim().endsWith(";")) {
            prepared = ";\n" + prepared;
        }
        return prepared;
    }

    private static String stripSemicolons(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == ';') start++;
        while (end > start && s.charAt(end - 1) == ';') end--;
        return s.substring(start, end);
    }
}
