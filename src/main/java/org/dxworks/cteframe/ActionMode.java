package org.dxworks.cteframe;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * What the CLI plans options for.
 */
public enum ActionMode {
    /** Every CTE of the scope, progressively. */
    RUN("run"),
    /** Required CTEs of the query at the caret, then the query itself. */
    FROM_HERE("from-here"),
    /** Like {@link #RUN}, with SQL prepared for appending to the document. */
    EDIT("edit");

    private final String name;

    ActionMode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static ActionMode fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (ActionMode mode : values()) {
            if (mode.name.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown mode: " + name + " (expected one of "
                + Arrays.stream(values()).map(ActionMode::getName).collect(Collectors.joining(", ")) + ")");
    }
}
