package org.dxworks.cteframe.options;

import org.dxworks.cteframe.tree.TreeHelper;

/**
 * One-line label for an option: {@code "name: SELECT ..."}, shortened to a maximum width.
 */
public final class SqlPreview {

    public static final int DEFAULT_MAX_LENGTH = 50;
    private static final String ELLIPSIS = "...";

    private SqlPreview() {
        // utility class
    }

    /**
     * The ellipsis is not counted against {@code maxLength}.
     */
    public static String format(String displayName, String sql, int maxLength) {
        String prefix = displayName + ": ";
        String preview = TreeHelper.normalizeInline(sql == null ? "" : sql);
        int available = Math.max(0, maxLength - prefix.length());
        if (preview.length() > available) {
            return prefix + preview.substring(0, available) + ELLIPSIS;
        }
        return prefix + preview;
    }
}
