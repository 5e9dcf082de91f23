package org.dxworks.cteframe.model;

import java.util.List;

public final class QueryOptionList {

    private final List<QueryOption> options;
    private final int preselectedIndex;

    public QueryOptionList(List<QueryOption> options, int preselectedIndex) {
        if (!options.isEmpty() && (preselectedIndex < 0 || preselectedIndex >= options.size())) {
            throw new IllegalArgumentException("Preselected index " + preselectedIndex
                    + " out of bounds for " + options.size() + " options");
        }
        this.options = List.copyOf(options);
        this.preselectedIndex = options.isEmpty() ? -1 : preselectedIndex;
    }

    public List<QueryOption> getOptions() {
        return options;
    }

    /**
     * Index of the option to select initially, {@code -1} when there are none.
     */
    public int getPreselectedIndex() {
        return preselectedIndex;
    }

    public QueryOption getPreselected() {
        return preselectedIndex < 0 ? null : options.get(preselectedIndex);
    }
}
