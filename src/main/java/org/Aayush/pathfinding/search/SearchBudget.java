package org.Aayush.pathfinding.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Work limits of one backward label search over the channel graph.
 * <p>
 * Two quantities grow with the number of simple paths near the target: labels taken off the
 * frontier and expanded toward their predecessors, and labels waiting on the frontier. Both are
 * capped here. A non-positive limit disables the check.
 * </p>
 * <p>
 * {@link #defaults()} reads the limits from {@value #PROP_MAX_EXPANDED_LABELS} and
 * {@value #PROP_MAX_FRONTIER}; absent or unparseable values leave the search unlimited.
 * </p>
 */
@Getter
@Accessors(fluent = true)
final class SearchBudget {
    static final int UNBOUNDED = Integer.MAX_VALUE;

    static final String REASON_EXPANSIONS_EXCEEDED = "SEARCH_BUDGET_EXPANSIONS_EXCEEDED";
    static final String REASON_FRONTIER_EXCEEDED = "SEARCH_BUDGET_FRONTIER_EXCEEDED";

    static final String PROP_MAX_EXPANDED_LABELS = "pathfinder.search.maxExpandedLabels";
    static final String PROP_MAX_FRONTIER = "pathfinder.search.maxFrontierSize";

    /** Labels that may be expanded toward their predecessors in one query. */
    private final int maxExpandedLabels;
    /** Labels that may wait on the frontier at once. */
    private final int maxFrontierSize;

    private SearchBudget(int maxExpandedLabels, int maxFrontierSize) {
        this.maxExpandedLabels = limitOrUnbounded(maxExpandedLabels);
        this.maxFrontierSize = limitOrUnbounded(maxFrontierSize);
    }

    static SearchBudget of(int maxExpandedLabels, int maxFrontierSize) {
        return new SearchBudget(maxExpandedLabels, maxFrontierSize);
    }

    static SearchBudget defaults() {
        return new SearchBudget(
                propertyLimit(PROP_MAX_EXPANDED_LABELS),
                propertyLimit(PROP_MAX_FRONTIER)
        );
    }

    /**
     * Called before each expansion with the running count, including the one about to happen.
     */
    void checkExpandedLabels(int expandedLabels) {
        if (expandedLabels > maxExpandedLabels) {
            throw new BudgetExceededException(
                    REASON_EXPANSIONS_EXCEEDED,
                    "label expansion " + expandedLabels + " exceeds the limit of " + maxExpandedLabels
            );
        }
    }

    void checkFrontierSize(int frontierSize) {
        if (frontierSize > maxFrontierSize) {
            throw new BudgetExceededException(
                    REASON_FRONTIER_EXCEEDED,
                    frontierSize + " pending labels exceed the frontier limit of " + maxFrontierSize
            );
        }
    }

    private static int limitOrUnbounded(int limit) {
        return limit > 0 ? limit : UNBOUNDED;
    }

    private static int propertyLimit(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    /**
     * Raised inside the search loop; the planner stops and ranks the paths completed so far.
     */
    @Getter
    @Accessors(fluent = true)
    static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super("[" + reasonCode + "] " + message);
            this.reasonCode = reasonCode;
        }
    }
}
