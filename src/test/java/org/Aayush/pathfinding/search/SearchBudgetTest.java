package org.Aayush.pathfinding.search;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Search Budget Tests")
class SearchBudgetTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(SearchBudget.PROP_MAX_EXPANDED_LABELS);
        System.clearProperty(SearchBudget.PROP_MAX_FRONTIER);
    }

    @Test
    @DisplayName("Non-positive bounds mean unbounded")
    void testNormalization() {
        SearchBudget budget = SearchBudget.of(0, -5);
        assertEquals(SearchBudget.UNBOUNDED, budget.maxExpandedLabels());
        assertEquals(SearchBudget.UNBOUNDED, budget.maxFrontierSize());
        assertDoesNotThrow(() -> budget.checkExpandedLabels(Integer.MAX_VALUE));
    }

    @Test
    @DisplayName("Exceeding a bound raises a reason-coded exception")
    void testExceeded() {
        SearchBudget budget = SearchBudget.of(3, 10);
        assertDoesNotThrow(() -> budget.checkExpandedLabels(3));
        SearchBudget.BudgetExceededException expansions = assertThrows(
                SearchBudget.BudgetExceededException.class,
                () -> budget.checkExpandedLabels(4)
        );
        assertEquals(SearchBudget.REASON_EXPANSIONS_EXCEEDED, expansions.reasonCode());
        assertEquals(
                "[SEARCH_BUDGET_EXPANSIONS_EXCEEDED] label expansion 4 exceeds the limit of 3",
                expansions.getMessage()
        );

        SearchBudget.BudgetExceededException frontier = assertThrows(
                SearchBudget.BudgetExceededException.class,
                () -> budget.checkFrontierSize(11)
        );
        assertEquals(SearchBudget.REASON_FRONTIER_EXCEEDED, frontier.reasonCode());
        assertTrue(frontier.getMessage().contains("11 pending labels exceed the frontier limit of 10"));
    }

    @Test
    @DisplayName("Defaults are read from system properties")
    void testDefaultsFromProperties() {
        System.setProperty(SearchBudget.PROP_MAX_EXPANDED_LABELS, " 42 ");
        System.setProperty(SearchBudget.PROP_MAX_FRONTIER, "not-a-number");
        SearchBudget budget = SearchBudget.defaults();
        assertEquals(42, budget.maxExpandedLabels());
        assertEquals(SearchBudget.UNBOUNDED, budget.maxFrontierSize());

        clearProperties();
        assertEquals(SearchBudget.UNBOUNDED, SearchBudget.defaults().maxExpandedLabels());
    }
}
