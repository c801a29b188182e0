package org.cranes.solver;

import org.cranes.core.CraneUnloadingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("SearchBudget Tests")
class SearchBudgetTest {

    @ParameterizedTest
    @CsvSource({"0, 63", "-5, 63", "64, 63", "1000, 63", "1, 1", "10, 10", "63, 63"})
    @DisplayName("Explicit bounds normalize into [1, 63]")
    void testNormalization(int requested, int expected) {
        assertEquals(expected, SearchBudget.of(requested).maxSteps());
    }

    @Test
    @DisplayName("checkSteps rejects step counts above the bound")
    void testCheckSteps() {
        SearchBudget budget = SearchBudget.of(5);
        assertDoesNotThrow(() -> budget.checkSteps(5));
        CraneUnloadingException ex = assertThrows(CraneUnloadingException.class, () -> budget.checkSteps(6));
        assertEquals(CraneUnloadingException.REASON_GRID_TOO_LARGE, ex.getReasonCode());
    }

    @Test
    @DisplayName("defaults() reads the system property and falls back to the ceiling")
    void testDefaultsFromSystemProperty() {
        String previous = System.getProperty(SearchBudget.PROP_MAX_STEPS);
        try {
            System.setProperty(SearchBudget.PROP_MAX_STEPS, "12");
            assertEquals(12, SearchBudget.defaults().maxSteps());

            System.setProperty(SearchBudget.PROP_MAX_STEPS, "not-a-number");
            assertEquals(SearchBudget.MAX_STEPS_CEILING, SearchBudget.defaults().maxSteps());

            System.clearProperty(SearchBudget.PROP_MAX_STEPS);
            assertEquals(SearchBudget.MAX_STEPS_CEILING, SearchBudget.defaults().maxSteps());
        } finally {
            if (previous == null) {
                System.clearProperty(SearchBudget.PROP_MAX_STEPS);
            } else {
                System.setProperty(SearchBudget.PROP_MAX_STEPS, previous);
            }
        }
    }
}
