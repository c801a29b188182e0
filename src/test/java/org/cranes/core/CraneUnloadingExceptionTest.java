package org.cranes.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("CraneUnloadingException Tests")
class CraneUnloadingExceptionTest {

    @Test
    @DisplayName("Message is prefixed with the reason code")
    void testMessagePrefix() {
        CraneUnloadingException ex = new CraneUnloadingException(
                CraneUnloadingException.REASON_GRID_EMPTY,
                "grid must be non-empty"
        );
        assertEquals("CU_GRID_EMPTY", ex.getReasonCode());
        assertEquals("[CU_GRID_EMPTY] grid must be non-empty", ex.getMessage());
    }

    @Test
    @DisplayName("Blank or null reason codes are rejected")
    void testReasonCodeRequired() {
        assertThrows(IllegalArgumentException.class, () -> new CraneUnloadingException("  ", "message"));
        assertThrows(NullPointerException.class, () -> new CraneUnloadingException(null, "message"));
        assertThrows(NullPointerException.class, () -> new CraneUnloadingException("CODE", null));
    }
}
