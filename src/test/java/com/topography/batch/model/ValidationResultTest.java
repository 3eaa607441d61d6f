package com.topography.batch.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValidationResultTest {

    @Test
    @DisplayName("result without errors is valid even with warnings")
    void warningsKeepResultValid() {
        ValidationResult result = new ValidationResult("Sa");
        result.addWarning("unused");

        assertTrue(result.isValid());
        assertEquals(1, result.getWarnings().size());
    }

    @Test
    @DisplayName("summary lists the function id and every error")
    void summary() {
        ValidationResult result = ValidationResult.failure("filter", "first");
        result.addError("second");

        assertFalse(result.isValid());
        assertEquals("filter: first; second", result.summary());
        assertThrows(UnsupportedOperationException.class, () -> result.getErrors().add("x"));
    }
}
