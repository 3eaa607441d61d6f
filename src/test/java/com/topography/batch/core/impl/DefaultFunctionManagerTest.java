package com.topography.batch.core.impl;

import com.topography.batch.core.SurfaceFunction;
import com.topography.batch.model.FunctionMetadata;
import com.topography.batch.model.ValidationResult;
import com.topography.batch.operators.MethodFunction;
import com.topography.batch.operators.SurfaceFunctions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DefaultFunctionManagerTest {

    private DefaultFunctionManager manager;

    @BeforeEach
    void setUp() {
        manager = new DefaultFunctionManager();
        SurfaceFunctions.registerBuiltins(manager);
    }

    @Test
    @DisplayName("published parameters follow registration order and exclude operations")
    void availableParameters() {
        List<String> parameters = manager.getAvailableParameters();

        assertEquals(Arrays.asList("Sa", "Sq", "Sp", "Sv", "Sz", "Ssk", "Sku", "Sdq", "Sdr", "Smc", "Smr",
                "height_statistics"), parameters);
        assertTrue(manager.isParameter("Sa"));
        assertFalse(manager.isParameter("level"));
        assertFalse(manager.isParameter("unknown"));
        assertNotNull(manager.getFunction("level"));
    }

    @Test
    @DisplayName("duplicate registration is rejected")
    void duplicateRegistration() {
        SurfaceFunction again = MethodFunction.parameter("Sa", "again", (s, a) -> 0.0);

        assertFalse(manager.registerFunction("Sa", again));
        assertNotSame(again, manager.getFunction("Sa"));
    }

    @Test
    @DisplayName("function without metadata is rejected")
    void missingMetadata() {
        SurfaceFunction function = mock(SurfaceFunction.class);
        when(function.getMetadata()).thenReturn(new FunctionMetadata());

        assertFalse(manager.registerFunction("custom", function));
        assertNull(manager.getFunction("custom"));
    }

    @Test
    @DisplayName("valid arguments pass validation")
    void validArguments() {
        ValidationResult result = manager.validateFunction("filter",
                Arrays.asList("bandpass", 25.0, 250.0), Map.of("inplace", true));

        assertTrue(result.isValid(), result.summary());
    }

    @Test
    @DisplayName("optional null argument passes validation")
    void nullableArgument() {
        ValidationResult result = manager.validateFunction("filter",
                Arrays.asList("lowpass", 80.0, null), null);

        assertTrue(result.isValid(), result.summary());
    }

    @Test
    @DisplayName("bandpass cutoffs are checked against each other")
    void crossArgumentConstraint() {
        ValidationResult missing = manager.validateFunction("filter", Arrays.asList("bandpass", 25.0), null);
        ValidationResult inverted = manager.validateFunction("filter",
                Arrays.asList("bandpass", 250.0), Map.of("cutoff2", 25.0));

        assertFalse(missing.isValid());
        assertTrue(missing.getErrors().get(0).contains("cutoff2"));
        assertFalse(inverted.isValid());
    }

    @Test
    @DisplayName("constraints only run once every argument is individually valid")
    void constraintSkippedAfterTypeError() {
        ValidationResult result = manager.validateFunction("filter", Arrays.asList("bandpass", "wide"), null);

        assertEquals(1, result.getErrors().size());
        assertTrue(result.getErrors().get(0).contains("NUMBER"));
    }

    @Test
    @DisplayName("enum value outside the allowed set is an error")
    void invalidEnum() {
        ValidationResult result = manager.validateFunction("filter", Arrays.asList("notch", 80.0), null);

        assertFalse(result.isValid());
        assertTrue(result.getErrors().get(0).contains("notch"));
    }

    @Test
    @DisplayName("number outside the allowed range is an error")
    void outOfRange() {
        ValidationResult result = manager.validateFunction("threshold", List.of(60.0), null);

        assertFalse(result.isValid());
        assertTrue(result.getErrors().get(0).contains("exceeds maximum"));
    }

    @Test
    @DisplayName("wrong argument type is an error")
    void wrongType() {
        ValidationResult result = manager.validateFunction("Smc", List.of("five"), null);

        assertFalse(result.isValid());
        assertTrue(result.getErrors().get(0).contains("NUMBER"));
    }

    @Test
    @DisplayName("binding errors become validation errors")
    void bindingError() {
        ValidationResult result = manager.validateFunction("Sa", List.of(1.0), Collections.emptyMap());

        assertFalse(result.isValid());
        assertTrue(result.getErrors().get(0).contains("positional"));
    }

    @Test
    @DisplayName("unregistered function fails validation")
    void unregistered() {
        ValidationResult result = manager.validateFunction("polish", null, null);

        assertFalse(result.isValid());
        assertEquals("polish: Function 'polish' is not registered.", result.summary());
    }
}
