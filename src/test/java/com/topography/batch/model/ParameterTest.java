package com.topography.batch.model;

import com.topography.batch.core.FunctionManager;
import com.topography.batch.core.impl.DefaultFunctionManager;
import com.topography.batch.exception.BatchException;
import com.topography.batch.exception.UnknownFunctionException;
import com.topography.batch.operators.MethodFunction;
import com.topography.batch.surface.Surface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParameterTest {

    private FunctionManager functions;
    private Surface surface;

    @BeforeEach
    void setUp() {
        functions = new DefaultFunctionManager();
        functions.registerFunction("peak", MethodFunction.parameter("peak", "max height",
                (s, a) -> s.get(0, 0)));
        functions.registerFunction("stats", MethodFunction.labelledParameter("stats", "two values",
                Arrays.asList("mean", "std"),
                (s, a) -> new double[] {1.5, 0.25}));
        functions.registerFunction("unlabelled", MethodFunction.parameter("unlabelled", "no labels",
                (s, a) -> Arrays.asList(1.0, 2.0)));
        functions.registerFunction("single", MethodFunction.parameter("single", "one element list",
                (s, a) -> new double[] {4.0}));
        functions.registerFunction("short_labels", MethodFunction.labelledParameter("short_labels", "mismatch",
                Arrays.asList("a", "b"),
                (s, a) -> new Object[] {1.0, 2.0, 3.0}));
        surface = new Surface(new double[][] {{7.0, 1.0}, {2.0, 3.0}}, 1.0, 1.0);
    }

    @Test
    @DisplayName("scalar result is keyed by the identifier")
    void scalarResult() {
        Map<String, Object> values = new Parameter("peak").calculateFrom(surface, functions);

        assertEquals(1, values.size());
        assertEquals(7.0, values.get("peak"));
    }

    @Test
    @DisplayName("labelled result is keyed identifier_label in return order")
    void labelledResult() {
        Map<String, Object> values = new Parameter("stats").calculateFrom(surface, functions);

        assertEquals(List.of("stats_mean", "stats_std"), List.copyOf(values.keySet()));
        assertEquals(1.5, values.get("stats_mean"));
        assertEquals(0.25, values.get("stats_std"));
    }

    @Test
    @DisplayName("list result without registered labels is rejected")
    void missingLabels() {
        BatchException e = assertThrows(BatchException.class,
                () -> new Parameter("unlabelled").calculateFrom(surface, functions));
        assertEquals("No return labels registered for Surface.unlabelled.", e.getMessage());
    }

    @Test
    @DisplayName("single element list still requires labels")
    void singleElementListRequiresLabels() {
        assertThrows(BatchException.class, () -> new Parameter("single").calculateFrom(surface, functions));
    }

    @Test
    @DisplayName("label count must match value count")
    void mismatchedLabels() {
        assertThrows(BatchException.class, () -> new Parameter("short_labels").calculateFrom(surface, functions));
    }

    @Test
    @DisplayName("missing capability raises UnknownFunctionException")
    void unknownCapability() {
        UnknownFunctionException e = assertThrows(UnknownFunctionException.class,
                () -> new Parameter("Sxyz").calculateFrom(surface, functions));
        assertEquals("Sxyz", e.getIdentifier());
        assertEquals("Surface", e.getOwner());
    }

    @Test
    @DisplayName("equal identifier and arguments make equal parameters")
    void equality() {
        Parameter a = new Parameter("Smc", List.of(5.0), null);
        Parameter b = new Parameter("Smc", List.of(5.0), Map.of());

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new Parameter("Smc"));
    }
}
