package com.topography.batch.operators;

import com.topography.batch.core.FunctionManager;
import com.topography.batch.core.impl.DefaultFunctionManager;
import com.topography.batch.model.Operation;
import com.topography.batch.model.Parameter;
import com.topography.batch.surface.Surface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SurfaceFunctionsTest {

    private FunctionManager functions;

    @BeforeEach
    void setUp() {
        functions = new DefaultFunctionManager();
        SurfaceFunctions.registerBuiltins(functions);
    }

    private static Surface sample() {
        return new Surface(new double[][] {{1, -1, 2}, {-1, 1, -2}, {0, 3, -3}}, 1.0, 1.0);
    }

    @Test
    @DisplayName("every operation is registered with a trailing inplace flag")
    void operationsHaveInplace() {
        for (String id : List.of("zero", "center", "level", "threshold", "remove_outliers", "fill_nonmeasured",
                "filter", "rotate", "align", "zoom")) {
            var definitions = functions.getFunction(id).getMetadata().getParameterDefinitions();
            assertFalse(functions.isParameter(id), id);
            assertEquals(SurfaceFunctions.INPLACE, definitions.get(definitions.size() - 1).getName(), id);
        }
    }

    @Test
    @DisplayName("registered operation mutates the surface when called inplace")
    void operationInplace() {
        Surface surface = sample();

        new Operation("zero").executeOn(surface, functions);

        assertEquals(0.0, surface.get(2, 2), 1e-9);
    }

    @Test
    @DisplayName("default arguments come from the parameter definitions")
    void defaultArguments() {
        Surface surface = sample();

        Object byDefault = functions.getFunction("Smc").invoke(surface, null, null);
        Object explicit = functions.getFunction("Smc").invoke(surface, List.of(10.0), null);

        assertEquals(explicit, byDefault);
    }

    @Test
    @DisplayName("height_statistics yields two labelled columns")
    void labelledStatistics() {
        Map<String, Object> values = new Parameter("height_statistics").calculateFrom(sample(), functions);

        assertEquals(List.of("height_statistics_mean", "height_statistics_std"), List.copyOf(values.keySet()));
        assertEquals(0.0, (Double) values.get("height_statistics_mean"), 1e-9);
    }

    @Test
    @DisplayName("keyword arguments reach the surface method")
    void keywordArguments() {
        Surface surface = sample();

        Object all = functions.getFunction("Smr").invoke(surface, null, Map.of("c", -100.0));

        assertEquals(100.0, (Double) all, 1e-9);
    }
}
