package com.topography.batch.model;

import com.topography.batch.core.FunctionManager;
import com.topography.batch.core.SurfaceFunction;
import com.topography.batch.exception.UnknownFunctionException;
import com.topography.batch.surface.Surface;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class OperationTest {

    @Test
    @DisplayName("inplace is always forced to true")
    void inplaceForced() {
        Operation op = new Operation("level", List.of(), Map.of(Operation.INPLACE, false, "x", 1.0));

        assertEquals(Boolean.TRUE, op.getKwargs().get(Operation.INPLACE));
        assertEquals(1.0, op.getKwargs().get("x"));
        assertEquals(Boolean.TRUE, new Operation("zero").getKwargs().get(Operation.INPLACE));
    }

    @Test
    @DisplayName("executeOn invokes the capability with the stored arguments")
    void executeInvokesCapability() {
        FunctionManager functions = mock(FunctionManager.class);
        SurfaceFunction function = mock(SurfaceFunction.class);
        when(functions.getFunction("threshold")).thenReturn(function);
        Surface surface = new Surface(new double[][] {{1.0}}, 1.0, 1.0);

        Operation op = new Operation("threshold", List.of(2.5), null);
        op.executeOn(surface, functions);

        verify(function).invoke(eq(surface), eq(List.of(2.5)), eq(Map.of(Operation.INPLACE, true)));
    }

    @Test
    @DisplayName("missing capability raises UnknownFunctionException")
    void unknownCapability() {
        FunctionManager functions = mock(FunctionManager.class);
        Surface surface = new Surface(new double[][] {{1.0}}, 1.0, 1.0);

        assertThrows(UnknownFunctionException.class, () -> new Operation("polish").executeOn(surface, functions));
        verify(functions, never()).validateFunction(any(), anyList(), anyMap());
    }

    @Test
    @DisplayName("blank identifier is rejected")
    void blankIdentifier() {
        assertThrows(IllegalArgumentException.class, () -> new Operation(" "));
    }
}
