package com.topography.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CallExpressionTest {

    @Test
    @DisplayName("bare identifiers have no arguments")
    void bareIdentifier() {
        CallExpression call = CallExpression.parse(" level ");

        assertEquals("level", call.getIdentifier());
        assertTrue(call.getArgs().isEmpty());
        assertTrue(call.getKwargs().isEmpty());
    }

    @Test
    @DisplayName("positional and keyword values are typed")
    void typedValues() {
        CallExpression call = CallExpression.parse("filter(bandpass, 2.5, cutoff2=25, inplace=true)");

        assertEquals("filter", call.getIdentifier());
        assertEquals(Arrays.asList("bandpass", 2.5), call.getArgs());
        assertEquals(Map.of("cutoff2", 25.0, "inplace", true), call.getKwargs());
    }

    @Test
    @DisplayName("quoted strings keep separators and null means no value")
    void quotedAndNull() {
        CallExpression call = CallExpression.parse("note('a;b, c', null)");

        assertEquals(Arrays.asList("a;b, c", null), call.getArgs());
    }

    @Test
    @DisplayName("list is split on top-level semicolons")
    void parseList() {
        List<CallExpression> calls = CallExpression.parseList("level; filter(lowpass, 80);; Smc(p=5)");

        assertEquals(3, calls.size());
        assertEquals("Smc", calls.get(2).getIdentifier());
        assertEquals(5.0, calls.get(2).getKwargs().get("p"));
        assertTrue(CallExpression.parseList(null).isEmpty());
    }

    @Test
    @DisplayName("malformed expressions are rejected")
    void malformed() {
        assertThrows(IllegalArgumentException.class, () -> CallExpression.parse("filter(lowpass"));
        assertThrows(IllegalArgumentException.class, () -> CallExpression.parse("bad name"));
        assertThrows(IllegalArgumentException.class, () -> CallExpression.parse("f(a=1, 2)"));
        assertThrows(IllegalArgumentException.class, () -> CallExpression.parse("f(a=1, a=2)"));
        assertThrows(IllegalArgumentException.class, () -> CallExpression.parse("f('open)"));
    }
}
