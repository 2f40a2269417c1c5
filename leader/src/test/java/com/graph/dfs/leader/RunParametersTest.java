package com.graph.dfs.leader;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RunParameters Tests")
class RunParametersTest {

    @Test
    @DisplayName("Should default to 10000 vertices per worker and a target at 84%")
    void shouldUseDefaults() {
        RunParameters parameters = RunParameters.parse(null, null, null, 4);

        assertEquals(40000, parameters.totalVertices);
        assertEquals(33600, parameters.target);
        assertFalse(parameters.broadcastFound);
    }

    @ParameterizedTest
    @CsvSource({
            "1, 100, 84",
            "3, 100, 252",
            "2, 0, 0",
            "7, 1, 5"
    })
    @DisplayName("Should scale the problem with the worker count")
    void shouldScaleWithWorkers(int numWorkers, String base, int expectedTarget) {
        RunParameters parameters = RunParameters.parse(base, null, null, numWorkers);

        assertEquals(Integer.parseInt(base) * numWorkers, parameters.totalVertices);
        assertEquals(expectedTarget, parameters.target);
    }

    @Test
    @DisplayName("Should take explicit values")
    void shouldTakeExplicitValues() {
        RunParameters parameters = RunParameters.parse(" 500 ", "12", "true", 2);

        assertEquals(1000, parameters.totalVertices);
        assertEquals(12, parameters.target);
        assertTrue(parameters.broadcastFound);
    }

    @ParameterizedTest
    @ValueSource(strings = { "abc", "-1", "1.5", "" })
    @DisplayName("Should reject invalid sizes")
    void shouldRejectInvalidSizes(String base) {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> RunParameters.parse(base, null, null, 2));

        assertTrue(e.getMessage().contains("basePerWorker"));
    }

    @Test
    @DisplayName("Should reject an invalid target")
    void shouldRejectInvalidTarget() {
        assertThrows(IllegalArgumentException.class, () -> RunParameters.parse("10", "x", null, 2));
        assertThrows(IllegalArgumentException.class, () -> RunParameters.parse("10", "-5", null, 2));
    }

    @Test
    @DisplayName("Should reject a problem size that does not fit a vertex id")
    void shouldRejectOverflow() {
        assertThrows(IllegalArgumentException.class, () -> RunParameters.parse("2000000000", null, null, 2));
    }

    @Test
    @DisplayName("Should require at least one worker")
    void shouldRequireWorkers() {
        assertThrows(IllegalArgumentException.class, () -> RunParameters.parse(null, null, null, 0));
    }
}
