package fr.uga.smtplan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class PlannerOptionsTest {

    @Test
    public void defaults() {
        PlannerOptions options = PlannerOptions.builder().build();

        assertEquals(1, options.getLowerBound());
        assertEquals(-1, options.getUpperBound());
        assertTrue(options.isUnbounded());
        assertEquals(1, options.getStepSize());
        assertTrue(options.isSolve());
        assertFalse(options.isPrune());
        assertFalse(options.isRpgLowerBound());
        assertFalse(options.isExplanatoryNames());
        assertEquals("", options.getEncodingPath());
        assertEquals("z3 -smt2", options.getSolverCommand());
    }

    @Test
    public void lowerBoundMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> PlannerOptions.builder().lowerBound(0).build());
    }

    @Test
    public void stepMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> PlannerOptions.builder().stepSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> PlannerOptions.builder().stepSize(-2).build());
    }

    @Test
    public void nullOutputMeansStandardOutput() {
        assertEquals("", PlannerOptions.builder().encodingPath(null).build().getEncodingPath());
    }
}
