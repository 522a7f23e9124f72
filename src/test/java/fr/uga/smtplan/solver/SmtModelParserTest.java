package fr.uga.smtplan.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import java.util.List;

public class SmtModelParserTest {

    private static final String Z3_MODEL = String.join("\n",
        "(",
        "  (define-fun sta0_0 () Bool",
        "    true)",
        "  (define-fun run0_1 () Bool",
        "    false)",
        "  (define-fun t0 () Real",
        "    0.0)",
        "  (define-fun t1 () Real",
        "    (/ 3.0 2.0))",
        "  (define-fun |(fuel truck)@1| () Real",
        "    (- 4.5))",
        "  (define-fun count () Int",
        "    7)",
        ")");

    @Test
    public void readsBooleansAndReals() {
        SolverModel model = SmtModelParser.parse(Z3_MODEL);

        assertTrue(model.isTrue("sta0_0"));
        assertFalse(model.isTrue("run0_1"));
        assertEquals(0.0, model.getReal("t0"));
        assertEquals(1.5, model.getReal("t1"));
        assertEquals(7.0, model.getReal("count"));
        assertEquals(6, model.size());
    }

    @Test
    public void quotedNamesLoseTheirBars() {
        SolverModel model = SmtModelParser.parse(Z3_MODEL);

        assertEquals(-4.5, model.getReal("(fuel truck)@1"));
    }

    @Test
    public void acceptsTheModelKeyword() {
        SolverModel model = SmtModelParser.parse("(model (define-fun p0_1 () Bool true))");

        assertTrue(model.isTrue("p0_1"));
    }

    @Test
    public void unknownVariablesHaveNoValue() {
        SolverModel model = SmtModelParser.parse("");

        assertTrue(model.isEmpty());
        assertFalse(model.isTrue("sta0_0"));
        assertNull(model.getReal("t0"));
    }

    @Test
    public void evaluatesArithmetic() {
        assertEquals(6.0, SmtModelParser.evaluate(List.of("*", "2.0", "3.0")));
        assertEquals(-1.0, SmtModelParser.evaluate(List.of("-", "2", "3")));
        assertEquals(0.25, SmtModelParser.evaluate(List.of("/", "1", List.of("+", "2", "2"))));
        assertNull(SmtModelParser.evaluate(List.of("root-obj", "x", "1")));
    }

    @Test
    public void skipsComments() {
        List<Object> expressions = SmtModelParser.read("; a comment (not a list)\n(a (b c))");

        assertEquals(1, expressions.size());
        assertEquals(List.of("a", List.of("b", "c")), expressions.get(0));
    }
}
