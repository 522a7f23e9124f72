package fr.uga.smtplan.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import fr.uga.smtplan.grounding.GroundedModel;
import fr.uga.smtplan.grounding.Grounder;
import fr.uga.smtplan.grounding.GroundingException;
import fr.uga.smtplan.model.ActionSchema;
import fr.uga.smtplan.model.Atom;
import fr.uga.smtplan.model.PlanningTask;

import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Paths;

public class ParsedProblemAdapterTest {

    static String resource(String name) throws URISyntaxException {
        return Paths.get(ParsedProblemAdapterTest.class.getResource("/pddl/" + name).toURI()).toString();
    }

    @Test
    public void convertsTheMoveDomain() throws URISyntaxException, ParseException {
        PlanningTask task = new ParsedProblemAdapter().parse(resource("move-domain.pddl"),
            resource("move-problem.pddl"));

        assertEquals(1, task.getDomain().getActions().size());
        ActionSchema move = task.getDomain().getActions().get(0);
        assertEquals("move", move.getName());
        assertEquals(2, move.getParameters().size());
        assertTrue(move.isDurative());
        assertEquals(1, move.getDuration().size());
        assertTrue(task.getDomain().getTypes().isDeclared("place"));
        assertTrue(task.getDomain().getPredicates().containsKey("connected"));
        assertEquals(2, task.getProblem().getObjects().size());
        assertTrue(task.getProblem().getInitialFacts().contains(new Atom("at", "x")));
        assertTrue(task.getProblem().getInitialFacts().contains(new Atom("connected", "x", "y")));
    }

    @Test
    public void parsedTaskGroundsToASingleMove() throws URISyntaxException, ParseException, GroundingException {
        PlanningTask task = new ParsedProblemAdapter().parse(resource("move-domain.pddl"),
            resource("move-problem.pddl"));

        GroundedModel model = new Grounder().ground(task.getDomain(), task.getProblem());

        assertEquals(1, model.actionCount());
        assertEquals("(move x y)", model.getActions().get(0).getName());
        assertTrue(model.getActions().get(0).isDurative());
    }

    @Test
    public void syntaxErrorIsReported() {
        assertThrows(ParseException.class, () -> new ParsedProblemAdapter().parse(resource("broken-domain.pddl"),
            resource("move-problem.pddl")));
    }

    @Test
    public void missingFileIsReported() {
        assertThrows(ParseException.class, () -> new ParsedProblemAdapter().parse("does/not/exist.pddl",
            resource("move-problem.pddl")));
    }
}
