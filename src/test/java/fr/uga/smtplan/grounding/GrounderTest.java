package fr.uga.smtplan.grounding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import fr.uga.smtplan.PlanningFixtures;
import fr.uga.smtplan.model.ActionSchema;
import fr.uga.smtplan.model.Atom;
import fr.uga.smtplan.model.Domain;
import fr.uga.smtplan.model.Expression;
import fr.uga.smtplan.model.Parameter;
import fr.uga.smtplan.model.PlanningTask;
import fr.uga.smtplan.model.Problem;
import fr.uga.smtplan.model.TypedObject;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class GrounderTest {

    private static GroundedModel ground(PlanningTask task) throws GroundingException {
        return new Grounder().ground(task.getDomain(), task.getProblem());
    }

    @Test
    public void staticPredicateKeepsOnlyConnectedMoves() throws GroundingException {
        GroundedModel model = ground(PlanningFixtures.moveXY(true));

        assertEquals(1, model.actionCount());
        GroundAction move = model.getActions().get(0);
        assertEquals("(move x y)", move.getName());
        assertTrue(move.isDurative());
        assertTrue(move.getOverAllCondition().isTrue());
        assertEquals(1, move.getDuration().size());
    }

    @Test
    public void staticPredicatesAreNotPropositions() throws GroundingException {
        GroundedModel model = ground(PlanningFixtures.moveXY(false));

        assertEquals(-1, model.indexOf(new GroundProposition("connected", "x", "y")));
        int atX = model.indexOf(new GroundProposition("at", "x"));
        int atY = model.indexOf(new GroundProposition("at", "y"));
        assertEquals(0, atX);
        assertTrue(model.isInitiallyTrue(atX));
        assertFalse(model.isInitiallyTrue(atY));
    }

    @Test
    public void inequalityExcludesMovesToTheSamePlace() throws GroundingException {
        GroundedModel model = ground(PlanningFixtures.teleports());

        List<String> moves = new ArrayList<>();
        for (GroundAction action : model.getActions()) {
            if (action.getSchema().equals("move")) {
                moves.add(action.getName());
                assertNotEquals(action.getArguments().get(0), action.getArguments().get(1));
            }
        }
        assertEquals(6, moves.size());
        assertEquals(1, model.fluentCount());
        assertEquals(5.0, model.getInitialValue(0));
    }

    @Test
    public void everyTypeValidSubstitutionIsGroundedOnce() throws GroundingException {
        GroundedModel model = ground(PlanningFixtures.drives());

        // 2 vehicles (a truck and a car) x 2 places x 2 places
        assertEquals(8, model.actionCount());
        Set<List<String>> substitutions = new HashSet<>();
        for (GroundAction action : model.getActions()) {
            assertTrue(substitutions.add(action.getArguments()), "duplicate " + action);
            assertFalse(action.getArguments().get(0).startsWith("p"));
            assertTrue(action.getArguments().get(1).startsWith("p"));
            assertTrue(action.getArguments().get(2).startsWith("p"));
        }
    }

    @Test
    public void actionIndicesFollowTheActionList() throws GroundingException {
        GroundedModel model = ground(PlanningFixtures.drives());

        for (int i = 0; i < model.actionCount(); i++) {
            assertEquals(i, model.getActions().get(i).getIndex());
        }
    }

    @Test
    public void groundingIsDeterministic() throws GroundingException {
        GroundedModel first = ground(PlanningFixtures.teleports());
        GroundedModel second = ground(PlanningFixtures.teleports());

        assertEquals(first.getPropositions(), second.getPropositions());
        assertEquals(first.getFluents(), second.getFluents());
        for (int i = 0; i < first.actionCount(); i++) {
            assertEquals(first.getActions().get(i).getName(), second.getActions().get(i).getName());
        }
    }

    @Test
    public void undeclaredPredicateInSchemaIsRejected() {
        PlanningTask task = PlanningFixtures.moveXY(false);
        ActionSchema fly = ActionSchema.instantaneous("fly", List.of(new Parameter("?a", "place")),
            Expression.atom("wings", "?a"), Expression.atom("at", "?a"));
        Domain domain = withActions(task.getDomain(), fly);

        assertThrows(GroundingException.class, () -> new Grounder().ground(domain, task.getProblem()));
    }

    @Test
    public void undeclaredParameterIsRejected() {
        PlanningTask task = PlanningFixtures.moveXY(false);
        ActionSchema jump = ActionSchema.instantaneous("jump", List.of(new Parameter("?a", "place")),
            Expression.atom("at", "?a"), Expression.atom("at", "?b"));
        Domain domain = withActions(task.getDomain(), jump);

        assertThrows(GroundingException.class, () -> new Grounder().ground(domain, task.getProblem()));
    }

    @Test
    public void wrongArityIsRejected() {
        PlanningTask task = PlanningFixtures.moveXY(false);
        ActionSchema stay = ActionSchema.instantaneous("stay", List.of(new Parameter("?a", "place")),
            Expression.atom("at", "?a", "?a"), Expression.trueExpression());
        Domain domain = withActions(task.getDomain(), stay);

        assertThrows(GroundingException.class, () -> new Grounder().ground(domain, task.getProblem()));
    }

    @Test
    public void undeclaredObjectInInitialStateIsRejected() {
        PlanningTask task = PlanningFixtures.moveXY(false);
        Problem problem = new Problem("unknown", task.getProblem().getObjects(),
            List.of(new Atom("at", "nowhere")), Map.of(), task.getProblem().getGoal());

        assertThrows(GroundingException.class, () -> new Grounder().ground(task.getDomain(), problem));
    }

    @Test
    public void undeclaredObjectInGoalIsRejected() {
        PlanningTask task = PlanningFixtures.moveXY(false);
        Problem problem = new Problem("unknown", task.getProblem().getObjects(),
            task.getProblem().getInitialFacts(), Map.of(), Expression.atom("at", "nowhere"));

        assertThrows(GroundingException.class, () -> new Grounder().ground(task.getDomain(), problem));
    }

    @Test
    public void undeclaredTypeIsRejected() {
        PlanningTask task = PlanningFixtures.moveXY(false);
        List<TypedObject> objects = new ArrayList<>(task.getProblem().getObjects());
        objects.add(new TypedObject("b1", "boat"));
        Problem problem = new Problem("boats", objects, task.getProblem().getInitialFacts(), Map.of(),
            task.getProblem().getGoal());

        assertThrows(GroundingException.class, () -> new Grounder().ground(task.getDomain(), problem));
    }

    private static Domain withActions(Domain domain, ActionSchema... extra) {
        List<ActionSchema> actions = new ArrayList<>(domain.getActions());
        actions.addAll(List.of(extra));
        return new Domain(domain.getName(), domain.getTypes(), domain.getConstants(),
            new ArrayList<>(domain.getPredicates().values()), new ArrayList<>(domain.getFunctions().values()),
            actions);
    }
}
