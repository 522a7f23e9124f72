package fr.uga.smtplan.rpg;

import fr.uga.smtplan.grounding.GroundAction;
import fr.uga.smtplan.grounding.GroundCondition;
import fr.uga.smtplan.grounding.GroundedModel;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Builds the delete-relaxed planning graph of a ground model.
 *
 * <p>Fact layer 0 holds the initial propositions. An action enters action layer k when its
 * at-start condition is relaxed-satisfied by fact layer k, and all its add effects (at start
 * and at end) enter fact layer k+1. Negative literals and numeric comparisons are assumed
 * satisfiable. The graph is expanded up to its fixpoint, so every proposition or action left
 * out of it can never occur in a plan.</p>
 */
public class RPGPruner {

    private static final Logger LOGGER = LogManager.getLogger(RPGPruner.class.getName());

    /**
     * Computes the reachability of every proposition and action of the model.
     */
    public ReachabilityResult build(GroundedModel model) {
        int[] propositionLayers = new int[model.propositionCount()];
        int[] actionLayers = new int[model.actionCount()];
        Arrays.fill(propositionLayers, ReachabilityResult.UNREACHABLE);
        Arrays.fill(actionLayers, ReachabilityResult.UNREACHABLE);

        BitSet facts = model.getInitialState();
        facts.stream().forEach(p -> propositionLayers[p] = 0);

        List<GroundAction> actions = model.getActions();
        int goalLayer = ReachabilityResult.UNREACHABLE;
        int layer = 0;
        while (true) {
            if (goalLayer == ReachabilityResult.UNREACHABLE && isRelaxedSatisfied(model.getGoal(), facts)) {
                goalLayer = layer;
                LOGGER.debug("Relaxed goal satisfied at layer {}", layer);
            }

            BitSet next = (BitSet) facts.clone();
            for (GroundAction action : actions) {
                if (actionLayers[action.getIndex()] == ReachabilityResult.UNREACHABLE
                    && isRelaxedSatisfied(action.getStartCondition(), facts)) {
                    actionLayers[action.getIndex()] = layer;
                }
                if (actionLayers[action.getIndex()] != ReachabilityResult.UNREACHABLE) {
                    action.getStartEffect().getAdds().forEach(next::set);
                    action.getEndEffect().getAdds().forEach(next::set);
                }
            }

            if (next.equals(facts)) {
                break;
            }
            layer++;
            final int current = layer;
            BitSet added = (BitSet) next.clone();
            added.andNot(facts);
            added.stream().forEach(p -> propositionLayers[p] = current);
            LOGGER.debug("Fact layer {}: {} new propositions", layer, added.cardinality());
            facts = next;
        }

        ReachabilityResult result = new ReachabilityResult(propositionLayers, actionLayers, goalLayer, layer + 1);
        LOGGER.info("RPG: {}", result);
        return result;
    }

    /**
     * Evaluates a condition in the relaxed sense: positive propositions must be in the fact
     * set, everything under a negation and every numeric comparison counts as satisfied.
     */
    static boolean isRelaxedSatisfied(GroundCondition condition, BitSet facts) {
        switch (condition.getKind()) {
            case TRUE:
            case NOT:
            case COMPARISON:
                return true;
            case FALSE:
                return false;
            case PROPOSITION:
                return facts.get(condition.getProposition());
            case AND:
                for (GroundCondition child : condition.getChildren()) {
                    if (!isRelaxedSatisfied(child, facts)) {
                        return false;
                    }
                }
                return true;
            case OR:
                for (GroundCondition child : condition.getChildren()) {
                    if (isRelaxedSatisfied(child, facts)) {
                        return true;
                    }
                }
                return false;
            default:
                throw new IllegalStateException("Unknown condition kind " + condition.getKind());
        }
    }
}
