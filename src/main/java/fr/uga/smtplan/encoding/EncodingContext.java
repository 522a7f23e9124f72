package fr.uga.smtplan.encoding;

import fr.uga.smtplan.grounding.GroundAction;
import fr.uga.smtplan.grounding.GroundedModel;
import fr.uga.smtplan.rpg.ReachabilityResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps the elements of a ground model and the happenings of one encoding to solver terms.
 * Lives for a single call of {@link Encoder#encode}. With pruning, unreachable propositions
 * are the constant {@code false} and unreachable actions are not encoded at all.
 */
final class EncodingContext {

    private final GroundedModel model;
    private final VariableNaming naming;
    private final int happenings;
    private final boolean[] encodedPropositions;
    private final List<Integer> propositions;
    private final List<GroundAction> actions;

    EncodingContext(GroundedModel model, ReachabilityResult reachability, boolean prune, VariableNaming naming,
                    int happenings) {
        this.model = model;
        this.naming = naming;
        this.happenings = happenings;
        this.encodedPropositions = new boolean[model.propositionCount()];
        List<Integer> kept = new ArrayList<>();
        for (int p = 0; p < model.propositionCount(); p++) {
            if (!prune || reachability.isPropositionReachable(p)) {
                this.encodedPropositions[p] = true;
                kept.add(p);
            }
        }
        this.propositions = Collections.unmodifiableList(kept);
        List<GroundAction> encoded = new ArrayList<>();
        for (GroundAction action : model.getActions()) {
            if (!prune || reachability.isActionReachable(action.getIndex())) {
                encoded.add(action);
            }
        }
        this.actions = Collections.unmodifiableList(encoded);
    }

    GroundedModel getModel() {
        return this.model;
    }

    VariableNaming getNaming() {
        return this.naming;
    }

    int getHappenings() {
        return this.happenings;
    }

    /**
     * The indices of the propositions that get variables.
     */
    List<Integer> getPropositions() {
        return this.propositions;
    }

    /**
     * The actions that get variables.
     */
    List<GroundAction> getActions() {
        return this.actions;
    }

    String time(int happening) {
        return this.naming.time(happening);
    }

    String proposition(int proposition, int state) {
        return this.encodedPropositions[proposition] ? this.naming.proposition(proposition, state) : Smt.FALSE;
    }

    String fluent(int fluent, int state) {
        return this.naming.fluent(fluent, state);
    }

    String start(GroundAction action, int happening) {
        return this.naming.start(action.getIndex(), happening);
    }

    String end(GroundAction action, int happening) {
        return this.naming.end(action.getIndex(), happening);
    }

    String running(GroundAction action, int happening) {
        return this.naming.running(action.getIndex(), happening);
    }

    String startTime(GroundAction action, int happening) {
        return this.naming.startTime(action.getIndex(), happening);
    }

    String duration(GroundAction action, int happening) {
        return this.naming.duration(action.getIndex(), happening);
    }
}
