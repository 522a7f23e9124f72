package fr.uga.smtplan.rpg;

import java.util.Arrays;

/**
 * The layer at which each ground proposition and action first appears in the relaxed
 * planning graph, -1 meaning never. Read-only.
 */
public final class ReachabilityResult {

    public static final int UNREACHABLE = -1;

    private final int[] propositionLayers;
    private final int[] actionLayers;
    private final int goalLayer;
    private final int layerCount;

    ReachabilityResult(int[] propositionLayers, int[] actionLayers, int goalLayer, int layerCount) {
        this.propositionLayers = propositionLayers.clone();
        this.actionLayers = actionLayers.clone();
        this.goalLayer = goalLayer;
        this.layerCount = layerCount;
    }

    /**
     * A result classifying every proposition and action as reachable at layer 0. Encoding
     * against it is the same as encoding without pruning.
     */
    public static ReachabilityResult everythingReachable(int propositions, int actions) {
        return new ReachabilityResult(new int[propositions], new int[actions], 0, 1);
    }

    public boolean isPropositionReachable(int proposition) {
        return this.propositionLayers[proposition] != UNREACHABLE;
    }

    public boolean isActionReachable(int action) {
        return this.actionLayers[action] != UNREACHABLE;
    }

    public int getPropositionLayer(int proposition) {
        return this.propositionLayers[proposition];
    }

    public int getActionLayer(int action) {
        return this.actionLayers[action];
    }

    /**
     * The first fact layer satisfying the relaxed goal, or -1 if the relaxed goal is never
     * satisfied. A lower bound on the number of happenings of any plan.
     */
    public int getGoalLayer() {
        return this.goalLayer;
    }

    public boolean isGoalReachable() {
        return this.goalLayer != UNREACHABLE;
    }

    /**
     * The number of fact layers built before the fixpoint.
     */
    public int getLayerCount() {
        return this.layerCount;
    }

    public long reachablePropositionCount() {
        return Arrays.stream(this.propositionLayers).filter(l -> l != UNREACHABLE).count();
    }

    public long reachableActionCount() {
        return Arrays.stream(this.actionLayers).filter(l -> l != UNREACHABLE).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReachabilityResult)) {
            return false;
        }
        ReachabilityResult other = (ReachabilityResult) o;
        return this.goalLayer == other.goalLayer && this.layerCount == other.layerCount
            && Arrays.equals(this.propositionLayers, other.propositionLayers)
            && Arrays.equals(this.actionLayers, other.actionLayers);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(this.propositionLayers) + Arrays.hashCode(this.actionLayers))
            + this.goalLayer;
    }

    @Override
    public String toString() {
        return "ReachabilityResult{propositions=" + reachablePropositionCount() + "/" + this.propositionLayers.length
            + ", actions=" + reachableActionCount() + "/" + this.actionLayers.length
            + ", goalLayer=" + this.goalLayer + ", layers=" + this.layerCount + "}";
    }
}
