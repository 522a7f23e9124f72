package fr.uga.smtplan;

/**
 * The resolved configuration of a run. Immutable.
 */
public final class PlannerOptions {

    private final String domainPath;
    private final String problemPath;
    private final String encodingPath;
    private final int lowerBound;
    private final int upperBound;
    private final int stepSize;
    private final boolean solve;
    private final boolean prune;
    private final boolean rpgLowerBound;
    private final boolean explanatoryNames;
    private final String solverCommand;

    private PlannerOptions(Builder builder) {
        if (builder.lowerBound < 1) {
            throw new IllegalArgumentException("The lower bound must be positive: " + builder.lowerBound);
        }
        if (builder.stepSize < 1) {
            throw new IllegalArgumentException("The step size must be positive: " + builder.stepSize);
        }
        this.domainPath = builder.domainPath;
        this.problemPath = builder.problemPath;
        this.encodingPath = builder.encodingPath == null ? "" : builder.encodingPath;
        this.lowerBound = builder.lowerBound;
        this.upperBound = builder.upperBound;
        this.stepSize = builder.stepSize;
        this.solve = builder.solve;
        this.prune = builder.prune;
        this.rpgLowerBound = builder.rpgLowerBound;
        this.explanatoryNames = builder.explanatoryNames;
        this.solverCommand = builder.solverCommand;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getDomainPath() {
        return this.domainPath;
    }

    public String getProblemPath() {
        return this.problemPath;
    }

    /**
     * Where formulas are written; empty for standard output.
     */
    public String getEncodingPath() {
        return this.encodingPath;
    }

    public int getLowerBound() {
        return this.lowerBound;
    }

    /**
     * The last happening count to try; negative for no limit.
     */
    public int getUpperBound() {
        return this.upperBound;
    }

    public boolean isUnbounded() {
        return this.upperBound < 0;
    }

    public int getStepSize() {
        return this.stepSize;
    }

    /**
     * False for runs that only emit the first encoding.
     */
    public boolean isSolve() {
        return this.solve;
    }

    public boolean isPrune() {
        return this.prune;
    }

    public boolean isRpgLowerBound() {
        return this.rpgLowerBound;
    }

    public boolean isExplanatoryNames() {
        return this.explanatoryNames;
    }

    public String getSolverCommand() {
        return this.solverCommand;
    }

    @Override
    public String toString() {
        return "PlannerOptions{domain=" + this.domainPath + ", problem=" + this.problemPath
            + ", output=" + (this.encodingPath.isEmpty() ? "<stdout>" : this.encodingPath)
            + ", bounds=[" + this.lowerBound + ", " + this.upperBound + "], step=" + this.stepSize
            + ", solve=" + this.solve + ", prune=" + this.prune + ", rpgLowerBound=" + this.rpgLowerBound
            + ", explanatoryNames=" + this.explanatoryNames + ", solver=" + this.solverCommand + "}";
    }

    public static final class Builder {

        private String domainPath = "";
        private String problemPath = "";
        private String encodingPath = "";
        private int lowerBound = 1;
        private int upperBound = -1;
        private int stepSize = 1;
        private boolean solve = true;
        private boolean prune;
        private boolean rpgLowerBound;
        private boolean explanatoryNames;
        private String solverCommand = "z3 -smt2";

        private Builder() {
        }

        public Builder domainPath(String domainPath) {
            this.domainPath = domainPath;
            return this;
        }

        public Builder problemPath(String problemPath) {
            this.problemPath = problemPath;
            return this;
        }

        public Builder encodingPath(String encodingPath) {
            this.encodingPath = encodingPath;
            return this;
        }

        public Builder lowerBound(int lowerBound) {
            this.lowerBound = lowerBound;
            return this;
        }

        public Builder upperBound(int upperBound) {
            this.upperBound = upperBound;
            return this;
        }

        public Builder stepSize(int stepSize) {
            this.stepSize = stepSize;
            return this;
        }

        public Builder solve(boolean solve) {
            this.solve = solve;
            return this;
        }

        public Builder prune(boolean prune) {
            this.prune = prune;
            return this;
        }

        public Builder rpgLowerBound(boolean rpgLowerBound) {
            this.rpgLowerBound = rpgLowerBound;
            return this;
        }

        public Builder explanatoryNames(boolean explanatoryNames) {
            this.explanatoryNames = explanatoryNames;
            return this;
        }

        public Builder solverCommand(String solverCommand) {
            this.solverCommand = solverCommand;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the lower bound or the step size is not positive.
         */
        public PlannerOptions build() {
            return new PlannerOptions(this);
        }
    }
}
