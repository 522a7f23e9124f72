package fr.uga.smtplan.search;

/**
 * Measures the elapsed time of the phases of a run. Passed explicitly to the components
 * that report timings.
 */
public final class Stopwatch {

    private final long start;
    private long last;

    private Stopwatch(long now) {
        this.start = now;
        this.last = now;
    }

    public static Stopwatch start() {
        return new Stopwatch(System.nanoTime());
    }

    /**
     * Seconds since the previous lap, or since the start for the first lap.
     */
    public double lap() {
        long now = System.nanoTime();
        double seconds = (now - this.last) / 1e9;
        this.last = now;
        return seconds;
    }

    /**
     * Seconds since the start.
     */
    public double total() {
        return (System.nanoTime() - this.start) / 1e9;
    }
}
