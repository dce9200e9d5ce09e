package alpha.lapis.events;

import java.time.Duration;
import java.util.Arrays;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Holder of a start and stop time, as returned by {@link System#nanoTime()}.
 */
public abstract class AbstractStats
{
    private final long start, stop;

    /**
     * Initializes this object.
     *
     * @param start {@link System#nanoTime()} on start
     * @param stop {@link System#nanoTime()} on stop
     */
    protected AbstractStats(long start, long stop) {
        this.start = start;
        this.stop  = stop;
    }

    /**
     * Returns {@link System#nanoTime()} on start.
     *
     * @return {@link System#nanoTime()} on start
     */
    public final long nanoTimeOnStart() {
        return start;
    }

    /**
     * Returns {@link System#nanoTime()} on stop.
     *
     * @return {@link System#nanoTime()} on stop
     */
    public final long nanoTimeOnStop() {
        return stop;
    }

    /**
     * Returns the difference between stop and start, in nanoseconds.
     *
     * @return elapsed nanoseconds
     */
    public final long elapsedNanos() {
        return stop - start;
    }

    /**
     * Returns the difference between stop and start, in milliseconds.
     *
     * @return elapsed milliseconds
     */
    public final long elapsedMillis() {
        return NANOSECONDS.toMillis(elapsedNanos());
    }

    /**
     * Returns the difference between stop and start.
     *
     * @return elapsed duration
     */
    public final Duration elapsedDuration() {
        return Duration.ofNanos(elapsedNanos());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(new long[]{start, stop});
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || this.getClass() != obj.getClass()) {
            return false;
        }
        var other = (AbstractStats) obj;
        return this.start == other.start &&
               this.stop  == other.stop;
    }
}
