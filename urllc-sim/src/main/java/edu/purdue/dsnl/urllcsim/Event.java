package edu.purdue.dsnl.urllcsim;

/**
 * A wake-up on the simulated timeline. Subclasses set {@link #time} and hand themselves back to the
 * {@link Simulator} to be resumed later.
 *
 * <p>Events are ordered by {@code (time, sequence)}. The sequence number is assigned by the simulator each time the
 * event is scheduled, so events due at the same instant run in the order they were scheduled.
 */
public abstract class Event implements Comparable<Event> {
    protected double time;

    long sequence;

    boolean scheduled;

    public abstract void execute();

    public double getTime() {
        return time;
    }

    @Override
    public int compareTo(Event o) {
        if (time != o.time) {
            return Double.compare(time, o.time);
        }
        return Long.compare(sequence, o.sequence);
    }
}
