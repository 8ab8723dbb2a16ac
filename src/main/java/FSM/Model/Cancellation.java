package FSM.Model;

import java.util.concurrent.ScheduledFuture;

/**
 * Caller-imposed limits on determinization: a cap on the number of result states and an
 * interrupt flag that another thread (e.g. a timer) may raise.
 */
public class Cancellation {

    private final int stateThreshold;

    private volatile boolean interrupted;
    private boolean oom;

    private ScheduledFuture<?> backref;

    public Cancellation() {
        this(false, Integer.MAX_VALUE);
    }

    public Cancellation(int stateThreshold) {
        this(false, stateThreshold);
    }

    public Cancellation(boolean interrupted, int stateThreshold) {
        this.interrupted = interrupted;
        this.stateThreshold = stateThreshold;
    }

    public int getStateThreshold() {
        return stateThreshold;
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    public void setInterrupted() {
        this.interrupted = true;
    }

    public boolean isOom() {
        return oom;
    }

    public boolean isAboveThreshold(int states) {
        this.oom |= states > stateThreshold;
        return this.oom;
    }

    public boolean isCancelled() {
        return isInterrupted() || isOom();
    }

    public String cancelLabel() {
        return this.isInterrupted() ? "TO" : "OOM";
    }

    /**
     * Cancels the timer registered through {@link #setBackref}, if any.
     */
    public void cancel() {
        if (backref != null) {
            backref.cancel(false);
        }
    }

    public void setBackref(ScheduledFuture<?> backref) {
        this.backref = backref;
    }
}
