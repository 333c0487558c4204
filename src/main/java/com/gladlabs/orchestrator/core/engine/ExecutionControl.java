package com.gladlabs.orchestrator.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag and deadline of one execution, shared between the worker running it
 * and callers asking it to stop.
 * <p>
 * The deadline is fixed when the worker starts the execution, so time spent queued for a
 * worker does not count against the workflow timeout.
 */
public class ExecutionControl {

    private static final Logger log = LoggerFactory.getLogger(ExecutionControl.class);

    private static final long SLEEP_SLICE_MS = 50;

    private final String executionId;
    private final Duration workflowTimeout;
    private final Clock clock;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private volatile Instant deadline;

    public ExecutionControl(String executionId, Duration workflowTimeout, Clock clock) {
        this.executionId = executionId;
        this.workflowTimeout = workflowTimeout;
        this.clock = clock;
    }

    public String executionId() {
        return executionId;
    }

    public void start() {
        deadline = clock.instant().plus(workflowTimeout);
    }

    /**
     * @return true if this call set the flag, false if cancellation was already requested
     */
    public boolean requestCancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public Duration remaining() {
        Instant end = deadline;
        if (end == null) {
            return workflowTimeout;
        }
        Duration left = Duration.between(clock.instant(), end);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isPastDeadline() {
        Instant end = deadline;
        return end != null && !clock.instant().isBefore(end);
    }

    /**
     * @throws WorkflowTimeoutException when the deadline has passed
     */
    public void checkDeadline() {
        if (isPastDeadline()) {
            throw new WorkflowTimeoutException("Execution " + executionId + " exceeded workflow timeout of "
                    + workflowTimeout.toSeconds() + "s");
        }
    }

    /** The smaller of the phase timeout and the remaining workflow budget. */
    public Duration boundedTimeout(Duration phaseTimeout) {
        Duration left = remaining();
        return phaseTimeout.compareTo(left) <= 0 ? phaseTimeout : left;
    }

    /**
     * Sleeps for the delay, bounded by the remaining budget, waking early on cancellation.
     * Interruption is treated as a cancellation request.
     */
    public void sleep(Duration delay) {
        long until = System.nanoTime() + boundedTimeout(delay).toNanos();
        try {
            while (!isCancelRequested()) {
                long leftMs = (until - System.nanoTime()) / 1_000_000;
                if (leftMs <= 0) {
                    return;
                }
                Thread.sleep(Math.min(leftMs, SLEEP_SLICE_MS));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Execution {} interrupted during backoff; treating as cancellation", executionId);
            requestCancel();
        }
    }
}
