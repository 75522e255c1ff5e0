package com.assistrelay.providers;

import com.assistrelay.shared.error.TransportException;
import com.assistrelay.shared.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Function;

/**
 * Polls a run's status at a fixed interval until it leaves queued/in_progress.
 * With no {@code maxWait} the wait is unbounded; otherwise {@link RunStatus#TIMED_OUT} is
 * returned once it elapses. Interrupting the polling thread cancels the wait.
 */
public class RunPoller {

    private static final Logger log = LoggerFactory.getLogger(RunPoller.class);

    private final Duration interval;
    private final Duration maxWait;

    public RunPoller(Duration interval, Duration maxWait) {
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be >= 0");
        }
        this.interval = interval;
        this.maxWait = maxWait;
    }

    public RunPoller(Duration interval) {
        this(interval, null);
    }

    public RunStatus poll(String threadId, Function<String, RunStatus> statusCheck) {
        long deadline = maxWait != null ? System.nanoTime() + maxWait.toNanos() : Long.MAX_VALUE;
        int attempt = 0;
        while (true) {
            attempt++;
            var status = statusCheck.apply(threadId);
            if (status.isTerminal()) {
                log.info("Run on thread {} finished with status: {} after {} polls", threadId, status, attempt);
                return status;
            }
            if (maxWait != null && System.nanoTime() - deadline >= 0) {
                log.warn("Run on thread {} still {} after {}, giving up", threadId, status, maxWait);
                return RunStatus.TIMED_OUT;
            }
            log.info("Waiting for run to complete... (thread {}, status {})", threadId, status);
            sleep(threadId);
        }
    }

    private void sleep(String threadId) {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for run on thread " + threadId, ie);
        }
    }
}
