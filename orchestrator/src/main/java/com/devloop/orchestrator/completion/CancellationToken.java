package com.devloop.orchestrator.completion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation for a background monitor.
 *
 * Resources registered with the token are closed on {@link #cancel()}, which is
 * how a monitor blocked reading a socket gets unstuck. Waits through
 * {@link #sleep(Duration)} end early on cancellation.
 */
public class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<AutoCloseable> resources = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (cancelled.getCount() == 0) return;
        cancelled.countDown();
        for (AutoCloseable resource : resources) {
            closeQuietly(resource);
        }
        resources.clear();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Close {@code resource} when this token is cancelled; closes it immediately if it already is.
     */
    public void register(AutoCloseable resource) {
        resources.add(resource);
        if (isCancelled() && resources.remove(resource)) {
            closeQuietly(resource);
        }
    }

    public void unregister(AutoCloseable resource) {
        resources.remove(resource);
    }

    /**
     * Wait for {@code duration} unless cancelled first.
     *
     * @return true if the full duration elapsed, false if cancelled or interrupted
     */
    public boolean sleep(Duration duration) {
        try {
            return !cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void closeQuietly(AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            log.debug("Error closing {} on cancellation: {}", resource, e.getMessage());
        }
    }
}
