package com.devloop.orchestrator.workflow;

import com.devloop.orchestrator.completion.CancellationToken;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background completion monitor running for one work item.
 *
 * @param done    completes when the monitor has finished, whatever the outcome
 * @param settled claimed by whichever of the monitor or a stop settles the item
 */
record MonitoringTask(String entityId, String projectId, String branchName,
                      CancellationToken cancellation, CompletableFuture<Void> done, AtomicBoolean settled) {

    MonitoringTask(String entityId, String projectId, String branchName) {
        this(entityId, projectId, branchName, new CancellationToken(), new CompletableFuture<>(), new AtomicBoolean());
    }

    /** True for exactly one caller: the one that moves the item out of IN_PROGRESS. */
    boolean claimSettlement() {
        return settled.compareAndSet(false, true);
    }
}
