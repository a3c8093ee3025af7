package com.integration.mergequeue.service;

import com.integration.mergequeue.config.MergeQueueProperties;
import com.integration.mergequeue.exception.FastForwardException;
import com.integration.mergequeue.forge.ForgeClient;
import com.integration.mergequeue.model.IntegrationRequest;
import com.integration.mergequeue.model.WorkflowOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Single consumer of the merge queue. Integrates one request at a time:
 * 1. Bring staging up to date with mainline
 * 2. Retarget the pull request onto mainline and update its branch
 * 3. Move staging to the pull request head
 * 4. Wait for the CI verdict on that commit and merge on success
 * 5. Reset staging to mainline, whatever happened before
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MergeQueueWorker {

    private static final IntegrationRequest SHUTDOWN = new IntegrationRequest(0, "", "", "");

    private final ForgeClient forgeClient;
    private final BranchAligner branchAligner;
    private final WorkflowRendezvous workflowRendezvous;
    private final PullRequestNotifier notifier;
    private final MergeQueueProperties properties;

    private final BlockingQueue<IntegrationRequest> queue = new LinkedBlockingQueue<>();

    private Thread thread;

    public synchronized void start() {
        if (thread != null) {
            return;
        }
        thread = new Thread(this::processQueue, "merge-queue-worker");
        thread.start();
        log.info("Merge queue worker started on {}", forgeClient.name());
    }

    /**
     * Ask the worker to finish after the request in progress. A worker still busy after
     * {@code joinTimeout} is interrupted.
     */
    public synchronized void stop(Duration joinTimeout) {
        if (thread == null) {
            return;
        }
        queue.add(SHUTDOWN);
        try {
            thread.join(joinTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.warn("Merge queue worker did not stop within {}, interrupting", joinTimeout);
            thread.interrupt();
        }
        thread = null;
        log.info("Merge queue worker stopped, {} request(s) left in queue", pendingCount());
    }

    public void submit(IntegrationRequest request) {
        queue.add(request);
        log.info("{} Pull request put in queue", request.logPrefix());
    }

    public int pendingCount() {
        return (int) queue.stream().filter(request -> request != SHUTDOWN).count();
    }

    public synchronized boolean isRunning() {
        return thread != null && thread.isAlive();
    }

    private void processQueue() {
        while (true) {
            IntegrationRequest request;
            try {
                request = queue.take();
            } catch (InterruptedException e) {
                log.info("Merge queue worker interrupted while idle");
                return;
            }
            if (request == SHUTDOWN) {
                return;
            }
            try {
                process(request);
            } catch (InterruptedException e) {
                log.warn("{} Integration interrupted, stopping worker", request.logPrefix());
                return;
            } catch (RuntimeException e) {
                log.error("{} Unexpected failure while processing request: {}", request.logPrefix(), e.getMessage(), e);
            }
        }
    }

    void process(IntegrationRequest request) throws InterruptedException {
        String prefix = request.logPrefix();
        try {
            integrate(request);
        } catch (FastForwardException e) {
            log.warn("{} Staging could not be brought up to date: {}", prefix, e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} Integration of `{}` aborted: {}", prefix, request.getHeadRef(), e.getMessage(), e);
        }
        resetStaging(prefix);
    }

    private void integrate(IntegrationRequest request) throws InterruptedException {
        String prefix = request.logPrefix();
        String mainline = properties.getMainlineBranch();
        String staging = properties.getStagingBranch();
        String headRef = request.getHeadRef();

        branchAligner.align(staging, mainline, false);

        forgeClient.updatePullRequestBase(request.getNumber(), mainline);
        forgeClient.updatePullRequestBranch(request.getNumber());
        log.debug("{} Base set to `{}` head", prefix, mainline);

        // Registered before staging moves so an early CI result is not lost.
        String headSha = branchAligner.resolveTip(headRef);
        WorkflowOutcome outcome = workflowRendezvous.register(headSha, request.getNumber());
        try {
            branchAligner.alignToCommit(staging, headSha, false);
        } catch (FastForwardException e) {
            workflowRendezvous.cancel(outcome);
            String message = "Rebasing `" + headRef + "` on top of `" + mainline + "` failed (cannot fast-forward)";
            log.info("{} {}", prefix, message);
            notifier.notify(request.getNumber(), message);
            return;
        } catch (RuntimeException e) {
            workflowRendezvous.cancel(outcome);
            throw e;
        }
        log.debug("{} `{}` merged into `{}`", prefix, headRef, staging);

        boolean success = workflowRendezvous.await(outcome, properties.getCiTimeout());
        if (success) {
            forgeClient.mergePullRequest(request.getNumber(), properties.getMergeMethod());
            log.info("{} `{}` successfully merged into `{}`", prefix, headRef, mainline);
        } else {
            String message = "Automated tests failed, `" + headRef + "` cannot be merged into `" + mainline + "`";
            notifier.notify(request.getNumber(), message);
            log.info("{} {}", prefix, message);
        }
    }

    private void resetStaging(String prefix) {
        try {
            branchAligner.align(properties.getStagingBranch(), properties.getMainlineBranch(), true);
        } catch (RuntimeException e) {
            log.error("{} Failed to reset `{}` to `{}`: {}", prefix,
                    properties.getStagingBranch(), properties.getMainlineBranch(), e.getMessage(), e);
        }
    }
}
