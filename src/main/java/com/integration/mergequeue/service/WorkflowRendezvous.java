package com.integration.mergequeue.service;

import com.integration.mergequeue.config.MergeQueueProperties;
import com.integration.mergequeue.model.WorkflowOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeoutException;

/**
 * Hands CI verdicts from the webhook threads to the merge queue worker.
 *
 * The worker registers the commit it is about to test, then blocks on the outcome.
 * A workflow_run delivery resolves the outcome registered for its head commit.
 * Verdicts for commits nobody waits on are dropped.
 */
@Component
@Slf4j
public class WorkflowRendezvous {

    private final ConcurrentMap<String, WorkflowOutcome> outcomes = new ConcurrentHashMap<>();

    private final String successConclusion;

    public WorkflowRendezvous(MergeQueueProperties properties) {
        this.successConclusion = properties.getSuccessConclusion();
    }

    /**
     * Start tracking the CI verdict of {@code commitSha}. An outcome left over for the same
     * commit is failed and replaced.
     */
    public WorkflowOutcome register(String commitSha, int pullRequestNumber) {
        WorkflowOutcome outcome = new WorkflowOutcome(commitSha, pullRequestNumber);
        WorkflowOutcome previous = outcomes.put(commitSha, outcome);
        if (previous != null && previous.resolve(false)) {
            log.warn("[PR #{}] Replaced stale workflow outcome for {}", previous.getPullRequestNumber(), commitSha);
        }
        log.debug("[PR #{}] Waiting for workflow on {}", pullRequestNumber, commitSha);
        return outcome;
    }

    /**
     * Block until the verdict for the outcome's commit is delivered.
     * Running out of time counts as a failed verdict.
     */
    public boolean await(WorkflowOutcome outcome, Duration timeout) throws InterruptedException {
        try {
            return outcome.await(timeout);
        } catch (TimeoutException e) {
            outcomes.remove(outcome.getCommitSha(), outcome);
            log.warn("[PR #{}] No workflow result for {} after {}",
                    outcome.getPullRequestNumber(), outcome.getCommitSha(), timeout);
            return false;
        } catch (InterruptedException e) {
            outcomes.remove(outcome.getCommitSha(), outcome);
            throw e;
        }
    }

    public boolean awaitResult(String commitSha, int pullRequestNumber, Duration timeout) throws InterruptedException {
        return await(register(commitSha, pullRequestNumber), timeout);
    }

    /**
     * Resolve the outcome registered for {@code commitSha}.
     *
     * @return false if no outcome was registered for that commit
     */
    public boolean deliver(String commitSha, String conclusion) {
        if (commitSha == null) {
            return false;
        }
        WorkflowOutcome outcome = outcomes.remove(commitSha);
        if (outcome == null) {
            log.debug("Ignoring workflow result `{}` for untracked commit {}", conclusion, commitSha);
            return false;
        }
        log.info("[PR #{}] Workflow completed with conclusion `{}`", outcome.getPullRequestNumber(), conclusion);
        outcome.resolve(successConclusion.equals(conclusion));
        return true;
    }

    public void cancel(WorkflowOutcome outcome) {
        if (outcomes.remove(outcome.getCommitSha(), outcome)) {
            log.debug("[PR #{}] Stopped waiting for workflow on {}",
                    outcome.getPullRequestNumber(), outcome.getCommitSha());
        }
    }

    public boolean isPending(String commitSha) {
        return outcomes.containsKey(commitSha);
    }
}
