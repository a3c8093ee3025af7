package com.integration.mergequeue.service;

import com.integration.mergequeue.config.MergeQueueProperties;
import com.integration.mergequeue.dto.github.IssueComment;
import com.integration.mergequeue.dto.github.IssueCommentPayload;
import com.integration.mergequeue.dto.github.PullRequest;
import com.integration.mergequeue.dto.github.WorkflowRunPayload;
import com.integration.mergequeue.forge.ForgeClient;
import com.integration.mergequeue.model.BatchAddResult;
import com.integration.mergequeue.model.CommandInvocation;
import com.integration.mergequeue.model.IntegrationRequest;
import com.integration.mergequeue.model.MergeCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point of the merge queue for webhook events.
 *
 * Pull request comments mentioning the bot are turned into merge requests:
 * - {@code try-merge} puts the pull request in the merge queue
 * - {@code try-batchmerge} adds it to the pending batch
 *
 * Completed workflow runs on the staging branch release the worker waiting for them.
 * The handler also owns the worker thread lifecycle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MergeQueueHandler implements SmartLifecycle {

    private static final String COMPLETED = "completed";
    private static final String DELETED = "deleted";

    private final ForgeClient forgeClient;
    private final CommandParser commandParser;
    private final AccessGate accessGate;
    private final WorkflowRendezvous workflowRendezvous;
    private final BatchAccumulator batchAccumulator;
    private final MergeQueueWorker mergeQueueWorker;
    private final PullRequestNotifier notifier;
    private final MergeQueueProperties properties;

    private volatile boolean running;

    // ========================= LIFECYCLE =========================

    @Override
    public void start() {
        log.info("Starting merge queue for {}", properties.getRepository().getFullName());
        mergeQueueWorker.start();
        running = true;
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        log.info("Shutting down merge queue");
        running = false;
        mergeQueueWorker.stop(properties.getShutdownTimeout());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ========================= WEBHOOK EVENTS =========================

    public String onPullRequestComment(IssueCommentPayload payload) {
        if (payload.getIssue() == null || !payload.getIssue().isPullRequest()) {
            return "Comment not from a pull-request";
        }
        if (DELETED.equals(payload.getAction())) {
            return "Does nothing on comment deletion";
        }
        IssueComment comment = payload.getComment();
        if (comment == null || notifier.isOwnComment(comment.getBody())) {
            return "Comment ignored";
        }

        int number = payload.getIssue().getNumber();
        CommandInvocation invocation = commandParser.parse(comment.getBody());
        if (!invocation.isMentioned()) {
            return "mergequeue app not mentioned";
        }

        Optional<MergeCommand> command = invocation.getCommand().flatMap(MergeCommand::fromKeyword);
        if (command.isEmpty()) {
            String reason = invocation.getCommand()
                    .map(keyword -> "unknown command `" + keyword + "`")
                    .orElse("no command provided");
            String message = "Failed to process command (reason: " + reason + ")";
            notifier.notify(number, message);
            log.info("[PR #{}] {}", number, message);
            return "Unknown command: " + invocation.getCommand().orElse("none");
        }

        PullRequest pullRequest = forgeClient.getPullRequest(number);
        String author = forgeClient.getIssueComment(comment.getId()).getUser().getLogin();
        String mainline = properties.getMainlineBranch();
        if (!accessGate.canPush(mainline, author)) {
            String message = "User @" + author + " hasn't push access on `" + mainline + "` branch.";
            notifier.notify(number, message);
            log.info("[PR #{}] {}", number, message);
            return "User hasn't the push permission";
        }

        switch (command.get()) {
            case TRY_MERGE -> tryMerge(pullRequest);
            case TRY_BATCHMERGE -> tryBatchMerge(pullRequest);
        }
        return "Command `" + command.get().getKeyword() + "` is being processed";
    }

    public String onWorkflowRun(WorkflowRunPayload payload) {
        WorkflowRunPayload.WorkflowRun run = payload.getWorkflowRun();
        if (run == null) {
            return "Nothing done, no workflow run in payload";
        }
        if (!COMPLETED.equals(run.getStatus())) {
            return "Nothing done, workflow run is not completed";
        }
        if (!properties.getStagingBranch().equals(run.getHeadBranch())) {
            return "Nothing done, workflow run is not against '" + properties.getStagingBranch() + "' branch";
        }

        workflowRendezvous.deliver(run.getHeadSha(), run.getConclusion());
        return "Workflow " + run.getId() + " has been handled";
    }

    // ========================= COMMANDS =========================

    public void tryMerge(PullRequest pullRequest) {
        mergeQueueWorker.submit(IntegrationRequest.of(pullRequest));
    }

    public BatchAddResult tryBatchMerge(PullRequest pullRequest) {
        return batchAccumulator.add(pullRequest);
    }
}
