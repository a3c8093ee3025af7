package com.integration.mergequeue.service;

import com.integration.mergequeue.config.MergeQueueProperties;
import com.integration.mergequeue.dto.github.PullRequest;
import com.integration.mergequeue.exception.ForgeApiException;
import com.integration.mergequeue.forge.ForgeClient;
import com.integration.mergequeue.model.BatchAddResult;
import com.integration.mergequeue.model.IntegrationRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Collects pull requests for a batch merge. Once the batch is full, every pull request is
 * merged onto a fresh batch branch and a single integration pull request is put in the
 * merge queue in their place.
 *
 * Pull requests are processed by order of arrival. The lock is held from the duplicate
 * check to the end of the trigger, so two deliveries can never both fill the same batch.
 */
@Component
@Slf4j
public class BatchAccumulator {

    private final ForgeClient forgeClient;
    private final MergeQueueWorker mergeQueueWorker;
    private final PullRequestNotifier notifier;
    private final MergeQueueProperties properties;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<PullRequest> pending = new ArrayList<>();
    private final AtomicLong batchSequence = new AtomicLong(System.currentTimeMillis());

    public BatchAccumulator(ForgeClient forgeClient, MergeQueueWorker mergeQueueWorker,
                            PullRequestNotifier notifier, MergeQueueProperties properties) {
        this.forgeClient = forgeClient;
        this.mergeQueueWorker = mergeQueueWorker;
        this.notifier = notifier;
        this.properties = properties;
    }

    public BatchAddResult add(PullRequest pullRequest) {
        lock.lock();
        try {
            int number = pullRequest.getNumber();
            boolean alreadyAdded = pending.stream().anyMatch(pr -> pr.getNumber() == number);
            if (alreadyAdded) {
                notifier.notify(number, "Pull request already added to batch merge queue.");
                return BatchAddResult.DUPLICATE;
            }

            pending.add(pullRequest);
            log.info("[PR #{}] Pull request put in batch queue", number);

            if (pending.size() < properties.getBatchSize()) {
                notifier.notify(number, "Pull request added to the batch merge queue. It will be processed soon.");
                return BatchAddResult.QUEUED;
            }

            try {
                return trigger(List.copyOf(pending));
            } finally {
                pending.clear();
            }
        } finally {
            lock.unlock();
        }
    }

    public List<Integer> pendingNumbers() {
        lock.lock();
        try {
            return pending.stream().map(PullRequest::getNumber).toList();
        } finally {
            lock.unlock();
        }
    }

    private BatchAddResult trigger(List<PullRequest> batch) {
        String branchName = "batch-" + batchSequence.incrementAndGet();
        forgeClient.createBranchRef(branchName, batch.get(0).getHead().getSha());
        log.debug("Batch merge branch `{}` created", branchName);

        // Merging the first pull request is a no-op unless its head moved since it was queued.
        List<PullRequest> added = new ArrayList<>();
        List<PullRequest> rejected = new ArrayList<>();
        for (PullRequest pullRequest : batch) {
            String headRef = pullRequest.getHead().getRef();
            try {
                forgeClient.mergeBranch(branchName, headRef, "Merge `" + headRef + "` into `" + branchName + "`");
                added.add(pullRequest);
                log.debug("[PR #{}] PR added to batch merge branch `{}`", pullRequest.getNumber(), branchName);
            } catch (ForgeApiException e) {
                log.info("[PR #{}] Merge of `{}` into `{}` failed: {}",
                        pullRequest.getNumber(), headRef, branchName, e.getMessage());
                rejected.add(pullRequest);
            }
        }

        for (PullRequest pullRequest : rejected) {
            notifyQuietly(pullRequest.getNumber(), "Batch branch `" + branchName + "` rebase onto `"
                    + pullRequest.getHead().getRef() + "` failed (cannot fast-forward)");
        }

        if (added.isEmpty()) {
            log.info("No pull requests added to batch merge on branch `{}`", branchName);
            return BatchAddResult.ABANDONED;
        }

        String details = added.stream()
                .map(pr -> "- [#" + pr.getNumber() + "](" + pr.getHtmlUrl() + ")\n")
                .collect(Collectors.joining());
        String title = properties.getMention() + " Batch merge with `" + branchName + "`";
        String body = properties.getMessagePrefix() + " Batch merge attempt for the following pull requests:\n"
                + details;
        PullRequest batchPullRequest = forgeClient.createPullRequest(
                title, body, branchName, properties.getMainlineBranch());
        log.info("[PR #{}] Batch merge pull request created for branch `{}`",
                batchPullRequest.getNumber(), branchName);

        mergeQueueWorker.submit(IntegrationRequest.of(batchPullRequest));

        for (PullRequest pullRequest : added) {
            notifyQuietly(pullRequest.getNumber(), "Commits added to `" + branchName + "` branch.\n"
                    + " Check batch merge pull request [#" + batchPullRequest.getNumber() + "]("
                    + batchPullRequest.getHtmlUrl() + ") associated with this branch to know merge status.");
        }
        return BatchAddResult.TRIGGERED;
    }

    private void notifyQuietly(int number, String message) {
        try {
            notifier.notify(number, message);
        } catch (ForgeApiException e) {
            log.warn("[PR #{}] Could not post comment: {}", number, e.getMessage());
        }
    }
}
