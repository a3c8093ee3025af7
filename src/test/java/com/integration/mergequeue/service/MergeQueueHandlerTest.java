package com.integration.mergequeue.service;

import com.integration.mergequeue.config.MergeQueueProperties;
import com.integration.mergequeue.dto.github.IssueCommentPayload;
import com.integration.mergequeue.forge.ForgeClient;
import com.integration.mergequeue.model.BatchAddResult;
import com.integration.mergequeue.model.IntegrationRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.integration.mergequeue.service.PullRequestFixtures.comment;
import static com.integration.mergequeue.service.PullRequestFixtures.commentPayload;
import static com.integration.mergequeue.service.PullRequestFixtures.pullRequest;
import static com.integration.mergequeue.service.PullRequestFixtures.workflowRun;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MergeQueueHandlerTest {

    @Mock
    private ForgeClient forgeClient;

    @Mock
    private AccessGate accessGate;

    @Mock
    private WorkflowRendezvous workflowRendezvous;

    @Mock
    private BatchAccumulator batchAccumulator;

    @Mock
    private MergeQueueWorker mergeQueueWorker;

    private MergeQueueProperties properties;

    private MergeQueueHandler handler;

    @BeforeEach
    void setUp() {
        properties = PullRequestFixtures.properties();
        handler = new MergeQueueHandler(forgeClient, new CommandParser(properties), accessGate, workflowRendezvous,
                batchAccumulator, mergeQueueWorker, new PullRequestNotifier(forgeClient, properties), properties);
    }

    @Test
    void ignoresCommentsOnPlainIssues() {
        IssueCommentPayload payload = commentPayload(7, 55L, "@mergequeue try-merge");
        payload.getIssue().setPullRequest(null);

        assertThat(handler.onPullRequestComment(payload)).isEqualTo("Comment not from a pull-request");
        verifyNoInteractions(forgeClient, mergeQueueWorker);
    }

    @Test
    void ignoresDeletedComments() {
        IssueCommentPayload payload = commentPayload(7, 55L, "@mergequeue try-merge");
        payload.setAction("deleted");

        assertThat(handler.onPullRequestComment(payload)).isEqualTo("Does nothing on comment deletion");
        verifyNoInteractions(forgeClient, mergeQueueWorker);
    }

    @Test
    void ignoresCommentsWrittenByTheBot() {
        IssueCommentPayload payload = commentPayload(7, 55L,
                "***[from mergequeue]*** Failed to process command (reason: no command provided) @mergequeue");

        handler.onPullRequestComment(payload);

        verifyNoInteractions(forgeClient, mergeQueueWorker);
    }

    @Test
    void ignoresCommentsWithoutMention() {
        assertThat(handler.onPullRequestComment(commentPayload(7, 55L, "Looks good to me")))
                .isEqualTo("mergequeue app not mentioned");
        verifyNoInteractions(forgeClient);
    }

    @Test
    void rejectsMentionWithoutCommand() {
        handler.onPullRequestComment(commentPayload(7, 55L, "@mergequeue"));

        verify(forgeClient).createIssueComment(7,
                "***[from mergequeue]*** Failed to process command (reason: no command provided)");
        verifyNoInteractions(mergeQueueWorker, batchAccumulator, accessGate);
    }

    @Test
    void rejectsUnknownCommand() {
        String response = handler.onPullRequestComment(commentPayload(7, 55L, "@mergequeue rebase"));

        assertThat(response).isEqualTo("Unknown command: rebase");
        verify(forgeClient).createIssueComment(7,
                "***[from mergequeue]*** Failed to process command (reason: unknown command `rebase`)");
        verifyNoInteractions(mergeQueueWorker, batchAccumulator, accessGate);
    }

    @Test
    void rejectsUserWithoutPushAccess() {
        when(forgeClient.getPullRequest(7)).thenReturn(pullRequest(7));
        when(forgeClient.getIssueComment(55L)).thenReturn(comment(55L, "mallory", "@mergequeue try-merge"));
        when(accessGate.canPush("master", "mallory")).thenReturn(false);

        String response = handler.onPullRequestComment(commentPayload(7, 55L, "@mergequeue try-merge"));

        assertThat(response).isEqualTo("User hasn't the push permission");
        verify(forgeClient).createIssueComment(7,
                "***[from mergequeue]*** User @mallory hasn't push access on `master` branch.");
        verifyNoInteractions(mergeQueueWorker, batchAccumulator);
    }

    @Test
    void queuesPullRequestOnTryMerge() {
        when(forgeClient.getPullRequest(7)).thenReturn(pullRequest(7));
        when(forgeClient.getIssueComment(55L)).thenReturn(comment(55L, "alice", "@mergequeue try-merge"));
        when(accessGate.canPush("master", "alice")).thenReturn(true);

        String response = handler.onPullRequestComment(commentPayload(7, 55L, "@mergequeue try-merge"));

        assertThat(response).isEqualTo("Command `try-merge` is being processed");
        verify(mergeQueueWorker).submit(new IntegrationRequest(7, "feature-7", "sha7",
                "https://github.com/acme/widgets/pull/7"));
        verify(forgeClient, never()).createIssueComment(anyInt(), anyString());
    }

    @Test
    void addsPullRequestToBatchOnTryBatchMerge() {
        when(forgeClient.getPullRequest(7)).thenReturn(pullRequest(7));
        when(forgeClient.getIssueComment(55L)).thenReturn(comment(55L, "alice", "@mergequeue try-batchmerge"));
        when(accessGate.canPush("master", "alice")).thenReturn(true);
        when(batchAccumulator.add(pullRequest(7))).thenReturn(BatchAddResult.QUEUED);

        String response = handler.onPullRequestComment(commentPayload(7, 55L, "@mergequeue try-batchmerge"));

        assertThat(response).isEqualTo("Command `try-batchmerge` is being processed");
        verify(batchAccumulator).add(pullRequest(7));
        verifyNoInteractions(mergeQueueWorker);
    }

    @Test
    void deliversCompletedStagingRuns() {
        String response = handler.onWorkflowRun(workflowRun("completed", "staging", "sha7", "success"));

        assertThat(response).isEqualTo("Workflow 99 has been handled");
        verify(workflowRendezvous).deliver("sha7", "success");
    }

    @Test
    void ignoresRunsStillInProgress() {
        assertThat(handler.onWorkflowRun(workflowRun("in_progress", "staging", "sha7", null)))
                .isEqualTo("Nothing done, workflow run is not completed");
        verifyNoInteractions(workflowRendezvous);
    }

    @Test
    void ignoresRunsOnOtherBranches() {
        assertThat(handler.onWorkflowRun(workflowRun("completed", "feature-7", "sha7", "success")))
                .isEqualTo("Nothing done, workflow run is not against 'staging' branch");
        verifyNoInteractions(workflowRendezvous);
    }

    @Test
    void startsAndStopsWorker() {
        handler.start();
        assertThat(handler.isRunning()).isTrue();
        verify(mergeQueueWorker).start();

        handler.stop();
        assertThat(handler.isRunning()).isFalse();
        verify(mergeQueueWorker).stop(properties.getShutdownTimeout());
    }
}
