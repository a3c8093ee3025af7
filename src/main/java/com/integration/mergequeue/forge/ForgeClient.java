package com.integration.mergequeue.forge;

import com.integration.mergequeue.dto.github.Branch;
import com.integration.mergequeue.dto.github.IssueComment;
import com.integration.mergequeue.dto.github.PullRequest;

import java.util.List;
import java.util.Optional;

/**
 * Operations of the code hosting platform used by the merge queue, scoped to one repository.
 * Failed calls throw {@link com.integration.mergequeue.exception.ForgeApiException}.
 */
public interface ForgeClient {

    PullRequest getPullRequest(int number);

    IssueComment getIssueComment(long commentId);

    /**
     * @return empty when the branch does not exist
     */
    Optional<Branch> findBranch(String branch);

    void createBranchRef(String branch, String sha);

    void updateBranchRef(String branch, String sha, boolean force);

    /**
     * Merge {@code head} into {@code base} on the platform side. Fails with 409 on conflicts.
     */
    void mergeBranch(String base, String head, String commitMessage);

    PullRequest createPullRequest(String title, String body, String head, String base);

    void updatePullRequestBase(int number, String base);

    void updatePullRequestBranch(int number);

    void mergePullRequest(int number, String mergeMethod);

    void createIssueComment(int issueNumber, String body);

    /**
     * Logins of the users allowed to push to {@code branch}.
     *
     * @return empty when the branch has no push restrictions configured
     */
    Optional<List<String>> findPushRestrictionUsers(String branch);

    String name();
}
