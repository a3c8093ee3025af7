package com.integration.mergequeue.model;

import com.integration.mergequeue.dto.github.PullRequest;
import lombok.Value;

/**
 * One unit of work of the merge queue: a single pull request or a batch integration pull request.
 */
@Value
public class IntegrationRequest {

    int number;

    String headRef;

    String headSha;

    String htmlUrl;

    public static IntegrationRequest of(PullRequest pullRequest) {
        return new IntegrationRequest(
                pullRequest.getNumber(),
                pullRequest.getHead().getRef(),
                pullRequest.getHead().getSha(),
                pullRequest.getHtmlUrl());
    }

    public String logPrefix() {
        return "[PR #" + number + "]";
    }
}
