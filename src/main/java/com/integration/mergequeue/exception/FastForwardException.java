package com.integration.mergequeue.exception;

import lombok.Getter;

/**
 * Moving a branch to a commit would discard commits of that branch.
 */
@Getter
public class FastForwardException extends RuntimeException {

    private final String branch;

    private final String commitSha;

    public FastForwardException(String branch, String commitSha, Throwable cause) {
        super("Cannot fast-forward `" + branch + "` to " + commitSha, cause);
        this.branch = branch;
        this.commitSha = commitSha;
    }
}
