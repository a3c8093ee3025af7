package com.integration.mergequeue.service;

import com.integration.mergequeue.config.MergeQueueProperties;
import com.integration.mergequeue.forge.ForgeClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Writes bot comments on pull requests. Every comment starts with the configured marker.
 */
@Component
@RequiredArgsConstructor
public class PullRequestNotifier {

    private final ForgeClient forgeClient;
    private final MergeQueueProperties properties;

    public void notify(int pullRequestNumber, String message) {
        forgeClient.createIssueComment(pullRequestNumber, String.join(" ", properties.getMessagePrefix(), message));
    }

    public boolean isOwnComment(String body) {
        return body != null && body.startsWith(properties.getMessagePrefix());
    }
}
