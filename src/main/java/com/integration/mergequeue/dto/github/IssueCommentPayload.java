package com.integration.mergequeue.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * GitHub webhook payload for issue_comment events.
 * Pull request conversations are issues carrying a {@code pull_request} object.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IssueCommentPayload {

    private String action;  // created, edited, deleted

    private Issue issue;

    private IssueComment comment;

    private GitHubUser sender;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Issue {
        private int number;

        private String title;

        @JsonProperty("pull_request")
        private JsonNode pullRequest;

        public boolean isPullRequest() {
            return pullRequest != null && !pullRequest.isNull();
        }
    }
}
