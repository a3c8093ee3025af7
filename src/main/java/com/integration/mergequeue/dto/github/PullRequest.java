package com.integration.mergequeue.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pull request as returned by GET /repos/{owner}/{repo}/pulls/{number}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PullRequest {

    private int number;
    private String title;
    private String state;

    @JsonProperty("html_url")
    private String htmlUrl;

    private GitHubUser user;

    private Ref head;
    private Ref base;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Ref {
        private String ref;  // Branch name
        private String sha;  // Tip commit SHA
    }
}
