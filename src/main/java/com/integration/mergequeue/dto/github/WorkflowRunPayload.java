package com.integration.mergequeue.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * GitHub webhook payload for workflow_run events.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowRunPayload {

    private String action;  // requested, in_progress, completed

    @JsonProperty("workflow_run")
    private WorkflowRun workflowRun;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WorkflowRun {
        private long id;

        private String name;

        private String status;      // queued, in_progress, completed

        private String conclusion;  // success, failure, cancelled, timed_out, ...

        @JsonProperty("head_branch")
        private String headBranch;

        @JsonProperty("head_sha")
        private String headSha;
    }
}
