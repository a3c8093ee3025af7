package com.integration.mergequeue.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings of the merge queue, bound from the {@code mergequeue.*} keys of application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "mergequeue")
public class MergeQueueProperties {

    /**
     * Token that addresses the bot in a pull request comment.
     */
    @NotBlank
    private String mention = "@mergequeue";

    /**
     * Marker put in front of every comment written by the bot.
     */
    @NotBlank
    private String messagePrefix = "***[from mergequeue]***";

    @NotBlank
    private String mainlineBranch = "master";

    @NotBlank
    private String stagingBranch = "staging";

    /**
     * Number of pull requests that triggers a batch merge.
     */
    @Min(1)
    private int batchSize = 3;

    /**
     * GitHub merge method used to land a candidate: merge, squash or rebase.
     */
    @NotBlank
    private String mergeMethod = "rebase";

    /**
     * Workflow run conclusion that counts as a passing test suite.
     */
    @NotBlank
    private String successConclusion = "success";

    /**
     * Upper bound on the wait for a CI verdict. Zero waits forever.
     */
    @NotNull
    private Duration ciTimeout = Duration.ofHours(6);

    /**
     * Time given to the worker to finish the ongoing integration on shutdown.
     */
    @NotNull
    private Duration shutdownTimeout = Duration.ofSeconds(20);

    @Valid
    private Repository repository = new Repository();

    @Data
    public static class Repository {

        @NotBlank
        private String owner;

        @NotBlank
        private String name;

        public String getFullName() {
            return owner + "/" + name;
        }
    }
}
