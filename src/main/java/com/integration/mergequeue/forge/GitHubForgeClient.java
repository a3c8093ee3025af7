package com.integration.mergequeue.forge;

import com.integration.mergequeue.dto.github.Branch;
import com.integration.mergequeue.dto.github.GitHubUser;
import com.integration.mergequeue.dto.github.IssueComment;
import com.integration.mergequeue.dto.github.PullRequest;
import com.integration.mergequeue.exception.ForgeApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.Supplier;

/**
 * {@link ForgeClient} backed by the GitHub REST API.
 * The {@link WebClient} is expected to carry the base URL and the authentication headers.
 */
@Slf4j
public class GitHubForgeClient implements ForgeClient {

    private static final int TRANSPORT_FAILURE = 502;

    private final WebClient webClient;
    private final String owner;
    private final String repo;

    public GitHubForgeClient(WebClient webClient, String owner, String repo) {
        this.webClient = Objects.requireNonNull(webClient, "webClient");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.repo = Objects.requireNonNull(repo, "repo");
    }

    // ========================= PULL REQUESTS =========================

    /**
     * GET /repos/{owner}/{repo}/pulls/{number}
     */
    @Override
    public PullRequest getPullRequest(int number) {
        log.debug("Fetching pull request {}#{}", name(), number);
        return call("Fetching pull request #" + number, () -> webClient.get()
                .uri("/repos/{owner}/{repo}/pulls/{number}", owner, repo, number)
                .retrieve()
                .bodyToMono(PullRequest.class)
                .block());
    }

    /**
     * POST /repos/{owner}/{repo}/pulls
     */
    @Override
    public PullRequest createPullRequest(String title, String body, String head, String base) {
        log.info("Opening pull request {} -> {} on {}", head, base, name());
        PullRequest created = call("Creating pull request from " + head, () -> webClient.post()
                .uri("/repos/{owner}/{repo}/pulls", owner, repo)
                .bodyValue(Map.of("title", title, "body", body, "head", head, "base", base))
                .retrieve()
                .bodyToMono(PullRequest.class)
                .block());
        if (created == null) {
            throw new ForgeApiException(TRANSPORT_FAILURE, "Empty response when creating pull request from " + head);
        }
        return created;
    }

    /**
     * PATCH /repos/{owner}/{repo}/pulls/{number}
     */
    @Override
    public void updatePullRequestBase(int number, String base) {
        log.debug("Setting base of pull request #{} to {}", number, base);
        call("Updating base of pull request #" + number, () -> webClient.patch()
                .uri("/repos/{owner}/{repo}/pulls/{number}", owner, repo, number)
                .bodyValue(Map.of("base", base))
                .retrieve()
                .toBodilessEntity()
                .block());
    }

    /**
     * PUT /repos/{owner}/{repo}/pulls/{number}/update-branch
     */
    @Override
    public void updatePullRequestBranch(int number) {
        log.debug("Requesting branch update of pull request #{}", number);
        call("Updating branch of pull request #" + number, () -> webClient.put()
                .uri("/repos/{owner}/{repo}/pulls/{number}/update-branch", owner, repo, number)
                .bodyValue(Map.of())
                .retrieve()
                .toBodilessEntity()
                .block());
    }

    /**
     * PUT /repos/{owner}/{repo}/pulls/{number}/merge
     */
    @Override
    public void mergePullRequest(int number, String mergeMethod) {
        log.info("Merging pull request #{} on {} with method {}", number, name(), mergeMethod);
        call("Merging pull request #" + number, () -> webClient.put()
                .uri("/repos/{owner}/{repo}/pulls/{number}/merge", owner, repo, number)
                .bodyValue(Map.of("merge_method", mergeMethod))
                .retrieve()
                .toBodilessEntity()
                .block());
    }

    // ========================= COMMENTS =========================

    /**
     * GET /repos/{owner}/{repo}/issues/comments/{comment_id}
     */
    @Override
    public IssueComment getIssueComment(long commentId) {
        return call("Fetching comment " + commentId, () -> webClient.get()
                .uri("/repos/{owner}/{repo}/issues/comments/{commentId}", owner, repo, commentId)
                .retrieve()
                .bodyToMono(IssueComment.class)
                .block());
    }

    /**
     * POST /repos/{owner}/{repo}/issues/{issue_number}/comments
     */
    @Override
    public void createIssueComment(int issueNumber, String body) {
        log.debug("Posting comment on {}#{}", name(), issueNumber);
        call("Commenting on #" + issueNumber, () -> webClient.post()
                .uri("/repos/{owner}/{repo}/issues/{number}/comments", owner, repo, issueNumber)
                .bodyValue(Map.of("body", body))
                .retrieve()
                .toBodilessEntity()
                .block());
    }

    // ========================= BRANCHES =========================

    /**
     * GET /repos/{owner}/{repo}/branches/{branch}
     */
    @Override
    public Optional<Branch> findBranch(String branch) {
        try {
            Map<String, Object> variables = repositoryVariables();
            String path = "/repos/{owner}/{repo}/branches/" + branchTemplate(branch, variables);
            return Optional.ofNullable(call("Fetching branch " + branch, () -> webClient.get()
                    .uri(path, variables)
                    .retrieve()
                    .bodyToMono(Branch.class)
                    .block()));
        } catch (ForgeApiException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    /**
     * POST /repos/{owner}/{repo}/git/refs
     */
    @Override
    public void createBranchRef(String branch, String sha) {
        log.debug("Creating branch {} at {}", branch, sha);
        call("Creating branch " + branch, () -> webClient.post()
                .uri("/repos/{owner}/{repo}/git/refs", owner, repo)
                .bodyValue(Map.of("ref", "refs/heads/" + branch, "sha", sha))
                .retrieve()
                .toBodilessEntity()
                .block());
    }

    /**
     * PATCH /repos/{owner}/{repo}/git/refs/heads/{branch}
     */
    @Override
    public void updateBranchRef(String branch, String sha, boolean force) {
        log.debug("Moving branch {} to {} (force={})", branch, sha, force);
        Map<String, Object> variables = repositoryVariables();
        String path = "/repos/{owner}/{repo}/git/refs/heads/" + branchTemplate(branch, variables);
        call("Updating branch " + branch, () -> webClient.patch()
                .uri(path, variables)
                .bodyValue(Map.of("sha", sha, "force", force))
                .retrieve()
                .toBodilessEntity()
                .block());
    }

    /**
     * POST /repos/{owner}/{repo}/merges
     */
    @Override
    public void mergeBranch(String base, String head, String commitMessage) {
        log.debug("Merging {} into {}", head, base);
        call("Merging " + head + " into " + base, () -> webClient.post()
                .uri("/repos/{owner}/{repo}/merges", owner, repo)
                .bodyValue(Map.of("base", base, "head", head, "commit_message", commitMessage))
                .retrieve()
                .toBodilessEntity()
                .block());
    }

    /**
     * GET /repos/{owner}/{repo}/branches/{branch}/protection/restrictions/users
     */
    @Override
    public Optional<List<String>> findPushRestrictionUsers(String branch) {
        Map<String, Object> variables = repositoryVariables();
        String path = "/repos/{owner}/{repo}/branches/" + branchTemplate(branch, variables)
                + "/protection/restrictions/users";
        try {
            List<GitHubUser> users = call("Fetching push restrictions of " + branch, () -> webClient.get()
                    .uri(path, variables)
                    .retrieve()
                    .bodyToMono(new ParameterizedTypeReference<List<GitHubUser>>() {})
                    .block());
            if (users == null) {
                return Optional.of(List.of());
            }
            return Optional.of(users.stream().map(GitHubUser::getLogin).toList());
        } catch (ForgeApiException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public String name() {
        return "github:" + owner + "/" + repo;
    }

    // ========================= HELPERS =========================

    private Map<String, Object> repositoryVariables() {
        Map<String, Object> variables = new HashMap<>();
        variables.put("owner", owner);
        variables.put("repo", repo);
        return variables;
    }

    /**
     * One URI variable per path segment of the branch name, so characters such as
     * {@code #} or {@code ?} are encoded while {@code /} keeps separating segments.
     */
    private static String branchTemplate(String branch, Map<String, Object> variables) {
        String[] segments = branch.split("/", -1);
        StringJoiner template = new StringJoiner("/");
        for (int i = 0; i < segments.length; i++) {
            variables.put("branch" + i, segments[i]);
            template.add("{branch" + i + "}");
        }
        return template.toString();
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            throw new ForgeApiException(status,
                    operation + " failed with status " + status + ": " + e.getResponseBodyAsString(), e);
        } catch (WebClientException e) {
            throw new ForgeApiException(TRANSPORT_FAILURE, operation + " failed: " + e.getMessage(), e);
        }
    }
}
