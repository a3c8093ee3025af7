package com.integration.mergequeue.service;

import com.integration.mergequeue.dto.github.Branch;
import com.integration.mergequeue.exception.FastForwardException;
import com.integration.mergequeue.exception.ForgeApiException;
import com.integration.mergequeue.forge.ForgeClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Points a branch at the tip of another branch, creating it when missing.
 * Only the merge queue worker moves the staging branch through this class.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BranchAligner {

    private static final int UNPROCESSABLE = 422;

    private final ForgeClient forgeClient;

    /**
     * Move {@code base} to the current tip of {@code head}.
     *
     * @return the commit {@code base} now points at
     * @throws FastForwardException if {@code force} is false and the move is not a fast-forward
     */
    public String align(String base, String head, boolean force) {
        String sha = resolveTip(head);
        alignToCommit(base, sha, force);
        log.debug("`{}` branch rebased on top of `{}`", base, head);
        return sha;
    }

    public void alignToCommit(String base, String sha, boolean force) {
        if (forgeClient.findBranch(base).isEmpty()) {
            log.debug("Branch `{}` cannot be found, creating one at {}", base, sha);
            forgeClient.createBranchRef(base, sha);
            return;
        }
        try {
            forgeClient.updateBranchRef(base, sha, force);
        } catch (ForgeApiException e) {
            if (!force && e.getStatus() == UNPROCESSABLE) {
                throw new FastForwardException(base, sha, e);
            }
            throw e;
        }
    }

    public String resolveTip(String branch) {
        return forgeClient.findBranch(branch)
                .map(Branch::getTipSha)
                .orElseThrow(() -> new ForgeApiException(404, "Branch not found: " + branch));
    }
}
