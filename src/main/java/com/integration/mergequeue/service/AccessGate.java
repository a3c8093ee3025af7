package com.integration.mergequeue.service;

import com.integration.mergequeue.forge.ForgeClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether a user may request merges onto a protected branch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessGate {

    private final ForgeClient forgeClient;

    /**
     * A branch without push restrictions lets everybody through.
     * Any other failure while reading the restrictions propagates.
     */
    public boolean canPush(String branch, String login) {
        Optional<List<String>> allowed = forgeClient.findPushRestrictionUsers(branch);
        if (allowed.isEmpty()) {
            log.debug("No push restrictions configured on `{}`, allowing @{}", branch, login);
            return true;
        }
        return login != null && allowed.get().contains(login);
    }
}
