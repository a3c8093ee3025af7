package com.integration.mergequeue.model;

import lombok.Value;

import java.util.Optional;

/**
 * Result of scanning a comment for the bot mention.
 */
@Value
public class CommandInvocation {

    boolean mentioned;

    /**
     * First token after the mention, empty when the mention ends the comment.
     */
    Optional<String> command;

    public static CommandInvocation notMentioned() {
        return new CommandInvocation(false, Optional.empty());
    }
}
