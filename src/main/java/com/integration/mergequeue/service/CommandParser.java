package com.integration.mergequeue.service;

import com.integration.mergequeue.config.MergeQueueProperties;
import com.integration.mergequeue.model.CommandInvocation;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Finds the bot mention in a comment and the command word that follows it.
 * Only the first occurrence of the mention is considered.
 */
@Component
public class CommandParser {

    private final String mention;

    public CommandParser(MergeQueueProperties properties) {
        this.mention = properties.getMention();
    }

    public CommandInvocation parse(String message) {
        if (message == null) {
            return CommandInvocation.notMentioned();
        }
        int index = message.indexOf(mention);
        if (index < 0) {
            return CommandInvocation.notMentioned();
        }

        String remain = message.substring(index + mention.length()).strip();
        if (remain.isEmpty()) {
            return new CommandInvocation(true, Optional.empty());
        }
        String command = remain.split("\\s+", 2)[0];
        return new CommandInvocation(true, Optional.of(command));
    }

    public String getMention() {
        return mention;
    }
}
