package com.integration.mergequeue.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum MergeCommand {
    TRY_MERGE("try-merge"),
    TRY_BATCHMERGE("try-batchmerge");

    private final String keyword;

    public static Optional<MergeCommand> fromKeyword(String keyword) {
        return Arrays.stream(values())
                .filter(command -> command.keyword.equals(keyword))
                .findFirst();
    }
}
