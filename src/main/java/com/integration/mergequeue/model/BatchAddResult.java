package com.integration.mergequeue.model;

/**
 * What happened to a pull request handed to the batch accumulator.
 */
public enum BatchAddResult {
    QUEUED,     // waiting for more pull requests
    DUPLICATE,  // already waiting in the batch
    TRIGGERED,  // completed the batch, integration pull request opened
    ABANDONED   // completed the batch, but no pull request could be merged onto the batch branch
}
