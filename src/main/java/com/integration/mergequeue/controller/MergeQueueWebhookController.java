package com.integration.mergequeue.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.integration.mergequeue.dto.github.IssueCommentPayload;
import com.integration.mergequeue.dto.github.WorkflowRunPayload;
import com.integration.mergequeue.service.MergeQueueHandler;
import com.integration.mergequeue.service.WebhookSignatureVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;

/**
 * Webhook endpoint of the merge queue GitHub app.
 *
 * Headers:
 *   X-GitHub-Event: issue_comment | workflow_run | ping
 *   X-Hub-Signature-256: sha256=...
 *   X-GitHub-Delivery: unique delivery GUID
 *
 * Every delivery is acknowledged, including those failing inside the merge queue,
 * so GitHub does not keep redelivering them.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class MergeQueueWebhookController {

    static final String GITHUB_EVENT = "X-GitHub-Event";

    private final MergeQueueHandler mergeQueueHandler;
    private final WebhookSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;

    @PostMapping("/")
    public ResponseEntity<String> handleWebhook(
            @RequestHeader(value = GITHUB_EVENT, required = false) String event,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestHeader(value = "X-GitHub-Delivery", required = false) String deliveryId,
            @RequestBody(required = false) byte[] rawBody) {

        if (event == null || event.isBlank()) {
            return ResponseEntity.ok("Webhook Event Not Found");
        }
        log.debug("Received GitHub webhook: event={}, delivery={}", event, deliveryId);

        byte[] body = rawBody != null ? rawBody : new byte[0];
        if (!signatureVerifier.isValid(body, signature)) {
            log.error("Invalid webhook signature for delivery: {}", deliveryId);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("Invalid signature");
        }

        try {
            return switch (event) {
                case "issue_comment" -> ResponseEntity.ok(mergeQueueHandler.onPullRequestComment(
                        objectMapper.readValue(body, IssueCommentPayload.class)));
                case "workflow_run" -> ResponseEntity.ok(mergeQueueHandler.onWorkflowRun(
                        objectMapper.readValue(body, WorkflowRunPayload.class)));
                case "ping" -> ResponseEntity.ok("pong");
                default -> ResponseEntity.ok("Webhook Event Not Handled");
            };
        } catch (JsonProcessingException e) {
            log.error("Failed to parse {} payload of delivery {}: {}", event, deliveryId, e.getMessage());
            return ResponseEntity.badRequest().body("Invalid payload");
        } catch (IOException | RuntimeException e) {
            log.error("Error handling {} event of delivery {}: {}", event, deliveryId, e.getMessage(), e);
            return ResponseEntity.ok("Event could not be processed");
        }
    }
}
