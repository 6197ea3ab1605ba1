package com.taskrelay.orchestrator.delegation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskrelay.orchestrator.delegation.dto.CreateSubtaskRequest;
import com.taskrelay.orchestrator.delegation.dto.CreateSubtaskResponse;
import com.taskrelay.orchestrator.delegation.dto.SubtaskResultReport;
import com.taskrelay.orchestrator.model.StepName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the agent-to-agent protocol.
 *
 * Outbound side of both roles: creating and abandoning subtasks on a
 * counterparty, and reporting results back to an agent that delegated a step
 * to us. Blocking I/O; called from worker threads and the timeout sweeper.
 */
@Component
public class CounterpartyClient {

    private static final Logger log = LoggerFactory.getLogger(CounterpartyClient.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient   http;
    private final ObjectMapper json;

    public CounterpartyClient(ObjectMapper objectMapper) {
        this.json = objectMapper;
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Delegating side
    // ------------------------------------------------------------------

    /**
     * Ask a counterparty to run one step.
     *
     * @return remote_id assigned by the counterparty
     * @throws CounterpartyException on a transport error, a non-2xx status, or
     *         a response without a remote_id
     */
    public String createSubtask(Counterparty counterparty, StepName step, String input,
                                String callerIdentity, String callbackUrl) {
        log.info("Creating '{}' subtask on {}", step.wireName(), counterparty.agentId());
        String body = toJson(new CreateSubtaskRequest(
                step.wireName(), input, callerIdentity, callbackUrl));
        String respBody = post(counterparty.baseUrl() + "/agent/tasks", body,
                "createSubtask on " + counterparty.agentId());
        try {
            CreateSubtaskResponse resp = json.readValue(respBody, CreateSubtaskResponse.class);
            if (resp.remote_id() == null || resp.remote_id().isBlank()) {
                throw new CounterpartyException(
                        "createSubtask on " + counterparty.agentId() + " returned no remote_id");
            }
            return resp.remote_id();
        } catch (JsonProcessingException e) {
            throw new CounterpartyException("Failed to parse createSubtask response", e);
        }
    }

    /** Ask a counterparty to stop working on a subtask we no longer need. */
    public void cancelSubtask(String counterpartyUrl, String remoteId) {
        log.info("Abandoning subtask {} on {}", remoteId, counterpartyUrl);
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(counterpartyUrl + "/agent/tasks/" + remoteId))
                    .timeout(REQUEST_TIMEOUT)
                    .header("Accept", "application/json")
                    .DELETE()
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new CounterpartyException(
                        "cancelSubtask failed for " + remoteId
                        + " — HTTP " + resp.statusCode() + ": " + resp.body());
            }
        } catch (CounterpartyException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CounterpartyException("cancelSubtask interrupted for " + remoteId, e);
        } catch (Exception e) {
            throw new CounterpartyException("cancelSubtask failed for " + remoteId, e);
        }
    }

    // ------------------------------------------------------------------
    // Serving side
    // ------------------------------------------------------------------

    /** Post a result to the agent that delegated {@code remoteId} to us. */
    public void reportResult(String callbackUrl, String remoteId, SubtaskResultReport report) {
        log.info("Reporting {} for subtask {} to {}", report.status(), remoteId, callbackUrl);
        post(callbackUrl + "/" + remoteId + "/result", toJson(report),
                "reportResult for " + remoteId);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String post(String url, String jsonBody, String opName) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(REQUEST_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new CounterpartyException(
                        opName + " failed — HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (CounterpartyException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CounterpartyException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new CounterpartyException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new CounterpartyException("JSON serialization failed", e);
        }
    }
}
