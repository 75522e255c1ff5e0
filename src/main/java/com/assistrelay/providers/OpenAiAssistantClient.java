package com.assistrelay.providers;

import com.assistrelay.shared.config.AssistantConfig;
import com.assistrelay.shared.error.StructuralException;
import com.assistrelay.shared.error.TransportException;
import com.assistrelay.shared.model.RunHandle;
import com.assistrelay.shared.model.RunStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for an Assistants v2 style backend: create a thread-and-run, poll its runs, read its
 * messages.
 */
public class OpenAiAssistantClient implements AssistantRunClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiAssistantClient.class);
    private static final String BETA_HEADER = "assistants=v2";

    private final String apiKey;
    private final String baseUrl;
    private final String assistantId;
    private final Duration timeout;
    private final RunPoller poller;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public OpenAiAssistantClient(AssistantConfig config) {
        this(config, new RunPoller(config.pollInterval(), config.maxWait()));
    }

    public OpenAiAssistantClient(AssistantConfig config, RunPoller poller) {
        this.apiKey = config.apiKey();
        this.baseUrl = config.baseUrl().replaceAll("/+$", "");
        this.assistantId = config.assistantId();
        this.timeout = Duration.ofSeconds(config.timeoutSeconds());
        this.poller = poller;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public RunHandle createRun(String inputText) {
        log.info("Creating thread for input text: {}", inputText);
        var message = new LinkedHashMap<String, Object>();
        message.put("role", "user");
        message.put("content", inputText);
        var body = new LinkedHashMap<String, Object>();
        body.put("assistant_id", assistantId);
        body.put("thread", Map.of("messages", List.of(message)));

        var root = send("create thread", request("/threads/runs").POST(jsonBody(body)).build());
        var threadId = requireText(root.path("thread_id"), "thread_id");
        var runId = root.path("id").asText(null);
        log.info("Thread created successfully: thread={} run={}", threadId, runId);
        return new RunHandle(runId, threadId);
    }

    @Override
    public RunStatus currentStatus(String threadId) {
        var root = send("get thread runs", request("/threads/" + threadId + "/runs").GET().build());
        var current = firstOf(root, "runs");
        return RunStatus.of(requireText(current.path("status"), "data[0].status"));
    }

    @Override
    public RunStatus pollUntilTerminal(String threadId) {
        return poller.poll(threadId, this::currentStatus);
    }

    @Override
    public String fetchLatestMessage(String threadId) {
        log.info("Getting messages for thread ID: {}", threadId);
        var root = send("get thread messages", request("/threads/" + threadId + "/messages").GET().build());
        var latest = firstOf(root, "messages");
        var content = latest.path("content");
        if (!content.isArray() || content.isEmpty() || !content.path(0).has("text")) {
            throw new StructuralException("Unexpected API response structure: latest message has no text content");
        }
        var value = content.path(0).path("text").path("value");
        if (!value.isTextual()) {
            throw new StructuralException("Unexpected API response structure: missing data[0].content[0].text.value");
        }
        return value.asText();
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .header("OpenAI-Beta", BETA_HEADER)
                .timeout(timeout);
    }

    private HttpRequest.BodyPublisher jsonBody(Object body) {
        try {
            return HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body));
        } catch (IOException e) {
            throw new IllegalArgumentException("Unserializable request body", e);
        }
    }

    private JsonNode send(String operation, HttpRequest request) {
        HttpResponse<String> resp;
        try {
            resp = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException("Failed to " + operation + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted during " + operation, e);
        }

        if (resp.statusCode() != 200) {
            log.error("Failed to {}: {}, {}", operation, resp.statusCode(), resp.body());
            throw new TransportException(
                    "Failed to " + operation + ": " + resp.statusCode() + ", " + resp.body(),
                    resp.statusCode(), resp.body());
        }
        try {
            return mapper.readTree(resp.body());
        } catch (IOException e) {
            throw new StructuralException("Failed to " + operation + ": response is not JSON");
        }
    }

    private static JsonNode firstOf(JsonNode root, String what) {
        var data = root.path("data");
        if (!data.isArray() || data.isEmpty()) {
            throw new StructuralException("Unexpected API response structure: no " + what + " in data");
        }
        return data.path(0);
    }

    private static String requireText(JsonNode node, String field) {
        if (!node.isTextual() || node.asText().isEmpty()) {
            throw new StructuralException("Unexpected API response structure: missing " + field);
        }
        return node.asText();
    }
}
