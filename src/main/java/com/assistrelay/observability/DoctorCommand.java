package com.assistrelay.observability;

import com.assistrelay.shared.config.RelayConfig;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;

public class DoctorCommand {

    private final RelayConfig config;

    public DoctorCommand(RelayConfig config) {
        this.config = config;
    }

    public String run() {
        var results = new ArrayList<String>();
        results.add(checkCredentials());
        results.add(checkDedupPath());
        results.add(checkAssistantEndpoint());
        results.add(checkJavaVersion());
        return String.join("\n", results);
    }

    private String checkCredentials() {
        var missing = new ArrayList<String>();
        if (config.assistant().apiKey().isBlank()) missing.add("API_KEY");
        if (config.assistant().assistantId().isBlank()) missing.add("ASSISTANT_ID");
        if (config.slack().botToken().isBlank()) missing.add("SLACK_BOT_TOKEN");
        return missing.isEmpty()
                ? "[OK] Credentials configured"
                : "[FAIL] Missing configuration: " + String.join(", ", missing);
    }

    private String checkDedupPath() {
        Path dir = config.dedup().path().toAbsolutePath().getParent();
        var file = config.dedup().path();
        if (Files.exists(file) ? Files.isWritable(file) : Files.isDirectory(dir) && Files.isWritable(dir)) {
            return "[OK] Dedup store writable: " + file;
        }
        return "[FAIL] Dedup store not writable: " + file;
    }

    private String checkAssistantEndpoint() {
        try {
            var client = HttpClient.newHttpClient();
            var req = HttpRequest.newBuilder()
                    .uri(URI.create(config.assistant().baseUrl()))
                    .timeout(Duration.ofSeconds(5))
                    .GET().build();
            var resp = client.send(req, HttpResponse.BodyHandlers.discarding());
            return resp.statusCode() < 500
                    ? "[OK] Assistant endpoint reachable"
                    : "[FAIL] Assistant endpoint: HTTP " + resp.statusCode();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "[FAIL] Assistant endpoint: interrupted";
        } catch (Exception e) {
            return "[FAIL] Assistant endpoint: " + e.getMessage();
        }
    }

    private String checkJavaVersion() {
        var version = Runtime.version().feature();
        return version >= 17
                ? "[OK] Java " + version
                : "[FAIL] Java " + version + " (17+ required)";
    }
}
