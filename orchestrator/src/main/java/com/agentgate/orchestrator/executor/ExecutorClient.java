package com.agentgate.orchestrator.executor;

import com.agentgate.orchestrator.executor.dto.ExecutionResult;
import com.agentgate.orchestrator.model.LineRange;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the external executor service.
 *
 * One typed method per executor endpoint. Uses java.net.http.HttpClient so
 * every header and byte on the wire is explicit.
 *
 * Called from the orchestrator's worker pool, so blocking I/O here is fine.
 */
public class ExecutorClient implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ExecutorClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     commandTimeout;

    public ExecutorClient(String baseUrl, Duration commandTimeout, ObjectMapper objectMapper) {
        this.baseUrl        = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.commandTimeout = commandTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // File operations
    // ------------------------------------------------------------------

    @Override
    public ExecutionResult createFile(String path, String content) {
        log.info("Creating file '{}' ({} chars)", path, content == null ? 0 : content.length());
        return post("/files/create", Map.of("path", path, "content", content == null ? "" : content),
                "createFile " + path, Duration.ofSeconds(30));
    }

    @Override
    public ExecutionResult modifyFile(String path, String content, LineRange lineRange) {
        log.info("Modifying file '{}'{}", path, lineRange == null ? "" : " lines " + lineRange.start() + "-" + lineRange.end());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("path", path);
        body.put("content", content == null ? "" : content);
        if (lineRange != null) {
            body.put("start_line", lineRange.start());
            body.put("end_line", lineRange.end());
        }
        return post("/files/modify", body, "modifyFile " + path, Duration.ofSeconds(30));
    }

    @Override
    public ExecutionResult openFile(String path) {
        return post("/files/open", Map.of("path", path), "openFile " + path, Duration.ofSeconds(10));
    }

    @Override
    public ExecutionResult analyzeFile(String path) {
        return post("/files/analyze", Map.of("path", path), "analyzeFile " + path, Duration.ofSeconds(60));
    }

    // ------------------------------------------------------------------
    // Commands
    // ------------------------------------------------------------------

    @Override
    public ExecutionResult runCommand(String command) {
        log.info("Running command: {}", command);
        // Allow a bit more wall-clock time than the executor's own kill deadline.
        return post("/commands/run",
                Map.of("command", command, "timeout_sec", commandTimeout.toSeconds()),
                "runCommand", commandTimeout.plusSeconds(30));
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private ExecutionResult post(String path, Object payload, String opName, Duration timeout) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(toJson(payload)))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ExecutorException(
                        opName + " failed, HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return json.readValue(resp.body(), ExecutionResult.class);
        } catch (ExecutorException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Failed to parse " + opName + " response", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ExecutorException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("JSON serialization failed", e);
        }
    }
}
