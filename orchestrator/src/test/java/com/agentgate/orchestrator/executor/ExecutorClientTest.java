package com.agentgate.orchestrator.executor;

import com.agentgate.orchestrator.executor.dto.ExecutionResult;
import com.agentgate.orchestrator.model.LineRange;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ExecutorClient against an in-process HTTP server that
 * records request bodies and replies with canned responses.
 */
class ExecutorClientTest {

    final ObjectMapper        mapper   = new ObjectMapper();
    final Map<String, String> received = new ConcurrentHashMap<>();

    HttpServer     server;
    ExecutorClient client;

    volatile int    status = 200;
    volatile String reply  = """
            {"exit_code":0,"stdout":"done","stderr":"","elapsed_sec":0.4,"error_type":null,"extra":"ignored"}
            """;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        client = new ExecutorClient("http://127.0.0.1:" + server.getAddress().getPort() + "/",
                Duration.ofSeconds(120), mapper);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void runCommand_postsCommandWithTimeout_andParsesResult() throws Exception {
        ExecutionResult result = client.runCommand("npm test");

        assertThat(result.success()).isTrue();
        assertThat(result.stdout()).isEqualTo("done");
        assertThat(result.elapsed_sec()).isEqualTo(0.4);

        JsonNode body = mapper.readTree(received.get("/commands/run"));
        assertThat(body.get("command").asText()).isEqualTo("npm test");
        assertThat(body.get("timeout_sec").asLong()).isEqualTo(120);
    }

    @Test
    void modifyFile_withLineRange_sendsStartAndEndLine() throws Exception {
        client.modifyFile("src/app.js", "x", new LineRange(10, 20));

        JsonNode body = mapper.readTree(received.get("/files/modify"));
        assertThat(body.get("path").asText()).isEqualTo("src/app.js");
        assertThat(body.get("start_line").asInt()).isEqualTo(10);
        assertThat(body.get("end_line").asInt()).isEqualTo(20);
    }

    @Test
    void modifyFile_withoutLineRange_omitsLineFields() throws Exception {
        client.modifyFile("src/app.js", null, null);

        JsonNode body = mapper.readTree(received.get("/files/modify"));
        assertThat(body.has("start_line")).isFalse();
        assertThat(body.get("content").asText()).isEmpty();
    }

    @Test
    void createFile_postsPathAndContent() throws Exception {
        client.createFile("src/a.ts", "export {}");

        JsonNode body = mapper.readTree(received.get("/files/create"));
        assertThat(body.get("path").asText()).isEqualTo("src/a.ts");
        assertThat(body.get("content").asText()).isEqualTo("export {}");
    }

    @Test
    void non2xxResponse_throwsExecutorException() {
        status = 500;
        reply  = "boom";

        assertThatThrownBy(() -> client.openFile("README.md"))
                .isInstanceOf(ExecutorException.class)
                .hasMessageContaining("HTTP 500")
                .hasMessageContaining("boom");
    }

    @Test
    void malformedJson_throwsExecutorException() {
        reply = "not json";

        assertThatThrownBy(() -> client.analyzeFile("src/a.ts"))
                .isInstanceOf(ExecutorException.class)
                .hasMessageContaining("Failed to parse");
    }

    @Test
    void unreachableExecutor_throwsExecutorException() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        ExecutorClient offline = new ExecutorClient("http://127.0.0.1:" + port, Duration.ofSeconds(5), mapper);

        assertThatThrownBy(() -> offline.runCommand("ls"))
                .isInstanceOf(ExecutorException.class)
                .hasMessageContaining("runCommand failed");
    }

    private void handle(HttpExchange exchange) throws IOException {
        received.put(exchange.getRequestURI().getPath(),
                new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        byte[] bytes = reply.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
