package io.regrada.cli.compile;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.regrada.cli.config.CompileServiceConfig;
import io.regrada.core.compile.CompileOutcome;
import io.regrada.core.compile.CompileResponseParser;
import io.regrada.core.compile.CompileService;
import io.regrada.core.compile.CompileServiceException;
import io.regrada.serialization.ProjectSerializer;
import io.regrada.serialization.compile.JacksonCompileResponseParser;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/// [CompileService] over HTTP.
///
/// ### Protocol
/// 1. `POST {url}/code` with `{"code": "<source>"}`; the reply body is an acknowledgement.
/// 2. `GET {url}/projections`, repeated up to `pollAttempts` times with
///    `pollIntervalMs` before each request, until the body is a non-empty array.
///
/// When every poll returns an empty array the outcome is [CompileOutcome.Pending].
/// The POST is never retried.
///
/// @implNote Thread-safe. A lock is held for the whole submit-then-poll cycle, so
/// concurrent callers cannot read each other's results.
/// @see CompileServiceConfig for the settings
public class HttpCompileService implements CompileService {

    private static final Logger logger = Logger.getLogger(HttpCompileService.class.getName());

    static final String CODE_PATH = "/code";
    static final String PROJECTIONS_PATH = "/projections";

    private final CompileServiceConfig config;
    private final CompileResponseParser parser;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ReentrantLock lock = new ReentrantLock();
    private final HttpClient client;

    /// Creates a client parsing replies with [JacksonCompileResponseParser].
    ///
    /// @param config service settings, not null
    public HttpCompileService(CompileServiceConfig config) {
        this(config, new JacksonCompileResponseParser(ProjectSerializer.createMapper()));
    }

    /// Creates a client.
    ///
    /// @param config service settings, not null
    /// @param parser parser for the projections endpoint, not null
    public HttpCompileService(CompileServiceConfig config, CompileResponseParser parser) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .build();
    }

    @Override
    public CompileOutcome compile(String source) throws CompileServiceException {
        Objects.requireNonNull(source, "source must not be null");
        lock.lock();
        try {
            String body = objectMapper.createObjectNode().put("code", source).toString();
            HttpResponse<String> ack = httpPost(CODE_PATH, body);
            checkStatus(ack, CODE_PATH);
            logger.info("Submitted " + source.length() + " characters to " + config.getUrl());

            for (int attempt = 1; attempt <= config.getPollAttempts(); attempt++) {
                pause(config.getPollIntervalMs());
                HttpResponse<String> response = httpGet(PROJECTIONS_PATH);
                checkStatus(response, PROJECTIONS_PATH);
                Optional<CompileOutcome> outcome = parser.parse(response.body());
                if (outcome.isPresent()) {
                    logger.info("Compile result received after " + attempt + " poll(s)");
                    return outcome.get();
                }
            }

            logger.warning("No compile result after " + config.getPollAttempts() + " poll(s)");
            return new CompileOutcome.Pending(config.getPollAttempts());
        } finally {
            lock.unlock();
        }
    }

    /// Sends an HTTP POST request.
    ///
    /// @param path path below the base URL, not null
    /// @param jsonBody JSON request body, not null
    /// @return HTTP response, never null
    /// @throws CompileServiceException if the request fails
    protected HttpResponse<String> httpPost(String path, String jsonBody) throws CompileServiceException {
        HttpRequest request = HttpRequest.newBuilder()
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .uri(URI.create(config.getUrl() + path))
                .timeout(Duration.ofMillis(config.getTimeoutMs()))
                .header("Content-Type", "application/json")
                .build();
        return sendRequest(request);
    }

    /// Sends an HTTP GET request.
    ///
    /// @param path path below the base URL, not null
    /// @return HTTP response, never null
    /// @throws CompileServiceException if the request fails
    protected HttpResponse<String> httpGet(String path) throws CompileServiceException {
        HttpRequest request = HttpRequest.newBuilder()
                .GET()
                .uri(URI.create(config.getUrl() + path))
                .timeout(Duration.ofMillis(config.getTimeoutMs()))
                .header("Accept", "application/json")
                .build();
        return sendRequest(request);
    }

    /// Waits before the next poll.
    ///
    /// @throws CompileServiceException if the thread is interrupted
    protected void pause(long millis) throws CompileServiceException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompileServiceException("Interrupted while waiting for the compile service", e);
        }
    }

    private HttpResponse<String> sendRequest(HttpRequest request) throws CompileServiceException {
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompileServiceException("Request interrupted", e);
        } catch (IOException e) {
            throw new CompileServiceException(
                    "Failed to connect to compile service at " + config.getUrl() + ": " + e.getMessage(), e);
        }
    }

    private static void checkStatus(HttpResponse<String> response, String path) throws CompileServiceException {
        int status = response.statusCode();
        if (status >= 400) {
            throw new CompileServiceException("HTTP " + status + " from " + path + ": " + response.body());
        }
    }
}
