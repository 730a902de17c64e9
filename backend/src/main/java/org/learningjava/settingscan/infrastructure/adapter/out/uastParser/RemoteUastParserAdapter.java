package org.learningjava.settingscan.infrastructure.adapter.out.uastParser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.learningjava.settingscan.application.port.UastParseException;
import org.learningjava.settingscan.application.port.UastParserPort;
import org.learningjava.settingscan.domain.model.uast.UastNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Tree producer backed by an external parse service speaking the Babelfish-style JSON protocol.
 */
public class RemoteUastParserAdapter implements UastParserPort {

    private static final Logger log = LoggerFactory.getLogger(RemoteUastParserAdapter.class);

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final long MAX_BACKOFF_MS = 10_000L;

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();
    private final String baseUrl;
    private final RetryTemplate retry;

    public RemoteUastParserAdapter(String baseUrl, OkHttpClient http,
                                   int maxAttempts, Duration initialBackoff, double multiplier) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.http = http;
        this.retry = buildRetryTemplate(maxAttempts, initialBackoff, multiplier);
    }

    private static RetryTemplate buildRetryTemplate(int maxAttempts, Duration initialBackoff, double multiplier) {
        long initial = Math.max(1L, initialBackoff.toMillis());
        RetryTemplateBuilder builder = RetryTemplate.builder().maxAttempts(Math.max(1, maxAttempts));
        if (multiplier > 1.0) {
            double max = initial;
            for (int i = 1; i < maxAttempts; i++) max = Math.min(max * multiplier, MAX_BACKOFF_MS);
            builder = builder.exponentialBackoff(initial, multiplier, Math.max(initial + 1, (long) max));
        } else {
            builder = builder.fixedBackoff(initial);
        }
        return builder.retryOn(RemoteUastParserAdapter::isTransient).build();
    }

    static boolean isTransient(Throwable t) {
        if (t instanceof ServiceFailure failure) return failure.transientFailure;
        return t instanceof IOException && !(t instanceof JsonProcessingException);
    }

    @Override
    public UastNode parse(Path sourceFile) throws UastParseException {
        String content;
        try {
            content = Files.readString(sourceFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UastParseException(sourceFile, "Cannot read " + sourceFile + ": " + e.getMessage(), e);
        }

        try {
            byte[] payload = requestBody(sourceFile, content);
            JsonNode response = retry.execute(ctx -> {
                if (ctx.getRetryCount() > 0) {
                    log.info("Retrying parse of {} (attempt {})", sourceFile, ctx.getRetryCount() + 1);
                }
                return call(payload);
            });
            return toTree(response);
        } catch (IOException e) {
            log.warn("Tree service failed for {}: {}", sourceFile, e.getMessage());
            throw new UastParseException(sourceFile, "Tree service failed for " + sourceFile + ": " + e.getMessage(), e);
        }
    }

    private byte[] requestBody(Path sourceFile, String content) throws IOException {
        ObjectNode body = om.createObjectNode();
        body.put("filename", sourceFile.getFileName().toString());
        body.put("language", "java");
        body.put("content", content);
        return om.writeValueAsBytes(body);
    }

    private JsonNode call(byte[] payload) throws IOException {
        Request req = new Request.Builder()
                .url(baseUrl + "/parse")
                .post(RequestBody.create(payload, JSON))
                .build();

        try (Response resp = http.newCall(req).execute()) {
            String s = resp.body() != null ? resp.body().string() : "";
            if (!resp.isSuccessful()) {
                boolean transientStatus = resp.code() == 429 || resp.code() >= 500;
                throw new ServiceFailure("HTTP " + resp.code() + " " + resp.message(), transientStatus);
            }
            if (log.isDebugEnabled()) log.debug("Tree service responded with {} bytes", s.length());
            return om.readTree(s);
        }
    }

    private UastNode toTree(JsonNode response) throws IOException {
        String status = response.path("status").asText("");
        if (!"ok".equalsIgnoreCase(status)) {
            throw new ServiceFailure("status '" + status + "', errors " + response.path("errors"), false);
        }
        JsonNode uast = response.get("uast");
        if (uast == null || uast.isNull()) {
            throw new ServiceFailure("response has no tree", false);
        }
        return UastJsonReader.read(uast);
    }

    static final class ServiceFailure extends IOException {
        private final boolean transientFailure;

        ServiceFailure(String message, boolean transientFailure) {
            super(message);
            this.transientFailure = transientFailure;
        }
    }
}
