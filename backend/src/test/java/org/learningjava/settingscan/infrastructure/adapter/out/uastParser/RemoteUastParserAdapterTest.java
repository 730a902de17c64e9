package org.learningjava.settingscan.infrastructure.adapter.out.uastParser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.learningjava.settingscan.application.port.UastParseException;
import org.learningjava.settingscan.domain.model.uast.UastNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;

class RemoteUastParserAdapterTest {

    private static final String TREE = """
            {"status":"ok","errors":[],"uast":{
              "internalType":"CompilationUnit","properties":{},"startPosition":{"line":1,"col":1},
              "children":[{
                "internalType":"FieldDeclaration","token":"","startPosition":{"line":3,"col":5},
                "properties":{"internalRole":"bodyDeclarations"},
                "children":[{"internalType":"SimpleName","token":"X","properties":{"internalRole":"name","kind":"id"}}]
              }]
            }}""";

    private final ObjectMapper om = new ObjectMapper();
    private MockWebServer server;
    private RemoteUastParserAdapter adapter;
    private Path source;

    @BeforeEach
    void setUp(@TempDir Path dir) throws IOException {
        server = new MockWebServer();
        server.start();
        adapter = new RemoteUastParserAdapter(server.url("/").toString(), new OkHttpClient(),
                3, Duration.ofMillis(1), 2.0);
        source = dir.resolve("A.java");
        Files.writeString(source, "class A { int X; }");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void posts_source_and_maps_the_tree() throws Exception {
        server.enqueue(new MockResponse().setBody(TREE));

        UastNode root = adapter.parse(source);

        assertEquals("CompilationUnit", root.tag());
        UastNode field = root.children().get(0);
        assertEquals("FieldDeclaration", field.tag());
        assertEquals("bodyDeclarations", field.role());
        assertEquals(3, field.position().line());
        assertEquals(5, field.position().column());
        UastNode name = field.children().get(0);
        assertEquals("X", name.token());
        assertEquals("name", name.role());
        assertEquals("id", name.attribute("kind"));
        assertNull(name.attribute("internalRole"));

        RecordedRequest req = server.takeRequest();
        assertEquals("POST", req.getMethod());
        assertEquals("/parse", req.getPath());
        JsonNode body = om.readTree(req.getBody().readUtf8());
        assertEquals("A.java", body.get("filename").asText());
        assertEquals("java", body.get("language").asText());
        assertEquals("class A { int X; }", body.get("content").asText());
    }

    @Test
    void retries_transient_server_errors() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(new MockResponse().setBody(TREE));

        UastNode root = adapter.parse(source);

        assertEquals("CompilationUnit", root.tag());
        assertEquals(3, server.getRequestCount());
    }

    @Test
    void gives_up_after_max_attempts() {
        for (int i = 0; i < 3; i++) server.enqueue(new MockResponse().setResponseCode(500));

        UastParseException e = assertThrows(UastParseException.class, () -> adapter.parse(source));

        assertThat(e.getMessage(), containsString("HTTP 500"));
        assertEquals(3, server.getRequestCount());
    }

    @Test
    void client_errors_are_not_retried() {
        server.enqueue(new MockResponse().setResponseCode(400));

        assertThrows(UastParseException.class, () -> adapter.parse(source));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void error_status_in_body_fails_without_retry() {
        server.enqueue(new MockResponse().setBody("{\"status\":\"error\",\"errors\":[\"unexpected token\"]}"));

        UastParseException e = assertThrows(UastParseException.class, () -> adapter.parse(source));

        assertThat(e.getMessage(), containsString("unexpected token"));
        assertEquals(source, e.getSourceFile());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void missing_tree_fails() {
        server.enqueue(new MockResponse().setBody("{\"status\":\"ok\",\"errors\":[]}"));

        assertThrows(UastParseException.class, () -> adapter.parse(source));
    }
}
