package com.libragraph.modelgate.test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.quarkus.test.common.QuarkusTestResourceLifecycleManager;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * One MockWebServer standing in for DashScope, DeepSeek and the auth gateway.
 *
 * <p>Vendors echo the last message back. Markers inside the prompt steer the
 * reply: {@link #UNAUTHORIZED} answers 401, {@link #UNAVAILABLE} 503,
 * {@link #SLOW} delays the body past the invoke timeout and {@link #GARBAGE}
 * returns HTML.
 *
 * <p>The auth gateway knows a handful of fixed credentials, see {@link #authReply}.
 */
public class VendorStubResource implements QuarkusTestResourceLifecycleManager {

    public static final String UNAUTHORIZED = "[[unauthorized]]";
    public static final String UNAVAILABLE = "[[unavailable]]";
    public static final String SLOW = "[[slow]]";
    public static final String GARBAGE = "[[garbage]]";

    public static final String SYSTEM_TOKEN = "system-token";
    public static final String USER_A = "user-a";
    public static final String USER_B = "user-b";
    public static final String READ_ONLY = "read-only";
    public static final String DENIED = "denied";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final List<String> vendorBodies = new CopyOnWriteArrayList<>();

    private MockWebServer server;

    @Override
    public Map<String, String> start() {
        server = new MockWebServer();
        server.setDispatcher(new StubDispatcher());
        try {
            server.start();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return Map.of(
                "modelgate.providers.aliyun.base-url", server.url("/aliyun/generation").toString(),
                "modelgate.providers.deepseek.base-url", server.url("/deepseek").toString(),
                "modelgate.auth.url", server.url("/auth").toString());
    }

    @Override
    public void stop() {
        if (server != null) {
            try {
                server.shutdown();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    /** Number of vendor requests whose body contains {@code fragment}. */
    public static long vendorCallsContaining(String fragment) {
        return vendorBodies.stream().filter(body -> body.contains(fragment)).count();
    }

    private static final class StubDispatcher extends Dispatcher {

        @Override
        public MockResponse dispatch(RecordedRequest request) {
            String path = request.getPath() == null ? "" : request.getPath();
            String body = request.getBody().readUtf8();
            try {
                if (path.startsWith("/auth/api/v1/auth/verify")) {
                    return authReply(MAPPER.readTree(body));
                }
                if (path.startsWith("/aliyun/generation")) {
                    return vendorReply(body, () -> aliyunReply(MAPPER.readTree(body)));
                }
                if (path.startsWith("/deepseek/chat/completions")) {
                    return vendorReply(body, () -> deepseekReply(MAPPER.readTree(body)));
                }
            } catch (IOException e) {
                return new MockResponse().setResponseCode(400).setBody(e.getMessage());
            }
            return new MockResponse().setResponseCode(404);
        }
    }

    private interface ReplyBuilder {
        String build() throws IOException;
    }

    private static MockResponse vendorReply(String body, ReplyBuilder ok) throws IOException {
        vendorBodies.add(body);
        if (body.contains(UNAUTHORIZED)) {
            return new MockResponse().setResponseCode(401).setBody("{\"message\":\"Invalid API-key\"}");
        }
        if (body.contains(UNAVAILABLE)) {
            return new MockResponse().setResponseCode(503).setBody("{\"message\":\"overloaded\"}");
        }
        if (body.contains(GARBAGE)) {
            return json("<html>bad gateway</html>");
        }
        MockResponse response = json(ok.build());
        if (body.contains(SLOW)) {
            response.setBodyDelay(2, TimeUnit.SECONDS);
        }
        return response;
    }

    private static String aliyunReply(JsonNode request) throws IOException {
        ObjectNode reply = MAPPER.createObjectNode();
        reply.put("request_id", "dashscope-" + System.nanoTime());
        reply.putObject("output")
                .put("text", "echo: " + lastContent(request.path("input").path("messages")))
                .put("finish_reason", "stop");
        reply.putObject("usage")
                .put("input_tokens", 5)
                .put("output_tokens", 7)
                .put("total_tokens", 12);
        return MAPPER.writeValueAsString(reply);
    }

    private static String deepseekReply(JsonNode request) throws IOException {
        String model = request.path("model").asText();
        ObjectNode reply = MAPPER.createObjectNode();
        reply.put("id", "chatcmpl-" + System.nanoTime());
        reply.put("object", "chat.completion");
        reply.put("created", 1_700_000_000L);
        reply.put("model", model);
        ArrayNode choices = reply.putArray("choices");
        ObjectNode message = choices.addObject().put("index", 0).put("finish_reason", "stop").putObject("message");
        message.put("role", "assistant");
        message.put("content", "echo: " + lastContent(request.path("messages")));
        if (model.endsWith("reasoner")) {
            message.put("reasoning_content", "thinking it through");
        }
        reply.putObject("usage")
                .put("prompt_tokens", 3)
                .put("completion_tokens", 4);
        return MAPPER.writeValueAsString(reply);
    }

    /**
     * Fixed credentials: {@code system-token} (system scope), {@code user-a} and
     * {@code user-b} (user scope), {@code read-only} (read and list only) and
     * {@code denied}. Anything else is answered with 401.
     */
    private static MockResponse authReply(JsonNode request) throws IOException {
        String credential = request.path("credential").asText();
        String action = request.path("action").asText();
        ObjectNode reply = MAPPER.createObjectNode();
        switch (credential) {
            case SYSTEM_TOKEN -> reply.put("allowed", true).put("principal", "system").put("scope", "system");
            case USER_A, USER_B -> reply.put("allowed", true).put("principal", credential).put("scope", "user");
            case READ_ONLY -> reply.put("allowed", action.equals("read") || action.equals("list"))
                    .put("principal", "reader").put("scope", "user");
            case DENIED -> reply.put("allowed", false);
            default -> {
                return new MockResponse().setResponseCode(401).setBody("{\"message\":\"unknown credential\"}");
            }
        }
        return json(MAPPER.writeValueAsString(reply));
    }

    private static String lastContent(JsonNode messages) {
        return messages.isArray() && !messages.isEmpty()
                ? messages.get(messages.size() - 1).path("content").asText()
                : "";
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
