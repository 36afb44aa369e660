package com.libragraph.modelgate.core.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.modelgate.core.error.AuthException;
import com.libragraph.modelgate.core.permission.PermissionRequirement;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

class HttpAuthGatewayClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final PermissionRequirement CREATE = PermissionRequirement.of("task", "create");

    private MockWebServer server;
    private HttpAuthGatewayClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new HttpAuthGatewayClient(new OkHttpClient(), MAPPER, server.url("/").toString());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void sendsVerifyRequest() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"allowed\":true,\"principal\":\"svc\",\"scope\":\"system\"}"));

        AuthDecision decision = client.verify(new Credential(CredentialKind.API_KEY, "k-1"), "modelgate", CREATE);

        assertThat(decision).isEqualTo(new AuthDecision(true, "svc", CallerScope.SYSTEM));
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/v1/auth/verify");
        JsonNode body = MAPPER.readTree(request.getBody().readUtf8());
        assertThat(body.path("credential_type").asText()).isEqualTo("api_key");
        assertThat(body.path("credential").asText()).isEqualTo("k-1");
        assertThat(body.path("service_name").asText()).isEqualTo("modelgate");
        assertThat(body.path("resource").asText()).isEqualTo("task");
        assertThat(body.path("action").asText()).isEqualTo("create");
    }

    @Test
    void denialIsReturnedNotThrown() {
        server.enqueue(new MockResponse().setBody("{\"allowed\":false,\"extra\":1}"));

        AuthDecision decision = client.verify(new Credential(CredentialKind.BEARER, "t"), "modelgate", CREATE);

        assertThat(decision.allowed()).isFalse();
    }

    @Test
    void unknownScopeDegradesToUser() {
        server.enqueue(new MockResponse().setBody("{\"allowed\":true,\"principal\":\"u\",\"scope\":\"admin\"}"));

        assertThat(client.verify(new Credential(CredentialKind.BEARER, "t"), "modelgate", CREATE).scope())
                .isEqualTo(CallerScope.USER);
    }

    @Test
    void nonSuccessStatusIsAuthError() {
        server.enqueue(new MockResponse().setResponseCode(401));

        assertThatThrownBy(() -> client.verify(new Credential(CredentialKind.BEARER, "t"), "modelgate", CREATE))
                .isInstanceOf(AuthException.class)
                .hasMessageContaining("401");
    }

    @Test
    void unreadableBodyIsAuthError() {
        server.enqueue(new MockResponse().setBody("not json"));

        assertThatThrownBy(() -> client.verify(new Credential(CredentialKind.BEARER, "t"), "modelgate", CREATE))
                .isInstanceOf(AuthException.class)
                .hasMessageContaining("unreadable");
    }

    @Test
    void unreachableGatewayIsAuthError() {
        HttpAuthGatewayClient offline = new HttpAuthGatewayClient(new OkHttpClient(), MAPPER, "http://127.0.0.1:1");

        assertThatThrownBy(() -> offline.verify(new Credential(CredentialKind.BEARER, "t"), "modelgate", CREATE))
                .isInstanceOf(AuthException.class)
                .hasMessageContaining("unreachable");
    }
}
