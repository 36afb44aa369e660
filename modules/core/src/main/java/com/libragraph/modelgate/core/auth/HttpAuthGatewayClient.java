package com.libragraph.modelgate.core.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.modelgate.core.error.AuthException;
import com.libragraph.modelgate.core.permission.PermissionRequirement;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link AuthGatewayClient} speaking JSON to {@code POST {url}/api/v1/auth/verify}.
 */
@ApplicationScoped
public class HttpAuthGatewayClient implements AuthGatewayClient {

    private static final Logger log = Logger.getLogger(HttpAuthGatewayClient.class);

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final String VERIFY_PATH = "/api/v1/auth/verify";

    @Inject
    OkHttpClient http;

    @Inject
    ObjectMapper objectMapper;

    @ConfigProperty(name = "modelgate.auth.url", defaultValue = "http://localhost:8081")
    String gatewayUrl;

    HttpAuthGatewayClient() {
    }

    HttpAuthGatewayClient(OkHttpClient http, ObjectMapper objectMapper, String gatewayUrl) {
        this.http = http;
        this.objectMapper = objectMapper;
        this.gatewayUrl = gatewayUrl;
    }

    @Override
    public AuthDecision verify(Credential credential, String serviceName, PermissionRequirement requirement) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("credential_type", credential.kind().wireName());
        body.put("credential", credential.value());
        body.put("service_name", serviceName);
        body.put("resource", requirement.resource());
        body.put("action", requirement.action());

        Request request;
        try {
            request = new Request.Builder()
                    .url(stripTrailingSlash(gatewayUrl) + VERIFY_PATH)
                    .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON))
                    .build();
        } catch (JsonProcessingException e) {
            throw new AuthException("Failed to encode verify request", e);
        }

        try (Response response = http.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful()) {
                log.warnf("Auth gateway rejected %s for %s: HTTP %d", credential, requirement, response.code());
                throw new AuthException("Auth gateway returned HTTP " + response.code());
            }
            if (responseBody == null) {
                throw new AuthException("Auth gateway returned an empty body");
            }
            AuthDecision decision = objectMapper.readValue(responseBody.string(), AuthDecision.class);
            log.debugf("Auth gateway: %s %s -> allowed=%s principal=%s",
                    credential, requirement, decision.allowed(), decision.principal());
            return decision;
        } catch (JsonProcessingException e) {
            throw new AuthException("Auth gateway returned an unreadable body", e);
        } catch (IOException e) {
            throw new AuthException("Auth gateway unreachable: " + e.getMessage(), e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
