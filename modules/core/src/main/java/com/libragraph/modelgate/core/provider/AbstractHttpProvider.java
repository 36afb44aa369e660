package com.libragraph.modelgate.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.modelgate.core.error.ValidationException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Base for providers that speak JSON over HTTPS. Owns model checks, the POST
 * round trip and the mapping of HTTP and I/O failures onto {@link FailureCategory}.
 */
public abstract class AbstractHttpProvider implements ModelProvider {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int ERROR_BODY_LIMIT = 512;

    protected final Logger log = Logger.getLogger(getClass());

    protected final ProviderSettings settings;
    protected final OkHttpClient http;
    protected final ObjectMapper mapper;
    private final Set<String> supportedModels;

    protected AbstractHttpProvider(ProviderSettings settings, OkHttpClient http, ObjectMapper mapper) {
        this.settings = settings;
        this.http = http;
        this.mapper = mapper;
        this.supportedModels = Set.copyOf(new LinkedHashSet<>(settings.supportedModels()));
    }

    @Override
    public String name() {
        return settings.name();
    }

    @Override
    public Set<String> supportedModels() {
        return supportedModels;
    }

    @Override
    public final Map<String, Object> prepare(String model, Map<String, Object> parameters) {
        if (!supports(model)) {
            throw new ValidationException("Model '" + model + "' not supported by provider '"
                    + name() + "'. Supported models: " + String.join(", ", settings.supportedModels()));
        }
        ParameterRules.requirePromptOrMessages(parameters);
        Map<String, Object> prepared = new LinkedHashMap<>(parameters);
        prepared.put("model", model);
        prepared.put(ParameterRules.MESSAGES, ParameterRules.messagesOf(parameters));
        applyDefaults(model, prepared);
        return prepared;
    }

    /** Vendor-specific clamps and defaults applied on top of the common preparation. */
    protected abstract void applyDefaults(String model, Map<String, Object> prepared);

    protected String requireApiKey() {
        if (!settings.hasApiKey()) {
            throw new ProviderException(FailureCategory.CONFIGURATION,
                    name() + " API key not configured");
        }
        return settings.apiKey();
    }

    /**
     * POSTs {@code body} as JSON and returns the parsed reply.
     *
     * @throws ProviderException for non-2xx replies, I/O failures and unparseable bodies
     */
    protected JsonNode postJson(String url, Object body, Map<String, String> headers) {
        String payload;
        try {
            payload = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(FailureCategory.MALFORMED_REQUEST,
                    "Failed to serialize " + name() + " request", e);
        }

        Request.Builder request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(payload, JSON));
        headers.forEach(request::header);

        try (Response response = http.newCall(request.build()).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                log.warnf("%s returned HTTP %d", name(), response.code());
                throw ProviderException.forHttpStatus(name(), response.code(), truncate(text));
            }
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProviderException(FailureCategory.MALFORMED_RESPONSE,
                    name() + " returned a non-JSON body", e);
        } catch (IOException e) {
            throw ProviderException.classify(e);
        }
    }

    protected static long epochSecondsOr(JsonNode node) {
        return node != null && node.canConvertToLong() && node.asLong() > 0
                ? node.asLong()
                : Instant.now().getEpochSecond();
    }

    protected static String textOrNull(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : node.asText();
    }

    private static String truncate(String text) {
        return text.length() <= ERROR_BODY_LIMIT ? text : text.substring(0, ERROR_BODY_LIMIT) + "...";
    }
}
