package com.libragraph.modelgate.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.modelgate.types.ChatCompletion;
import com.libragraph.modelgate.types.ChatMessage;
import com.libragraph.modelgate.types.Choice;
import com.libragraph.modelgate.types.Usage;
import okhttp3.OkHttpClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * DeepSeek's OpenAI-compatible chat completions API.
 * <p>
 * {@code deepseek-reasoner} ignores sampling knobs, so temperature and top_p are
 * dropped for it; its {@code reasoning_content} is carried into the normalized message.
 */
public class DeepSeekProvider extends AbstractHttpProvider {

    public static final String NAME = "deepseek";
    public static final String DEFAULT_URL = "https://api.deepseek.com";
    public static final String DEFAULT_MODELS = "deepseek-chat,deepseek-reasoner";
    public static final String REASONER = "deepseek-reasoner";

    public DeepSeekProvider(ProviderSettings settings, OkHttpClient http, ObjectMapper mapper) {
        super(settings, http, mapper);
    }

    @Override
    protected void applyDefaults(String model, Map<String, Object> prepared) {
        prepared.remove(ParameterRules.PROMPT);
        ParameterRules.capInt(prepared, "max_tokens", 32768, 4096);
        if (REASONER.equals(model)) {
            prepared.remove("temperature");
            prepared.remove("top_p");
        } else {
            ParameterRules.clampDouble(prepared, "temperature", 0.0, 2.0, 0.7);
            ParameterRules.clampDouble(prepared, "top_p", 0.0, 1.0, 0.9);
        }
        ParameterRules.disableStreaming(prepared);
    }

    @Override
    public JsonNode invoke(String model, Map<String, Object> parameters) {
        Map<String, Object> prepared = prepare(model, parameters);
        String apiKey = requireApiKey();

        log.infof("Calling DeepSeek model %s", model);
        return postJson(chatCompletionsUrl(), prepared, Map.of("Authorization", "Bearer " + apiKey));
    }

    @Override
    public ChatCompletion normalize(String model, JsonNode nativeResponse) {
        if (nativeResponse == null || !nativeResponse.path("choices").isArray()) {
            throw new ProviderException(FailureCategory.MALFORMED_RESPONSE,
                    "DeepSeek reply carries no choices");
        }
        List<Choice> choices = new ArrayList<>();
        int position = 0;
        for (JsonNode choice : nativeResponse.get("choices")) {
            JsonNode message = choice.path("message");
            choices.add(new Choice(
                    choice.path("index").asInt(position),
                    new ChatMessage(
                            message.path("role").asText(ChatMessage.ASSISTANT),
                            message.path("content").asText(""),
                            textOrNull(message.get("reasoning_content")),
                            toolCallsOf(message)),
                    textOrNull(choice.get("finish_reason"))));
            position++;
        }

        JsonNode usage = nativeResponse.path("usage");
        String id = textOrNull(nativeResponse.get("id"));
        String reportedModel = textOrNull(nativeResponse.get("model"));
        return new ChatCompletion(
                id != null ? id : UUID.randomUUID().toString(),
                reportedModel != null ? reportedModel : model,
                epochSecondsOr(nativeResponse.get("created")),
                choices,
                Usage.of(usage.path("prompt_tokens").asLong(0),
                        usage.path("completion_tokens").asLong(0),
                        usage.path("total_tokens").asLong(0)));
    }

    private String chatCompletionsUrl() {
        String base = settings.baseUrl();
        return (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + "/chat/completions";
    }

    /** Tool calls as returned, or a legacy {@code function_call} wrapped as a single tool call. */
    private JsonNode toolCallsOf(JsonNode message) {
        JsonNode toolCalls = message.get("tool_calls");
        if (toolCalls != null && toolCalls.isArray() && !toolCalls.isEmpty()) {
            return toolCalls;
        }
        JsonNode functionCall = message.get("function_call");
        if (functionCall == null || functionCall.isNull()) {
            return null;
        }
        ArrayNode wrapped = mapper.createArrayNode();
        ObjectNode call = wrapped.addObject();
        call.put("type", "function");
        call.set("function", functionCall);
        return wrapped;
    }
}
