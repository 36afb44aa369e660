package com.libragraph.modelgate.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.modelgate.types.ChatCompletion;
import com.libragraph.modelgate.types.ChatMessage;
import com.libragraph.modelgate.types.Choice;
import com.libragraph.modelgate.types.Usage;
import okhttp3.OkHttpClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Alibaba Cloud DashScope text-generation API.
 * <p>
 * The request nests messages under {@code input} and every other knob under
 * {@code parameters}; the reply carries either {@code output.text} or
 * {@code output.choices}, with token counts named {@code input_tokens}/{@code output_tokens}.
 */
public class AliyunProvider extends AbstractHttpProvider {

    public static final String NAME = "aliyun";
    public static final String DEFAULT_URL =
            "https://dashscope.aliyuncs.com/api/v1/services/aigc/text-generation/generation";
    public static final String DEFAULT_MODELS =
            "qwen-turbo,qwen-plus,qwen-max,qwen3-235b-a22b,qwen3-30b-a3b,"
                    + "qwen-plus-latest,qwen-turbo-latest,qwen-vl-max,qwen-vl-plus";

    private static final Set<String> NOT_PARAMETERS = Set.of("model", "messages", "prompt");

    public AliyunProvider(ProviderSettings settings, OkHttpClient http, ObjectMapper mapper) {
        super(settings, http, mapper);
    }

    @Override
    protected void applyDefaults(String model, Map<String, Object> prepared) {
        ParameterRules.capInt(prepared, "max_tokens", 6000, 2048);
        ParameterRules.clampDouble(prepared, "temperature", 0.0, 1.0, 0.7);
        ParameterRules.clampDouble(prepared, "top_p", 0.0, 1.0, 0.9);
        ParameterRules.clampIntIfPresent(prepared, "top_k", 1, 100);
        ParameterRules.disableStreaming(prepared);
        if (prepared.get("seed") != null) {
            prepared.put("seed", ParameterRules.toInt("seed", prepared.get("seed")));
        }
        prepared.putIfAbsent("enable_thinking", false);
    }

    @Override
    public JsonNode invoke(String model, Map<String, Object> parameters) {
        Map<String, Object> prepared = prepare(model, parameters);
        String apiKey = requireApiKey();

        Map<String, Object> vendorParameters = new LinkedHashMap<>();
        prepared.forEach((key, value) -> {
            if (!NOT_PARAMETERS.contains(key)) {
                vendorParameters.put(key, value);
            }
        });
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("input", Map.of("messages", prepared.get(ParameterRules.MESSAGES)));
        body.put("parameters", vendorParameters);

        log.infof("Calling Aliyun model %s", model);
        return postJson(settings.baseUrl(), body, Map.of(
                "Authorization", "Bearer " + apiKey,
                "X-DashScope-SSE", "disable",
                "X-DashScope-DataInspection", "disable"));
    }

    @Override
    public ChatCompletion normalize(String model, JsonNode nativeResponse) {
        if (nativeResponse == null || !nativeResponse.isObject()) {
            throw new ProviderException(FailureCategory.MALFORMED_RESPONSE,
                    "Aliyun reply is not a JSON object");
        }
        JsonNode output = nativeResponse.path("output");
        List<Choice> choices = new ArrayList<>();
        if (output.hasNonNull("text")) {
            choices.add(new Choice(0, ChatMessage.assistant(output.get("text").asText()),
                    output.path("finish_reason").asText("stop")));
        } else if (output.path("choices").isArray()) {
            int index = 0;
            for (JsonNode choice : output.get("choices")) {
                JsonNode message = choice.path("message");
                JsonNode toolCalls = message.get("tool_calls");
                choices.add(new Choice(index++,
                        new ChatMessage(ChatMessage.ASSISTANT, message.path("content").asText(""),
                                textOrNull(message.get("reasoning_content")),
                                toolCalls != null && !toolCalls.isNull() ? toolCalls : null),
                        choice.path("finish_reason").asText("stop")));
            }
        } else {
            throw new ProviderException(FailureCategory.MALFORMED_RESPONSE,
                    "Aliyun reply carries neither output.text nor output.choices");
        }

        JsonNode usage = nativeResponse.path("usage");
        String id = textOrNull(nativeResponse.get("request_id"));
        return new ChatCompletion(
                id != null ? id : UUID.randomUUID().toString(),
                model,
                epochSecondsOr(null),
                choices,
                Usage.of(usage.path("input_tokens").asLong(0),
                        usage.path("output_tokens").asLong(0),
                        usage.path("total_tokens").asLong(0)));
    }
}
