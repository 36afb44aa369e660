package com.libragraph.modelgate.core.provider;

import com.libragraph.modelgate.core.error.ValidationException;

import java.util.List;
import java.util.Map;

/**
 * Shape checks and coercions shared by the provider implementations.
 */
public final class ParameterRules {

    public static final String PROMPT = "prompt";
    public static final String MESSAGES = "messages";

    private ParameterRules() {}

    /** Fails unless the parameters carry a usable {@code prompt} or {@code messages}. */
    public static void requirePromptOrMessages(Map<String, Object> parameters) {
        if (parameters == null) {
            throw new ValidationException("Parameter 'prompt' or 'messages' is required");
        }
        Object messages = parameters.get(MESSAGES);
        Object prompt = parameters.get(PROMPT);
        if (messages == null && prompt == null) {
            throw new ValidationException("Parameter 'prompt' or 'messages' is required");
        }
        if (messages != null) {
            if (!(messages instanceof List<?> list) || list.isEmpty()) {
                throw new ValidationException("Parameter 'messages' must be a non-empty list");
            }
            for (Object m : list) {
                if (!(m instanceof Map<?, ?> msg) || !(msg.get("role") instanceof String)
                        || !msg.containsKey("content")) {
                    throw new ValidationException(
                            "Each message must be an object with 'role' and 'content'");
                }
            }
        } else if (!(prompt instanceof String s) || s.isBlank()) {
            throw new ValidationException("Parameter 'prompt' must be a non-empty string");
        }
    }

    /** Caller messages, or a single user message wrapping the prompt. */
    public static Object messagesOf(Map<String, Object> parameters) {
        Object messages = parameters.get(MESSAGES);
        if (messages != null) {
            return messages;
        }
        return List.of(Map.of("role", "user", "content", parameters.get(PROMPT)));
    }

    public static int toInt(String name, Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        Double parsed = value instanceof String s ? parseNumber(s) : null;
        if (parsed != null) {
            return parsed.intValue();
        }
        throw new ValidationException("Parameter '" + name + "' must be an integer");
    }

    public static double toDouble(String name, Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        Double parsed = value instanceof String s ? parseNumber(s) : null;
        if (parsed != null) {
            return parsed;
        }
        throw new ValidationException("Parameter '" + name + "' must be a number");
    }

    public static boolean toBoolean(String name, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            if ("true".equalsIgnoreCase(s.trim())) return true;
            if ("false".equalsIgnoreCase(s.trim())) return false;
        }
        throw new ValidationException("Parameter '" + name + "' must be a boolean");
    }

    /** {@code value} capped at {@code max}, or {@code defaultValue} when absent. */
    public static void capInt(Map<String, Object> params, String name, int max, int defaultValue) {
        Object raw = params.get(name);
        params.put(name, raw == null ? defaultValue : Math.min(toInt(name, raw), max));
    }

    public static void clampDouble(Map<String, Object> params, String name,
                                   double min, double max, double defaultValue) {
        Object raw = params.get(name);
        params.put(name, raw == null ? defaultValue : Math.max(min, Math.min(toDouble(name, raw), max)));
    }

    /** Clamps {@code name} into [min, max] only when the caller supplied it. */
    public static void clampIntIfPresent(Map<String, Object> params, String name, int min, int max) {
        Object raw = params.get(name);
        if (raw != null) {
            params.put(name, Math.max(min, Math.min(toInt(name, raw), max)));
        }
    }

    /**
     * Normalizes {@code stream} to a boolean. Streamed responses are not
     * supported, so {@code true} is rejected.
     */
    public static void disableStreaming(Map<String, Object> params) {
        Object raw = params.get("stream");
        if (raw != null && toBoolean("stream", raw)) {
            throw new ValidationException("Streaming responses are not supported");
        }
        params.put("stream", false);
    }

    private static Double parseNumber(String s) {
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
