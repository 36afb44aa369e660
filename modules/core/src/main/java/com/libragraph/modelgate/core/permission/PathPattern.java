package com.libragraph.modelgate.core.permission;

import java.util.ArrayList;
import java.util.List;

/**
 * Route template such as {@code /tasks/{id}/status}. A {@code {name}} segment
 * matches exactly one non-empty path segment; a trailing slash is ignored on
 * both sides.
 */
public final class PathPattern {

    private final String template;
    private final List<String> segments;
    private final int variables;

    private PathPattern(String template, List<String> segments) {
        this.template = template;
        this.segments = segments;
        this.variables = (int) segments.stream().filter(PathPattern::isVariable).count();
    }

    public static PathPattern parse(String template) {
        if (template == null || !template.startsWith("/")) {
            throw new IllegalArgumentException("Route pattern must start with '/': " + template);
        }
        List<String> segments = split(template);
        for (String segment : segments) {
            if (segment.contains("{") && !isVariable(segment)) {
                throw new IllegalArgumentException("Malformed path variable in pattern: " + template);
            }
        }
        return new PathPattern(normalize(template), List.copyOf(segments));
    }

    public boolean matches(String path) {
        if (path == null) {
            return false;
        }
        List<String> actual = split(path.startsWith("/") ? path : "/" + path);
        if (actual.size() != segments.size()) {
            return false;
        }
        for (int i = 0; i < segments.size(); i++) {
            String expected = segments.get(i);
            String segment = actual.get(i);
            if (isVariable(expected) ? segment.isEmpty() : !expected.equals(segment)) {
                return false;
            }
        }
        return true;
    }

    /** Number of {@code {name}} segments; literal routes have none. */
    public int variableCount() {
        return variables;
    }

    public String template() {
        return template;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PathPattern other && template.equals(other.template);
    }

    @Override
    public int hashCode() {
        return template.hashCode();
    }

    @Override
    public String toString() {
        return template;
    }

    private static boolean isVariable(String segment) {
        return segment.length() > 2 && segment.startsWith("{") && segment.endsWith("}");
    }

    private static String normalize(String path) {
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    private static List<String> split(String path) {
        String normalized = normalize(path);
        List<String> out = new ArrayList<>();
        if (normalized.equals("/")) {
            return out;
        }
        for (String segment : normalized.substring(1).split("/", -1)) {
            out.add(segment);
        }
        return out;
    }
}
