package dev.nova.tools;

import java.util.Map;

/**
 * Typed access to step arguments. Violations surface as {@link IllegalArgumentException}.
 */
final class ToolArgs {

    private ToolArgs() {}

    static String requireString(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (!(value instanceof String s)) {
            throw new IllegalArgumentException(value == null
                ? "Missing required argument '%s'".formatted(name)
                : "Argument '%s' must be a string but was %s".formatted(name, value.getClass().getSimpleName()));
        }
        return s;
    }

    static Map<String, Object> requireMap(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing required argument '%s'".formatted(name));
        }
        return asMap(name, value);
    }

    static Map<String, Object> optionalMap(Map<String, Object> args, String name) {
        Object value = args.get(name);
        return value == null ? Map.of() : asMap(name, value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(String name, Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Argument '%s' must be an object but was %s"
                .formatted(name, value.getClass().getSimpleName()));
        }
        return (Map<String, Object>) map;
    }
}
