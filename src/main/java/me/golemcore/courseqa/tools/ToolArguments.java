package me.golemcore.courseqa.tools;

import java.util.Map;

/**
 * Lenient readers for model-supplied tool arguments. Models send numbers as
 * JSON numbers or as strings; both are accepted.
 */
final class ToolArguments {

    private ToolArguments() {
    }

    static String string(Map<String, Object> parameters, String key) {
        if (parameters == null) {
            return null;
        }
        Object value = parameters.get(key);
        return value != null ? value.toString() : null;
    }

    static Integer integer(Map<String, Object> parameters, String key) {
        if (parameters == null) {
            return null;
        }
        Object value = parameters.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
