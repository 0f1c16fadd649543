package com.lensql.core.meta;

/**
 * Identifier case conversions shared by the generator and the runtime.
 */
public interface Naming {

    /**
     * {@code AuthorId} becomes {@code author_id}; snake_case input is returned unchanged.
     */
    static String snakeCase(String value) {
        if (value == null || value.isEmpty()) return "";
        StringBuilder result = new StringBuilder();
        char[] chars = value.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];
            if (c == '-' || c == ' ') {
                result.append('_');
            } else if (Character.isUpperCase(c)) {
                boolean prevLowerOrDigit = i > 0 && (Character.isLowerCase(chars[i - 1]) || Character.isDigit(chars[i - 1]));
                boolean acronymEnd = i > 0 && Character.isUpperCase(chars[i - 1])
                        && i + 1 < chars.length && Character.isLowerCase(chars[i + 1]);
                if (prevLowerOrDigit || acronymEnd) {
                    result.append('_');
                }
                result.append(Character.toLowerCase(c));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    static String pascalCase(String value) {
        if (value == null || value.isEmpty()) return "";
        StringBuilder result = new StringBuilder();
        boolean capitalizeNext = true;
        for (char c : value.toCharArray()) {
            if (c == '_' || c == '-' || c == ' ') {
                capitalizeNext = true;
            } else if (capitalizeNext) {
                result.append(Character.toUpperCase(c));
                capitalizeNext = false;
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    static String camelCase(String value) {
        String pascal = pascalCase(value);
        if (pascal.isEmpty()) return pascal;
        return Character.toLowerCase(pascal.charAt(0)) + pascal.substring(1);
    }

    /**
     * Last segment of a {@code ::} or {@code .} separated path.
     */
    static String lastSegment(String path) {
        if (path == null) return "";
        String[] segments = path.split("::|\\.");
        return segments[segments.length - 1];
    }
}
