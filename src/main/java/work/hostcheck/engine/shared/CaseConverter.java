package work.hostcheck.engine.shared;

import java.util.Locale;

/**
 * Derives the snake_case names resource types and members are exposed under.
 */
public final class CaseConverter {
    private CaseConverter() {}

    public static String camelToSnake(String camel) {
        if (camel == null || camel.isBlank()) {
            return "";
        }
        StringBuilder builder = new StringBuilder(camel.length() + 4);
        for (int i = 0; i < camel.length(); i++) {
            char ch = camel.charAt(i);
            if (Character.isUpperCase(ch)) {
                // "HTTPServer" -> "http_server": split only where a lower-case run begins or ends
                boolean prevLower = i > 0 && !Character.isUpperCase(camel.charAt(i - 1)) && camel.charAt(i - 1) != '_';
                boolean nextLower = i + 1 < camel.length() && Character.isLowerCase(camel.charAt(i + 1));
                boolean prevUpper = i > 0 && Character.isUpperCase(camel.charAt(i - 1));
                if (i > 0 && (prevLower || (prevUpper && nextLower))) {
                    builder.append('_');
                }
                builder.append(Character.toLowerCase(ch));
            } else {
                builder.append(ch);
            }
        }
        return builder.toString().toLowerCase(Locale.ROOT);
    }
}
