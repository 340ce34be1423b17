package io.github.yok.blogvault.util;

import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts camelCase, kebab-case and spaced names into snake_case.
 *
 * <p>
 * Acronym runs are kept together: {@code s3Options} becomes {@code s3_options},
 * {@code APIToken} becomes {@code api_token}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class SnakeCaseUtil {

    @Generated
    private SnakeCaseUtil() {}

    /**
     * Converts a raw field or option name to snake_case.
     *
     * @param raw source name, may be {@code null}
     * @return lower snake_case name; empty string for blank input
     */
    public static String toSnakeCase(String raw) {
        String s = StringUtils.trimToEmpty(raw);
        if (s.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(s.length() + 4);
        boolean lastUnderscore = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '-' || c == ' ' || c == '_') {
                if (!lastUnderscore && out.length() > 0) {
                    out.append('_');
                    lastUnderscore = true;
                }
                continue;
            }
            if (Character.isUpperCase(c)) {
                if (i > 0 && !lastUnderscore) {
                    char prev = s.charAt(i - 1);
                    boolean nextLower =
                            i + 1 < s.length() && Character.isLowerCase(s.charAt(i + 1));
                    if (Character.isLowerCase(prev) || Character.isDigit(prev) || nextLower) {
                        out.append('_');
                    }
                }
            }
            out.append(Character.toLowerCase(c));
            lastUnderscore = false;
        }
        String result = StringUtils.strip(out.toString(), "_");
        while (result.contains("__")) {
            result = result.replace("__", "_");
        }
        return result;
    }

    /**
     * Removes separators and lower-cases a name, e.g. {@code Mail_Options} to {@code mailoptions}.
     *
     * @param raw source name
     * @return squashed lower-case name
     */
    public static String squash(String raw) {
        return StringUtils.remove(toSnakeCase(raw), '_');
    }
}
