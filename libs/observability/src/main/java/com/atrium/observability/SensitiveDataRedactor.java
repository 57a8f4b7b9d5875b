package com.atrium.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps credentials out of log output.
 * <p>
 * Field names matching password, token, secret, authorization, hash or credential
 * (case-insensitive) are replaced by {@value #REDACTED}. Free text such as exception messages
 * goes through {@link #scrub(String)}. Bearer tokens that must be referenced in a log line are
 * shortened with {@link #maskToken(String)}.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final int VISIBLE_TOKEN_CHARS = 6;

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "hash", "credential"
    );

    private static final Pattern BEARER = Pattern.compile("(?i)\\bbearer\\s+[A-Za-z0-9._~+/=-]+");
    private static final Pattern JWT = Pattern.compile("eyJ[\\w-]*\\.[\\w-]*\\.[\\w-]*");

    private final Pattern compiledPattern;
    private final Pattern keyValuePattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom sensitive field patterns (case-insensitive).
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        String regex = String.join("|", patterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        // key = value, key: value, "key": "value"
        this.keyValuePattern = Pattern.compile(
                "(\"?[\\w.-]*(?:" + regex + ")[\\w.-]*\"?\\s*[:=]\\s*)(\"[^\"]*\"|[^\\s,;&}]+)",
                Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a new map with sensitive values redacted. Null input returns an empty map.
     */
    public Map<String, Object> redact(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> result.put(key, isSensitive(key) ? REDACTED : value));
        return result;
    }

    /**
     * Masks credentials inside free text: values of sensitive keys, bearer tokens and anything
     * shaped like a JWT. Null stays null.
     */
    public String scrub(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = keyValuePattern.matcher(text)
                .replaceAll(m -> Matcher.quoteReplacement(m.group(1) + REDACTED));
        result = BEARER.matcher(result).replaceAll("Bearer " + Matcher.quoteReplacement(REDACTED));
        return JWT.matcher(result).replaceAll(Matcher.quoteReplacement(REDACTED));
    }

    /**
     * Checks whether a field name matches any sensitive pattern.
     */
    public boolean isSensitive(String fieldName) {
        return fieldName != null && compiledPattern.matcher(fieldName).find();
    }

    /**
     * Shortens a token to its first characters followed by an ellipsis, enough to tell two
     * tokens apart in a log without making either replayable.
     */
    public static String maskToken(String token) {
        if (token == null || token.isEmpty()) {
            return "<none>";
        }
        if (token.length() <= VISIBLE_TOKEN_CHARS * 2) {
            return REDACTED;
        }
        return token.substring(0, VISIBLE_TOKEN_CHARS) + "…";
    }
}
