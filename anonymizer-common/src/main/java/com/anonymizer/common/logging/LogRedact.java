package com.anonymizer.common.logging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks personal data and secrets in text before it reaches a log line.
 * Worker diagnostics routinely echo fragments of the document being
 * analyzed, so anything copied from a worker stream goes through here.
 */
public final class LogRedact {

    private LogRedact() {
    }

    // -----------------------------------------------------------------------
    // Modes
    // -----------------------------------------------------------------------

    public enum RedactMode {
        OFF,
        ON;

        public static RedactMode of(boolean enabled) {
            return enabled ? ON : OFF;
        }
    }

    // -----------------------------------------------------------------------
    // Constants
    // -----------------------------------------------------------------------

    public static final int DEFAULT_MAX_LENGTH = 2_000;

    private static final int MIN_TOKEN_LENGTH = 18;
    private static final int KEEP_START = 4;
    private static final int KEEP_END = 2;

    private static final List<String> DEFAULT_PATTERN_SOURCES = List.of(
            // E-mail addresses
            "\\b([A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,})\\b",
            // IBAN-like account numbers
            "\\b([A-Z]{2}\\d{2}[A-Z0-9]{11,30})\\b",
            // International phone numbers
            "(\\+\\d{1,4}[\\s.-]?\\d{1,4}[\\s.-]?\\d{3,9})",
            // Card, national id and other long digit runs
            "\\b(\\d[\\d -]{7,}\\d)\\b",
            // ENV-style secrets
            "\\b[A-Z0-9_]*(?:KEY|TOKEN|SECRET|PASSWORD)\\b\\s*[=:]\\s*([\"']?)([^\\s\"'\\\\]+)\\1",
            // Bearer tokens
            "\\bBearer\\s+([A-Za-z0-9._\\-+=]{18,})\\b");

    private static final List<Pattern> DEFAULT_PATTERNS;
    static {
        List<Pattern> compiled = new ArrayList<>();
        for (String src : DEFAULT_PATTERN_SOURCES) {
            compiled.add(Pattern.compile(src));
        }
        DEFAULT_PATTERNS = Collections.unmodifiableList(compiled);
    }

    // -----------------------------------------------------------------------
    // Public API
    // -----------------------------------------------------------------------

    /**
     * Redact with default patterns and truncate to {@link #DEFAULT_MAX_LENGTH}.
     */
    public static String redactSensitiveText(String text) {
        return redactSensitiveText(text, RedactMode.ON, DEFAULT_MAX_LENGTH);
    }

    /**
     * Redact and truncate.
     *
     * @param text      the input text, may be null
     * @param mode      OFF only truncates
     * @param maxLength truncation limit, {@code <= 0} keeps the full text
     */
    public static String redactSensitiveText(String text, RedactMode mode, int maxLength) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = mode == RedactMode.OFF ? text : redactText(text, DEFAULT_PATTERNS);
        return truncate(result, maxLength);
    }

    /**
     * Mask a single token, preserving a few start/end characters of long ones.
     */
    public static String maskToken(String token) {
        if (token.length() < MIN_TOKEN_LENGTH) {
            return "***";
        }
        String start = token.substring(0, KEEP_START);
        String end = token.substring(token.length() - KEEP_END);
        return start + "…" + end;
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "… (" + (text.length() - maxLength) + " more chars)";
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private static String redactText(String text, List<Pattern> patterns) {
        String result = text;
        for (Pattern pattern : patterns) {
            result = redactWithPattern(result, pattern);
        }
        return result;
    }

    private static String redactWithPattern(String text, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String replacement = redactMatch(matcher.group(0), matcher);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String redactMatch(String fullMatch, Matcher matcher) {
        // Last non-empty capture group is the sensitive part
        String token = fullMatch;
        for (int i = matcher.groupCount(); i >= 1; i--) {
            String group = matcher.group(i);
            if (group != null && !group.isEmpty()) {
                token = group;
                break;
            }
        }
        String masked = maskToken(token);
        if (token.equals(fullMatch)) {
            return masked;
        }
        return fullMatch.replace(token, masked);
    }
}
