package com.example.interview.service;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts and repairs a JSON object from noisy model output.
 * <p>
 * Repair order:
 * <ol>
 *   <li>direct parse</li>
 *   <li>contents of a fenced code block, if any, else the whole text</li>
 *   <li>largest {@code {...}} span</li>
 *   <li>normalization: typographic quotes used as delimiters, missing commas between
 *       fields, {@code True/False/None} literals</li>
 *   <li>parse with a lenient reader (trailing commas, comments, single quotes, unquoted names)</li>
 * </ol>
 * Already valid JSON is returned exactly as parsed. Only JSON objects are returned;
 * anything else yields {@code null} and the caller decides the fallback.
 */
public final class JsonRepair {

    private static final Logger log = LoggerFactory.getLogger(JsonRepair.class);

    private static final ObjectMapper STRICT_MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    /** Same tolerance as the structured-output reader used for agent responses. */
    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
            .build();

    private static final Pattern FENCE = Pattern.compile("```(?:json|JSON)?\\s*(.*?)```", Pattern.DOTALL);

    /** Closing brace/bracket, string or literal, then a key on the next line. */
    private static final Pattern MISSING_COMMA_NEWLINE =
            Pattern.compile("([}\\]\"]|\\d|true|false|null)([ \\t]*\\r?\\n\\s*)(\"[^\"\\n]*\"\\s*:)");

    /** Closing brace/bracket followed by a key on the same line. */
    private static final Pattern MISSING_COMMA_INLINE =
            Pattern.compile("([}\\]])([ \\t]+)(\"[^\"\\n]*\"\\s*:)");

    private JsonRepair() {
        // utility class
    }

    /**
     * Repairs model output into a JSON object.
     *
     * @param text raw model output
     * @return the parsed object, or {@code null} when no object could be recovered
     */
    public static ObjectNode repair(String text) {
        if (text == null || text.isBlank()) return null;

        // ── Step 1: direct parse ─────────────────────────────────────────────
        ObjectNode direct = parseObject(STRICT_MAPPER, text.trim());
        if (direct != null) return direct;

        // ── Step 2/3: fenced block, then the whole text ──────────────────────
        Matcher fence = FENCE.matcher(text);
        if (fence.find()) {
            ObjectNode fenced = repairCandidate(fence.group(1));
            if (fenced != null) return fenced;
            log.debug("JsonRepair: fenced block holds no object, searching the full text");
        }
        ObjectNode repaired = repairCandidate(text);
        if (repaired == null) {
            log.debug("JsonRepair: unrecoverable output ({} chars)", text.length());
        }
        return repaired;
    }

    /** Steps 3 to 5 on one candidate text: largest brace span, strict, then normalized and lenient. */
    private static ObjectNode repairCandidate(String candidate) {
        ObjectNode direct = parseObject(STRICT_MAPPER, candidate.trim());
        if (direct != null) return direct;
        String span = largestObjectSpan(candidate);
        if (span == null) return null;
        ObjectNode spanned = parseObject(STRICT_MAPPER, span);
        if (spanned != null) return spanned;

        // ── Step 4/5: normalize and parse leniently ──────────────────────────
        return parseObject(LENIENT_MAPPER, normalize(span));
    }

    /**
     * Applies the textual fixes of step 4. Trailing commas are left to the lenient reader.
     * Exposed for diagnostics.
     */
    static String normalize(String json) {
        String s = normalizeQuotes(json);
        s = replacePythonLiterals(s);
        s = MISSING_COMMA_NEWLINE.matcher(s).replaceAll("$1,$2$3");
        s = MISSING_COMMA_INLINE.matcher(s).replaceAll("$1,$2$3");
        return s;
    }

    /**
     * Turns typographic quotes into ASCII where they delimit a string. Inside a string they
     * are content and stay as they are. A typographic quote closes a string it opened only
     * when it is followed by a colon, a comma, a closing brace or bracket, or the end.
     */
    static String normalizeQuotes(String s) {
        StringBuilder out = new StringBuilder(s.length());
        char open = 0;
        boolean typographicOpen = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (open == 0) {
                if (isTypographicDouble(c) || isTypographicSingle(c)) {
                    open = isTypographicDouble(c) ? '"' : '\'';
                    typographicOpen = true;
                    out.append(open);
                } else {
                    if (c == '"' || c == '\'') {
                        open = c;
                        typographicOpen = false;
                    }
                    out.append(c);
                }
                continue;
            }
            if (c == '\\' && i + 1 < s.length()) {
                out.append(c).append(s.charAt(++i));
                continue;
            }
            if (c == open) {
                open = 0;
                out.append(c);
                continue;
            }
            boolean sameKind = open == '"' ? isTypographicDouble(c) : isTypographicSingle(c);
            if (typographicOpen && sameKind && closesString(s, i + 1)) {
                out.append(open);
                open = 0;
                continue;
            }
            out.append(c);
        }
        return out.toString();
    }

    private static boolean isTypographicDouble(char c) {
        return c == '\u201C' || c == '\u201D' || c == '\u201E' || c == '\u201F';
    }

    private static boolean isTypographicSingle(char c) {
        return c == '\u2018' || c == '\u2019' || c == '\u201A' || c == '\u201B';
    }

    private static boolean closesString(String s, int from) {
        int j = from;
        while (j < s.length() && Character.isWhitespace(s.charAt(j))) j++;
        return j == s.length() || ":,}]".indexOf(s.charAt(j)) >= 0;
    }

    private static String largestObjectSpan(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        return start >= 0 && end > start ? text.substring(start, end + 1) : null;
    }

    /** Maps True/False/None to JSON literals, leaving string contents untouched. */
    private static String replacePythonLiterals(String s) {
        StringBuilder out = new StringBuilder(s.length());
        char quote = 0;
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (quote != 0) {
                out.append(c);
                if (c == '\\' && i + 1 < s.length()) {
                    out.append(s.charAt(i + 1));
                    i += 2;
                    continue;
                }
                if (c == quote) quote = 0;
                i++;
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
                out.append(c);
                i++;
                continue;
            }
            if (Character.isLetter(c) && (i == 0 || !Character.isLetterOrDigit(s.charAt(i - 1)))) {
                int j = i;
                while (j < s.length() && Character.isLetterOrDigit(s.charAt(j))) j++;
                String word = s.substring(i, j);
                switch (word) {
                    case "True" -> out.append("true");
                    case "False" -> out.append("false");
                    case "None" -> out.append("null");
                    default -> out.append(word);
                }
                i = j;
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static ObjectNode parseObject(ObjectMapper mapper, String text) {
        try {
            JsonNode node = mapper.readTree(text);
            return node instanceof ObjectNode obj ? obj : null;
        } catch (Exception e) {
            log.trace("JsonRepair: parse attempt failed ({})", e.getMessage());
            return null;
        }
    }
}
