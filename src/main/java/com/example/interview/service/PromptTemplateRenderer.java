package com.example.interview.service;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {identifier}} placeholders. JSON examples inside templates
 * ({@code {"a": 1}}) are left alone because they are not identifiers.
 */
public final class PromptTemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private PromptTemplateRenderer() {
    }

    /**
     * @throws MissingTemplateVariableException if a placeholder has no entry in {@code variables}
     */
    public static String render(String stageName, String template, Map<String, ?> variables) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder(template.length() + 256);
        while (m.find()) {
            String name = m.group(1);
            if (!variables.containsKey(name)) {
                throw new MissingTemplateVariableException(stageName, name);
            }
            Object value = variables.get(name);
            m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? String.valueOf(value) : ""));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
