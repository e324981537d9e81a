package com.smurthy.ai.shopping.mcp;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A renderable prompt published by a tool endpoint. Placeholders use {@code {{argument}}}.
 * The template body stays on the server; only name, description and arguments are published.
 */
public record PromptTemplate(
        String name,
        String description,
        List<Argument> arguments,
        @JsonIgnore String template
) {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([a-zA-Z0-9_]+)\\s*}}");

    public record Argument(String name, String description, boolean required) {}

    public PromptTemplate {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    /**
     * @throws IllegalArgumentException if a required argument is missing
     */
    public String render(Map<String, String> values) {
        for (Argument argument : arguments) {
            String value = values.get(argument.name());
            if (argument.required() && (value == null || value.isBlank())) {
                throw new IllegalArgumentException("Missing required prompt argument: " + argument.name());
            }
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = values.getOrDefault(matcher.group(1), "");
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
