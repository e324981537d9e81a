package com.smurthy.ai.shopping.agents;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One row of the classifier's rule table: if {@code pattern} finds a match in the
 * lower-cased request, the request becomes {@code intent} run as {@code workflow}.
 */
public record IntentRule(
        Intent intent,
        Pattern pattern,
        WorkflowPattern workflow,
        String primaryHandler,
        List<String> secondaryHandlers,
        double confidence
) {
    public IntentRule {
        secondaryHandlers = secondaryHandlers == null ? List.of() : List.copyOf(secondaryHandlers);
    }

    public static IntentRule of(Intent intent, String regex, WorkflowPattern workflow,
                                String primaryHandler, String... secondaryHandlers) {
        return new IntentRule(intent, Pattern.compile(regex), workflow, primaryHandler,
                List.of(secondaryHandlers), 0.9);
    }

    public boolean matches(String normalizedText) {
        return pattern.matcher(normalizedText).find();
    }
}
