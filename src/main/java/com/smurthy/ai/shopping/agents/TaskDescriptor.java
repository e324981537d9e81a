package com.smurthy.ai.shopping.agents;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One classified request, ready for dispatch. Immutable once built.
 *
 * @param depth follow-up nesting level, 0 for a request that came from a caller
 */
public record TaskDescriptor(
        String id,
        String originText,
        String sessionId,
        Intent intent,
        Map<String, Object> parameters,
        WorkflowPattern workflow,
        String primaryHandler,
        List<String> secondaryHandlers,
        double confidence,
        int depth
) {
    public static final double AMBIGUOUS_CONFIDENCE = 0.5;

    public TaskDescriptor {
        // Map.copyOf rejects null values; parameters are filtered before they get here
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        secondaryHandlers = secondaryHandlers == null ? List.of() : List.copyOf(secondaryHandlers);
    }

    public static String newId() {
        return "task-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Primary handler followed by the secondaries, in dispatch order.
     */
    public List<String> handlers() {
        List<String> all = new ArrayList<>(secondaryHandlers.size() + 1);
        all.add(primaryHandler);
        all.addAll(secondaryHandlers);
        return List.copyOf(all);
    }

    public boolean isAmbiguous() {
        return intent == Intent.GENERAL && confidence < AMBIGUOUS_CONFIDENCE;
    }

    /**
     * Descriptor for a follow-up requested by a handler of this task.
     */
    public TaskDescriptor child(FollowUp followUp, String handlerName) {
        Map<String, Object> merged = new LinkedHashMap<>(parameters);
        merged.putAll(followUp.parameters());
        return new TaskDescriptor(id + "." + (depth + 1), originText, sessionId, followUp.intent(), merged,
                WorkflowPattern.HIERARCHICAL, handlerName, List.of(), confidence, depth + 1);
    }

    public String stringParam(String name) {
        Object value = parameters.get(name);
        return value == null ? null : value.toString();
    }

    public int intParam(String name, int defaultValue) {
        Object value = parameters.get(name);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public Double doubleParam(String name) {
        Object value = parameters.get(name);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
