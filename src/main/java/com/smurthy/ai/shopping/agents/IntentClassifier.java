package com.smurthy.ai.shopping.agents;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rule-based Intent Classifier
 *
 * Turns free text into a {@link TaskDescriptor} by walking an ordered rule table; the first
 * matching rule wins. Cart, checkout and shipping rules sit above product search so that
 * "add the sunglasses to my cart" is a cart operation and not a search.
 *
 * Classification never fails: text no rule matches becomes a low-confidence GENERAL task for
 * the general assistant.
 */
@Component
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    static final double FALLBACK_CONFIDENCE = 0.2;

    private static final String SEARCH_VERBS = "find|search|looking for|look for|recommend|browse";
    private static final String ECO_WORDS = "eco|green|sustainable|low[- ]carbon|environment(?:al(?:ly)?)? friendly";

    private static final List<IntentRule> RULES = List.of(
            IntentRule.of(Intent.PAYMENT,
                    // only an explicit instruction to pay; talk of checking out stays a checkout
                    "^(?!.*\\b(proceed to|check ?out|check-out)\\b).*"
                            + "\\b(pay( now| for (it|this|my order|the order))?|place (my |the |an )?order"
                            + "|confirm (my |the )?(order|purchase)|complete (my |the )?(order|purchase)|buy now)\\b",
                    WorkflowPattern.SEQUENTIAL, CheckoutAgent.NAME),
            IntentRule.of(Intent.CART_ADD,
                    "\\b(add|put|throw)\\b.*\\b(cart|basket|bag)\\b|^(please )?add\\b",
                    WorkflowPattern.HIERARCHICAL, CartManagementAgent.NAME, Co2CalculatorAgent.NAME),
            IntentRule.of(Intent.CART_REMOVE,
                    "\\b(remove|delete|take out|drop)\\b",
                    WorkflowPattern.HIERARCHICAL, CartManagementAgent.NAME, Co2CalculatorAgent.NAME),
            IntentRule.of(Intent.CART_CLEAR,
                    "\\b(clear|empty|reset)\\b.*\\b(cart|basket)\\b|\\bstart over\\b",
                    WorkflowPattern.HIERARCHICAL, CartManagementAgent.NAME),
            IntentRule.of(Intent.CART_VIEW,
                    "\\b(view|show|see|display|open)\\b.*\\b(cart|basket)\\b|what'?s in (my|the) (cart|basket)"
                            + "|^(my )?(cart|basket)\\??$",
                    WorkflowPattern.SEQUENTIAL, CartManagementAgent.NAME),
            IntentRule.of(Intent.SHIPPING_SELECT,
                    "\\b(eco|ground|express|standard|green|fast|faster|fastest|overnight)[- ]?(shipping|delivery)\\b"
                            + "|\\b(ship|shipping|delivery|deliver)\\b.*\\b(via|with|using|by)\\b"
                            + "|\\b(use|choose|select|pick|switch to)\\b.*\\b(shipping|delivery)\\b",
                    WorkflowPattern.SEQUENTIAL, CheckoutAgent.NAME),
            IntentRule.of(Intent.CHECKOUT,
                    "\\b(checkout|check out|check-out|proceed to (checkout|payment)|ready to (buy|order))\\b",
                    WorkflowPattern.SEQUENTIAL, CheckoutAgent.NAME),
            IntentRule.of(Intent.COMPARE,
                    "\\b(compare|comparison|versus|vs\\.?|which is (greener|better|more sustainable))\\b",
                    WorkflowPattern.SEQUENTIAL, ProductDiscoveryAgent.NAME, ComparisonAgent.NAME),
            IntentRule.of(Intent.FOOTPRINT,
                    "^(?!.*\\b(" + SEARCH_VERBS + ")\\b).*\\b(footprint|emissions?|co2|carbon|shipping options"
                            + "|environmental impact)\\b",
                    WorkflowPattern.SEQUENTIAL, Co2CalculatorAgent.NAME),
            IntentRule.of(Intent.PRODUCT_SEARCH,
                    "\\b(" + ECO_WORDS + ")\\b",
                    WorkflowPattern.PARALLEL, ProductDiscoveryAgent.NAME, Co2CalculatorAgent.NAME),
            IntentRule.of(Intent.PRODUCT_SEARCH,
                    "\\b(" + SEARCH_VERBS + "|show|need|want|buy|shop|get me|do you have|sell)\\b"
                            + "|\\b(sunglasses|watch|loafers|shoes|hairdryer|candle|mug|jar|shakers|tank top"
                            + "|clothing|clothes|accessories|footwear|kitchen|decor|home|beauty)\\b",
                    WorkflowPattern.SEQUENTIAL, ProductDiscoveryAgent.NAME),
            new IntentRule(Intent.GENERAL,
                    Pattern.compile("\\b(hi|hello|hey|help|thanks|thank you|what can you do)\\b"),
                    WorkflowPattern.SEQUENTIAL, GeneralAssistantAgent.NAME, List.of(), 0.8)
    );

    private static final Map<String, String> CATEGORIES = Map.ofEntries(
            Map.entry("accessories", "accessories"),
            Map.entry("accessory", "accessories"),
            Map.entry("clothing", "clothing"),
            Map.entry("clothes", "clothing"),
            Map.entry("tops", "tops"),
            Map.entry("footwear", "footwear"),
            Map.entry("shoes", "footwear"),
            Map.entry("hair", "hair"),
            Map.entry("beauty", "beauty"),
            Map.entry("decor", "decor"),
            Map.entry("home", "home"),
            Map.entry("kitchen", "kitchen")
    );

    private static final Map<String, Integer> NUMBER_WORDS = Map.of(
            "one", 1, "two", 2, "three", 3, "four", 4, "five", 5,
            "six", 6, "seven", 7, "eight", 8, "nine", 9, "ten", 10);

    private static final Pattern MAX_PRICE = Pattern.compile(
            "(?:under|below|less than|cheaper than|max(?:imum)?|up to)\\s*\\$?\\s*(\\d+(?:\\.\\d+)?)");
    private static final Pattern MIN_PRICE = Pattern.compile(
            "(?:over|above|more than|at least)\\s*\\$?\\s*(\\d+(?:\\.\\d+)?)");
    private static final Pattern DOLLAR_AMOUNT = Pattern.compile("\\$\\s*(\\d+(?:\\.\\d+)?)");
    private static final Pattern QUANTITY = Pattern.compile(
            "\\b(?:add|put|remove)\\s+(\\d{1,3}|one|two|three|four|five|six|seven|eight|nine|ten)\\b");
    private static final Pattern PRODUCT_ID = Pattern.compile("\\b(?=[A-Z0-9]*\\d)[A-Z0-9]{10}\\b");
    private static final Pattern PRICE_PHRASE = Pattern.compile(
            "(?:under|below|less than|cheaper than|max(?:imum)?|up to|over|above|more than|at least)?\\s*\\$?\\s*\\d+(?:\\.\\d+)?");

    private static final Set<String> STOP_WORDS = Set.of(
            "add", "put", "throw", "to", "my", "the", "a", "an", "cart", "basket", "bag", "please", "find", "search",
            "show", "me", "for", "some", "i", "want", "need", "looking", "look", "remove", "delete", "from", "take",
            "out", "drop", "of", "and", "or", "with", "can", "you", "get", "buy", "shop", "browse", "recommend",
            "compare", "comparison", "vs", "versus", "is", "which", "what", "are", "any", "eco", "friendly", "green",
            "sustainable", "low", "carbon", "products", "items", "item", "product", "footprint", "co2", "emissions",
            "emission", "in", "on", "do", "have", "that", "this", "it", "dollars", "usd", "greener", "better", "more",
            "one", "two", "three", "four", "five", "six", "seven", "eight", "nine", "ten", "calculate", "how", "much",
            "environmentally", "environmental", "impact", "sell", "something", "s", "co", "kg");

    /**
     * Classifies {@code text} for the given session. Never throws.
     */
    public TaskDescriptor classify(String text, String sessionId) {
        String normalized = normalize(text);
        Map<String, Object> parameters = extractParameters(text == null ? "" : text, normalized);

        if (!normalized.isEmpty()) {
            for (IntentRule rule : RULES) {
                if (rule.matches(normalized)) {
                    TaskDescriptor descriptor = new TaskDescriptor(TaskDescriptor.newId(), text, sessionId,
                            rule.intent(), parameters, rule.workflow(), rule.primaryHandler(),
                            rule.secondaryHandlers(), rule.confidence(), 0);
                    log.info("Classified '{}' as {} ({}) -> {}", text, rule.intent(), rule.workflow(),
                            descriptor.handlers());
                    return descriptor;
                }
            }
        }

        log.info("No rule matched '{}'; routing to {} with low confidence", text, GeneralAssistantAgent.NAME);
        return new TaskDescriptor(TaskDescriptor.newId(), text, sessionId, Intent.GENERAL, parameters,
                WorkflowPattern.SEQUENTIAL, GeneralAssistantAgent.NAME, List.of(), FALLBACK_CONFIDENCE, 0);
    }

    /**
     * Builds a single-handler descriptor for {@code handlerName} without choosing the handler by
     * classification. The intent is the highest-precedence rule the handler can serve, falling back
     * to the first intent among its capabilities.
     */
    public TaskDescriptor describeFor(String handlerName, Set<String> capabilities, String text, String sessionId) {
        String normalized = normalize(text);
        Map<String, Object> parameters = extractParameters(text == null ? "" : text, normalized);

        Intent intent = RULES.stream()
                .filter(r -> capabilities.contains(r.intent().capability()))
                .filter(r -> r.matches(normalized))
                .map(IntentRule::intent)
                .findFirst()
                .orElseGet(() -> Arrays.stream(Intent.values())
                        .filter(i -> capabilities.contains(i.capability()))
                        .findFirst()
                        .orElse(Intent.GENERAL));

        return new TaskDescriptor(TaskDescriptor.newId(), text, sessionId, intent, parameters,
                WorkflowPattern.SEQUENTIAL, handlerName, List.of(), 1.0, 0);
    }

    List<IntentRule> rules() {
        return RULES;
    }

    Map<String, Object> extractParameters(String original, String normalized) {
        Map<String, Object> params = new LinkedHashMap<>();

        Matcher max = MAX_PRICE.matcher(normalized);
        if (max.find()) {
            params.put("max_price", Double.parseDouble(max.group(1)));
        } else {
            Matcher dollars = DOLLAR_AMOUNT.matcher(normalized);
            if (dollars.find()) {
                params.put("max_price", Double.parseDouble(dollars.group(1)));
            }
        }
        Matcher min = MIN_PRICE.matcher(normalized);
        if (min.find()) {
            params.put("min_price", Double.parseDouble(min.group(1)));
        }

        for (String token : normalized.split("[^a-z]+")) {
            if (CATEGORIES.containsKey(token)) {
                params.put("category", CATEGORIES.get(token));
                break;
            }
        }

        Matcher quantity = QUANTITY.matcher(normalized);
        if (quantity.find()) {
            String value = quantity.group(1);
            params.put("quantity", NUMBER_WORDS.containsKey(value) ? NUMBER_WORDS.get(value) : Integer.parseInt(value));
        }

        String method = shippingMethod(normalized);
        if (method != null) {
            params.put("shipping_method", method);
        }

        List<String> ids = new ArrayList<>();
        Matcher id = PRODUCT_ID.matcher(original);
        while (id.find()) {
            ids.add(id.group());
        }
        if (!ids.isEmpty()) {
            params.put("product_id", ids.get(0));
            params.put("product_ids", List.copyOf(ids));
        }

        String query = productQuery(original);
        if (!query.isEmpty()) {
            params.put("product_query", query);
        }
        return params;
    }

    private static String shippingMethod(String normalized) {
        if (normalized.matches(".*\\b(express|fast|faster|fastest|overnight|next[- ]day)\\b.*")) {
            return "express";
        }
        if (normalized.matches(".*\\b(eco|green|sustainable|slow)\\b.*(shipping|delivery).*")
                || normalized.matches(".*\\b(shipping|delivery)\\b.*\\b(eco|green|sustainable)\\b.*")) {
            return "eco";
        }
        if (normalized.matches(".*\\b(ground|standard|regular)\\b.*")) {
            return "ground";
        }
        return null;
    }

    private static String productQuery(String original) {
        String stripped = PRODUCT_ID.matcher(original).replaceAll(" ").toLowerCase(Locale.ROOT);
        stripped = PRICE_PHRASE.matcher(stripped).replaceAll(" ");
        Set<String> kept = new LinkedHashSet<>();
        for (String token : stripped.split("[^a-z&-]+")) {
            String t = token.replaceAll("^-+|-+$", "");
            if (!t.isEmpty() && !STOP_WORDS.contains(t) && !t.startsWith("eco-")) {
                kept.add(t);
            }
        }
        return kept.stream().collect(Collectors.joining(" "));
    }

    private static String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
