package com.smurthy.ai.shopping.orchestration;

import com.smurthy.ai.shopping.agents.AgentRequest;
import com.smurthy.ai.shopping.agents.AgentResult;
import com.smurthy.ai.shopping.agents.AggregatorAgent;
import com.smurthy.ai.shopping.agents.FollowUp;
import com.smurthy.ai.shopping.agents.Intent;
import com.smurthy.ai.shopping.agents.IntentClassifier;
import com.smurthy.ai.shopping.agents.ShoppingAgent;
import com.smurthy.ai.shopping.agents.TaskDescriptor;
import com.smurthy.ai.shopping.config.RouterProperties;
import com.smurthy.ai.shopping.errors.ErrorKind;
import com.smurthy.ai.shopping.registry.CapabilityCard;
import com.smurthy.ai.shopping.registry.CapabilityRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Message Router
 *
 * Classifies a request, resolves healthy handlers through the capability registry, runs the
 * task's workflow and aggregates the outcomes:
 * - SEQUENTIAL runs handlers in order on the calling thread, each seeing earlier results;
 *   the first failure aborts the rest of the chain.
 * - PARALLEL fans handlers out on the handler executor under one shared deadline; each
 *   outcome stands on its own and a late handler is reported as degraded.
 * - HIERARCHICAL runs the primary handler and then the follow-ups it asks for, recursively,
 *   up to {@code shopping.router.max-depth} levels.
 *
 * Nothing a handler does escapes {@link #dispatch}: failures, timeouts and the absence of a
 * capable handler are all reported in the {@link AggregatedResult}.
 */
@Service
public class MessageRouter {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final IntentClassifier classifier;
    private final CapabilityRegistry registry;
    private final Map<String, ShoppingAgent> agents;
    private final HandlerInvoker invoker;
    private final AggregatorAgent aggregator;
    private final ExecutorService handlerExecutor;
    private final RouterProperties properties;
    private final Clock clock;

    public MessageRouter(IntentClassifier classifier,
                         CapabilityRegistry registry,
                         List<ShoppingAgent> agents,
                         HandlerInvoker invoker,
                         AggregatorAgent aggregator,
                         ExecutorService handlerExecutor,
                         RouterProperties properties,
                         Clock clock) {
        this.classifier = classifier;
        this.registry = registry;
        this.agents = agents.stream().collect(Collectors.toUnmodifiableMap(ShoppingAgent::name, Function.identity()));
        this.invoker = invoker;
        this.aggregator = aggregator;
        this.handlerExecutor = handlerExecutor;
        this.properties = properties;
        this.clock = clock;
        log.info("MessageRouter initialized with {} handlers, max depth {}, {} retries",
                this.agents.size(), properties.maxDepth(), properties.maxRetries());
    }

    /**
     * Classifies {@code text} and dispatches it.
     */
    public AggregatedResult route(String text, String sessionId) {
        return dispatch(classifier.classify(text, sessionId));
    }

    /**
     * Dispatches {@code text} straight to {@code agentName}, bypassing handler selection.
     */
    public AggregatedResult send(String agentName, String text, String sessionId) {
        ShoppingAgent agent = agents.get(agentName);
        if (agent == null) {
            log.warn("Direct send to unknown handler {}", agentName);
            TaskDescriptor unknown = classifier.describeFor(agentName, Set.of(), text, sessionId);
            return noHandler(unknown, ErrorKind.HANDLER_UNAVAILABLE, "Handler " + agentName + " is not registered");
        }
        return dispatch(classifier.describeFor(agentName, agent.capabilities(), text, sessionId));
    }

    public AggregatedResult dispatch(TaskDescriptor task) {
        return dispatch(task, CancellationToken.create());
    }

    public AggregatedResult dispatch(TaskDescriptor task, CancellationToken token) {
        return dispatch(task, token, properties.defaultDeadline());
    }

    public AggregatedResult dispatch(TaskDescriptor task, CancellationToken token, Duration timeout) {
        CallContext context = new CallContext(Deadline.after(timeout, clock), token);
        List<String> warnings = new ArrayList<>();
        if (task.isAmbiguous()) {
            warnings.add(ErrorKind.CLASSIFICATION_AMBIGUOUS.name() + ": routed to " + task.primaryHandler());
        }

        Optional<ShoppingAgent> primary = resolve(task.primaryHandler(), task.intent());
        if (primary.isEmpty()) {
            log.warn("No healthy handler for {} (requested {})", task.intent(), task.primaryHandler());
            return noHandler(task, ErrorKind.NO_CAPABLE_HANDLER,
                    "No healthy handler can serve " + task.intent().capability());
        }
        if (!primary.get().name().equals(task.primaryHandler())) {
            log.info("{} unavailable; {} takes over {}", task.primaryHandler(), primary.get().name(), task.intent());
            warnings.add(task.primaryHandler() + " unavailable; used " + primary.get().name());
        }

        log.info("Dispatching {} {} as {} to {}", task.id(), task.intent(), task.workflow(), task.handlers());
        long start = System.currentTimeMillis();

        List<HandlerOutcome> outcomes = new ArrayList<>();
        ErrorKind error = switch (task.workflow()) {
            case SEQUENTIAL -> runSequential(task, primary.get(), context, outcomes);
            case PARALLEL -> runParallel(task, primary.get(), context, outcomes);
            case HIERARCHICAL -> runHierarchical(task, primary.get(), List.of(), context, outcomes, warnings);
        };

        AggregatedResult result = aggregate(task, outcomes, error, warnings);
        log.info("Task {} finished in {}ms: {} handler(s), partial={}, degraded={}, failed={}",
                task.id(), System.currentTimeMillis() - start, outcomes.size(), result.partial(),
                result.degradedHandlers(), result.failedHandlers());
        return result;
    }

    private ErrorKind runSequential(TaskDescriptor task, ShoppingAgent primary, CallContext context,
                                    List<HandlerOutcome> outcomes) {
        List<String> chain = new ArrayList<>(task.handlers());
        chain.set(0, primary.name());
        List<AgentResult> prior = new ArrayList<>();

        for (int i = 0; i < chain.size(); i++) {
            String name = chain.get(i);
            HandlerOutcome outcome = invokeByName(name, new AgentRequest(task, prior, context));
            outcomes.add(outcome);
            if (!outcome.isSuccess()) {
                for (String rest : chain.subList(i + 1, chain.size())) {
                    outcomes.add(HandlerOutcome.skipped(rest, "aborted after " + name + " " + outcome.status()));
                }
                if (i + 1 < chain.size()) {
                    log.warn("Sequential chain for {} aborted at {} ({})", task.id(), name, outcome.status());
                }
                return errorOf(outcome);
            }
            prior.add(outcome.result());
        }
        return null;
    }

    private ErrorKind runParallel(TaskDescriptor task, ShoppingAgent primary, CallContext context,
                                  List<HandlerOutcome> outcomes) {
        List<String> names = new ArrayList<>(task.handlers());
        names.set(0, primary.name());

        Map<String, Future<HandlerOutcome>> futures = new LinkedHashMap<>();
        Map<String, HandlerOutcome> unavailable = new LinkedHashMap<>();
        long started = System.currentTimeMillis();
        for (String name : names) {
            ShoppingAgent agent = healthyAgent(name);
            if (agent == null) {
                unavailable.put(name, HandlerOutcome.failed(name, ErrorKind.HANDLER_UNAVAILABLE,
                        name + " is not available", 0, 0));
                continue;
            }
            AgentRequest request = new AgentRequest(task, List.of(), context);
            futures.put(name, handlerExecutor.submit(() -> invoker.invoke(agent, request)));
        }
        context.cancellationToken().onCancel(() -> futures.values().forEach(f -> f.cancel(true)));

        boolean deadlineHit = false;
        for (String name : names) {
            if (unavailable.containsKey(name)) {
                outcomes.add(unavailable.get(name));
                continue;
            }
            Future<HandlerOutcome> future = futures.get(name);
            try {
                outcomes.add(future.get(context.deadline().remainingMillis(), TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                deadlineHit = true;
                log.warn("{} exceeded the deadline for {}; marked degraded", name, task.id());
                outcomes.add(HandlerOutcome.timedOut(name, 1, System.currentTimeMillis() - started));
            } catch (CancellationException e) {
                outcomes.add(HandlerOutcome.cancelled(name, reasonOf(context), 0, 0));
            } catch (ExecutionException e) {
                log.error("{} crashed outside the invoker", name, e.getCause());
                outcomes.add(HandlerOutcome.failed(name, ErrorKind.HANDLER_UNAVAILABLE,
                        String.valueOf(e.getCause().getMessage()), 1, 0));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.cancellationToken().cancel("router interrupted");
                outcomes.add(HandlerOutcome.cancelled(name, "router interrupted", 0, 0));
            }
        }
        if (deadlineHit) {
            // stops tool calls still in flight in the abandoned handlers
            context.cancellationToken().cancel("deadline expired");
        }

        boolean anySuccess = outcomes.stream().anyMatch(HandlerOutcome::isSuccess);
        return anySuccess ? null : outcomes.stream().map(this::errorOf).filter(Objects::nonNull).findFirst().orElse(null);
    }

    private ErrorKind runHierarchical(TaskDescriptor task, ShoppingAgent agent,
                                      List<AgentResult> prior,
                                      CallContext context, List<HandlerOutcome> outcomes, List<String> warnings) {
        HandlerOutcome outcome = invoker.invoke(agent, new AgentRequest(task, prior, context));
        outcomes.add(outcome);
        if (!outcome.isSuccess()) {
            return errorOf(outcome);
        }
        if (!outcome.result().needsFollowUp()) {
            return null;
        }

        for (FollowUp followUp : outcome.result().followUps()) {
            if (task.depth() + 1 >= properties.maxDepth()) {
                log.warn("Follow-up {} from {} dropped: depth limit {} reached", followUp.intent(), agent.name(),
                        properties.maxDepth());
                warnings.add("Follow-up " + followUp.intent() + " skipped: depth limit " + properties.maxDepth() + " reached");
                continue;
            }
            String requested = followUp.handlerName() != null ? followUp.handlerName() : firstOrNull(task.secondaryHandlers());
            Optional<ShoppingAgent> child = resolve(requested, followUp.intent());
            if (child.isEmpty()) {
                outcomes.add(HandlerOutcome.failed(requested != null ? requested : followUp.intent().capability(),
                        ErrorKind.NO_CAPABLE_HANDLER, "No healthy handler for follow-up " + followUp.intent(), 0, 0));
                continue;
            }
            log.debug("{} requested follow-up {} ({}) -> {}", agent.name(), followUp.intent(), followUp.reason(),
                    child.get().name());
            runHierarchical(task.child(followUp, child.get().name()), child.get(), List.of(outcome.result()),
                    context, outcomes, warnings);
        }
        return null;
    }

    private HandlerOutcome invokeByName(String name, AgentRequest request) {
        ShoppingAgent agent = healthyAgent(name);
        if (agent == null) {
            return HandlerOutcome.failed(name, ErrorKind.HANDLER_UNAVAILABLE, name + " is not available", 0, 0);
        }
        return invoker.invoke(agent, request);
    }

    /**
     * The named handler if it is healthy, otherwise the first healthy handler declaring the
     * intent's capability.
     */
    private Optional<ShoppingAgent> resolve(String name, Intent intent) {
        ShoppingAgent named = name == null ? null : healthyAgent(name);
        if (named != null) {
            return Optional.of(named);
        }
        return registry.findCapable(intent.capability()).stream()
                .map(CapabilityCard::name)
                .map(agents::get)
                .filter(Objects::nonNull)
                .findFirst();
    }

    private ShoppingAgent healthyAgent(String name) {
        ShoppingAgent agent = agents.get(name);
        if (agent == null) {
            return null;
        }
        boolean healthy = registry.get(name).map(CapabilityCard::isHealthy).orElse(false);
        return healthy ? agent : null;
    }

    private AggregatedResult aggregate(TaskDescriptor task, List<HandlerOutcome> outcomes, ErrorKind error,
                                       List<String> warnings) {
        List<String> degraded = outcomes.stream()
                .filter(o -> o.status() == OutcomeStatus.TIMED_OUT)
                .map(HandlerOutcome::handlerName)
                .toList();
        List<String> failed = outcomes.stream()
                .filter(o -> o.status() == OutcomeStatus.FAILED || o.status() == OutcomeStatus.CANCELLED
                        || o.status() == OutcomeStatus.SKIPPED)
                .map(HandlerOutcome::handlerName)
                .toList();
        boolean partial = !degraded.isEmpty() || !failed.isEmpty();
        return new AggregatedResult(task.id(), task.intent(), task.workflow(), aggregator.synthesize(task, outcomes),
                outcomes, partial, degraded, failed, error, warnings);
    }

    private AggregatedResult noHandler(TaskDescriptor task, ErrorKind kind, String message) {
        return new AggregatedResult(task.id(), task.intent(), task.workflow(), message, List.of(), false,
                List.of(), List.of(), kind, List.of());
    }

    private ErrorKind errorOf(HandlerOutcome outcome) {
        return switch (outcome.status()) {
            case SUCCEEDED, SKIPPED -> null;
            case TIMED_OUT -> ErrorKind.HANDLER_TIMEOUT;
            case CANCELLED -> ErrorKind.HANDLER_UNAVAILABLE;
            case FAILED -> outcome.errorKind();
        };
    }

    private static String reasonOf(CallContext context) {
        String reason = context.cancellationToken().reason();
        return reason != null ? reason : "cancelled";
    }

    private static String firstOrNull(List<String> names) {
        return names.isEmpty() ? null : names.get(0);
    }
}
