package com.smurthy.ai.shopping.orchestration;

import com.smurthy.ai.shopping.agents.AgentResult;
import com.smurthy.ai.shopping.agents.AggregatorAgent;
import com.smurthy.ai.shopping.agents.FollowUp;
import com.smurthy.ai.shopping.agents.GeneralAssistantAgent;
import com.smurthy.ai.shopping.agents.Intent;
import com.smurthy.ai.shopping.agents.IntentClassifier;
import com.smurthy.ai.shopping.agents.ShoppingAgent;
import com.smurthy.ai.shopping.agents.TaskDescriptor;
import com.smurthy.ai.shopping.agents.WorkflowPattern;
import com.smurthy.ai.shopping.config.RegistryProperties;
import com.smurthy.ai.shopping.config.RetryConfig;
import com.smurthy.ai.shopping.config.RouterProperties;
import com.smurthy.ai.shopping.errors.ErrorKind;
import com.smurthy.ai.shopping.errors.TransientHandlerException;
import com.smurthy.ai.shopping.observability.AssistantMetrics;
import com.smurthy.ai.shopping.registry.CapabilityCard;
import com.smurthy.ai.shopping.registry.CapabilityRegistry;
import com.smurthy.ai.shopping.registry.HealthStatus;
import com.smurthy.ai.shopping.support.StubAgent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.equalTo;

class MessageRouterTest {

    private static final RouterProperties PROPERTIES = new RouterProperties(2, Duration.ofMillis(5), 2.0,
            Duration.ofMillis(20), Duration.ofSeconds(2), 3, 4);

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private CapabilityRegistry registry;

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private MessageRouter routerWith(ShoppingAgent... agents) {
        registry = new CapabilityRegistry(RegistryProperties.defaults(), (name, message) -> "ok", Clock.systemUTC());
        for (ShoppingAgent agent : agents) {
            registry.register(CapabilityCard.of(agent.name(), agent.description(), agent.capabilities()));
            registry.heartbeat(agent.name());
        }
        return new MessageRouter(new IntentClassifier(), registry, Arrays.asList(agents),
                new HandlerInvoker(RetryConfig.buildRetryTemplate(PROPERTIES), new AssistantMetrics(Clock.systemUTC())),
                new AggregatorAgent(),
                executor, PROPERTIES, Clock.systemUTC());
    }

    private static TaskDescriptor task(Intent intent, WorkflowPattern workflow, String primary, String... secondaries) {
        return new TaskDescriptor("task-test", "test request", "s1", intent, Map.of(), workflow, primary,
                List.of(secondaries), 0.9, 0);
    }

    private static StubAgent sleeping(String name, String capability, long millis) {
        return sleeping(name, capability, millis, new AtomicInteger());
    }

    private static StubAgent sleeping(String name, String capability, long millis, AtomicInteger interrupted) {
        return new StubAgent(name, Set.of(capability), r -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                interrupted.incrementAndGet();
                Thread.currentThread().interrupt();
                throw new CancellationException(name + " interrupted");
            }
            return AgentResult.success(name, name + " woke up", millis);
        });
    }

    @Nested
    @DisplayName("Sequential workflow")
    class Sequential {

        @Test
        @DisplayName("A failing first handler aborts the chain before the second runs")
        void shortCircuitsOnFailure() {
            StubAgent first = new StubAgent("Alpha", Set.of("product_search"),
                    r -> AgentResult.failure("Alpha", "nothing matched", 1, ErrorKind.INVALID_REQUEST));
            StubAgent second = StubAgent.answering("Beta", "compare", "compared");
            MessageRouter router = routerWith(first, second);

            AggregatedResult result = router.dispatch(task(Intent.COMPARE, WorkflowPattern.SEQUENTIAL, "Alpha", "Beta"));

            assertThat(second.calls()).isZero();
            assertThat(result.partial()).isTrue();
            assertThat(result.error()).isEqualTo(ErrorKind.INVALID_REQUEST);
            assertThat(result.failedHandlers()).containsExactly("Alpha", "Beta");
            assertThat(result.outcomes()).extracting(HandlerOutcome::status)
                    .containsExactly(OutcomeStatus.FAILED, OutcomeStatus.SKIPPED);
            assertThat(result.response()).contains("nothing matched");
        }

        @Test
        @DisplayName("Later handlers see the results of earlier ones")
        void passesPriorResults() {
            StubAgent first = new StubAgent("Alpha", Set.of("product_search"),
                    r -> AgentResult.success("Alpha", "found two", 1, Map.of("product_ids", List.of("A", "B"))));
            AtomicReference<Object> seen = new AtomicReference<>();
            StubAgent second = new StubAgent("Beta", Set.of("compare"), r -> {
                seen.set(r.priorData("product_ids").orElse(null));
                return AgentResult.success("Beta", "A is greener", 1);
            });
            MessageRouter router = routerWith(first, second);

            AggregatedResult result = router.dispatch(task(Intent.COMPARE, WorkflowPattern.SEQUENTIAL, "Alpha", "Beta"));

            assertThat(seen.get()).isEqualTo(List.of("A", "B"));
            assertThat(result.partial()).isFalse();
            assertThat(result.error()).isNull();
            assertThat(result.response()).isEqualTo("found two\n\nA is greener");
        }

        @Test
        @DisplayName("Transient handler failures are retried by the router")
        void retriesTransientFailures() {
            AtomicInteger attempts = new AtomicInteger();
            StubAgent flaky = new StubAgent("Alpha", Set.of("footprint"), r -> {
                if (attempts.incrementAndGet() == 1) {
                    throw new TransientHandlerException("emissions service warming up");
                }
                return AgentResult.success("Alpha", "49.00 kg", 1);
            });
            MessageRouter router = routerWith(flaky);

            AggregatedResult result = router.dispatch(task(Intent.FOOTPRINT, WorkflowPattern.SEQUENTIAL, "Alpha"));

            assertThat(result.error()).isNull();
            assertThat(result.outcomes().get(0).attempts()).isEqualTo(2);
            assertThat(result.response()).isEqualTo("49.00 kg");
        }
    }

    @Nested
    @DisplayName("Parallel workflow")
    class Parallel {

        @Test
        @DisplayName("A handler that misses the deadline is dropped while the others are returned")
        void isolatesTimeouts() {
            StubAgent slow = sleeping("Slow", "product_search", 5_000);
            StubAgent fast = StubAgent.answering("Fast", "footprint", "Mug: 49.55 kg CO2e");
            MessageRouter router = routerWith(slow, fast);
            CancellationToken token = CancellationToken.create();

            long start = System.currentTimeMillis();
            AggregatedResult result = router.dispatch(
                    task(Intent.PRODUCT_SEARCH, WorkflowPattern.PARALLEL, "Slow", "Fast"), token, Duration.ofMillis(300));
            long elapsed = System.currentTimeMillis() - start;

            assertThat(elapsed).isLessThan(3_000);
            assertThat(result.error()).isNull();
            assertThat(result.partial()).isTrue();
            assertThat(result.degradedHandlers()).containsExactly("Slow");
            assertThat(result.successfulResults()).extracting(AgentResult::agentName).containsExactly("Fast");
            assertThat(result.response()).contains("Mug: 49.55 kg CO2e").contains("Slow didn't respond in time");
            assertThat(token.isCancelled()).isTrue();

            HandlerOutcome degraded = result.outcomes().stream()
                    .filter(o -> o.handlerName().equals("Slow")).findFirst().orElseThrow();
            assertThat(degraded.status()).isEqualTo(OutcomeStatus.TIMED_OUT);
            assertThat(degraded.elapsedMs()).isGreaterThanOrEqualTo(250L).isLessThan(3_000L);
        }

        @Test
        @DisplayName("Cancelling the token stops every in-flight handler")
        void cancellationStopsHandlers() {
            AtomicInteger interrupted = new AtomicInteger();
            MessageRouter router = routerWith(sleeping("Alpha", "product_search", 5_000, interrupted),
                    sleeping("Beta", "footprint", 5_000, interrupted));
            CancellationToken token = CancellationToken.create();
            ScheduledExecutorService canceller = Executors.newSingleThreadScheduledExecutor();
            try {
                canceller.schedule(() -> token.cancel("shopper left"), 100, TimeUnit.MILLISECONDS);

                long start = System.currentTimeMillis();
                AggregatedResult result = router.dispatch(
                        task(Intent.PRODUCT_SEARCH, WorkflowPattern.PARALLEL, "Alpha", "Beta"), token, Duration.ofSeconds(10));

                assertThat(System.currentTimeMillis() - start).isLessThan(3_000);
                assertThat(result.outcomes()).extracting(HandlerOutcome::status)
                        .containsOnly(OutcomeStatus.CANCELLED);
                assertThat(result.failedHandlers()).containsExactly("Alpha", "Beta");
                await().atMost(Duration.ofSeconds(2)).untilAtomic(interrupted, equalTo(2));
            } finally {
                canceller.shutdownNow();
            }
        }

        @Test
        @DisplayName("An unhealthy secondary is reported as unavailable without blocking the rest")
        void unhealthySecondary() {
            StubAgent primary = StubAgent.answering("Alpha", "product_search", "3 products");
            StubAgent secondary = StubAgent.answering("Beta", "footprint", "never");
            MessageRouter router = routerWith(primary, secondary);
            registry.markStatus("Beta", HealthStatus.UNREACHABLE);

            AggregatedResult result = router.dispatch(
                    task(Intent.PRODUCT_SEARCH, WorkflowPattern.PARALLEL, "Alpha", "Beta"));

            assertThat(secondary.calls()).isZero();
            assertThat(result.response()).startsWith("3 products");
            assertThat(result.failedHandlers()).containsExactly("Beta");
            assertThat(result.outcomes().get(1).errorKind()).isEqualTo(ErrorKind.HANDLER_UNAVAILABLE);
        }
    }

    @Nested
    @DisplayName("Hierarchical workflow")
    class Hierarchical {

        @Test
        @DisplayName("Follow-ups run as child tasks that see the parent's result")
        void runsFollowUps() {
            StubAgent cart = new StubAgent("Cart", Set.of("cart_add"), r -> AgentResult
                    .success("Cart", "Added Mug", 1, Map.of("item_count", 1))
                    .withFollowUps(List.of(FollowUp.of(Intent.FOOTPRINT, "Co2", "cart changed"))));
            AtomicReference<TaskDescriptor> childTask = new AtomicReference<>();
            StubAgent co2 = new StubAgent("Co2", Set.of("footprint"), r -> {
                childTask.set(r.task());
                return AgentResult.success("Co2", "Cart footprint 49.55 kg", 1,
                        Map.of("parent_items", r.priorData("item_count").orElse(0)));
            });
            MessageRouter router = routerWith(cart, co2);

            AggregatedResult result = router.dispatch(task(Intent.CART_ADD, WorkflowPattern.HIERARCHICAL, "Cart", "Co2"));

            assertThat(result.handlers()).containsExactly("Cart", "Co2");
            assertThat(childTask.get().depth()).isEqualTo(1);
            assertThat(childTask.get().intent()).isEqualTo(Intent.FOOTPRINT);
            assertThat(childTask.get().id()).isEqualTo("task-test.1");
            assertThat(result.successfulResults().get(1).data()).containsEntry("parent_items", 1);
            assertThat(result.response()).isEqualTo("Added Mug\n\nCart footprint 49.55 kg");
        }

        @Test
        @DisplayName("Follow-up chains stop at the configured depth")
        void boundsDepth() {
            StubAgent looping = new StubAgent("Loop", Set.of("footprint"), r -> AgentResult
                    .success("Loop", "level " + r.task().depth(), 1)
                    .withFollowUps(List.of(FollowUp.of(Intent.FOOTPRINT, "Loop", "again"))));
            MessageRouter router = routerWith(looping);

            AggregatedResult result = router.dispatch(task(Intent.FOOTPRINT, WorkflowPattern.HIERARCHICAL, "Loop"));

            assertThat(looping.calls()).isEqualTo(PROPERTIES.maxDepth());
            assertThat(result.warnings()).anyMatch(w -> w.contains("depth limit"));
            assertThat(result.partial()).isFalse();
        }

        @Test
        @DisplayName("A follow-up nobody can serve is reported without failing the parent")
        void followUpWithoutHandler() {
            StubAgent cart = new StubAgent("Cart", Set.of("cart_add"), r -> AgentResult
                    .success("Cart", "Added Mug", 1)
                    .withFollowUps(List.of(new FollowUp(Intent.FOOTPRINT, null, Map.of(), "cart changed"))));
            MessageRouter router = routerWith(cart);

            AggregatedResult result = router.dispatch(task(Intent.CART_ADD, WorkflowPattern.HIERARCHICAL, "Cart"));

            assertThat(result.error()).isNull();
            assertThat(result.partial()).isTrue();
            assertThat(result.outcomes().get(1).errorKind()).isEqualTo(ErrorKind.NO_CAPABLE_HANDLER);
            assertThat(result.response()).startsWith("Added Mug");
        }
    }

    @Nested
    @DisplayName("Handler resolution")
    class Resolution {

        @Test
        @DisplayName("No capable handler is reported in the result, never thrown")
        void noCapableHandler() {
            MessageRouter router = routerWith(StubAgent.answering("Alpha", "footprint", "unused"));

            AggregatedResult result = router.dispatch(task(Intent.COMPARE, WorkflowPattern.SEQUENTIAL, "Ghost"));

            assertThat(result.error()).isEqualTo(ErrorKind.NO_CAPABLE_HANDLER);
            assertThat(result.outcomes()).isEmpty();
            assertThat(result.response()).contains("compare");
        }

        @Test
        @DisplayName("An unhealthy primary is replaced by another handler with the capability")
        void fallsBackToCapableHandler() {
            StubAgent preferred = StubAgent.answering("Alpha", "footprint", "from alpha");
            StubAgent backup = StubAgent.answering("Backup", "footprint", "from backup");
            MessageRouter router = routerWith(preferred, backup);
            registry.markStatus("Alpha", HealthStatus.DEGRADED);

            AggregatedResult result = router.dispatch(task(Intent.FOOTPRINT, WorkflowPattern.SEQUENTIAL, "Alpha"));

            assertThat(preferred.calls()).isZero();
            assertThat(result.response()).isEqualTo("from backup");
            assertThat(result.warnings()).anyMatch(w -> w.contains("Backup"));
        }

        @Test
        @DisplayName("Unclassifiable text reaches the general assistant with an ambiguity warning")
        void unclassifiableText() {
            MessageRouter router = routerWith(StubAgent.answering(GeneralAssistantAgent.NAME, "general", "How can I help?"));

            AggregatedResult result = router.route("asdkjh", "s1");

            assertThat(result.intent()).isEqualTo(Intent.GENERAL);
            assertThat(result.handlers()).containsExactly(GeneralAssistantAgent.NAME);
            assertThat(result.response()).isEqualTo("How can I help?");
            assertThat(result.warnings()).anyMatch(w -> w.startsWith(ErrorKind.CLASSIFICATION_AMBIGUOUS.name()));
        }

        @Test
        @DisplayName("Direct send skips classification and names an unknown handler as unavailable")
        void directSend() {
            StubAgent co2 = StubAgent.answering("Co2", "footprint", "cart footprint 0 kg");
            MessageRouter router = routerWith(co2);

            AggregatedResult sent = router.send("Co2", "add sunglasses to my cart", "s1");
            AggregatedResult unknown = router.send("Nobody", "hello", "s1");

            assertThat(sent.handlers()).containsExactly("Co2");
            assertThat(sent.intent()).isEqualTo(Intent.FOOTPRINT);
            assertThat(unknown.error()).isEqualTo(ErrorKind.HANDLER_UNAVAILABLE);
        }
    }
}
