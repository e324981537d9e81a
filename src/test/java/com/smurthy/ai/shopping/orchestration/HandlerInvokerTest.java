package com.smurthy.ai.shopping.orchestration;

import com.smurthy.ai.shopping.agents.AgentRequest;
import com.smurthy.ai.shopping.agents.AgentResult;
import com.smurthy.ai.shopping.agents.Intent;
import com.smurthy.ai.shopping.agents.TaskDescriptor;
import com.smurthy.ai.shopping.agents.WorkflowPattern;
import com.smurthy.ai.shopping.config.RetryConfig;
import com.smurthy.ai.shopping.config.RouterProperties;
import com.smurthy.ai.shopping.errors.ErrorKind;
import com.smurthy.ai.shopping.errors.InvalidSessionStateException;
import com.smurthy.ai.shopping.errors.TransientHandlerException;
import com.smurthy.ai.shopping.mcp.ToolErrorCode;
import com.smurthy.ai.shopping.mcp.ToolInvocationException;
import com.smurthy.ai.shopping.observability.AssistantMetrics;
import com.smurthy.ai.shopping.session.Lifecycle;
import com.smurthy.ai.shopping.support.StubAgent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class HandlerInvokerTest {

    private static final RouterProperties FAST_RETRIES = new RouterProperties(2, Duration.ofMillis(5), 2.0,
            Duration.ofMillis(20), Duration.ofSeconds(2), 3, 2);

    private final AssistantMetrics metrics = new AssistantMetrics(Clock.systemUTC());
    private final HandlerInvoker invoker = new HandlerInvoker(RetryConfig.buildRetryTemplate(FAST_RETRIES), metrics);

    private static AgentRequest request(CallContext context) {
        TaskDescriptor task = new TaskDescriptor("task-1", "anything", "s1", Intent.GENERAL, Map.of(),
                WorkflowPattern.SEQUENTIAL, "Stub", List.of(), 1.0, 0);
        return new AgentRequest(task, List.of(), context);
    }

    @Test
    @DisplayName("A transient failure is retried until it succeeds")
    void retriesTransientFailure() {
        AtomicInteger attempts = new AtomicInteger();
        StubAgent agent = new StubAgent("Stub", Set.of("general"), r -> {
            if (attempts.incrementAndGet() < 3) {
                throw new TransientHandlerException("catalog busy");
            }
            return AgentResult.success("Stub", "done", 1);
        });

        HandlerOutcome outcome = invoker.invoke(agent, request(CallContext.none()));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(outcome.result().result()).isEqualTo("done");
    }

    @Test
    @DisplayName("Retries stop at the configured limit and report RETRY_EXHAUSTED")
    void exhaustsRetries() {
        StubAgent agent = new StubAgent("Stub", Set.of("general"), r -> {
            throw new ToolInvocationException(ToolErrorCode.UPSTREAM_UNAVAILABLE, "co2 endpoint down");
        });

        HandlerOutcome outcome = invoker.invoke(agent, request(CallContext.none()));

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.RETRY_EXHAUSTED);
        assertThat(agent.calls()).isEqualTo(3);
        assertThat(outcome.message()).contains("co2 endpoint down");
    }

    @Test
    @DisplayName("Non-transient failures are not retried")
    void doesNotRetryPermanentFailures() {
        StubAgent invalidParams = new StubAgent("Stub", Set.of("general"), r -> {
            throw new ToolInvocationException(ToolErrorCode.INVALID_PARAMS, "bad product id");
        });
        StubAgent badState = new StubAgent("Stub", Set.of("general"), r -> {
            throw new InvalidSessionStateException("s1", Lifecycle.CHECKOUT, "cart is frozen");
        });

        HandlerOutcome first = invoker.invoke(invalidParams, request(CallContext.none()));
        HandlerOutcome second = invoker.invoke(badState, request(CallContext.none()));

        assertThat(invalidParams.calls()).isEqualTo(1);
        assertThat(first.errorKind()).isEqualTo(ErrorKind.UPSTREAM_INVOCATION_ERROR);
        assertThat(badState.calls()).isEqualTo(1);
        assertThat(second.errorKind()).isEqualTo(ErrorKind.INVALID_SESSION_STATE);
    }

    @Test
    @DisplayName("A failed result is reported with its own error kind")
    void failedResult() {
        StubAgent agent = new StubAgent("Stub", Set.of("general"),
                r -> AgentResult.failure("Stub", "Your cart is empty", 1, ErrorKind.INVALID_SESSION_STATE));

        HandlerOutcome outcome = invoker.invoke(agent, request(CallContext.none()));

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.INVALID_SESSION_STATE);
        assertThat(outcome.message()).isEqualTo("Your cart is empty");
    }

    @Test
    @DisplayName("An expired deadline never reaches the handler")
    void expiredDeadline() {
        StubAgent agent = StubAgent.answering("Stub", "general", "late");
        CallContext expired = new CallContext(Deadline.after(Duration.ZERO), CancellationToken.create());

        HandlerOutcome outcome = invoker.invoke(agent, request(expired));

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.TIMED_OUT);
        assertThat(agent.calls()).isZero();
    }

    @Test
    @DisplayName("A cancelled token never reaches the handler")
    void cancelledToken() {
        StubAgent agent = StubAgent.answering("Stub", "general", "ignored");
        CancellationToken token = CancellationToken.create();
        token.cancel("client disconnected");

        HandlerOutcome outcome = invoker.invoke(agent, request(new CallContext(Deadline.none(), token)));

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.CANCELLED);
        assertThat(outcome.message()).isEqualTo("client disconnected");
        assertThat(agent.calls()).isZero();
    }

    @Test
    @DisplayName("Unexpected exceptions are contained as HANDLER_UNAVAILABLE")
    void unexpectedException() {
        StubAgent agent = new StubAgent("Stub", Set.of("general"), r -> {
            throw new NullPointerException("oops");
        });

        HandlerOutcome outcome = invoker.invoke(agent, request(CallContext.none()));

        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.HANDLER_UNAVAILABLE);
        assertThat(agent.calls()).isEqualTo(1);
    }

    @Test
    @DisplayName("Every outcome is counted once per call, not once per attempt")
    void countsOutcomes() {
        AtomicInteger attempts = new AtomicInteger();
        StubAgent flaky = new StubAgent("Stub", Set.of("general"), r -> {
            if (attempts.incrementAndGet() == 1) {
                throw new TransientHandlerException("catalog busy");
            }
            return AgentResult.success("Stub", "done", 1);
        });
        StubAgent failing = new StubAgent("Stub", Set.of("general"),
                r -> AgentResult.failure("Stub", "Your cart is empty", 1, ErrorKind.INVALID_SESSION_STATE));

        invoker.invoke(flaky, request(CallContext.none()));
        invoker.invoke(failing, request(CallContext.none()));
        invoker.invoke(failing, request(new CallContext(Deadline.after(Duration.ZERO), CancellationToken.create())));

        AssistantMetrics.HandlerStats stats = metrics.getMetricsSummary().handlers().get("Stub");
        assertThat(stats.requestsProcessed()).isEqualTo(3);
        assertThat(stats.successful()).isEqualTo(1);
        assertThat(stats.failed()).isEqualTo(1);
        assertThat(stats.timedOut()).isEqualTo(1);
        assertThat(stats.cancelled()).isZero();
    }
}
