package com.smurthy.ai.shopping.orchestration;

import com.smurthy.ai.shopping.agents.AgentRequest;
import com.smurthy.ai.shopping.agents.AgentResult;
import com.smurthy.ai.shopping.agents.ShoppingAgent;
import com.smurthy.ai.shopping.errors.ErrorKind;
import com.smurthy.ai.shopping.errors.HandlerTimeoutException;
import com.smurthy.ai.shopping.errors.RetryExhaustedException;
import com.smurthy.ai.shopping.errors.ShoppingAssistantException;
import com.smurthy.ai.shopping.observability.AssistantMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one handler call under the router's retry policy and turns whatever happens into a
 * {@link HandlerOutcome}. Never throws.
 *
 * Every attempt first checks the call's cancellation token and deadline, so a retry scheduled
 * after cancellation or expiry never reaches the handler. Every outcome is recorded in
 * {@link AssistantMetrics}.
 */
@Component
public class HandlerInvoker {

    private static final Logger log = LoggerFactory.getLogger(HandlerInvoker.class);

    private final RetryTemplate retryTemplate;
    private final AssistantMetrics metrics;

    public HandlerInvoker(RetryTemplate handlerRetryTemplate, AssistantMetrics metrics) {
        this.retryTemplate = handlerRetryTemplate;
        this.metrics = metrics;
    }

    public HandlerOutcome invoke(ShoppingAgent agent, AgentRequest request) {
        HandlerOutcome outcome = attempt(agent, request);
        metrics.recordHandler(outcome);
        return outcome;
    }

    private HandlerOutcome attempt(ShoppingAgent agent, AgentRequest request) {
        CallContext context = request.context();
        String name = agent.name();
        AtomicInteger attempts = new AtomicInteger();
        long start = System.currentTimeMillis();

        try {
            AgentResult result = retryTemplate.execute(retryContext -> {
                context.cancellationToken().throwIfCancelled();
                if (context.isExpired()) {
                    throw new HandlerTimeoutException(name + " call reached its deadline");
                }
                int attempt = attempts.incrementAndGet();
                if (attempt > 1) {
                    log.info("Retrying {} (attempt {}) after: {}", name, attempt,
                            retryContext.getLastThrowable().getMessage());
                }
                return agent.handle(request);
            });
            long elapsed = System.currentTimeMillis() - start;

            if (context.isExpired()) {
                log.warn("{} finished after the deadline ({}ms); result discarded", name, elapsed);
                return HandlerOutcome.timedOut(name, attempts.get(), elapsed);
            }
            if (!result.success()) {
                ErrorKind kind = result.errorKind() != null ? result.errorKind() : ErrorKind.UPSTREAM_INVOCATION_ERROR;
                log.info("{} reported failure ({}): {}", name, kind, result.result());
                return HandlerOutcome.failed(name, kind, result.result(), attempts.get(), elapsed);
            }
            return HandlerOutcome.succeeded(name, result, attempts.get(), elapsed);

        } catch (CancellationException e) {
            log.info("{} cancelled: {}", name, e.getMessage());
            return HandlerOutcome.cancelled(name, e.getMessage(), attempts.get(), System.currentTimeMillis() - start);
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("{} cancelled while waiting to retry", name);
            return HandlerOutcome.cancelled(name, "interrupted during retry backoff", attempts.get(),
                    System.currentTimeMillis() - start);
        } catch (ShoppingAssistantException e) {
            long elapsed = System.currentTimeMillis() - start;
            if (e.getKind() == ErrorKind.HANDLER_TIMEOUT || context.isExpired()) {
                log.warn("{} timed out after {} attempt(s), {}ms", name, attempts.get(), elapsed);
                return HandlerOutcome.timedOut(name, attempts.get(), elapsed);
            }
            if (e.isTransient()) {
                RetryExhaustedException exhausted = new RetryExhaustedException(name, attempts.get(), e);
                log.error("{}", exhausted.getMessage());
                return HandlerOutcome.failed(name, exhausted.getKind(), exhausted.getMessage(), attempts.get(), elapsed);
            }
            log.warn("{} failed with {}: {}", name, e.getKind(), e.getMessage());
            return HandlerOutcome.failed(name, e.getKind(), e.getMessage(), attempts.get(), elapsed);
        } catch (RuntimeException e) {
            long elapsed = System.currentTimeMillis() - start;
            log.error("{} failed unexpectedly", name, e);
            return HandlerOutcome.failed(name, ErrorKind.HANDLER_UNAVAILABLE, name + " failed: " + e.getMessage(),
                    attempts.get(), elapsed);
        }
    }
}
