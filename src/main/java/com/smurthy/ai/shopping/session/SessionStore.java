package com.smurthy.ai.shopping.session;

import com.smurthy.ai.shopping.config.SessionProperties;
import com.smurthy.ai.shopping.errors.TransientHandlerException;
import com.smurthy.ai.shopping.orchestration.CallContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Session Store
 *
 * Holds one {@link SessionState} per session id. All mutations for a key run under that
 * key's lock; readers get the last published snapshot without locking. Sessions are created
 * on the first mutation and reset (never deleted) on payment or an explicit clear. Idle
 * sessions are evicted by a scheduled sweep.
 */
@Service
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final Map<String, SessionSlot> sessions = new ConcurrentHashMap<>();
    private final SessionProperties properties;
    private final Clock clock;

    public SessionStore(SessionProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        log.info("SessionStore initialized (idle TTL {})", properties.idleTtl());
    }

    /**
     * Read-only view of the session. Unknown sessions yield the zero snapshot and are not created.
     */
    public SessionState viewCart(String sessionId) {
        SessionSlot slot = sessions.get(sessionId);
        return slot != null ? slot.state : SessionState.empty(sessionId, clock.instant());
    }

    public SessionState addToCart(String sessionId, CartItem item, String operationId) {
        return addToCart(sessionId, item, operationId, CallContext.none());
    }

    /**
     * Adds (or merges) a cart line. Replaying an {@code operationId} that was already applied
     * returns the current snapshot without touching it.
     */
    public SessionState addToCart(String sessionId, CartItem item, String operationId, CallContext context) {
        return mutate(sessionId, context, operationId, state -> state.addItem(item, clock.instant()));
    }

    public SessionState removeFromCart(String sessionId, String itemId) {
        return removeFromCart(sessionId, itemId, CallContext.none());
    }

    public SessionState removeFromCart(String sessionId, String itemId, CallContext context) {
        return mutate(sessionId, context, null, state -> state.removeItem(itemId, clock.instant()));
    }

    public SessionState clearCart(String sessionId) {
        return clearCart(sessionId, CallContext.none());
    }

    public SessionState clearCart(String sessionId, CallContext context) {
        return mutate(sessionId, context, null, state -> state.clear(clock.instant()));
    }

    public SessionState selectShipping(String sessionId, String method, double footprintKg) {
        return selectShipping(sessionId, method, footprintKg, CallContext.none());
    }

    public SessionState selectShipping(String sessionId, String method, double footprintKg, CallContext context) {
        return mutate(sessionId, context, null, state -> state.withShipping(method, footprintKg, clock.instant()));
    }

    public SessionState checkout(String sessionId) {
        return checkout(sessionId, CallContext.none());
    }

    public SessionState checkout(String sessionId, CallContext context) {
        return mutate(sessionId, context, null, state -> state.beginCheckout(clock.instant()));
    }

    public OrderConfirmation paymentSuccess(String sessionId, String paymentReference) {
        return paymentSuccess(sessionId, paymentReference, CallContext.none());
    }

    /**
     * Moves CHECKOUT to COMPLETED and immediately resets to a zeroed ACTIVE session, all under
     * the session lock, so no reader ever observes the COMPLETED snapshot.
     */
    public OrderConfirmation paymentSuccess(String sessionId, String paymentReference, CallContext context) {
        OrderConfirmation[] confirmation = new OrderConfirmation[1];
        mutate(sessionId, context, null, state -> {
            Instant now = clock.instant();
            SessionState completed = state.complete(now);
            confirmation[0] = OrderConfirmation.from(newOrderId(), completed, paymentReference, now);
            return completed.reset(now);
        });
        log.info("Session {} completed order {} ({} kg CO2e)", sessionId,
                confirmation[0].orderId(), String.format("%.1f", confirmation[0].totalFootprintKg()));
        return confirmation[0];
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    @Scheduled(fixedDelayString = "${shopping.session.eviction-interval-ms:60000}")
    public void evictIdleSessions() {
        Instant cutoff = clock.instant().minus(properties.idleTtl());
        int evicted = 0;
        for (Iterator<Map.Entry<String, SessionSlot>> it = sessions.entrySet().iterator(); it.hasNext(); ) {
            SessionSlot slot = it.next().getValue();
            if (!slot.state.lastUpdated().isBefore(cutoff) || !slot.lock.tryLock()) {
                continue;
            }
            try {
                if (slot.state.lastUpdated().isBefore(cutoff)) {
                    slot.evicted = true;
                    it.remove();
                    evicted++;
                }
            } finally {
                slot.lock.unlock();
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} idle sessions", evicted);
        }
    }

    private SessionState mutate(String sessionId, CallContext context, String operationId,
                                UnaryOperator<SessionState> operation) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        while (true) {
            SessionSlot slot = sessions.computeIfAbsent(sessionId,
                    id -> new SessionSlot(SessionState.empty(id, clock.instant())));
            acquire(slot, sessionId, context);
            try {
                if (slot.evicted) {
                    continue;
                }
                // effects are applied only if the caller is still interested
                context.cancellationToken().throwIfCancelled();
                if (operationId != null && slot.appliedOperations.contains(operationId)) {
                    log.debug("Operation {} already applied to session {}, skipping", operationId, sessionId);
                    return slot.state;
                }
                SessionState next = operation.apply(slot.state);
                slot.state = next;
                if (operationId != null) {
                    slot.remember(operationId, properties.operationHistory());
                }
                log.debug("Session {} -> {} items, product {} kg, shipping {} kg, {}", sessionId,
                        next.itemCount(), next.productFootprintKg(), next.shippingFootprintKg(), next.lifecycle());
                return next;
            } finally {
                slot.lock.unlock();
            }
        }
    }

    private static void acquire(SessionSlot slot, String sessionId, CallContext context) {
        try {
            if (!slot.lock.tryLock(context.deadline().remainingMillis(), TimeUnit.MILLISECONDS)) {
                throw new TransientHandlerException("Timed out waiting for session " + sessionId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for session " + sessionId);
        }
    }

    private static String newOrderId() {
        return "ORD-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase();
    }

    private static final class SessionSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private final Set<String> appliedOperations = new LinkedHashSet<>();
        private volatile SessionState state;
        private boolean evicted;

        private SessionSlot(SessionState initial) {
            this.state = initial;
        }

        private void remember(String operationId, int limit) {
            appliedOperations.add(operationId);
            if (appliedOperations.size() > limit) {
                Iterator<String> oldest = appliedOperations.iterator();
                oldest.next();
                oldest.remove();
            }
        }
    }
}
