package io.b2mash.tms.tendering.hook;

import io.b2mash.tms.tendering.exception.PolicyVetoException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed registry of lifecycle interception handlers.
 *
 * <p>Pre handlers for a hook point run in ascending {@code order} (registration order breaks
 * ties). Each receives the payload returned by the previous one; the first veto stops the chain
 * and surfaces as {@link PolicyVetoException}. Post handlers run after the surrounding transaction
 * commits; a failing post handler is logged and the remaining ones still run.
 *
 * <p>Handlers are contributed by {@link HookContributor} beans at startup and can also be
 * registered and removed at runtime by owner ID.
 */
@Component
public class HookRegistry {

  private static final Logger log = LoggerFactory.getLogger(HookRegistry.class);

  private static final Comparator<Registration> EXECUTION_ORDER =
      Comparator.comparingInt(Registration::order).thenComparingLong(Registration::sequence);

  private final Map<String, List<Registration>> registrations = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();
  private final ApplicationEventPublisher eventPublisher;

  public HookRegistry(
      ObjectProvider<HookContributor> contributors, ApplicationEventPublisher eventPublisher) {
    this.eventPublisher = eventPublisher;
    contributors.orderedStream().forEach(contributor -> contributor.contribute(this));
  }

  public <P> void registerPre(
      HookPoint<P> point, String ownerId, int order, PreHookHandler<P> handler) {
    register(point, HookPhase.PRE, ownerId, order, handler);
  }

  public <P> void registerPost(
      HookPoint<P> point, String ownerId, int order, PostHookHandler<P> handler) {
    register(point, HookPhase.POST, ownerId, order, handler);
  }

  /** Removes every handler registered by {@code ownerId}. Returns the number removed. */
  public int unregisterOwner(String ownerId) {
    int removed = 0;
    for (var handlers : registrations.values()) {
      var owned = handlers.stream().filter(r -> r.ownerId().equals(ownerId)).toList();
      handlers.removeAll(owned);
      removed += owned.size();
    }
    if (removed > 0) {
      log.info("Unregistered {} hook handler(s) owned by {}", removed, ownerId);
    }
    return removed;
  }

  public int handlerCount(HookPoint<?> point) {
    return registrations.getOrDefault(point.id(), List.of()).size();
  }

  /**
   * Runs the pre handlers of {@code point} as a waterfall.
   *
   * @return the payload after every handler has had the chance to rewrite it
   * @throws PolicyVetoException if a handler vetoes or throws
   */
  @SuppressWarnings("unchecked")
  public <P> P runPre(HookPoint<P> point, P payload) {
    requirePhase(point, HookPhase.PRE);
    P current = payload;
    for (var registration : sorted(point)) {
      var handler = (PreHookHandler<P>) registration.handler();
      HookDecision<P> decision;
      try {
        decision = handler.handle(current);
      } catch (PolicyVetoException e) {
        throw e;
      } catch (RuntimeException e) {
        var reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.warn(
            "Hook {} handler from {} failed, treating as veto: {}",
            point.id(),
            registration.ownerId(),
            reason);
        throw new PolicyVetoException(point.id(), reason, e);
      }
      if (decision == null) {
        continue;
      }
      if (!decision.proceed()) {
        log.warn(
            "Hook {} vetoed by {}: {}", point.id(), registration.ownerId(), decision.reason());
        throw new PolicyVetoException(point.id(), decision.reason());
      }
      if (decision.payload() != null) {
        Object rewritten = decision.payload();
        if (!point.payloadType().isInstance(rewritten)) {
          var reason =
              "Handler rewrote payload to "
                  + rewritten.getClass().getSimpleName()
                  + ", expected "
                  + point.payloadType().getSimpleName();
          log.warn("Hook {} handler from {}: {}", point.id(), registration.ownerId(), reason);
          throw new PolicyVetoException(point.id(), reason);
        }
        current = point.payloadType().cast(rewritten);
      }
      log.debug("Hook {} handler from {} proceeded", point.id(), registration.ownerId());
    }
    return current;
  }

  /** Schedules the post handlers of {@code point} to run once the current transaction commits. */
  public <P> void publishPost(HookPoint<P> point, P payload) {
    requirePhase(point, HookPhase.POST);
    if (handlerCount(point) == 0) {
      return;
    }
    eventPublisher.publishEvent(new PostHookEvent(point, payload));
  }

  @SuppressWarnings("unchecked")
  void dispatchPost(HookPoint<?> point, Object payload) {
    for (var registration : sorted(point)) {
      try {
        ((PostHookHandler<Object>) registration.handler()).handle(payload);
      } catch (RuntimeException e) {
        log.error(
            "Post hook {} handler from {} failed", point.id(), registration.ownerId(), e);
      }
    }
  }

  private void register(
      HookPoint<?> point, HookPhase phase, String ownerId, int order, Object handler) {
    requirePhase(point, phase);
    if (ownerId == null || ownerId.isBlank()) {
      throw new IllegalArgumentException("ownerId must not be blank");
    }
    if (handler == null) {
      throw new IllegalArgumentException("handler must not be null");
    }
    registrations
        .computeIfAbsent(point.id(), k -> new CopyOnWriteArrayList<>())
        .add(new Registration(ownerId, order, sequence.getAndIncrement(), handler));
    log.debug("Registered {} handler for {} from {}", phase, point.id(), ownerId);
  }

  private List<Registration> sorted(HookPoint<?> point) {
    return registrations.getOrDefault(point.id(), List.of()).stream()
        .sorted(EXECUTION_ORDER)
        .toList();
  }

  private static void requirePhase(HookPoint<?> point, HookPhase expected) {
    if (point.phase() != expected) {
      throw new IllegalArgumentException(
          "Hook " + point.id() + " is a " + point.phase() + " hook, not " + expected);
    }
  }

  private record Registration(String ownerId, int order, long sequence, Object handler) {}
}
