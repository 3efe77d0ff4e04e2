package ca.gc.cra.tide.application.dispatch;

import ca.gc.cra.tide.application.port.ChangeEventHandler;
import ca.gc.cra.tide.domain.events.ChangeEvent;
import ca.gc.cra.tide.domain.events.ChangeType;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Ordered, append-only list of subscriptions.
 * <p><strong>Why:</strong> Handlers run in the order they were registered; freezing the registry once streaming starts
 * keeps that order stable for the lifetime of the stream.</p>
 * <p><strong>Role:</strong> Application state shared by the consumer facade and the dispatcher.</p>
 * <p><strong>Thread-safety:</strong> Registration and matching may happen on different threads.</p>
 * <p><strong>Performance:</strong> Matching is a linear scan; subscription counts are expected to be small.</p>
 *
 * @since 0.1.0
 */
public final class SubscriptionRegistry {
  private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

  private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
  private volatile boolean frozen;

  /**
   * Registers a subscription.
   *
   * @param typeFilter accepted event types
   * @param pattern accepted relations
   * @param handler callback
   * @return registered subscription
   * @throws IllegalStateException once the registry has been frozen
   */
  public Subscription register(EventTypeFilter typeFilter, TablePattern pattern, ChangeEventHandler handler) {
    Subscription subscription = new Subscription(typeFilter, pattern, handler);
    synchronized (this) {
      if (frozen) {
        throw new IllegalStateException("subscriptions cannot be added after streaming has started");
      }
      subscriptions.add(subscription);
    }
    log.debug("Registered subscription {}", subscription.describe());
    return subscription;
  }

  /**
   * Registers {@code handler} once for every change type on {@code pattern}.
   *
   * @param pattern accepted relations
   * @param handler callback
   * @return registered subscriptions, one per change type
   * @throws IllegalStateException once the registry has been frozen
   */
  public List<Subscription> registerAll(TablePattern pattern, ChangeEventHandler handler) {
    List<Subscription> registered = new ArrayList<>();
    synchronized (this) {
      if (frozen) {
        throw new IllegalStateException("subscriptions cannot be added after streaming has started");
      }
      for (ChangeType type : ChangeType.values()) {
        registered.add(register(EventTypeFilter.of(type), pattern, handler));
      }
    }
    return List.copyOf(registered);
  }

  /**
   * Blocks further registration.
   */
  public synchronized void freeze() {
    frozen = true;
  }

  /**
   * Indicates whether registration is closed.
   *
   * @return {@code true} after {@link #freeze()}
   */
  public boolean isFrozen() {
    return frozen;
  }

  /**
   * Returns subscriptions matching an event, in registration order.
   *
   * @param event candidate event
   * @return matching subscriptions; empty when none match
   */
  public List<Subscription> matching(ChangeEvent event) {
    List<Subscription> matches = new ArrayList<>(2);
    for (Subscription subscription : subscriptions) {
      if (subscription.matches(event)) {
        matches.add(subscription);
      }
    }
    return matches;
  }

  /**
   * Returns every subscription in registration order.
   *
   * @return snapshot of subscriptions
   */
  public List<Subscription> subscriptions() {
    return List.copyOf(subscriptions);
  }

  /**
   * Returns the number of subscriptions.
   *
   * @return subscription count
   */
  public int size() {
    return subscriptions.size();
  }
}
