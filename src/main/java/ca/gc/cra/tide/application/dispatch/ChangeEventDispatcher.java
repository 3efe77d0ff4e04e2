package ca.gc.cra.tide.application.dispatch;

import ca.gc.cra.tide.application.port.MetricsPort;
import ca.gc.cra.tide.domain.events.ChangeEvent;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Delivers a change event to every matching subscription.
 * <p><strong>Why:</strong> One failing subscriber must not starve the others or stop the stream.</p>
 * <p><strong>Role:</strong> Application use case invoked by the stream runner for every built event.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Invoke matching handlers synchronously, in registration order.</li>
 *   <li>Contain handler exceptions and non-VM errors, logging them with transaction and relation context.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe to share; each call runs on the caller's thread.</p>
 * <p><strong>Performance:</strong> Handlers run inline; slow handlers throttle the stream.</p>
 * <p><strong>Observability:</strong> Increments {@code dispatch.handler.invoked}, {@code dispatch.handler.failure},
 * {@code dispatch.event.unmatched}; sets MDC keys {@code txId} and {@code relation} while handlers run.</p>
 *
 * @since 0.1.0
 */
public final class ChangeEventDispatcher {
  private static final Logger log = LoggerFactory.getLogger(ChangeEventDispatcher.class);
  static final String MDC_TX_ID = "txId";
  static final String MDC_RELATION = "relation";

  private final SubscriptionRegistry registry;
  private final MetricsPort metrics;

  /**
   * Creates a dispatcher.
   *
   * @param registry subscription source; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public ChangeEventDispatcher(SubscriptionRegistry registry, MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Invokes every matching handler.
   *
   * @param event event to deliver; never {@code null}
   * @return number of handlers that completed without throwing
   */
  public int dispatch(ChangeEvent event) {
    Objects.requireNonNull(event, "event");
    List<Subscription> matches = registry.matching(event);
    if (matches.isEmpty()) {
      metrics.increment("dispatch.event.unmatched");
      return 0;
    }

    String previousTxId = MDC.get(MDC_TX_ID);
    String previousRelation = MDC.get(MDC_RELATION);
    int delivered = 0;
    try {
      MDC.put(MDC_TX_ID, Long.toString(event.transactionId()));
      MDC.put(MDC_RELATION, event.qualifiedTable());
      for (Subscription subscription : matches) {
        metrics.increment("dispatch.handler.invoked");
        try {
          subscription.handler().handle(event);
          delivered++;
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          metrics.increment("dispatch.handler.failure");
          log.warn("Handler for {} interrupted on {} event at {}",
              subscription.describe(), event.type(), event.position());
        } catch (VirtualMachineError ex) {
          throw ex;
        } catch (Exception | Error ex) {
          metrics.increment("dispatch.handler.failure");
          log.error("Handler for {} failed on {} event for {} (tx {}, lsn {})",
              subscription.describe(), event.type(), event.qualifiedTable(),
              event.transactionId(), event.position(), ex);
        }
      }
    } finally {
      restore(MDC_TX_ID, previousTxId);
      restore(MDC_RELATION, previousRelation);
    }
    return delivered;
  }

  private static void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }
}
