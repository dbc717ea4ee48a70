package ai.pipestream.supervisor.health;

import io.smallrye.mutiny.subscription.MultiEmitter;
import org.jboss.logging.Logger;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One watcher of the health stream.
 * <p>
 * The monitor offers updates without blocking. Once {@code capacity} updates are waiting for
 * the watcher, further ones are dropped until it catches up.
 */
class HealthSubscription {

    private static final Logger LOG = Logger.getLogger(HealthSubscription.class);

    private final String id = UUID.randomUUID().toString();
    private final Set<String> serviceIds;
    private final int capacity;
    private final AtomicInteger waiting = new AtomicInteger();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile MultiEmitter<? super HealthUpdate> emitter;

    HealthSubscription(Set<String> serviceIds, int capacity) {
        this.serviceIds = Set.copyOf(serviceIds);
        this.capacity = capacity;
    }

    String id() {
        return id;
    }

    Set<String> serviceIds() {
        return serviceIds;
    }

    /**
     * An empty filter means every service
     */
    boolean isInterestedIn(String serviceId) {
        return serviceIds.isEmpty() || serviceIds.contains(serviceId);
    }

    void bind(MultiEmitter<? super HealthUpdate> emitter) {
        this.emitter = emitter;
    }

    /**
     * Non-blocking hand-off. Callers are serialized by the monitor's write lock.
     * @return false if the update was dropped
     */
    boolean offer(HealthUpdate update) {
        MultiEmitter<? super HealthUpdate> target = emitter;
        if (closed.get() || target == null) {
            return false;
        }
        if (waiting.get() >= capacity) {
            dropped.incrementAndGet();
            return false;
        }
        waiting.incrementAndGet();
        target.emit(update);
        return true;
    }

    void delivered(HealthUpdate update) {
        waiting.decrementAndGet();
    }

    // The downstream stopped requesting before the buffer filled up
    void discarded(HealthUpdate update) {
        waiting.decrementAndGet();
        dropped.incrementAndGet();
        LOG.debugf("Subscriber %s discarded health update for %s", id, update.serviceId());
    }

    long droppedCount() {
        return dropped.get();
    }

    void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        MultiEmitter<? super HealthUpdate> target = emitter;
        if (target != null) {
            target.complete();
        }
    }
}
