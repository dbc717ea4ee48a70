package ai.pipestream.supervisor.logs;

import ai.pipestream.supervisor.entity.ServiceLogEntry;
import org.jboss.logging.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-memory buffer of log lines streamed in by workers.
 * <p>
 * Every entry is also written to the supervisor's own log under the
 * {@code service.<name>} category, so worker output shows up alongside ours.
 * Once the buffer is full the oldest entry is evicted.
 */
public class ServiceLogStore {

    private static final Logger LOG = Logger.getLogger(ServiceLogStore.class);

    public static final String CATEGORY_PREFIX = "service.";

    private final int maxEntries;
    private final Deque<ServiceLogEntry> entries = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final ConcurrentMap<String, Logger> loggers = new ConcurrentHashMap<>();

    public ServiceLogStore(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.maxEntries = maxEntries;
    }

    /**
     * Store an entry and forward it to the supervisor log
     * @param serviceName Used for the log category, falls back to the service id when blank
     */
    public void append(ServiceLogEntry entry, String serviceName) {
        lock.lock();
        try {
            if (entries.size() == maxEntries) {
                entries.removeFirst();
            }
            entries.addLast(entry);
        } finally {
            lock.unlock();
        }
        forward(entry, serviceName == null || serviceName.isBlank() ? entry.serviceId() : serviceName);
    }

    /**
     * Most recent entries for one service, oldest first
     */
    public List<ServiceLogEntry> recent(String serviceId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<ServiceLogEntry> newestFirst = new ArrayList<>();
        lock.lock();
        try {
            Iterator<ServiceLogEntry> it = entries.descendingIterator();
            while (it.hasNext() && newestFirst.size() < limit) {
                ServiceLogEntry entry = it.next();
                if (entry.serviceId().equals(serviceId)) {
                    newestFirst.add(entry);
                }
            }
        } finally {
            lock.unlock();
        }
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    private void forward(ServiceLogEntry entry, String serviceName) {
        Logger logger = loggers.computeIfAbsent(serviceName, name -> Logger.getLogger(CATEGORY_PREFIX + name));
        Logger.Level level = toLevel(entry.level());
        if (!logger.isEnabled(level)) {
            return;
        }
        if (entry.fields().isEmpty()) {
            logger.log(level, entry.message());
        } else {
            logger.logf(level, "%s %s", entry.message(), entry.fields());
        }
    }

    static Logger.Level toLevel(String level) {
        if (level == null || level.isBlank()) {
            return Logger.Level.INFO;
        }
        switch (level.toUpperCase(Locale.ROOT)) {
            case "TRACE":
                return Logger.Level.TRACE;
            case "DEBUG":
                return Logger.Level.DEBUG;
            case "WARN":
            case "WARNING":
                return Logger.Level.WARN;
            case "ERROR":
                return Logger.Level.ERROR;
            case "INFO":
                return Logger.Level.INFO;
            default:
                LOG.debugf("Unknown worker log level %s, logging at INFO", level);
                return Logger.Level.INFO;
        }
    }
}
