package dk.cloudcreate.streamstore.aggregates.repository;

import dk.cloudcreate.streamstore.aggregates.*;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@link Repository} decorator that keeps loaded and saved aggregates in an in-process cache keyed by aggregate type and id.<br>
 * Callers loading the same aggregate receive the same instance. On every {@link #getById(Class, Object)} a cached instance without pending
 * events is brought up to date with the events persisted since it was cached (by this or any other writer), so the returned instance is
 * never behind the stream it was loaded from.
 * <p>
 * Loads, saves and deletes of the same aggregate type and id are serialized on a lock per cache key, which is also held while the
 * delegate reads from or writes to the stream store. Operations on different aggregates don't wait for each other.
 * <p>
 * The cache is unbounded. An instance that has pending events is returned as is, since other callers may be in the middle of changing it.
 * Loading a specific version bypasses the cache.
 */
public final class CachingRepository implements Repository {
    private static final Logger log = LoggerFactory.getLogger(CachingRepository.class);

    private final Repository                               delegate;
    private final ConcurrentMap<CacheKey, EventSource<?>>  cache    = new ConcurrentHashMap<>();
    /**
     * Lock entries outlive evictions, so two callers never hold different locks for the same key
     */
    private final ConcurrentMap<CacheKey, ReentrantLock>   keyLocks = new ConcurrentHashMap<>();

    public CachingRepository(Repository delegate) {
        this.delegate = checkNotNull(delegate, "No delegate repository provided");
    }

    @Override
    public <ID, AGGREGATE extends EventSource<ID>> AGGREGATE getById(Class<AGGREGATE> aggregateType, ID aggregateId) {
        checkNotNull(aggregateType, "No aggregateType provided");
        checkNotNull(aggregateId, "No aggregateId provided");
        var key  = new CacheKey(aggregateType, aggregateId);
        var lock = lockFor(key);
        lock.lock();
        try {
            var cached = cache.get(key);
            if (cached != null) {
                var aggregate = aggregateType.cast(cached);
                if (!aggregate.hasPendingEvents()) {
                    try {
                        delegate.updateToCurrent(aggregate);
                    } catch (AggregateNotFoundException e) {
                        cache.remove(key);
                        log.debug("Evicted aggregate '{}' with id '{}' from the cache since it no longer exists", aggregateType.getName(), aggregateId);
                        throw e;
                    }
                }
                return aggregate;
            }
            var aggregate = delegate.getById(aggregateType, aggregateId);
            cache.put(key, aggregate);
            return aggregate;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <ID, AGGREGATE extends EventSource<ID>> AGGREGATE getById(Class<AGGREGATE> aggregateType, ID aggregateId, int version) {
        return delegate.getById(aggregateType, aggregateId, version);
    }

    @Override
    public <ID, AGGREGATE extends EventSource<ID>> AGGREGATE updateToCurrent(AGGREGATE aggregate) {
        return delegate.updateToCurrent(aggregate);
    }

    /**
     * Save the aggregate using the delegate and cache it. Nothing is cached if the save fails
     */
    @Override
    public <ID> void save(EventSource<ID> aggregate, UUID commitId, Consumer<Map<String, Object>> updateHeaders) {
        checkNotNull(aggregate, "No aggregate provided");
        if (aggregate.aggregateId() == null) {
            delegate.save(aggregate, commitId, updateHeaders);
            return;
        }
        var key  = new CacheKey(aggregate.getClass(), aggregate.aggregateId());
        var lock = lockFor(key);
        lock.lock();
        try {
            delegate.save(aggregate, commitId, updateHeaders);
            cache.put(key, aggregate);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <ID> void delete(EventSource<ID> aggregate) {
        checkNotNull(aggregate, "No aggregate provided");
        evictAfter(aggregate, () -> delegate.delete(aggregate));
    }

    @Override
    public <ID> void hardDelete(EventSource<ID> aggregate) {
        checkNotNull(aggregate, "No aggregate provided");
        evictAfter(aggregate, () -> delegate.hardDelete(aggregate));
    }

    /**
     * Evict the cached instance of the given aggregate type and id
     */
    public void clearCache(Class<?> aggregateType, Object aggregateId) {
        evict(new CacheKey(aggregateType, aggregateId));
    }

    /**
     * Evict every cached instance with the given id, regardless of aggregate type
     */
    public void clearCache(Object aggregateId) {
        checkNotNull(aggregateId, "No aggregateId provided");
        List.copyOf(cache.keySet())
            .stream()
            .filter(key -> key.aggregateId.equals(aggregateId))
            .forEach(this::evict);
    }

    public void clearCache() {
        List.copyOf(cache.keySet()).forEach(this::evict);
    }

    public boolean isCached(Class<?> aggregateType, Object aggregateId) {
        return cache.containsKey(new CacheKey(aggregateType, aggregateId));
    }

    private <ID> void evictAfter(EventSource<ID> aggregate, Runnable deletion) {
        if (aggregate.aggregateId() == null) {
            deletion.run();
            return;
        }
        var key  = new CacheKey(aggregate.getClass(), aggregate.aggregateId());
        var lock = lockFor(key);
        lock.lock();
        try {
            deletion.run();
            cache.remove(key);
        } finally {
            lock.unlock();
        }
    }

    private void evict(CacheKey key) {
        var lock = lockFor(key);
        lock.lock();
        try {
            cache.remove(key);
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(CacheKey key) {
        return keyLocks.computeIfAbsent(key, ignored -> new ReentrantLock());
    }

    private static final class CacheKey {
        private final Class<?> aggregateType;
        private final Object   aggregateId;

        private CacheKey(Class<?> aggregateType, Object aggregateId) {
            this.aggregateType = checkNotNull(aggregateType, "No aggregateType provided");
            this.aggregateId = checkNotNull(aggregateId, "No aggregateId provided");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof CacheKey)) return false;
            var that = (CacheKey) o;
            return aggregateType.equals(that.aggregateType) && aggregateId.equals(that.aggregateId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(aggregateType, aggregateId);
        }
    }
}
