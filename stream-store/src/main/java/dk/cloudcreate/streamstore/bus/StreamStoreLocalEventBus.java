package dk.cloudcreate.streamstore.bus;

import dk.cloudcreate.streamstore.common.Lifecycle;
import org.slf4j.*;
import reactor.core.Disposable;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.*;

import java.util.List;
import java.util.concurrent.*;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.*;
import static com.google.common.base.Strings.lenientFormat;

/**
 * In-process bus on which a stream store connection publishes {@link EventsAppended} after every successful append.<br>
 * Synchronous subscribers are called on the appending thread, after the append has completed.<br>
 * Asynchronous subscribers each receive the notifications in publishing order on a thread from the bus' scheduler.<br>
 * A subscriber that throws an exception doesn't affect the append or the other subscribers; the exception is logged.
 * <p>
 * The async delivery threads only exist while the bus is {@link #start() started}. {@link #stop()} releases them but keeps the
 * registered subscribers, which are reconnected by the next {@link #start()}. Notifications published while the bus is stopped
 * are not delivered to asynchronous subscribers.
 */
public class StreamStoreLocalEventBus implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger("StreamStoreLocalEventBus");

    private final String                                                     busName;
    private final int                                                        asyncSubscriberThreads;
    private final List<Consumer<EventsAppended>>                             syncSubscribers  = new CopyOnWriteArrayList<>();
    private final ConcurrentMap<Consumer<EventsAppended>, AsyncSubscription> asyncSubscribers = new ConcurrentHashMap<>();
    private volatile Scheduler                                               asyncScheduler;

    /**
     * @param busName                the name of the bus (also used to name the async subscriber threads)
     * @param asyncSubscriberThreads the maximum number of threads used to deliver to asynchronous subscribers
     */
    public StreamStoreLocalEventBus(String busName, int asyncSubscriberThreads) {
        this.busName = checkNotNull(busName, "No busName provided");
        checkArgument(asyncSubscriberThreads > 0, "asyncSubscriberThreads must be > 0, was %s", asyncSubscriberThreads);
        this.asyncSubscriberThreads = asyncSubscriberThreads;
    }

    @Override
    public synchronized void start() {
        if (asyncScheduler == null) {
            asyncScheduler = Schedulers.newBoundedElastic(asyncSubscriberThreads,
                                                          Integer.MAX_VALUE,
                                                          busName,
                                                          60,
                                                          true);
            asyncSubscribers.values().forEach(subscription -> subscription.connect(asyncScheduler));
            log.debug("[{}] Started", busName);
        }
    }

    @Override
    public synchronized void stop() {
        if (asyncScheduler != null) {
            asyncSubscribers.values().forEach(AsyncSubscription::disconnect);
            asyncScheduler.dispose();
            asyncScheduler = null;
            log.debug("[{}] Stopped", busName);
        }
    }

    @Override
    public boolean isStarted() {
        return asyncScheduler != null;
    }

    public void publish(EventsAppended eventsAppended) {
        checkNotNull(eventsAppended, "No eventsAppended provided");
        log.trace("[{}] Publishing {}", busName, eventsAppended);
        syncSubscribers.forEach(subscriber -> deliver(subscriber, eventsAppended));
        asyncSubscribers.values().forEach(subscription -> subscription.emit(eventsAppended));
    }

    public StreamStoreLocalEventBus addSyncSubscriber(Consumer<EventsAppended> subscriber) {
        checkNotNull(subscriber, "No subscriber provided");
        if (!syncSubscribers.contains(subscriber)) {
            syncSubscribers.add(subscriber);
        }
        return this;
    }

    public StreamStoreLocalEventBus removeSyncSubscriber(Consumer<EventsAppended> subscriber) {
        checkNotNull(subscriber, "No subscriber provided");
        syncSubscribers.remove(subscriber);
        return this;
    }

    public synchronized StreamStoreLocalEventBus addAsyncSubscriber(Consumer<EventsAppended> subscriber) {
        checkNotNull(subscriber, "No subscriber provided");
        asyncSubscribers.computeIfAbsent(subscriber, newSubscriber -> {
            var subscription = new AsyncSubscription(newSubscriber);
            if (asyncScheduler != null) {
                subscription.connect(asyncScheduler);
            }
            return subscription;
        });
        return this;
    }

    public synchronized StreamStoreLocalEventBus removeAsyncSubscriber(Consumer<EventsAppended> subscriber) {
        checkNotNull(subscriber, "No subscriber provided");
        var subscription = asyncSubscribers.remove(subscriber);
        if (subscription != null) {
            subscription.disconnect();
        }
        return this;
    }

    public boolean hasSubscriber(Consumer<EventsAppended> subscriber) {
        return syncSubscribers.contains(subscriber) || asyncSubscribers.containsKey(subscriber);
    }

    /**
     * {@link #stop() Stop} the bus and remove all subscribers
     */
    public synchronized void dispose() {
        stop();
        syncSubscribers.clear();
        asyncSubscribers.clear();
    }

    private void deliver(Consumer<EventsAppended> subscriber, EventsAppended eventsAppended) {
        try {
            subscriber.accept(eventsAppended);
        } catch (Exception e) {
            onErrorHandler(subscriber, eventsAppended, e);
        }
    }

    private void onErrorHandler(Consumer<EventsAppended> subscriber, EventsAppended eventsAppended, Exception e) {
        log.error(lenientFormat("[%s] Failed to publish %s to subscriber %s", busName, eventsAppended, subscriber.getClass().getName()), e);
    }

    private class AsyncSubscription {
        private final Consumer<EventsAppended> subscriber;
        private Sinks.Many<EventsAppended>     sink;
        private Disposable                     disposable;

        AsyncSubscription(Consumer<EventsAppended> subscriber) {
            this.subscriber = subscriber;
        }

        synchronized void connect(Scheduler scheduler) {
            sink = Sinks.many().unicast().onBackpressureBuffer();
            disposable = sink.asFlux()
                             .publishOn(scheduler)
                             .subscribe(eventsAppended -> deliver(subscriber, eventsAppended));
        }

        synchronized void emit(EventsAppended eventsAppended) {
            if (sink == null) {
                log.debug("[{}] Bus is stopped, not delivering {} to async subscriber {}", busName, eventsAppended, subscriber.getClass().getName());
                return;
            }
            var result = sink.tryEmitNext(eventsAppended);
            if (result.isFailure()) {
                log.debug("[{}] Couldn't deliver {} to async subscriber: {}", busName, eventsAppended, result);
            }
        }

        synchronized void disconnect() {
            if (sink != null) {
                sink.tryEmitComplete();
                disposable.dispose();
                sink = null;
                disposable = null;
            }
        }
    }
}
