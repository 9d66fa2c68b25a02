package dk.cloudcreate.streamstore.aggregates;

import java.lang.reflect.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.BiConsumer;

import static com.google.common.base.Preconditions.*;
import static com.google.common.base.Strings.lenientFormat;

/**
 * Dispatch table that routes an event to the handler registered for its type on a given aggregate type.<br>
 * A table is built once per aggregate type and shared by all its instances, either explicitly:
 * <pre>{@code
 * private static final EventRoutes<Account> ROUTES = EventRoutes.builder(Account.class)
 *                                                                .on(AccountCreated.class, Account::on)
 *                                                                .on(AccountCredited.class, Account::on)
 *                                                                .build();
 * }</pre>
 * or derived from the aggregate's {@link EventHandler} annotated methods using {@link #annotated(Class)}.
 * <p>
 * An event is routed to the handler registered for its runtime class. If there's none, the handlers registered for its
 * superclasses (nearest first) and then its interfaces are tried. Events without a matching handler are ignored.
 *
 * @param <AGGREGATE> the aggregate type
 */
public final class EventRoutes<AGGREGATE> {
    /**
     * Key: aggregate type
     */
    private static final ConcurrentMap<Class<?>, EventRoutes<?>> ANNOTATED_ROUTES = new ConcurrentHashMap<>();

    private final Class<AGGREGATE>                                                   aggregateType;
    private final Map<Class<?>, BiConsumer<AGGREGATE, Object>>                       handlers;
    /**
     * Key: the runtime event type<br>
     * Value: the resolved handler (empty if no handler matches)
     */
    private final ConcurrentMap<Class<?>, Optional<BiConsumer<AGGREGATE, Object>>> resolvedHandlers = new ConcurrentHashMap<>();

    private EventRoutes(Class<AGGREGATE> aggregateType, Map<Class<?>, BiConsumer<AGGREGATE, Object>> handlers) {
        this.aggregateType = aggregateType;
        this.handlers = Map.copyOf(handlers);
    }

    public static <AGGREGATE> Builder<AGGREGATE> builder(Class<AGGREGATE> aggregateType) {
        return new Builder<>(aggregateType);
    }

    /**
     * Get the routes for the {@link EventHandler} annotated methods declared on <code>aggregateType</code> and its superclasses.
     * The methods are scanned the first time a type is requested; the result is cached
     *
     * @param aggregateType the aggregate type
     * @return the routes
     * @throws IllegalArgumentException if a handler method doesn't have exactly one parameter or two handlers handle the same event type
     */
    @SuppressWarnings("unchecked")
    public static <AGGREGATE> EventRoutes<AGGREGATE> annotated(Class<AGGREGATE> aggregateType) {
        checkNotNull(aggregateType, "No aggregateType provided");
        return (EventRoutes<AGGREGATE>) ANNOTATED_ROUTES.computeIfAbsent(aggregateType, EventRoutes::scanAnnotatedHandlers);
    }

    private static <AGGREGATE> EventRoutes<AGGREGATE> scanAnnotatedHandlers(Class<AGGREGATE> aggregateType) {
        var builder = new Builder<>(aggregateType);
        for (Class<?> type = aggregateType; type != null && type != Object.class; type = type.getSuperclass()) {
            for (var method : type.getDeclaredMethods()) {
                if (!method.isAnnotationPresent(EventHandler.class)) {
                    continue;
                }
                checkArgument(method.getParameterCount() == 1,
                              "@EventHandler method '%s' on '%s' must have exactly one parameter",
                              method.getName(),
                              type.getName());
                method.setAccessible(true);
                builder.register(method.getParameterTypes()[0], (aggregate, event) -> invoke(method, aggregate, event));
            }
        }
        return builder.build();
    }

    private static void invoke(Method method, Object aggregate, Object event) {
        try {
            method.invoke(aggregate, event);
        } catch (InvocationTargetException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new AggregateException(lenientFormat("@EventHandler method '%s' failed to handle '%s'", method, event.getClass().getName()), cause);
        } catch (IllegalAccessException e) {
            throw new AggregateException(lenientFormat("Couldn't call @EventHandler method '%s'", method), e);
        }
    }

    /**
     * Apply the event to the aggregate using the handler resolved for the event's type.
     * Nothing happens if no handler matches the event
     *
     * @param aggregate the aggregate instance
     * @param event     the event
     */
    public void apply(AGGREGATE aggregate, Object event) {
        checkNotNull(aggregate, "No aggregate provided");
        checkNotNull(event, "No event provided");
        resolveHandler(event.getClass()).ifPresent(handler -> handler.accept(aggregate, event));
    }

    /**
     * Does any handler match events of the given type
     */
    public boolean handles(Class<?> eventType) {
        return resolveHandler(checkNotNull(eventType, "No eventType provided")).isPresent();
    }

    public Class<AGGREGATE> aggregateType() {
        return aggregateType;
    }

    /**
     * The event types that handlers have been registered for
     */
    public Set<Class<?>> eventTypes() {
        return handlers.keySet();
    }

    private Optional<BiConsumer<AGGREGATE, Object>> resolveHandler(Class<?> eventType) {
        return resolvedHandlers.computeIfAbsent(eventType, this::findHandler);
    }

    private Optional<BiConsumer<AGGREGATE, Object>> findHandler(Class<?> eventType) {
        for (Class<?> type = eventType; type != null; type = type.getSuperclass()) {
            var handler = handlers.get(type);
            if (handler != null) {
                return Optional.of(handler);
            }
        }
        var interfacesToVisit = new ArrayDeque<Class<?>>();
        for (Class<?> type = eventType; type != null; type = type.getSuperclass()) {
            interfacesToVisit.addAll(Arrays.asList(type.getInterfaces()));
        }
        var visited = new HashSet<Class<?>>();
        while (!interfacesToVisit.isEmpty()) {
            var anInterface = interfacesToVisit.poll();
            if (!visited.add(anInterface)) {
                continue;
            }
            var handler = handlers.get(anInterface);
            if (handler != null) {
                return Optional.of(handler);
            }
            interfacesToVisit.addAll(Arrays.asList(anInterface.getInterfaces()));
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "EventRoutes{" +
                "aggregateType=" + aggregateType.getName() +
                ", eventTypes=" + handlers.keySet() +
                '}';
    }

    public static final class Builder<AGGREGATE> {
        private final Class<AGGREGATE>                             aggregateType;
        private final Map<Class<?>, BiConsumer<AGGREGATE, Object>> handlers = new LinkedHashMap<>();

        private Builder(Class<AGGREGATE> aggregateType) {
            this.aggregateType = checkNotNull(aggregateType, "No aggregateType provided");
        }

        /**
         * Register the handler for an event type
         *
         * @param eventType the event type
         * @param handler   the handler, typically a method reference to a (private) method on the aggregate
         * @return this builder
         * @throws IllegalArgumentException if a handler is already registered for <code>eventType</code>
         */
        @SuppressWarnings("unchecked")
        public <EVENT> Builder<AGGREGATE> on(Class<EVENT> eventType, BiConsumer<AGGREGATE, ? super EVENT> handler) {
            checkNotNull(handler, "No handler provided");
            var typedHandler = (BiConsumer<AGGREGATE, Object>) handler;
            return register(eventType, typedHandler);
        }

        private Builder<AGGREGATE> register(Class<?> eventType, BiConsumer<AGGREGATE, Object> handler) {
            checkNotNull(eventType, "No eventType provided");
            checkArgument(!handlers.containsKey(eventType),
                          "Aggregate '%s' already has a handler for event type '%s'",
                          aggregateType.getName(),
                          eventType.getName());
            handlers.put(eventType, handler);
            return this;
        }

        public EventRoutes<AGGREGATE> build() {
            return new EventRoutes<>(aggregateType, handlers);
        }
    }
}
