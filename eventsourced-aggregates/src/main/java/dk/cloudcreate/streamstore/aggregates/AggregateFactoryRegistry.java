package dk.cloudcreate.streamstore.aggregates;

import java.util.Optional;
import java.util.concurrent.*;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.*;
import static com.google.common.base.Strings.lenientFormat;

/**
 * {@link AggregateInstanceFactory} that creates aggregates using explicitly registered factory functions:
 * <pre>{@code
 * var factories = new AggregateFactoryRegistry().register(Account.class, Account::new);
 * }</pre>
 * Aggregate types without a registered factory are delegated to the fallback factory, if one was provided.
 */
public final class AggregateFactoryRegistry implements AggregateInstanceFactory {
    private final ConcurrentMap<Class<?>, Supplier<?>>   factories = new ConcurrentHashMap<>();
    private final Optional<AggregateInstanceFactory> fallbackFactory;

    /**
     * Create a registry that only creates the registered aggregate types
     */
    public AggregateFactoryRegistry() {
        this.fallbackFactory = Optional.empty();
    }

    /**
     * Create a registry that delegates unregistered aggregate types to <code>fallbackFactory</code>
     */
    public AggregateFactoryRegistry(AggregateInstanceFactory fallbackFactory) {
        this.fallbackFactory = Optional.of(checkNotNull(fallbackFactory, "No fallbackFactory provided"));
    }

    /**
     * Register the factory function for an aggregate type
     *
     * @param aggregateType the aggregate type
     * @param factory       creates an empty instance of the aggregate type
     * @return this registry
     * @throws IllegalArgumentException if a factory has already been registered for the aggregate type
     */
    public <AGGREGATE> AggregateFactoryRegistry register(Class<AGGREGATE> aggregateType, Supplier<? extends AGGREGATE> factory) {
        checkNotNull(aggregateType, "No aggregateType provided");
        checkNotNull(factory, "No factory provided");
        var existing = factories.putIfAbsent(aggregateType, factory);
        checkArgument(existing == null, "A factory has already been registered for aggregate type '%s'", aggregateType.getName());
        return this;
    }

    public boolean isRegistered(Class<?> aggregateType) {
        return factories.containsKey(aggregateType);
    }

    @Override
    public <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType) {
        checkNotNull(aggregateType, "No aggregateType provided");
        var factory = factories.get(aggregateType);
        if (factory != null) {
            var aggregate = factory.get();
            if (aggregate == null) {
                throw new AggregateException(lenientFormat("The factory registered for aggregate type '%s' returned null", aggregateType.getName()));
            }
            return aggregateType.cast(aggregate);
        }
        return fallbackFactory.orElseThrow(() -> new AggregateException(lenientFormat("No factory has been registered for aggregate type '%s'", aggregateType.getName())))
                              .create(aggregateType);
    }
}
