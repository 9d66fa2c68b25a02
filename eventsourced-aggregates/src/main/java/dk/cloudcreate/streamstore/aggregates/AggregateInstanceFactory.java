package dk.cloudcreate.streamstore.aggregates;

import org.objenesis.*;
import org.objenesis.instantiator.ObjectInstantiator;

import java.lang.reflect.*;
import java.util.concurrent.*;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Strings.lenientFormat;

/**
 * Creates the empty aggregate instances that a repository hydrates with the events loaded from a stream.
 *
 * @see #defaultConstructorFactory()
 * @see #objenesisFactory()
 * @see AggregateFactoryRegistry
 */
public interface AggregateInstanceFactory {
    /**
     * Create an empty instance of the given aggregate type
     *
     * @param aggregateType the aggregate type
     * @return a new instance to which no events have been applied
     * @throws AggregateException if the instance couldn't be created
     */
    <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType);

    /**
     * Returns an {@link AggregateInstanceFactory} that calls the no-arguments constructor (of any visibility) of the aggregate type
     */
    static AggregateInstanceFactory defaultConstructorFactory() {
        return DefaultConstructorAggregateInstanceFactory.INSTANCE;
    }

    /**
     * Returns an {@link AggregateInstanceFactory} that uses {@link Objenesis} to create instances of aggregate types that don't
     * have a no-arguments constructor.<br>
     * <b>Objenesis doesn't call any constructor nor initialize any fields</b>, so the aggregate's fields must be initialized by the handler of its creation event.
     * {@link EventSourcedAggregate} is prepared for this and applies events using its {@link EventHandler} annotated methods.
     */
    static AggregateInstanceFactory objenesisFactory() {
        return ObjenesisAggregateInstanceFactory.INSTANCE;
    }

    final class DefaultConstructorAggregateInstanceFactory implements AggregateInstanceFactory {
        private static final DefaultConstructorAggregateInstanceFactory INSTANCE = new DefaultConstructorAggregateInstanceFactory();

        /**
         * Key: aggregate type
         */
        private final ConcurrentMap<Class<?>, Constructor<?>> constructors = new ConcurrentHashMap<>();

        private DefaultConstructorAggregateInstanceFactory() {
        }

        @Override
        public <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType) {
            checkNotNull(aggregateType, "No aggregateType provided");
            var constructor = constructors.computeIfAbsent(aggregateType, DefaultConstructorAggregateInstanceFactory::resolveConstructor);
            try {
                return aggregateType.cast(constructor.newInstance());
            } catch (InvocationTargetException e) {
                throw new AggregateException(lenientFormat("The no-arguments constructor of '%s' failed", aggregateType.getName()), e.getCause());
            } catch (InstantiationException | IllegalAccessException e) {
                throw new AggregateException(lenientFormat("Failed to create an instance of '%s'", aggregateType.getName()), e);
            }
        }

        private static Constructor<?> resolveConstructor(Class<?> aggregateType) {
            if (Modifier.isAbstract(aggregateType.getModifiers())) {
                throw new AggregateException(lenientFormat("Cannot create an instance of abstract aggregate type '%s'", aggregateType.getName()));
            }
            try {
                var constructor = aggregateType.getDeclaredConstructor();
                constructor.setAccessible(true);
                return constructor;
            } catch (NoSuchMethodException e) {
                throw new AggregateException(lenientFormat("Aggregate type '%s' doesn't have a no-arguments constructor", aggregateType.getName()), e);
            }
        }
    }

    final class ObjenesisAggregateInstanceFactory implements AggregateInstanceFactory {
        private static final ObjenesisAggregateInstanceFactory INSTANCE = new ObjenesisAggregateInstanceFactory();

        private final Objenesis                                      objenesis     = new ObjenesisStd();
        private final ConcurrentMap<Class<?>, ObjectInstantiator<?>> instantiators = new ConcurrentHashMap<>();

        private ObjenesisAggregateInstanceFactory() {
        }

        @Override
        public <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType) {
            checkNotNull(aggregateType, "No aggregateType provided");
            try {
                return aggregateType.cast(instantiators.computeIfAbsent(aggregateType, objenesis::getInstantiatorOf)
                                                       .newInstance());
            } catch (ObjenesisException e) {
                throw new AggregateException(lenientFormat("Objenesis failed to create an instance of '%s'", aggregateType.getName()), e);
            }
        }
    }
}
