package dk.cloudcreate.streamsourcing.aggregates;

import dk.cloudcreate.essentials.shared.reflection.Reflector;
import org.objenesis.*;
import org.objenesis.instantiator.ObjectInstantiator;

import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Factory that helps a repository create an empty instance of an aggregate type before restoring it from its events.
 *
 * @see #defaultConstructorFactory()
 * @see DefaultConstructorAggregateRootInstanceFactory
 * @see #objenesisAggregateRootFactory()
 * @see ObjenesisAggregateRootInstanceFactory
 */
public interface AggregateRootInstanceFactory {
    /**
     * An {@link AggregateRootInstanceFactory} that calls the no-arguments constructor (which may be private) on the concrete aggregate type
     */
    AggregateRootInstanceFactory DEFAULT_CONSTRUCTOR_AGGREGATE_ROOT_FACTORY = new DefaultConstructorAggregateRootInstanceFactory();
    /**
     * An {@link AggregateRootInstanceFactory} that uses {@link Objenesis} to create a new instance of the aggregate.<br>
     * <b>Please note: Objenesis doesn't initialize fields nor call any constructors</b>, so field initializers in the concrete
     * aggregate aren't run. {@link AggregateRoot} has been prepared to be created by {@link Objenesis}
     */
    AggregateRootInstanceFactory OBJENESIS_AGGREGATE_ROOT_FACTORY           = new ObjenesisAggregateRootInstanceFactory();

    /**
     * Create an empty aggregate instance, i.e. an instance without an id that hasn't applied any events
     *
     * @param aggregateType the concrete aggregate type
     * @param <AGGREGATE>   the concrete aggregate type
     * @return the new instance
     */
    <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType);

    /**
     * @return #DEFAULT_CONSTRUCTOR_AGGREGATE_ROOT_FACTORY
     */
    static AggregateRootInstanceFactory defaultConstructorFactory() {
        return DEFAULT_CONSTRUCTOR_AGGREGATE_ROOT_FACTORY;
    }

    /**
     * Use this factory for aggregates that only have constructors that assign an id or raise events.
     *
     * @return #OBJENESIS_AGGREGATE_ROOT_FACTORY
     */
    static AggregateRootInstanceFactory objenesisAggregateRootFactory() {
        return OBJENESIS_AGGREGATE_ROOT_FACTORY;
    }

    /**
     * Creates aggregates through their no-arguments constructor. The constructor may be private, but it mustn't assign an id
     * or raise events, since the repository restores the id and state from the aggregate's events
     */
    class DefaultConstructorAggregateRootInstanceFactory implements AggregateRootInstanceFactory {
        @Override
        public <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType) {
            requireNonNull(aggregateType, "You must provide an aggregateType");
            return Reflector.reflectOn(aggregateType).newInstance();
        }
    }

    /**
     * Creates aggregates without calling any constructor. The {@link ObjectInstantiator} of each aggregate type is created once and reused
     */
    class ObjenesisAggregateRootInstanceFactory implements AggregateRootInstanceFactory {
        private final Objenesis                                      objenesis       = new ObjenesisStd();
        private final ConcurrentMap<Class<?>, ObjectInstantiator<?>> instantiatorMap = new ConcurrentHashMap<>();

        @SuppressWarnings("unchecked")
        @Override
        public <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType) {
            requireNonNull(aggregateType, "You must provide an aggregateType");
            return (AGGREGATE) instantiatorMap.computeIfAbsent(aggregateType,
                                                               objenesis::getInstantiatorOf)
                                              .newInstance();
        }
    }
}
