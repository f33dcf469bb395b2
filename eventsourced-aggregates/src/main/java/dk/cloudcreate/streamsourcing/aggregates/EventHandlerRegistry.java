package dk.cloudcreate.streamsourcing.aggregates;

import dk.cloudcreate.essentials.shared.reflection.invocation.*;

import java.lang.reflect.*;
import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The verified {@link EventHandler} methods of an aggregate type.<br>
 * A registry is built once per aggregate type (see {@link #of(Class, Class)}) and shared by all instances of that type.
 * <p>
 * If the aggregate's event base type is <code>sealed</code> then every concrete event type it permits must be handled by
 * an {@link EventHandler} method, otherwise building the registry fails with an {@link AggregateException}.<br>
 * Events are applied to an aggregate instance by the {@link PatternMatchingMethodInvoker} created using {@link #createInvoker(Object)},
 * which calls the {@link EventHandler} method with the most specific parameter type.
 */
public final class EventHandlerRegistry {
    private static final ConcurrentMap<Class<?>, EventHandlerRegistry> REGISTRIES = new ConcurrentHashMap<>();

    private final Class<?>      aggregateType;
    private final Class<?>      eventBaseType;
    private final Set<Class<?>> handledEventTypes;

    /**
     * Get the registry for <code>aggregateType</code>, building it on first use
     *
     * @param aggregateType the concrete aggregate type
     * @param eventBaseType the common super type of the events the aggregate raises
     * @return the registry
     * @throws AggregateException if an {@link EventHandler} method has an invalid signature or if a permitted event type of a sealed event hierarchy isn't handled
     */
    public static EventHandlerRegistry of(Class<?> aggregateType, Class<?> eventBaseType) {
        requireNonNull(aggregateType, "You must supply an aggregateType");
        requireNonNull(eventBaseType, "You must supply an eventBaseType");
        return REGISTRIES.computeIfAbsent(aggregateType, type -> new EventHandlerRegistry(type, eventBaseType));
    }

    private EventHandlerRegistry(Class<?> aggregateType, Class<?> eventBaseType) {
        this.aggregateType = aggregateType;
        this.eventBaseType = eventBaseType;
        this.handledEventTypes = Collections.unmodifiableSet(findHandledEventTypes(aggregateType, eventBaseType));
        verifyAllPermittedEventTypesAreHandled();
    }

    public Class<?> aggregateType() {
        return aggregateType;
    }

    public Class<?> eventBaseType() {
        return eventBaseType;
    }

    /**
     * @return the parameter types of the {@link EventHandler} methods
     */
    public Set<Class<?>> handledEventTypes() {
        return handledEventTypes;
    }

    /**
     * Is there an {@link EventHandler} method whose parameter type is <code>eventType</code> or one of its super types
     */
    public boolean canHandle(Class<?> eventType) {
        requireNonNull(eventType, "You must supply an eventType");
        return handledEventTypes.stream().anyMatch(handledType -> handledType.isAssignableFrom(eventType));
    }

    /**
     * Create the invoker that applies events to the {@link EventHandler} methods of <code>aggregate</code>
     *
     * @param aggregate the aggregate instance, which must be an instance of {@link #aggregateType()}
     * @return the invoker
     */
    @SuppressWarnings("unchecked")
    public PatternMatchingMethodInvoker<Object> createInvoker(Object aggregate) {
        requireNonNull(aggregate, "You must supply an aggregate");
        if (!aggregateType.isInstance(aggregate)) {
            throw new IllegalArgumentException(msg("'{}' isn't an instance of aggregate type '{}'",
                                                   aggregate.getClass().getName(),
                                                   aggregateType.getName()));
        }
        return new PatternMatchingMethodInvoker<>(aggregate,
                                                  new SingleArgumentAnnotatedMethodPatternMatcher<>(EventHandler.class,
                                                                                                    (Class<Object>) eventBaseType),
                                                  InvocationStrategy.InvokeMostSpecificTypeMatched);
    }

    private void verifyAllPermittedEventTypesAreHandled() {
        if (!eventBaseType.isSealed()) {
            return;
        }
        var unhandled = new ArrayList<String>();
        for (var eventType : concreteEventTypesOf(eventBaseType)) {
            if (!canHandle(eventType)) {
                unhandled.add(eventType.getName());
            }
        }
        if (!unhandled.isEmpty()) {
            throw new AggregateException(msg("Aggregate '{}' is missing @EventHandler methods for the event types {} permitted by '{}'",
                                             aggregateType.getName(),
                                             unhandled,
                                             eventBaseType.getName()));
        }
    }

    private static List<Class<?>> concreteEventTypesOf(Class<?> type) {
        var concreteTypes = new ArrayList<Class<?>>();
        if (type.isSealed()) {
            for (var permittedSubclass : type.getPermittedSubclasses()) {
                concreteTypes.addAll(concreteEventTypesOf(permittedSubclass));
            }
        } else {
            // Final, non-sealed or a record. A non-sealed abstract type must be handled as a whole
            concreteTypes.add(type);
        }
        return concreteTypes;
    }

    private static Set<Class<?>> findHandledEventTypes(Class<?> aggregateType, Class<?> eventBaseType) {
        var eventTypes = new LinkedHashSet<Class<?>>();
        Class<?> type = aggregateType;
        while (type != null && type != Object.class) {
            for (var method : type.getDeclaredMethods()) {
                if (!method.isAnnotationPresent(EventHandler.class)) {
                    continue;
                }
                if (method.getParameterCount() != 1) {
                    throw new AggregateException(msg("@EventHandler method '{}' in '{}' must take exactly one argument but takes {}",
                                                     method.getName(),
                                                     type.getName(),
                                                     method.getParameterCount()));
                }
                var parameterType = method.getParameterTypes()[0];
                if (!eventBaseType.isAssignableFrom(parameterType)) {
                    throw new AggregateException(msg("@EventHandler method '{}' in '{}' accepts '{}' which isn't a subtype of '{}'",
                                                     method.getName(),
                                                     type.getName(),
                                                     parameterType.getName(),
                                                     eventBaseType.getName()));
                }
                if (Modifier.isStatic(method.getModifiers())) {
                    throw new AggregateException(msg("@EventHandler method '{}' in '{}' must not be static",
                                                     method.getName(),
                                                     type.getName()));
                }
                eventTypes.add(parameterType);
            }
            type = type.getSuperclass();
        }
        return eventTypes;
    }
}
