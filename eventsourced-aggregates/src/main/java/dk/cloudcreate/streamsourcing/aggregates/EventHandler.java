package dk.cloudcreate.streamsourcing.aggregates;

import java.lang.annotation.*;

/**
 * Methods annotated with this Annotation will automatically be called when an event is raised on, or restored into, an {@link AggregateRoot} instance.<br>
 * The method must take exactly one argument, which is the event type it handles.
 *
 * @see EventHandlerRegistry
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface EventHandler {
}
