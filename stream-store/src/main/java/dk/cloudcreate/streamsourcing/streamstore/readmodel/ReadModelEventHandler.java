package dk.cloudcreate.streamsourcing.streamstore.readmodel;

import java.lang.annotation.*;

/**
 * Marks a method in a {@link ReadModelBase} subclass as a handler for the event type of its first parameter.<br>
 * The method may declare a 2nd parameter of type {@link dk.cloudcreate.streamsourcing.streamstore.RecordedEvent},
 * which receives the recorded event the event was deserialized from.
 * <pre>{@code
 * @ReadModelEventHandler
 * private void on(AmountDeposited e) {
 *     balance += e.amount;
 * }
 * }</pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ReadModelEventHandler {
}
