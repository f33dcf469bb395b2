package dk.cloudcreate.streamsourcing.aggregates;

import dk.cloudcreate.streamsourcing.common.messaging.CorrelatedMessage;

import java.util.Optional;

/**
 * An {@link EventSource} whose raised events continue the causal chain of a source message
 */
public interface CorrelatedEventSource extends EventSource {
    /**
     * Use <code>source</code> as the cause of every event raised until the uncommitted events are drained
     *
     * @throws IllegalStateException if the aggregate has undrained events that were raised under a different source
     */
    void correlateWith(CorrelatedMessage source);

    Optional<CorrelatedMessage> correlationSource();
}
