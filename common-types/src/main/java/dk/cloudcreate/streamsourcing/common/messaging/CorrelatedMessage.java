package dk.cloudcreate.streamsourcing.common.messaging;

import dk.cloudcreate.streamsourcing.common.types.*;

/**
 * A message that carries a correlation envelope, which links it to the causal chain it belongs to
 */
public interface CorrelatedMessage {
    /**
     * @return the unique id of this message instance
     */
    MsgId msgId();

    /**
     * @return the id shared by all messages in the causal chain this message belongs to
     */
    CorrelationId correlationId();

    /**
     * @return the {@link MsgId} of the message that caused this message
     */
    CausationId causationId();

    /**
     * Is this message the root of its causal chain
     */
    default boolean isChainRoot() {
        return causationId() != null && causationId().isCausedBy(msgId());
    }
}
