package dk.cloudcreate.streamsourcing.common.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Identifier shared by every message that belongs to the same causal chain.<br>
 * It is assigned once, by the root of the chain, and copied unchanged to every descendant message.
 */
public class CorrelationId extends CharSequenceType<CorrelationId> {

    public CorrelationId(CharSequence value) {
        super(UUIDs.requireUUID(value, "CorrelationId"));
    }

    public static CorrelationId random() {
        return new CorrelationId(UUID.randomUUID().toString());
    }

    public static CorrelationId of(CharSequence value) {
        return new CorrelationId(value);
    }

    public static CorrelationId of(UUID value) {
        return new CorrelationId(requireNonNull(value, "You must supply a value").toString());
    }

    /**
     * The correlation id of a chain root is the root message's own {@link MsgId}
     *
     * @param rootMsgId the msg id of the root message
     * @return the correlation id for the chain started by the root message
     */
    public static CorrelationId startedBy(MsgId rootMsgId) {
        return new CorrelationId(requireNonNull(rootMsgId, "You must supply a rootMsgId"));
    }

    public UUID toUUID() {
        return UUID.fromString(toString());
    }
}
