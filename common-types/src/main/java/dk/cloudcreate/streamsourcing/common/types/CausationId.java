package dk.cloudcreate.streamsourcing.common.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The {@link MsgId} of the message that directly caused a message.<br>
 * A chain root is caused by itself, i.e. its {@link CausationId} is equal to its own {@link MsgId}
 */
public class CausationId extends CharSequenceType<CausationId> {

    public CausationId(CharSequence value) {
        super(UUIDs.requireUUID(value, "CausationId"));
    }

    public static CausationId of(CharSequence value) {
        return new CausationId(value);
    }

    public static CausationId of(UUID value) {
        return new CausationId(requireNonNull(value, "You must supply a value").toString());
    }

    /**
     * @param parentMsgId the msg id of the message that caused the new message
     * @return the causation id pointing at the parent message
     */
    public static CausationId causedBy(MsgId parentMsgId) {
        return new CausationId(requireNonNull(parentMsgId, "You must supply a parentMsgId"));
    }

    public boolean isCausedBy(MsgId msgId) {
        return msgId != null && toString().equals(msgId.toString());
    }

    public UUID toUUID() {
        return UUID.fromString(toString());
    }
}
