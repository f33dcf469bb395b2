package dk.cloudcreate.streamsourcing.common.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Uniquely identifies a single message (command or event) instance.<br>
 * The value is always the string representation of a 128 bit {@link UUID}
 */
public class MsgId extends CharSequenceType<MsgId> {

    public MsgId(CharSequence value) {
        super(UUIDs.requireUUID(value, "MsgId"));
    }

    public MsgId(UUID value) {
        super(requireNonNull(value, "You must supply a value").toString());
    }

    public static MsgId random() {
        return new MsgId(UUID.randomUUID());
    }

    public static MsgId of(CharSequence value) {
        return new MsgId(value);
    }

    public static MsgId of(UUID value) {
        return new MsgId(value);
    }

    public UUID toUUID() {
        return UUID.fromString(toString());
    }
}
