package dk.cloudcreate.streamsourcing.common.types;

import java.util.UUID;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

final class UUIDs {
    private UUIDs() {
    }

    static CharSequence requireUUID(CharSequence value, String typeName) {
        requireNonNull(value, msg("You must supply a {} value", typeName));
        try {
            UUID.fromString(value.toString());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(msg("'{}' is not a valid {} - it must be a UUID", value, typeName), e);
        }
        return value;
    }
}
