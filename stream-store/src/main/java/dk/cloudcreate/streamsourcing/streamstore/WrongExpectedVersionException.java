package dk.cloudcreate.streamsourcing.streamstore;

import dk.cloudcreate.streamsourcing.streamstore.types.ExpectedVersion;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an append or delete was rejected because the stream's current version didn't match
 * the expected version supplied by the caller, i.e. another writer changed the stream in between.<br>
 * This exception is never retried by the infrastructure - it's up to the caller to decide whether to reload and retry.
 */
public class WrongExpectedVersionException extends StreamStoreConnectionException {
    public final String          streamName;
    public final ExpectedVersion expectedVersion;
    public final long            actualVersion;

    public WrongExpectedVersionException(String streamName, ExpectedVersion expectedVersion, long actualVersion) {
        super(msg("Stream '{}' is at version {} but the expected version was {}",
                  streamName,
                  actualVersion,
                  expectedVersion));
        this.streamName = requireNonNull(streamName, "No streamName provided");
        this.expectedVersion = requireNonNull(expectedVersion, "No expectedVersion provided");
        this.actualVersion = actualVersion;
    }
}
