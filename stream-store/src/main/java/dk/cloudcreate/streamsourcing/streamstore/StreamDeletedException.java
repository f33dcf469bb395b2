package dk.cloudcreate.streamsourcing.streamstore;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The stream existed but has been deleted
 */
public class StreamDeletedException extends StreamStoreConnectionException {
    public final String streamName;

    public StreamDeletedException(String streamName) {
        super(msg("Stream '{}' has been deleted", streamName));
        this.streamName = streamName;
    }
}
