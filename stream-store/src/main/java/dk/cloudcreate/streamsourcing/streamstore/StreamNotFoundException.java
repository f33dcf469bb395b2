package dk.cloudcreate.streamsourcing.streamstore;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class StreamNotFoundException extends StreamStoreConnectionException {
    public final String streamName;

    public StreamNotFoundException(String streamName) {
        super(msg("Stream '{}' doesn't exist", streamName));
        this.streamName = streamName;
    }
}
