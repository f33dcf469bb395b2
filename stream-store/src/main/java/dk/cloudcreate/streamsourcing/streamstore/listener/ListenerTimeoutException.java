package dk.cloudcreate.streamsourcing.streamstore.listener;

import java.time.Duration;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when a {@link StreamListener} didn't catch up with its stream, or a {@link StreamReader} completion check
 * wasn't satisfied, within the timeout provided
 */
public class ListenerTimeoutException extends RuntimeException {
    public final String   name;
    public final String   streamName;
    public final Duration timeout;

    public ListenerTimeoutException(String name, String streamName, Duration timeout, String reason) {
        super(msg("[{}] Timed out after {} ms while {} for stream '{}'",
                  name,
                  timeout.toMillis(),
                  reason,
                  streamName));
        this.name = name;
        this.streamName = streamName;
        this.timeout = timeout;
    }
}
