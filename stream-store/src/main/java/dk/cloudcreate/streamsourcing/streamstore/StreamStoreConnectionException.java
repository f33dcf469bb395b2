package dk.cloudcreate.streamsourcing.streamstore;

/**
 * Base class for all errors reported by a {@link StreamStoreConnection}
 *
 * @see StreamStoreUnavailableException
 * @see WrongExpectedVersionException
 * @see StreamNotFoundException
 * @see StreamDeletedException
 */
public class StreamStoreConnectionException extends RuntimeException {
    public StreamStoreConnectionException(String message) {
        super(message);
    }

    public StreamStoreConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    public StreamStoreConnectionException(Throwable cause) {
        super(cause);
    }
}
