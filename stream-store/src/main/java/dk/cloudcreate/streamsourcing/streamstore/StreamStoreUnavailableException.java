package dk.cloudcreate.streamsourcing.streamstore;

/**
 * The {@link StreamStoreConnection} couldn't communicate with the underlying store (not connected, connection closed, timeouts, etc.)<br>
 * These errors are transient and retrying the operation at a later point in time may succeed.
 */
public class StreamStoreUnavailableException extends StreamStoreConnectionException {
    public final String connectionName;

    public StreamStoreUnavailableException(String connectionName, String message) {
        super(message);
        this.connectionName = connectionName;
    }

    public StreamStoreUnavailableException(String connectionName, String message, Throwable cause) {
        super(message, cause);
        this.connectionName = connectionName;
    }
}
