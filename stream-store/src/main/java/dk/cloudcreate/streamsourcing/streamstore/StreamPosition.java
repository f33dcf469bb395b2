package dk.cloudcreate.streamsourcing.streamstore;

/**
 * Well known event numbers used as starting points when reading a stream
 */
public final class StreamPosition {
    /**
     * The first event in a stream
     */
    public static final long START = 0;
    /**
     * The last event in a stream (only meaningful when reading backwards)
     */
    public static final long END   = -1;

    private StreamPosition() {
    }
}
