package dk.cloudcreate.streamsourcing.streamstore.types;

import dk.cloudcreate.essentials.types.LongType;

import static dk.cloudcreate.essentials.shared.FailFast.requireTrue;

/**
 * The version a writer expects a stream to be at when appending to, or deleting, the stream.<br>
 * The version of a stream is the number of events that have been appended to it, so a stream that
 * contains 3 events is at version 3 and the next event appended will get event number 3 (event numbers are zero based).
 */
public class ExpectedVersion extends LongType<ExpectedVersion> {
    /**
     * Disables the optimistic concurrency check
     */
    public static final ExpectedVersion ANY       = new ExpectedVersion(-1L);
    /**
     * The stream must not contain any events (i.e. it doesn't exist yet)
     */
    public static final ExpectedVersion NO_STREAM = new ExpectedVersion(0L);

    public ExpectedVersion(Long value) {
        super(value);
        requireTrue(value >= -1L, "An ExpectedVersion must be >= -1");
    }

    public static ExpectedVersion of(long value) {
        return new ExpectedVersion(value);
    }

    public boolean isAny() {
        return value() == -1L;
    }

    /**
     * @param currentStreamVersion the current number of events in a stream
     * @return true if a stream at <code>currentStreamVersion</code> satisfies this expected version
     */
    public boolean isSatisfiedBy(long currentStreamVersion) {
        return isAny() || value() == currentStreamVersion;
    }
}
