package dk.cloudcreate.streamsourcing.streamstore;

import dk.cloudcreate.streamsourcing.streamstore.types.ExpectedVersion;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The result of a successful append
 *
 * @see StreamStoreConnection#appendToStream(String, ExpectedVersion, java.util.List)
 */
public final class WriteResult {
    /**
     * The version the stream is at after the append, i.e. the {@link ExpectedVersion} to use for the next append
     */
    public final ExpectedVersion nextExpectedVersion;

    public WriteResult(ExpectedVersion nextExpectedVersion) {
        this.nextExpectedVersion = requireNonNull(nextExpectedVersion, "No nextExpectedVersion provided");
    }

    @Override
    public String toString() {
        return "WriteResult{" +
                "nextExpectedVersion=" + nextExpectedVersion +
                '}';
    }
}
