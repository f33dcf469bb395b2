package dk.cloudcreate.streamsourcing.streamstore.serializer;

/**
 * Names of the headers stored in the metadata of every serialized event
 */
public final class EventHeaders {
    /**
     * The Fully Qualified Class Name of the event. Added by the {@link EventSerializer}
     */
    public static final String EVENT_JAVA_TYPE     = "EventJavaType";
    /**
     * Identifies all events persisted as part of the same save/commit
     */
    public static final String COMMIT_ID           = "CommitId";
    /**
     * The Fully Qualified Class Name of the aggregate that raised the event
     */
    public static final String AGGREGATE_JAVA_TYPE = "AggregateJavaType";

    private EventHeaders() {
    }
}
