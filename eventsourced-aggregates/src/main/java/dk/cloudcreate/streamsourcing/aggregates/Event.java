package dk.cloudcreate.streamsourcing.aggregates;

import dk.cloudcreate.streamsourcing.common.messaging.CorrelatedMessage;
import dk.cloudcreate.streamsourcing.common.types.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Base class for the events raised by an {@link AggregateRoot}.<br>
 * The aggregate id and the correlation envelope ({@link #msgId()}, {@link #correlationId()} and {@link #causationId()})
 * are assigned by the {@link AggregateRoot} when the event is raised, so concrete events only have to carry their own payload.
 * <p>
 * Concrete events must have a no-arguments constructor (it may be private) to support deserialization.
 */
public abstract class Event implements CorrelatedMessage {
    private UUID          aggregateId;
    private MsgId         msgId;
    private CorrelationId correlationId;
    private CausationId   causationId;

    protected Event() {
    }

    /**
     * @return the id of the aggregate that raised this event or null if the event hasn't been raised yet
     */
    public UUID aggregateId() {
        return aggregateId;
    }

    @Override
    public MsgId msgId() {
        return msgId;
    }

    @Override
    public CorrelationId correlationId() {
        return correlationId;
    }

    @Override
    public CausationId causationId() {
        return causationId;
    }

    /**
     * Has the correlation envelope been assigned
     */
    public boolean isStamped() {
        return msgId != null;
    }

    void aggregateId(UUID aggregateId) {
        requireNonNull(aggregateId, "You must supply an aggregateId");
        if (this.aggregateId != null && !this.aggregateId.equals(aggregateId)) {
            throw new IllegalArgumentException(msg("Event '{}' belongs to aggregate '{}' and cannot be applied to aggregate '{}'",
                                                   getClass().getName(),
                                                   this.aggregateId,
                                                   aggregateId));
        }
        this.aggregateId = aggregateId;
    }

    /**
     * Assign a new {@link MsgId} and derive the correlation and causation from <code>source</code>.<br>
     * Without a source the event becomes the root of a new causal chain.
     */
    void stamp(Optional<CorrelatedMessage> source) {
        if (isStamped()) {
            throw new IllegalStateException(msg("Event '{}' with msgId '{}' has already been raised",
                                                getClass().getName(),
                                                msgId));
        }
        msgId = MsgId.random();
        if (source.isPresent()) {
            correlationId = requireNonNull(source.get().correlationId(), "The correlation source doesn't have a correlationId");
            causationId = CausationId.causedBy(source.get().msgId());
        } else {
            correlationId = CorrelationId.startedBy(msgId);
            causationId = CausationId.causedBy(msgId);
        }
    }
}
