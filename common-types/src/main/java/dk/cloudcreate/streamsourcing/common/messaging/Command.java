package dk.cloudcreate.streamsourcing.common.messaging;

import dk.cloudcreate.streamsourcing.common.types.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Base class for commands, i.e. requests to change state.<br>
 * A command is never persisted, but it seeds the correlation chain of the events it causes.
 * <p>
 * A command created with {@link #Command()} starts a new causal chain, whereas a command created with
 * {@link #Command(CorrelatedMessage)} continues the chain of the message that caused it.
 */
public abstract class Command implements CorrelatedMessage {
    private MsgId         msgId;
    private CorrelationId correlationId;
    private CausationId   causationId;

    /**
     * Create a command that is the root of a new causal chain
     */
    protected Command() {
        msgId = MsgId.random();
        correlationId = CorrelationId.startedBy(msgId);
        causationId = CausationId.causedBy(msgId);
    }

    /**
     * Create a command caused by <code>source</code>
     *
     * @param source the message that caused this command
     */
    protected Command(CorrelatedMessage source) {
        requireNonNull(source, "You must supply a source message");
        msgId = MsgId.random();
        correlationId = requireNonNull(source.correlationId(), "The source message doesn't have a correlationId");
        causationId = CausationId.causedBy(source.msgId());
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

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "msgId=" + msgId +
                ", correlationId=" + correlationId +
                ", causationId=" + causationId +
                '}';
    }
}
