package dk.cloudcreate.streamsourcing.aggregates;

import dk.cloudcreate.streamsourcing.common.messaging.*;

import java.util.UUID;

public class TransferFunds extends Command {
    public final UUID fromAccountId;
    public final UUID toAccountId;
    public final long amount;

    public TransferFunds(UUID fromAccountId, UUID toAccountId, long amount) {
        this.fromAccountId = fromAccountId;
        this.toAccountId = toAccountId;
        this.amount = amount;
    }

    public TransferFunds(CorrelatedMessage source, UUID fromAccountId, UUID toAccountId, long amount) {
        super(source);
        this.fromAccountId = fromAccountId;
        this.toAccountId = toAccountId;
        this.amount = amount;
    }
}
