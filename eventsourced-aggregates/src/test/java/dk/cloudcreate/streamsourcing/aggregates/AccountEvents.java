package dk.cloudcreate.streamsourcing.aggregates;

public final class AccountEvents {
    // Note: These Events rely on the JacksonEventSerializer's field visibility, so they only need a no-arguments constructor
    public abstract static sealed class AccountEvent extends Event {
    }

    public static final class AmountDeposited extends AccountEvent {
        private long amount;

        public AmountDeposited() {
        }

        public AmountDeposited(long amount) {
            this.amount = amount;
        }

        public long getAmount() {
            return amount;
        }
    }

    public static final class AmountWithdrawn extends AccountEvent {
        private long amount;

        public AmountWithdrawn() {
        }

        public AmountWithdrawn(long amount) {
            this.amount = amount;
        }

        public long getAmount() {
            return amount;
        }
    }

    public static final class AccountDeactivated extends AccountEvent {
    }

    public static final class AccountReactivated extends AccountEvent {
    }

    public static final class AccountClosed extends AccountEvent {
    }

    private AccountEvents() {
    }
}
