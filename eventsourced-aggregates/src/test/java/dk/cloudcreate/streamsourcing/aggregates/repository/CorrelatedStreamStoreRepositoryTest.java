package dk.cloudcreate.streamsourcing.aggregates.repository;

import dk.cloudcreate.streamsourcing.aggregates.*;
import dk.cloudcreate.streamsourcing.common.types.CausationId;
import dk.cloudcreate.streamsourcing.streamstore.StreamPosition;
import dk.cloudcreate.streamsourcing.streamstore.inmemory.InMemoryStreamStoreConnection;
import dk.cloudcreate.streamsourcing.streamstore.naming.*;
import dk.cloudcreate.streamsourcing.streamstore.serializer.JacksonEventSerializer;
import org.junit.jupiter.api.*;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class CorrelatedStreamStoreRepositoryTest {
    private InMemoryStreamStoreConnection   connection;
    private StreamNameBuilder               streamNameBuilder;
    private JacksonEventSerializer          serializer;
    private StreamStoreRepository           repository;
    private CorrelatedStreamStoreRepository correlatedRepository;

    @BeforeEach
    void setup() {
        connection = new InMemoryStreamStoreConnection("correlated-repository-test");
        connection.connect();
        streamNameBuilder = new PrefixedCamelCaseStreamNameBuilder();
        serializer = new JacksonEventSerializer();
        repository = new StreamStoreRepository(streamNameBuilder, connection, serializer);
        correlatedRepository = new CorrelatedStreamStoreRepository(repository);
    }

    @AfterEach
    void cleanup() {
        connection.close();
    }

    @Test
    void all_aggregates_touched_by_a_command_share_its_correlation_id() {
        // Given
        var fromAccountId = savedAccount(100);
        var toAccountId   = savedAccount(0);
        var command       = new TransferFunds(fromAccountId, toAccountId, 30);

        // When
        var from = correlatedRepository.getById(Account.class, command.fromAccountId, command);
        var to   = correlatedRepository.getById(Account.class, command.toAccountId, command);
        from.withdraw(command.amount);
        to.deposit(command.amount);
        correlatedRepository.save(from);
        correlatedRepository.save(to);

        // Then
        var withdrawn = lastPersistedEvent(fromAccountId);
        var deposited = lastPersistedEvent(toAccountId);
        assertThat((CharSequence) withdrawn.correlationId()).isEqualTo(command.correlationId());
        assertThat((CharSequence) deposited.correlationId()).isEqualTo(command.correlationId());
        assertThat((CharSequence) withdrawn.causationId()).isEqualTo(CausationId.causedBy(command.msgId()));
        assertThat((CharSequence) deposited.causationId()).isEqualTo(CausationId.causedBy(command.msgId()));
        assertThat((CharSequence) withdrawn.msgId()).isNotEqualTo(deposited.msgId());
        assertThat(repository.getById(Account.class, fromAccountId).balance()).isEqualTo(70);
        assertThat(repository.getById(Account.class, toAccountId).balance()).isEqualTo(30);
    }

    @Test
    void a_follow_up_command_continues_the_chain() {
        // Given
        var accountId = savedAccount(100);
        var root      = new TransferFunds(accountId, UUID.randomUUID(), 10);
        var followUp  = new TransferFunds(root, accountId, UUID.randomUUID(), 20);

        // When
        var account = correlatedRepository.getById(Account.class, accountId, followUp);
        account.withdraw(followUp.amount);
        correlatedRepository.save(account);

        // Then
        var event = lastPersistedEvent(accountId);
        assertThat((CharSequence) followUp.correlationId()).isEqualTo(root.correlationId());
        assertThat((CharSequence) event.correlationId()).isEqualTo(root.correlationId());
        assertThat((CharSequence) event.causationId()).isEqualTo(CausationId.causedBy(followUp.msgId()));
    }

    @Test
    void the_correlation_source_is_cleared_when_the_aggregate_is_saved() {
        // Given
        var accountId = savedAccount(100);
        var command   = new TransferFunds(accountId, UUID.randomUUID(), 10);
        var account   = correlatedRepository.getById(Account.class, accountId, command);
        account.withdraw(10);

        // When
        correlatedRepository.save(account);
        account.withdraw(5);

        // Then
        assertThat(account.correlationSource()).isEmpty();
        var event = (Event) account.uncommittedEvents().get(0);
        assertThat(event.isChainRoot()).isTrue();
    }

    @Test
    void try_get_by_id_returns_empty_for_an_unknown_aggregate() {
        var command = new TransferFunds(UUID.randomUUID(), UUID.randomUUID(), 10);

        assertThat(correlatedRepository.tryGetById(Account.class, command.fromAccountId, command)).isEmpty();
        assertThatThrownBy(() -> correlatedRepository.getById(Account.class, command.fromAccountId, command))
                .isExactlyInstanceOf(AggregateNotFoundException.class);
    }

    @Test
    void a_specific_version_can_be_loaded_with_a_source() {
        var accountId = savedAccount(100, 50);
        var command   = new TransferFunds(accountId, UUID.randomUUID(), 10);

        var account = correlatedRepository.getById(Account.class, accountId, 1, command);

        assertThat(account.balance()).isEqualTo(100);
        assertThat(account.correlationSource()).contains(command);
    }

    @Test
    void a_source_is_required() {
        var accountId = savedAccount(100);

        assertThatThrownBy(() -> correlatedRepository.getById(Account.class, accountId, null))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }

    private Event lastPersistedEvent(UUID accountId) {
        var slice = connection.readStreamBackward(streamNameBuilder.generateForAggregate(Account.class, accountId), StreamPosition.END, 1);
        assertThat(slice.events()).hasSize(1);
        return (Event) serializer.deserialize(slice.events().get(0));
    }

    private UUID savedAccount(long... deposits) {
        var accountId = UUID.randomUUID();
        var account   = new Account(accountId);
        for (var amount : deposits) {
            if (amount > 0) {
                account.deposit(amount);
            }
        }
        if (!account.hasUncommittedEvents()) {
            account.deactivate();
            account.reactivate();
        }
        repository.save(account);
        return accountId;
    }
}
