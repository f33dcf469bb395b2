package dk.cloudcreate.streamsourcing.streamstore.inmemory;

import dk.cloudcreate.streamsourcing.streamstore.*;
import dk.cloudcreate.streamsourcing.streamstore.subscription.SubscriptionDropReason;
import dk.cloudcreate.streamsourcing.streamstore.types.ExpectedVersion;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.streamsourcing.streamstore.TestEvents.eventData;
import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class InMemoryStreamStoreConnectionTest {
    private InMemoryStreamStoreConnection connection;

    @BeforeEach
    void setup() {
        connection = new InMemoryStreamStoreConnection("test");
        connection.connect();
    }

    @AfterEach
    void cleanup() {
        connection.close();
    }

    @Test
    void appending_to_a_new_stream_creates_the_stream_with_zero_based_event_numbers() {
        // When
        var result = connection.appendToStream("account-1", ExpectedVersion.NO_STREAM, eventData("Opened"), eventData("Deposited"));

        // Then
        assertThat(result.nextExpectedVersion).isEqualTo(ExpectedVersion.of(2));
        var slice = connection.readStreamForward("account-1", StreamPosition.START, 10);
        assertThat(slice.status()).isEqualTo(SliceReadStatus.SUCCESS);
        assertThat(slice.events()).extracting(RecordedEvent::eventNumber).containsExactly(0L, 1L);
        assertThat(slice.events()).extracting(RecordedEvent::eventType).containsExactly("Opened", "Deposited");
        assertThat(slice.lastEventNumber()).isEqualTo(1);
        assertThat(slice.isEndOfStream()).isTrue();
    }

    @Test
    void appending_with_the_wrong_expected_version_fails_and_leaves_the_stream_untouched() {
        // Given
        connection.appendToStream("account-1", ExpectedVersion.NO_STREAM, eventData("Opened"));

        // When
        assertThatThrownBy(() -> connection.appendToStream("account-1", ExpectedVersion.NO_STREAM, eventData("Deposited")))
                .isExactlyInstanceOf(WrongExpectedVersionException.class)
                .satisfies(e -> {
                    var wrongExpectedVersion = (WrongExpectedVersionException) e;
                    assertThat(wrongExpectedVersion.streamName).isEqualTo("account-1");
                    assertThat(wrongExpectedVersion.expectedVersion).isEqualTo(ExpectedVersion.NO_STREAM);
                    assertThat(wrongExpectedVersion.actualVersion).isEqualTo(1);
                });

        // Then
        assertThat(connection.readStreamForward("account-1", 0, 10).events()).hasSize(1);
    }

    @Test
    void a_batch_containing_a_null_event_is_rejected_without_appending_any_of_its_events() {
        // When
        assertThatThrownBy(() -> connection.appendToStream("thing-1", ExpectedVersion.NO_STREAM, Arrays.asList(eventData("Thing"), null)))
                .isInstanceOf(IllegalArgumentException.class);

        // Then
        assertThat(connection.readStreamForward("thing-1", StreamPosition.START, 10).status()).isEqualTo(SliceReadStatus.STREAM_NOT_FOUND);
        assertThat(connection.readStreamForward("$ce-thing", StreamPosition.START, 10).status()).isEqualTo(SliceReadStatus.STREAM_NOT_FOUND);
        assertThat(connection.readStreamForward("$et-Thing", StreamPosition.START, 10).status()).isEqualTo(SliceReadStatus.STREAM_NOT_FOUND);

        // And When
        connection.appendToStream("thing-1", ExpectedVersion.NO_STREAM, eventData("Thing"));
        assertThatThrownBy(() -> connection.appendToStream("thing-1", ExpectedVersion.of(1), Arrays.asList(eventData("Other"), null)))
                .isInstanceOf(IllegalArgumentException.class);

        // Then
        var slice = connection.readStreamForward("thing-1", StreamPosition.START, 10);
        assertThat(slice.events()).extracting(RecordedEvent::eventType).containsExactly("Thing");
        assertThat(connection.appendToStream("thing-1", ExpectedVersion.of(1), eventData("Other")).nextExpectedVersion).isEqualTo(ExpectedVersion.of(2));
    }

    @Test
    void appending_with_expected_version_any_skips_the_concurrency_check() {
        // Given
        connection.appendToStream("account-1", ExpectedVersion.ANY, eventData("Opened"));

        // When
        var result = connection.appendToStream("account-1", ExpectedVersion.ANY, eventData("Deposited"));

        // Then
        assertThat(result.nextExpectedVersion).isEqualTo(ExpectedVersion.of(2));
    }

    @Test
    void appending_no_events_returns_the_current_version() {
        // Given
        connection.appendToStream("account-1", ExpectedVersion.NO_STREAM, eventData("Opened"));

        // When
        var result = connection.appendToStream("account-1", ExpectedVersion.of(1), List.of());

        // Then
        assertThat(result.nextExpectedVersion).isEqualTo(ExpectedVersion.of(1));
    }

    @Test
    void appending_to_a_system_stream_is_rejected() {
        assertThatThrownBy(() -> connection.appendToStream("$ce-account", ExpectedVersion.ANY, eventData("Opened")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void operations_on_a_connection_that_is_not_connected_fail_with_StreamStoreUnavailableException() {
        // Given
        var notConnected = new InMemoryStreamStoreConnection("not-connected");

        // Then
        assertThatThrownBy(() -> notConnected.appendToStream("account-1", ExpectedVersion.ANY, eventData("Opened")))
                .isExactlyInstanceOf(StreamStoreUnavailableException.class);
        assertThatThrownBy(() -> notConnected.readStreamForward("account-1", 0, 1))
                .isExactlyInstanceOf(StreamStoreUnavailableException.class);
    }

    @Test
    void reading_a_missing_stream_returns_stream_not_found() {
        // When
        var slice = connection.readStreamForward("account-missing", 0, 10);

        // Then
        assertThat(slice.status()).isEqualTo(SliceReadStatus.STREAM_NOT_FOUND);
        assertThat(slice.events()).isEmpty();
    }

    @Test
    void reading_forward_in_pages() {
        // Given
        appendEvents("account-1", 5);

        // When
        var firstPage = connection.readStreamForward("account-1", 0, 2);
        var lastPage  = connection.readStreamForward("account-1", 4, 2);

        // Then
        assertThat(firstPage.events()).extracting(RecordedEvent::eventNumber).containsExactly(0L, 1L);
        assertThat(firstPage.nextEventNumber()).isEqualTo(2);
        assertThat(firstPage.isEndOfStream()).isFalse();
        assertThat(lastPage.events()).extracting(RecordedEvent::eventNumber).containsExactly(4L);
        assertThat(lastPage.nextEventNumber()).isEqualTo(5);
        assertThat(lastPage.isEndOfStream()).isTrue();
    }

    @Test
    void reading_backward_from_the_end() {
        // Given
        appendEvents("account-1", 5);

        // When
        var firstPage  = connection.readStreamBackward("account-1", StreamPosition.END, 3);
        var secondPage = connection.readStreamBackward("account-1", firstPage.nextEventNumber(), 3);

        // Then
        assertThat(firstPage.readDirection()).isEqualTo(ReadDirection.BACKWARD);
        assertThat(firstPage.events()).extracting(RecordedEvent::eventNumber).containsExactly(4L, 3L, 2L);
        assertThat(firstPage.isEndOfStream()).isFalse();
        assertThat(secondPage.events()).extracting(RecordedEvent::eventNumber).containsExactly(1L, 0L);
        assertThat(secondPage.isEndOfStream()).isTrue();
    }

    @Test
    void appended_events_are_linked_into_the_category_event_type_and_all_streams() {
        // Given
        connection.appendToStream("account-1", ExpectedVersion.NO_STREAM, eventData("Opened"));
        connection.appendToStream("account-2", ExpectedVersion.NO_STREAM, eventData("Opened"), eventData("Deposited"));
        connection.appendToStream("customer-1", ExpectedVersion.NO_STREAM, eventData("Registered"));

        // When
        var category  = connection.readStreamForward("$ce-account", 0, 10);
        var eventType = connection.readStreamForward("$et-Opened", 0, 10);
        var all       = connection.readStreamForward("$all", 0, 10);

        // Then
        assertThat(category.events()).extracting(RecordedEvent::originalStreamName).containsExactly("account-1", "account-2", "account-2");
        assertThat(category.events()).extracting(RecordedEvent::eventNumber).containsExactly(0L, 1L, 2L);
        assertThat(category.events()).extracting(RecordedEvent::originalEventNumber).containsExactly(0L, 0L, 1L);
        assertThat(category.events()).allMatch(RecordedEvent::isLink);
        assertThat(eventType.events()).extracting(RecordedEvent::originalStreamName).containsExactly("account-1", "account-2");
        assertThat(all.events()).hasSize(4);
        assertThat(InMemoryStreamStoreConnection.categoryStreamNameOf("bank.account-123")).isEqualTo("$ce-bank.account");
    }

    @Test
    void a_soft_deleted_stream_can_not_be_read_or_appended_to_but_stays_in_the_projections() {
        // Given
        appendEvents("account-1", 2);

        // When
        connection.deleteStream("account-1", ExpectedVersion.of(2));

        // Then
        assertThat(connection.readStreamForward("account-1", 0, 10).status()).isEqualTo(SliceReadStatus.STREAM_DELETED);
        assertThatThrownBy(() -> connection.appendToStream("account-1", ExpectedVersion.ANY, eventData("Deposited")))
                .isExactlyInstanceOf(StreamDeletedException.class);
        assertThatThrownBy(() -> connection.deleteStream("account-1", ExpectedVersion.ANY))
                .isExactlyInstanceOf(StreamDeletedException.class);
        assertThat(connection.readStreamForward("$ce-account", 0, 10).events()).hasSize(2);
    }

    @Test
    void a_hard_deleted_stream_disappears_from_the_projections() {
        // Given
        appendEvents("account-1", 2);
        appendEvents("account-2", 1);

        // When
        connection.hardDeleteStream("account-1", ExpectedVersion.ANY);

        // Then
        assertThat(connection.readStreamForward("account-1", 0, 10).status()).isEqualTo(SliceReadStatus.STREAM_DELETED);
        var category = connection.readStreamForward("$ce-account", 0, 10);
        assertThat(category.events()).extracting(RecordedEvent::originalStreamName).containsExactly("account-2");
        assertThat(category.events()).extracting(RecordedEvent::eventNumber).containsExactly(2L);
        assertThatThrownBy(() -> connection.hardDeleteStream("account-1", ExpectedVersion.ANY))
                .isExactlyInstanceOf(StreamDeletedException.class);
    }

    @Test
    void deleting_with_the_wrong_expected_version_or_a_missing_stream_fails() {
        // Given
        appendEvents("account-1", 2);

        // Then
        assertThatThrownBy(() -> connection.deleteStream("account-1", ExpectedVersion.of(1)))
                .isExactlyInstanceOf(WrongExpectedVersionException.class);
        assertThatThrownBy(() -> connection.deleteStream("account-missing", ExpectedVersion.ANY))
                .isExactlyInstanceOf(StreamNotFoundException.class);
    }

    @Test
    void a_subscription_delivers_historic_events_then_goes_live_and_delivers_new_events() {
        // Given
        appendEvents("account-1", 3);
        var received = new CopyOnWriteArrayList<Long>();
        var live     = new AtomicBoolean();

        // When
        var subscription = connection.subscribeToStreamFrom("account-1",
                                                            Optional.empty(),
                                                            recordedEvent -> received.add(recordedEvent.eventNumber()),
                                                            () -> live.set(true),
                                                            (reason, e) -> {});
        await().atMost(Duration.ofSeconds(2)).untilTrue(live);
        appendEvents("account-1", 2);

        // Then
        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(received).containsExactly(0L, 1L, 2L, 3L, 4L));
        assertThat(subscription.isLive()).isTrue();
        subscription.unsubscribe();
    }

    @Test
    void a_subscription_starts_after_the_checkpoint() {
        // Given
        appendEvents("account-1", 4);
        var received = new CopyOnWriteArrayList<Long>();

        // When
        connection.subscribeToStreamFrom("account-1",
                                         Optional.of(1L),
                                         recordedEvent -> received.add(recordedEvent.eventNumber()),
                                         () -> {},
                                         (reason, e) -> {});

        // Then
        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(received).containsExactly(2L, 3L));
    }

    @Test
    void a_subscription_to_a_stream_that_does_not_exist_yet_receives_the_events_once_appended() {
        // Given
        var received = new CopyOnWriteArrayList<RecordedEvent>();
        connection.subscribeToStreamFrom("$ce-account",
                                         Optional.empty(),
                                         received::add,
                                         () -> {},
                                         (reason, e) -> {});

        // When
        appendEvents("account-1", 1);

        // Then
        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(received).hasSize(1));
        assertThat(received.get(0).originalStreamName()).isEqualTo("account-1");
    }

    @Test
    void a_failing_subscriber_is_dropped_with_reason_subscriber_error() {
        // Given
        appendEvents("account-1", 3);
        var dropReason = new AtomicReference<SubscriptionDropReason>();
        var dropCause  = new AtomicReference<Exception>();
        var received   = new AtomicInteger();

        // When
        var subscription = connection.subscribeToStreamFrom("account-1",
                                                            Optional.empty(),
                                                            recordedEvent -> {
                                                                received.incrementAndGet();
                                                                throw new IllegalStateException("Subscriber failure");
                                                            },
                                                            () -> {},
                                                            (reason, e) -> {
                                                                dropCause.set(e);
                                                                dropReason.set(reason);
                                                            });

        // Then
        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(dropReason.get()).isEqualTo(SubscriptionDropReason.SUBSCRIBER_ERROR));
        assertThat(dropCause.get()).isInstanceOf(IllegalStateException.class);
        assertThat(received.get()).isEqualTo(1);
        assertThat(subscription.isActive()).isFalse();
    }

    @Test
    void subscriptions_are_dropped_when_unsubscribing_deleting_the_stream_or_closing_the_connection() {
        // Given
        appendEvents("account-1", 1);
        appendEvents("account-2", 1);
        var reasons = new ConcurrentHashMap<String, SubscriptionDropReason>();
        var first = connection.subscribeToStreamFrom("account-1", Optional.empty(), e -> {}, () -> {}, (reason, e) -> reasons.put("first", reason));
        connection.subscribeToStreamFrom("account-2", Optional.empty(), e -> {}, () -> {}, (reason, e) -> reasons.put("second", reason));
        connection.subscribeToStreamFrom("$all", Optional.empty(), e -> {}, () -> {}, (reason, e) -> reasons.put("third", reason));

        // When
        first.unsubscribe();
        connection.deleteStream("account-2", ExpectedVersion.ANY);
        connection.close();

        // Then
        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(reasons).containsOnly(entry("first", SubscriptionDropReason.USER_INITIATED),
                                                                                                      entry("second", SubscriptionDropReason.STREAM_DELETED),
                                                                                                      entry("third", SubscriptionDropReason.CONNECTION_CLOSED)));
    }

    @Test
    void subscribing_to_a_deleted_stream_fails() {
        // Given
        appendEvents("account-1", 1);
        connection.deleteStream("account-1", ExpectedVersion.ANY);

        // Then
        assertThatThrownBy(() -> connection.subscribeToStreamFrom("account-1", Optional.empty(), e -> {}, () -> {}, (reason, e) -> {}))
                .isExactlyInstanceOf(StreamDeletedException.class);
    }

    @Test
    void concurrent_appends_with_any_are_all_persisted_in_a_total_order() throws InterruptedException {
        // Given
        var executor = Executors.newFixedThreadPool(4);

        // When
        for (var i = 0; i < 100; i++) {
            executor.execute(() -> connection.appendToStream("account-1", ExpectedVersion.ANY, eventData("Deposited")));
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        // Then
        var eventNumbers = connection.readStreamForward("account-1", 0, 1000)
                                     .events()
                                     .stream()
                                     .map(RecordedEvent::eventNumber)
                                     .collect(Collectors.toList());
        assertThat(eventNumbers).hasSize(100);
        assertThat(eventNumbers).isSorted();
        assertThat(eventNumbers.get(99)).isEqualTo(99L);
    }

    private void appendEvents(String streamName, int numberOfEvents) {
        for (var i = 0; i < numberOfEvents; i++) {
            connection.appendToStream(streamName, ExpectedVersion.ANY, eventData("Deposited"));
        }
    }
}
