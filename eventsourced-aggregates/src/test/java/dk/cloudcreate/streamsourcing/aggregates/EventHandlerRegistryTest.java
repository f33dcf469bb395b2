package dk.cloudcreate.streamsourcing.aggregates;

import dk.cloudcreate.streamsourcing.aggregates.AccountEvents.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class EventHandlerRegistryTest {
    @Test
    void the_registry_is_built_once_per_aggregate_type() {
        var first  = EventHandlerRegistry.of(Account.class, AccountEvent.class);
        var second = EventHandlerRegistry.of(Account.class, AccountEvent.class);

        assertThat(first).isSameAs(second);
        assertThat(first.handledEventTypes()).containsExactlyInAnyOrder(AmountDeposited.class,
                                                                        AmountWithdrawn.class,
                                                                        AccountDeactivated.class,
                                                                        AccountReactivated.class,
                                                                        AccountClosed.class);
    }

    @Test
    void an_aggregate_missing_a_handler_for_a_sealed_event_type_cannot_be_created() {
        assertThatThrownBy(() -> new IncompleteLight(UUID.randomUUID()))
                .isExactlyInstanceOf(AggregateException.class)
                .hasMessageContaining(SwitchedOff.class.getName());
    }

    @Test
    void a_handler_for_a_sealed_sub_hierarchy_covers_all_its_permitted_types() {
        // Given
        var light = new DimmableLight(UUID.randomUUID());

        // When
        light.switchOn();
        light.dim(40);
        light.switchOff();

        // Then
        assertThat(light.handledEvents).containsExactly("on", "brightness", "off");
        assertThat(light.expectedVersion()).isEqualTo(3);
    }

    @Test
    void the_most_specific_handler_is_invoked() {
        // Given
        var note = new Note(UUID.randomUUID());

        // When
        note.add("hello");
        note.archive();

        // Then
        assertThat(note.handledEvents).containsExactly("added:hello", "any:NoteArchived");
    }

    @Test
    void an_event_without_a_handler_is_rejected_and_neither_applied_nor_recorded() {
        // Given
        var note = new Note(UUID.randomUUID());

        // When
        assertThatThrownBy(note::forget)
                .isExactlyInstanceOf(UnknownEventTypeException.class)
                .hasMessageContaining(NoteForgotten.class.getName());

        // Then
        assertThat(note.expectedVersion()).isEqualTo(EventSource.NO_EVENTS_HAVE_BEEN_APPLIED);
        assertThat(note.hasUncommittedEvents()).isFalse();
    }

    @Test
    void an_event_handler_with_an_invalid_signature_is_rejected() {
        assertThatThrownBy(() -> EventHandlerRegistry.of(TwoArgumentHandler.class, LightEvent.class))
                .isExactlyInstanceOf(AggregateException.class)
                .hasMessageContaining("exactly one argument");
    }

    @Test
    void exceptions_thrown_by_an_event_handler_are_propagated() {
        var note = new Note(UUID.randomUUID());

        var failure = catchThrowable(() -> note.add(""));

        assertThat(rootCauseOf(failure))
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("empty note");
        assertThat(note.hasUncommittedEvents()).isFalse();
        assertThat(note.expectedVersion()).isEqualTo(EventSource.NO_EVENTS_HAVE_BEEN_APPLIED);
    }

    @Test
    void the_registry_only_resolves_handlers_for_event_types_the_aggregate_handles() {
        var registry = EventHandlerRegistry.of(Note.class, NoteEvent.class);

        assertThat(registry.canHandle(NoteAdded.class)).isTrue();
        assertThat(registry.canHandle(NoteArchived.class)).isTrue();
        assertThat(registry.canHandle(NoteForgotten.class)).isFalse();
    }

    private static Throwable rootCauseOf(Throwable throwable) {
        assertThat(throwable).isNotNull();
        var rootCause = throwable;
        while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
            rootCause = rootCause.getCause();
        }
        return rootCause;
    }

    // ------------------------------------------------------------------------------------------------------------

    abstract static sealed class LightEvent extends Event {
    }

    static final class SwitchedOn extends LightEvent {
    }

    static final class SwitchedOff extends LightEvent {
    }

    abstract static sealed class DimmingEvent extends LightEvent {
    }

    static final class BrightnessChanged extends DimmingEvent {
        int brightness;

        BrightnessChanged(int brightness) {
            this.brightness = brightness;
        }
    }

    static class IncompleteLight extends AggregateRoot<LightEvent> {
        IncompleteLight(UUID id) {
            super(id);
        }

        @EventHandler
        private void on(SwitchedOn e) {
        }

        @EventHandler
        private void on(DimmingEvent e) {
        }
    }

    static class DimmableLight extends AggregateRoot<LightEvent> {
        final List<String> handledEvents = new ArrayList<>();

        DimmableLight(UUID id) {
            super(id);
        }

        void switchOn() {
            raise(new SwitchedOn());
        }

        void dim(int brightness) {
            raise(new BrightnessChanged(brightness));
        }

        void switchOff() {
            raise(new SwitchedOff());
        }

        @EventHandler
        private void on(SwitchedOn e) {
            handledEvents.add("on");
        }

        @EventHandler
        private void on(SwitchedOff e) {
            handledEvents.add("off");
        }

        @EventHandler
        private void on(DimmingEvent e) {
            handledEvents.add("brightness");
        }
    }

    static class TwoArgumentHandler extends AggregateRoot<LightEvent> {
        @EventHandler
        private void on(SwitchedOn e, String unexpected) {
        }
    }

    abstract static class NoteEvent extends Event {
    }

    static class NoteAdded extends NoteEvent {
        String text;

        NoteAdded(String text) {
            this.text = text;
        }
    }

    static class NoteArchived extends NoteEvent {
    }

    static class NoteForgotten extends Event {
    }

    static class Note extends AggregateRoot<NoteEvent> {
        final List<String> handledEvents = new ArrayList<>();

        Note(UUID id) {
            super(id);
        }

        void add(String text) {
            raise(new NoteAdded(text));
        }

        void archive() {
            raise(new NoteArchived());
        }

        @SuppressWarnings({"unchecked", "rawtypes"})
        void forget() {
            // Bypasses the compile time check to simulate an event type the aggregate doesn't know
            ((AggregateRoot) this).raise(new NoteForgotten());
        }

        @EventHandler
        private void on(NoteAdded e) {
            if (e.text.isEmpty()) {
                throw new IllegalStateException("empty note");
            }
            handledEvents.add("added:" + e.text);
        }

        @EventHandler
        private void on(NoteEvent e) {
            handledEvents.add("any:" + e.getClass().getSimpleName());
        }
    }
}
