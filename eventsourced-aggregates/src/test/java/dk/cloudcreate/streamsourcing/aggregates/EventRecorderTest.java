package dk.cloudcreate.streamsourcing.aggregates;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EventRecorderTest {
    @Test
    void recorded_events_are_drained_in_order_and_only_once() {
        // Given
        var recorder = new EventRecorder();
        recorder.record("first");
        recorder.record("second");

        // When
        var drained = recorder.drainRecordedEvents();

        // Then
        assertThat(drained).containsExactly("first", "second");
        assertThat(recorder.hasRecordedEvents()).isFalse();
        assertThat(recorder.drainRecordedEvents()).isEmpty();
    }

    @Test
    void draining_returns_a_copy_that_is_unaffected_by_later_records() {
        var recorder = new EventRecorder();
        recorder.record("first");
        var drained = recorder.drainRecordedEvents();

        recorder.record("second");

        assertThat(drained).containsExactly("first");
        assertThat(recorder.recordedEvents()).containsExactly("second");
    }

    @Test
    void recorded_events_view_is_read_only() {
        var recorder = new EventRecorder();
        recorder.record("first");

        assertThatThrownBy(() -> recorder.recordedEvents().add("second"))
                .isExactlyInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void recording_null_fails() {
        var recorder = new EventRecorder();

        assertThatThrownBy(() -> recorder.record(null))
                .isExactlyInstanceOf(IllegalArgumentException.class);
        assertThat(recorder.hasRecordedEvents()).isFalse();
    }
}
