package dk.cloudcreate.streamsourcing.streamstore;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

public final class TestEvents {
    private TestEvents() {
    }

    public static EventData eventData(String eventType) {
        return new EventData(UUID.randomUUID(),
                             eventType,
                             true,
                             "{}".getBytes(StandardCharsets.UTF_8),
                             "{}".getBytes(StandardCharsets.UTF_8));
    }

    public static class ValueAdded {
        private String name;
        private int    value;

        private ValueAdded() {
        }

        public ValueAdded(String name, int value) {
            this.name = name;
            this.value = value;
        }

        public String name() {
            return name;
        }

        public int value() {
            return value;
        }
    }

    public static class ValueRemoved {
        private String name;

        private ValueRemoved() {
        }

        public ValueRemoved(String name) {
            this.name = name;
        }

        public String name() {
            return name;
        }
    }
}
