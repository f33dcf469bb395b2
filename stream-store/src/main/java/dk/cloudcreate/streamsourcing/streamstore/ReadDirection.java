package dk.cloudcreate.streamsourcing.streamstore;

public enum ReadDirection {
    FORWARD,
    BACKWARD
}
