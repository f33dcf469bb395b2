package dk.cloudcreate.streamsourcing.streamstore;

public enum SliceReadStatus {
    SUCCESS,
    STREAM_NOT_FOUND,
    STREAM_DELETED
}
