package dk.cloudcreate.streamstore.connection;

public enum SliceReadStatus {
    SUCCESS,
    STREAM_NOT_FOUND,
    /**
     * The stream has been soft or hard deleted
     */
    STREAM_DELETED
}
