package com.bucketcopy.objectCopy;

public class MultipartCopyException extends RuntimeException {
    private final UploadSession uploadSession;
    private final CopyState state;

    public MultipartCopyException(String message, UploadSession uploadSession, CopyState state, Throwable cause) {
        super(message+": "+uploadSession, cause);
        this.uploadSession = uploadSession;
        this.state = state;
    }

    public UploadSession getUploadSession() {
        return uploadSession;
    }

    /**
     * @return the state the copy was in when this exception was raised.
     */
    public CopyState getState() {
        return state;
    }
}
