package com.bucketcopy.objectCopy;

/**
 * The copy failed, the upload was aborted and no parts remain. The cause
 * is the PartCopyException that triggered the abort.
 */
public class MultipartCopyAbortedException extends MultipartCopyException {
    public MultipartCopyAbortedException(UploadSession uploadSession, PartCopyException cause) {
        super("multipart copy aborted", uploadSession, CopyState.ABORT_VERIFIED, cause);
    }

    @Override
    public PartCopyException getCause() {
        return (PartCopyException)super.getCause();
    }
}
