package com.bucketcopy.objectCopy;

/**
 * The first part copy that failed. Further part failures of the same
 * copy are attached as suppressed exceptions.
 */
public class PartCopyException extends MultipartCopyException {
    private final int partNum;

    public PartCopyException(UploadSession uploadSession, int partNum, Throwable cause) {
        super("Copy of part "+partNum+" failed", uploadSession, CopyState.COPYING_PARTS, cause);
        this.partNum = partNum;
    }

    public int getPartNum() {
        return partNum;
    }
}
