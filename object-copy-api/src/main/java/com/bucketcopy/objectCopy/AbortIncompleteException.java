package com.bucketcopy.objectCopy;

import java.util.Collections;
import java.util.List;

/**
 * The abort call succeeded but listing the upload still shows parts. The
 * storage side needs to be inspected, see getRemainingParts().
 */
public class AbortIncompleteException extends MultipartCopyException {
    private final List<PartResult> remainingParts;

    public AbortIncompleteException(UploadSession uploadSession, List<PartResult> remainingParts, PartCopyException cause) {
        super("Abort procedure passed but copy parts were not removed (remaining="+remainingParts.size()+")",
              uploadSession, CopyState.ABORT_FAILED, cause);
        this.remainingParts = Collections.unmodifiableList(remainingParts);
    }

    public List<PartResult> getRemainingParts() {
        return remainingParts;
    }

    @Override
    public PartCopyException getCause() {
        return (PartCopyException)super.getCause();
    }
}
