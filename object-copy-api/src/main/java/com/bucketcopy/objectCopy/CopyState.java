package com.bucketcopy.objectCopy;

/**
 * Lifecycle of a single multipart copy.
 *
 * INITIATING -&gt; COPYING_PARTS -&gt; FINALIZING -&gt; COMPLETED
 * INITIATING -&gt; COPYING_PARTS -&gt; ABORTING -&gt; ABORT_VERIFIED | ABORT_FAILED
 */
public enum CopyState {
    INITIATING,
    COPYING_PARTS,
    FINALIZING,
    COMPLETED,
    ABORTING,
    ABORT_VERIFIED,
    ABORT_FAILED;

    public boolean isTerminal() {
        return COMPLETED == this || ABORT_VERIFIED == this || ABORT_FAILED == this;
    }
}
