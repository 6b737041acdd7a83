package com.bucketcopy.objectCopy;

import lombok.Value;
import lombok.Builder;

/**
 * A byte range of the source object copied into one part. Both offsets
 * are inclusive.
 */
@Value @Builder
public class PartRange {
    private int partNum;
    private long start;
    private long end;

    public long getLength() {
        return end - start + 1;
    }

    /**
     * @return the range in the form used by the copy-source-range header,
     *     for example "bytes=0-49999999".
     */
    public String toHttpRange() {
        return "bytes="+start+"-"+end;
    }
}
