package com.bucketcopy.objectCopy.impl;

import com.bucketcopy.objectCopy.InvalidCopyRequestException;
import com.bucketcopy.objectCopy.PartRange;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class PartitionPlanner {
    // Every part but the last must be at least this large:
    public static final long MINIMUM_PART_SIZE = 5242880;
    public static final long DEFAULT_PART_SIZE = 50000000;
    public static final int MAXIMUM_PARTS = 10000;

    private PartitionPlanner() {}

    /**
     * Split an object into the byte ranges of a multipart copy. A remainder
     * smaller than MINIMUM_PART_SIZE is folded into the previous range. An
     * object no larger than partSize is always a single range.
     *
     * @param objectSize is the size of the source object in bytes.
     *
     * @param partSize is the nominal size of each range.
     *
     * @return the ranges in ascending order, numbered from 1.
     *
     * @throws InvalidCopyRequestException if objectSize is not positive,
     *     partSize is below MINIMUM_PART_SIZE or more than MAXIMUM_PARTS
     *     ranges are needed.
     */
    public static List<PartRange> plan(long objectSize, long partSize) {
        if ( objectSize <= 0 ) {
            throw new InvalidCopyRequestException("objectSize must be positive, got="+objectSize);
        }
        if ( partSize < MINIMUM_PART_SIZE ) {
            throw new InvalidCopyRequestException(
                "partSize must be at least "+MINIMUM_PART_SIZE+" got="+partSize);
        }
        long numFullParts = objectSize / partSize;
        long remainder = objectSize % partSize;
        if ( numFullParts == 0 ) {
            return Collections.singletonList(range(1, 0, objectSize - 1));
        }
        boolean trailingPart = remainder >= MINIMUM_PART_SIZE;
        long numParts = numFullParts + ( trailingPart ? 1 : 0 );
        if ( numParts > MAXIMUM_PARTS ) {
            throw new InvalidCopyRequestException(
                "objectSize="+objectSize+" needs "+numParts+" parts of partSize="+partSize+
                ", at most "+MAXIMUM_PARTS+" are allowed");
        }

        List<PartRange> ranges = new ArrayList<>((int)numParts);
        for ( long index=0; index < numFullParts; index++ ) {
            long start = index * partSize;
            long end = start + partSize - 1;
            if ( index == numFullParts - 1 && ! trailingPart ) {
                end += remainder;
            }
            ranges.add(range(ranges.size() + 1, start, end));
        }
        if ( trailingPart ) {
            long start = numFullParts * partSize;
            ranges.add(range(ranges.size() + 1, start, start + remainder - 1));
        }
        return Collections.unmodifiableList(ranges);
    }

    private static PartRange range(int partNum, long start, long end) {
        return PartRange.builder()
            .partNum(partNum)
            .start(start)
            .end(end)
            .build();
    }
}
