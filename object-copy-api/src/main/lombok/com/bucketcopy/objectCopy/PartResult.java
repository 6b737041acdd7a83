package com.bucketcopy.objectCopy;

import lombok.Value;
import lombok.Builder;

@Value @Builder
public class PartResult {
    private int partNum;
    private String etag; // opaque, returned by copyPart()
    private Long size; // only set by listParts()
}
