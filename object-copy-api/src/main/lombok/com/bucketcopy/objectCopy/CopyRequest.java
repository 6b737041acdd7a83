package com.bucketcopy.objectCopy;

import lombok.Value;
import lombok.Builder;

@Value @Builder
public class CopyRequest {
    private ObjectKey source;
    private ObjectKey destination;
    private long objectSize;
    // null to use the copier's default part size:
    private Long partSize;
    private UploadOptions options;
}
