package com.bucketcopy.objectCopy;

import lombok.Value;
import lombok.Builder;

@Value @Builder
public class UploadSession {
    private String bucket;
    private String key;
    private String uploadId;

    public ObjectKey getDestination() {
        return ObjectKey.builder()
            .bucket(bucket)
            .key(key)
            .build();
    }
}
