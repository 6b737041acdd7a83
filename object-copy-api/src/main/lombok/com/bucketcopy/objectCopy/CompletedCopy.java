package com.bucketcopy.objectCopy;

import lombok.Value;
import lombok.Builder;

@Value @Builder
public class CompletedCopy {
    private String bucket;
    private String key;
    private String location;
    private String etag;
    private String versionId;
    private String uploadId;
}
