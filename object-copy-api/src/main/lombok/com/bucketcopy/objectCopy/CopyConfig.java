package com.bucketcopy.objectCopy;

import java.io.File;
import java.net.URI;
import lombok.Data;
import lombok.Builder;

@Data @Builder
public class CopyConfig {
    public interface Factory {
        public CopyConfig create(File file);
    }
    private StoreType type;
    private File diskStorageRoot;
    private URI endpoint;
    private String region;
    private String profileName;
    private String awsAccessKeyId;
    private String awsSecretAccessKey;
    private Boolean forceV4Signature;
    private Boolean pathStyleAccess;
    private URI proxy;
    private Long partSize;
    private Integer maxConcurrency;
}
