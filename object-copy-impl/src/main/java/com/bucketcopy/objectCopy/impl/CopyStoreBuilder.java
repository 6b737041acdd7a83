package com.bucketcopy.objectCopy.impl;

import com.amazonaws.auth.AWSCredentialsProvider;
import com.bucketcopy.objectCopy.*;
import com.bucketcopy.objectCopy.impl.disk.DiskMultipartCopyStore;
import com.bucketcopy.objectCopy.impl.s3.S3MultipartCopyStore;
import java.io.File;
import java.net.URI;
import javax.inject.Inject;

public class CopyStoreBuilder implements MultipartCopyStore.Builder {
    private URI endpoint;
    private String region;
    private AWSCredentialsProvider credentials;
    private URI proxy;
    private StoreType storeType = StoreType.S3;
    private Boolean forceV4Signature;
    private Boolean pathStyleAccess;
    private File diskStorageRoot;

    @Inject
    private S3MultipartCopyStore.Factory _s3Factory;
    @Inject
    private DiskMultipartCopyStore.Factory _diskFactory;

    @Override
    public MultipartCopyStore.Builder withEndpoint(URI endpoint) {
        this.endpoint = endpoint;
        return this;
    }

    @Override
    public MultipartCopyStore.Builder withRegion(String region) {
        this.region = region;
        return this;
    }

    @Override
    public MultipartCopyStore.Builder withCredentials(AWSCredentialsProvider credentials) {
        this.credentials = credentials;
        return this;
    }

    @Override
    public MultipartCopyStore.Builder withProxy(URI proxy) {
        this.proxy = proxy;
        return this;
    }

    @Override
    public MultipartCopyStore.Builder withStoreType(StoreType storeType) {
        this.storeType = storeType;
        return this;
    }

    @Override
    public MultipartCopyStore.Builder withForceV4Signature(Boolean forceV4Signature) {
        this.forceV4Signature = forceV4Signature;
        return this;
    }

    @Override
    public MultipartCopyStore.Builder withPathStyleAccess(Boolean pathStyleAccess) {
        this.pathStyleAccess = pathStyleAccess;
        return this;
    }

    @Override
    public MultipartCopyStore.Builder withDiskStorageRoot(File diskStorageRoot) {
        this.diskStorageRoot = diskStorageRoot;
        return this;
    }

    @Override
    public MultipartCopyStore build() {
        if ( null == storeType ) {
            throw new IllegalStateException("storeType must be set");
        }
        switch ( storeType ) {
        case S3:
            return _s3Factory.create(this);
        case DISK:
            return _diskFactory.create(this);
        default:
            throw(new RuntimeException("Unsupported store type: "+storeType));
        }
    }

    public StoreType getStoreType() {
        return storeType;
    }

    public File getDiskStorageRoot() {
        return diskStorageRoot;
    }

    public URI getProxy() {
        return proxy;
    }

    public AWSCredentialsProvider getCredentials() {
        return credentials;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    public String getRegion() {
        return region;
    }

    public Boolean getForceV4Signature() {
        return forceV4Signature;
    }

    public Boolean getPathStyleAccess() {
        return pathStyleAccess;
    }
}
