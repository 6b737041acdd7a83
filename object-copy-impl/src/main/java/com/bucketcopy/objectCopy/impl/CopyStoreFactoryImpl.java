package com.bucketcopy.objectCopy.impl;

import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.auth.profile.ProfileCredentialsProvider;
import com.bucketcopy.objectCopy.*;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Provider;
import javax.inject.Singleton;

/**
 * Creates store builders pre-populated from the bound CopyConfig.
 */
@Singleton
public class CopyStoreFactoryImpl implements MultipartCopyStore.Factory {
    @Inject
    private Provider<CopyConfig> _configProvider;
    @Inject @Named("BASE")
    private MultipartCopyStore.Factory _factory;

    @Override
    public MultipartCopyStore.Builder create() {
        CopyConfig config = _configProvider.get();
        MultipartCopyStore.Builder builder = _factory.create()
            .withDiskStorageRoot(config.getDiskStorageRoot())
            .withEndpoint(config.getEndpoint())
            .withRegion(config.getRegion())
            .withProxy(config.getProxy())
            .withForceV4Signature(config.getForceV4Signature())
            .withPathStyleAccess(config.getPathStyleAccess());
        if ( null != config.getType() ) {
            builder.withStoreType(config.getType());
        }
        if ( StoreType.DISK != config.getType() ) {
            builder.withCredentials(toCredentials(config));
        }
        return builder;
    }

    static AWSCredentialsProvider toCredentials(CopyConfig config) {
        if ( null != config.getProfileName() ) {
            return new ProfileCredentialsProvider(config.getProfileName());
        }
        if ( null != config.getAwsAccessKeyId() && null != config.getAwsSecretAccessKey() ) {
            return new AWSStaticCredentialsProvider(
                new BasicAWSCredentials(config.getAwsAccessKeyId(), config.getAwsSecretAccessKey()));
        }
        return DefaultAWSCredentialsProviderChain.getInstance();
    }
}
