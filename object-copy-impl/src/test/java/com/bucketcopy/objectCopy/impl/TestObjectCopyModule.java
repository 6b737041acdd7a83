package com.bucketcopy.objectCopy.impl;

import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.bucketcopy.objectCopy.*;
import com.bucketcopy.objectCopy.impl.disk.DiskMultipartCopyStore;
import com.bucketcopy.objectCopy.impl.s3.S3MultipartCopyStore;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import java.io.File;
import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import org.junit.AfterClass;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class TestObjectCopyModule {
    private static ExecutorService EXECUTOR = ObjectCopyModule.newPartCopyExecutor(
        CopyConfig.builder().maxConcurrency(2).build());

    @AfterClass
    public static void afterClass() {
        EXECUTOR.shutdownNow();
    }

    @Test
    public void testDiskCopier() throws Exception {
        File configFile = new File(getClass().getResource("/copy-config-disk.json").toURI());
        Injector injector = Guice.createInjector(
            new ObjectCopyModule(configFile),
            executorModule());

        ObjectCopier copier = injector.getInstance(ObjectCopier.class);
        assertThat(copier, instanceOf(MultipartObjectCopier.class));
        assertThat(((MultipartObjectCopier)copier).getDefaultPartSize(), equalTo(5242880L));
        assertThat(injector.getInstance(ObjectCopier.class), sameInstance(copier));

        DiskMultipartCopyStore seed = new DiskMultipartCopyStore(new File("target/module-copy-root"));
        seed.createBucket("module-bucket");
        ObjectKey source = ObjectKey.builder().bucket("module-bucket").key("source.bin").build();
        ObjectKey destination = ObjectKey.builder().bucket("module-bucket").key("destination.bin").build();
        byte[] content = new byte[2*5242880 + 99];
        new Random(42).nextBytes(content);
        seed.put(source, content);

        CompletedCopy completed = copier.copy(
            CopyRequest.builder()
            .source(source)
            .destination(destination)
            .objectSize(content.length)
            .build());

        assertThat(completed.getEtag().endsWith("-2"), equalTo(true));
        assertThat(Arrays.equals(seed.get(destination), content), equalTo(true));
    }

    @Test
    public void testS3StoreFromConfig() {
        Injector injector = Guice.createInjector(
            new ObjectCopyModule(
                CopyConfig.builder()
                .region("us-east-1")
                .awsAccessKeyId("AKIAEXAMPLEKEY")
                .awsSecretAccessKey("example-secret")
                .build()),
            executorModule());

        MultipartCopyStore.Builder builder = injector.getInstance(MultipartCopyStore.Factory.class).create();
        assertThat(builder, instanceOf(CopyStoreBuilder.class));
        CopyStoreBuilder copyStoreBuilder = (CopyStoreBuilder)builder;
        assertThat(copyStoreBuilder.getStoreType(), equalTo(StoreType.S3));
        assertThat(copyStoreBuilder.getRegion(), equalTo("us-east-1"));
        assertThat(copyStoreBuilder.getCredentials(), instanceOf(AWSStaticCredentialsProvider.class));
        assertThat(builder.build(), instanceOf(S3MultipartCopyStore.class));

        assertThat(injector.getInstance(ObjectCopier.class), instanceOf(MultipartObjectCopier.class));
    }

    @Test
    public void testEmptyConfigBuilder() {
        Injector injector = Guice.createInjector(new ObjectCopyModule(), executorModule());

        CopyStoreBuilder builder = (CopyStoreBuilder)injector.getInstance(MultipartCopyStore.Factory.class).create();

        assertThat(builder.getStoreType(), equalTo(StoreType.S3));
        assertThat(builder.getRegion(), nullValue());
        assertThat(builder.getEndpoint(), nullValue());
        assertThat(builder.getDiskStorageRoot(), nullValue());
        assertThat(builder.getCredentials(),
                   sameInstance((Object)DefaultAWSCredentialsProviderChain.getInstance()));
    }

    @Test
    public void testBuilderOverridesConfig() {
        Injector injector = Guice.createInjector(new ObjectCopyModule(), executorModule());

        MultipartCopyStore store = injector.getInstance(MultipartCopyStore.Factory.class).create()
            .withStoreType(StoreType.DISK)
            .withDiskStorageRoot(new File("target/builder-copy-root"))
            .build();
        assertThat(store, instanceOf(DiskMultipartCopyStore.class));

        store = injector.getInstance(MultipartCopyStore.Factory.class).create()
            .withRegion("us-west-2")
            .withCredentials(new AWSStaticCredentialsProvider(new BasicAWSCredentials("AKIA", "secret")))
            .build();
        assertThat(store, instanceOf(S3MultipartCopyStore.class));
    }

    @Test
    public void testDiskStoreRequiresDiskType() {
        Injector injector = Guice.createInjector(new ObjectCopyModule(), executorModule());
        try {
            injector.getInstance(DiskMultipartCopyStore.Factory.class)
                .create(injector.getInstance(CopyStoreBuilder.class));
            fail("Expected IllegalArgumentException");
        } catch ( RuntimeException ex ) {
            Throwable cause = ex;
            while ( null != cause.getCause() && ! (cause instanceof IllegalArgumentException) ) {
                cause = cause.getCause();
            }
            assertThat(cause, instanceOf(IllegalArgumentException.class));
        }
    }

    @Test
    public void testPartCopyExecutor() {
        ExecutorService executor = ObjectCopyModule.newPartCopyExecutor(null);
        try {
            assertThat(((ThreadPoolExecutor)executor).getMaximumPoolSize(),
                       equalTo(ObjectCopyModule.DEFAULT_MAX_CONCURRENCY));
        } finally {
            executor.shutdownNow();
        }
        executor = ObjectCopyModule.newPartCopyExecutor(CopyConfig.builder().maxConcurrency(3).build());
        try {
            assertThat(((ThreadPoolExecutor)executor).getMaximumPoolSize(), equalTo(3));
        } finally {
            executor.shutdownNow();
        }
        try {
            ObjectCopyModule.newPartCopyExecutor(CopyConfig.builder().maxConcurrency(0).build());
            fail("Expected IllegalArgumentException");
        } catch ( IllegalArgumentException ex ) {}
    }

    private static AbstractModule executorModule() {
        return new AbstractModule() {
            @Override
            protected void configure() {
                bind(ExecutorService.class).toInstance(EXECUTOR);
            }
        };
    }
}
