package com.bucketcopy.objectCopy.impl;

import com.bucketcopy.objectCopy.*;
import com.bucketcopy.objectCopy.impl.disk.DiskMultipartCopyStore;
import com.bucketcopy.objectCopy.impl.s3.S3MultipartCopyStore;
import com.google.inject.AbstractModule;
import com.google.inject.Key;
import com.google.inject.assistedinject.FactoryModuleBuilder;
import com.google.inject.name.Names;
import java.io.File;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import javax.inject.Inject;
import javax.inject.Provider;
import javax.inject.Singleton;

/**
 * Binds ObjectCopier and the store factories. The application must bind
 * the ExecutorService that part copies run on, its size bounds how many
 * parts are copied at once (see CopyConfig.maxConcurrency).
 */
public class ObjectCopyModule extends AbstractModule {
    public static final int DEFAULT_MAX_CONCURRENCY = 10;

    private Provider<CopyConfig> _configProvider;

    // S3 with the default credential chain and region:
    public ObjectCopyModule() {
        this(CopyConfig.builder().build());
    }

    public ObjectCopyModule(String file) {
        this(new File(file));
    }

    public ObjectCopyModule(File file) {
        this(new Provider<CopyConfig>() {
                @Inject
                private CopyConfig.Factory _factory;
                private CopyConfig _config;
                @Override
                public synchronized CopyConfig get() {
                    if ( null == _config ) {
                        _config = _factory.create(file);
                    }
                    return _config;
                }
            });
    }

    public ObjectCopyModule(CopyConfig config) {
        this(() -> config);
    }

    public ObjectCopyModule(Provider<CopyConfig> configProvider) {
        if ( null == configProvider ) {
            throw new NullPointerException("null configProvider");
        }
        _configProvider = configProvider;
    }

    @Override
    protected void configure() {
        bind(MultipartCopyStore.Builder.class)
            .to(CopyStoreBuilder.class);
        bind(Key.get(MultipartCopyStore.Factory.class, Names.named("BASE")))
            .toInstance(
                new MultipartCopyStore.Factory() {
                    @Inject
                    private Provider<MultipartCopyStore.Builder> _builder;
                    @Override
                    public MultipartCopyStore.Builder create() {
                        return _builder.get();
                    }
                });
        bind(CopyConfig.class).toProvider(_configProvider);
        bind(MultipartCopyStore.Factory.class).to(CopyStoreFactoryImpl.class);
        bind(CopyConfig.Factory.class).to(CopyConfigFactoryImpl.class);
        install(new FactoryModuleBuilder()
                .implement(MultipartCopyStore.class, S3MultipartCopyStore.class)
                .build(S3MultipartCopyStore.Factory.class));
        install(new FactoryModuleBuilder()
                .implement(MultipartCopyStore.class, DiskMultipartCopyStore.class)
                .build(DiskMultipartCopyStore.Factory.class));
        bind(ObjectCopier.class)
            .toProvider(ObjectCopierProvider.class)
            .in(Singleton.class);

        requireBinding(ExecutorService.class);
    }

    /**
     * Create a fixed size pool of daemon threads suitable for binding as
     * the part copy ExecutorService.
     *
     * @param config supplies maxConcurrency, DEFAULT_MAX_CONCURRENCY is
     *     used when it is null or not set.
     *
     * @return the new executor, the caller owns its shutdown.
     */
    public static ExecutorService newPartCopyExecutor(CopyConfig config) {
        Integer maxConcurrency = ( null == config ) ? null : config.getMaxConcurrency();
        int numThreads = ( null == maxConcurrency ) ? DEFAULT_MAX_CONCURRENCY : maxConcurrency;
        if ( numThreads < 1 ) {
            throw new IllegalArgumentException("maxConcurrency must be positive, got="+numThreads);
        }
        AtomicInteger threadNum = new AtomicInteger();
        return Executors.newFixedThreadPool(numThreads, (runnable) -> {
                Thread thread = new Thread(runnable, "part-copy-"+threadNum.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
    }
}
