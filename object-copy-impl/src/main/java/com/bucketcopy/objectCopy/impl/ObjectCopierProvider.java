package com.bucketcopy.objectCopy.impl;

import com.bucketcopy.objectCopy.*;
import java.util.concurrent.ExecutorService;
import javax.inject.Inject;
import javax.inject.Provider;

/**
 * Builds the store once and hands it to the copier along with the bound
 * executor and the configured part size.
 */
public class ObjectCopierProvider implements Provider<ObjectCopier> {
    @Inject
    private MultipartCopyStore.Factory _storeFactory;
    @Inject
    private ExecutorService _executor;
    @Inject
    private Provider<CopyConfig> _configProvider;

    @Override
    public ObjectCopier get() {
        CopyConfig config = _configProvider.get();
        Long partSize = config.getPartSize();
        return new MultipartObjectCopier(
            _storeFactory.create().build(),
            _executor,
            null == partSize ? PartitionPlanner.DEFAULT_PART_SIZE : partSize);
    }
}
