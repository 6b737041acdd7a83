package com.bucketcopy.objectCopy.impl;

import com.bucketcopy.objectCopy.*;
import com.bucketcopy.utils.Errors;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import static com.bucketcopy.utils.IsEmpty.isEmpty;

/**
 * Drives a multipart copy: initiate the upload, copy all parts
 * concurrently on the executor, then complete the upload. If any part
 * fails the upload is aborted and the abort is verified by listing the
 * remaining parts.
 *
 * No step is retried. Only this class completes or aborts the upload
 * session it initiated, and it does so exactly once.
 */
public class MultipartObjectCopier implements ObjectCopier {
    private static final Logger LOG = LoggerFactory.getLogger(MultipartObjectCopier.class);

    private final MultipartCopyStore _store;
    private final ExecutorService _executor;
    private final long _defaultPartSize;

    public MultipartObjectCopier(MultipartCopyStore store, ExecutorService executor) {
        this(store, executor, PartitionPlanner.DEFAULT_PART_SIZE);
    }

    public MultipartObjectCopier(MultipartCopyStore store, ExecutorService executor, long defaultPartSize) {
        if ( null == store ) throw new NullPointerException("null store");
        if ( null == executor ) throw new NullPointerException("null executor");
        if ( defaultPartSize < PartitionPlanner.MINIMUM_PART_SIZE ) {
            throw new IllegalArgumentException(
                "defaultPartSize must be at least "+PartitionPlanner.MINIMUM_PART_SIZE+" got="+defaultPartSize);
        }
        _store = store;
        _executor = executor;
        _defaultPartSize = defaultPartSize;
    }

    public long getDefaultPartSize() {
        return _defaultPartSize;
    }

    @Override
    public CompletedCopy copy(CopyRequest request, String requestContext) {
        String previousContext = MDC.get(REQUEST_CONTEXT_MDC_KEY);
        if ( null != requestContext ) {
            MDC.put(REQUEST_CONTEXT_MDC_KEY, requestContext);
        }
        try {
            return copyParts(request);
        } finally {
            if ( null == previousContext ) {
                MDC.remove(REQUEST_CONTEXT_MDC_KEY);
            } else {
                MDC.put(REQUEST_CONTEXT_MDC_KEY, previousContext);
            }
        }
    }

    private CompletedCopy copyParts(CopyRequest request) {
        validate(request);
        long partSize = ( null == request.getPartSize() ) ? _defaultPartSize : request.getPartSize();
        // Plan before initiating so bad input never creates an upload:
        List<PartRange> ranges = PartitionPlanner.plan(request.getObjectSize(), partSize);
        UploadOptions options = withDefaults(request.getOptions());

        CopyRun run = new CopyRun(request.getDestination());
        UploadSession session = _store.initiateMultipartUpload(request.getDestination(), options);
        run.session = session;
        LOG.info("Initiated multipart copy source="+request.getSource()+" uploadId="+session.getUploadId()+
                 " objectSize="+request.getObjectSize()+" parts="+ranges.size());

        run.moveTo(CopyState.COPYING_PARTS);
        List<Future<PartResult>> futures = new ArrayList<>(ranges.size());
        PartCopyException failure = null;
        for ( PartRange range : ranges ) {
            try {
                futures.add(_executor.submit(new PartCopyTask(_store, session, request.getSource(), range)));
            } catch ( RejectedExecutionException ex ) {
                failure = addFailure(failure, session, range.getPartNum(), ex);
                break;
            }
        }

        List<PartResult> results = new ArrayList<>(futures.size());
        boolean interrupted = false;
        for ( int i=0; i < futures.size(); i++ ) {
            int partNum = ranges.get(i).getPartNum();
            while ( true ) {
                try {
                    results.add(futures.get(i).get());
                } catch ( ExecutionException ex ) {
                    failure = addFailure(failure, session, partNum, Errors.stitchCause(ex));
                } catch ( InterruptedException ex ) {
                    // Fail the copy but keep joining, parts in flight must settle before the abort:
                    if ( ! interrupted ) {
                        LOG.warn("Interrupted while joining part={} of uploadId={}", partNum, session.getUploadId());
                        failure = addFailure(failure, session, partNum, ex);
                    }
                    interrupted = true;
                    continue;
                }
                break;
            }
        }
        if ( null != failure ) {
            MultipartCopyException aborted;
            try {
                aborted = abort(run, failure);
            } finally {
                if ( interrupted ) Thread.currentThread().interrupt();
            }
            throw aborted;
        }

        results.sort(Comparator.comparingInt(PartResult::getPartNum));
        run.moveTo(CopyState.FINALIZING);
        CompletedCopy completed = _store.completeMultipartUpload(session, Collections.unmodifiableList(results));
        run.moveTo(CopyState.COMPLETED);
        LOG.info("Completed multipart copy to "+request.getDestination()+" etag="+completed.getEtag());
        return completed;
    }

    private MultipartCopyException abort(CopyRun run, PartCopyException failure) {
        UploadSession session = run.session;
        run.moveTo(CopyState.ABORTING);
        LOG.warn("Aborting uploadId="+session.getUploadId()+" since part="+failure.getPartNum()+
                 " failed: "+failure.getCause(), failure);
        List<PartResult> remaining;
        try {
            _store.abortMultipartUpload(session);
            remaining = _store.listParts(session);
        } catch ( RuntimeException ex ) {
            LOG.error("Abort of uploadId="+session.getUploadId()+" failed: "+ex.getMessage(), ex);
            Errors.suppress(ex, failure);
            throw ex;
        }
        if ( isEmpty(remaining) ) {
            run.moveTo(CopyState.ABORT_VERIFIED);
            return new MultipartCopyAbortedException(session, failure);
        }
        run.moveTo(CopyState.ABORT_FAILED);
        LOG.error("Parts remain after abort of uploadId="+session.getUploadId()+" remaining="+remaining);
        return new AbortIncompleteException(session, remaining, failure);
    }

    private static PartCopyException addFailure(PartCopyException failure, UploadSession session, int partNum, Throwable cause) {
        if ( null == failure ) {
            return new PartCopyException(session, partNum, cause);
        }
        LOG.debug("Additional failure of part={}: {}", partNum, cause.getMessage());
        Errors.suppress(failure, cause);
        return failure;
    }

    private static void validate(CopyRequest request) {
        if ( null == request ) {
            throw new InvalidCopyRequestException("null CopyRequest");
        }
        validate("source", request.getSource());
        validate("destination", request.getDestination());
    }

    private static void validate(String name, ObjectKey key) {
        if ( null == key || isEmpty(key.getBucket()) || isEmpty(key.getKey()) ) {
            throw new InvalidCopyRequestException("Expected "+name+" bucket and key to be set, got "+key);
        }
    }

    private static UploadOptions withDefaults(UploadOptions options) {
        if ( null == options ) {
            return UploadOptions.builder()
                .acl(UploadOptions.DEFAULT_ACL)
                .build();
        }
        if ( isEmpty(options.getAcl()) ) {
            return options.toBuilder()
                .acl(UploadOptions.DEFAULT_ACL)
                .build();
        }
        return options;
    }

    // State of one copy() call, never shared across calls:
    private static class CopyRun {
        private final ObjectKey destination;
        private CopyState state = CopyState.INITIATING;
        private UploadSession session;

        private CopyRun(ObjectKey destination) {
            this.destination = destination;
        }

        private void moveTo(CopyState next) {
            if ( LOG.isDebugEnabled() ) {
                LOG.debug("Copy to "+destination+" "+state+" -> "+next);
            }
            state = next;
        }
    }
}
