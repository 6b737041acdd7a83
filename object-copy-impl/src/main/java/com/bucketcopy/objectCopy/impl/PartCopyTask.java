package com.bucketcopy.objectCopy.impl;

import com.bucketcopy.objectCopy.MultipartCopyStore;
import com.bucketcopy.objectCopy.ObjectKey;
import com.bucketcopy.objectCopy.PartRange;
import com.bucketcopy.objectCopy.PartResult;
import com.bucketcopy.objectCopy.UploadSession;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Copies one range of the source into its part of the upload session.
 * Runs on an executor thread with the MDC of the thread that created it.
 */
public class PartCopyTask implements Callable<PartResult> {
    private static final Logger LOG = LoggerFactory.getLogger(PartCopyTask.class);

    private final MultipartCopyStore _store;
    private final UploadSession _session;
    private final ObjectKey _source;
    private final PartRange _range;
    private final Map<String, String> _mdc;

    public PartCopyTask(MultipartCopyStore store, UploadSession session, ObjectKey source, PartRange range) {
        _store = store;
        _session = session;
        _source = source;
        _range = range;
        _mdc = MDC.getCopyOfContextMap();
    }

    public PartRange getRange() {
        return _range;
    }

    @Override
    public PartResult call() {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        setContextMap(_mdc);
        try {
            if ( LOG.isDebugEnabled() ) {
                LOG.debug("Copying part="+_range.getPartNum()+" range="+_range.toHttpRange()+
                          " source="+_source+" uploadId="+_session.getUploadId());
            }
            PartResult result = _store.copyPart(_session, _source, _range);
            if ( result.getPartNum() != _range.getPartNum() ) {
                // Always key the result by the part we asked for:
                result = PartResult.builder()
                    .partNum(_range.getPartNum())
                    .etag(result.getEtag())
                    .build();
            }
            LOG.debug("Copied part={} etag={}", result.getPartNum(), result.getEtag());
            return result;
        } finally {
            setContextMap(previous);
        }
    }

    private static void setContextMap(Map<String, String> contextMap) {
        if ( null == contextMap ) {
            MDC.clear();
        } else {
            MDC.setContextMap(contextMap);
        }
    }
}
