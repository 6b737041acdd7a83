package com.bucketcopy.objectCopy;

public interface ObjectCopier {
    // MDC key holding the requestContext passed to copy():
    public static final String REQUEST_CONTEXT_MDC_KEY = "requestContext";

    /**
     * Copy an object with a multipart upload. Either the destination is
     * created from all parts, or the upload is aborted and an exception is
     * thrown.
     *
     * @param request describes the source, destination and size.
     *
     * @param requestContext is only used for logging, may be null.
     *
     * @return the response of the complete call.
     *
     * @throws InvalidCopyRequestException if the request can not be
     *     partitioned, no store call is made in that case.
     * @throws MultipartCopyAbortedException if a part failed and the
     *     upload was cleanly aborted.
     * @throws AbortIncompleteException if a part failed and the abort left
     *     parts behind.
     */
    public CompletedCopy copy(CopyRequest request, String requestContext);

    public default CompletedCopy copy(CopyRequest request) {
        return copy(request, null);
    }
}
