package com.bucketcopy.objectCopy;

import com.amazonaws.auth.AWSCredentialsProvider;
import java.io.File;
import java.net.URI;
import java.security.AccessControlException;
import java.util.List;
import javax.persistence.EntityNotFoundException;

/**
 * The server side multipart copy operations of an object store. Every
 * method is a single remote call, failures are thrown as-is and are never
 * retried here.
 */
public interface MultipartCopyStore {
    public interface Builder {
        public Builder withDiskStorageRoot(File dir);
        public Builder withEndpoint(URI endpoint);
        public Builder withRegion(String region);
        public Builder withCredentials(AWSCredentialsProvider credentials);
        public Builder withProxy(URI proxy);
        public Builder withStoreType(StoreType storeType);
        // S3 specific parameters:
        public Builder withForceV4Signature(Boolean forceV4);
        public Builder withPathStyleAccess(Boolean pathStyleAccess);
        public MultipartCopyStore build();
    }
    public interface Factory {
        public Builder create();
    }

    /**
     * Start a new multipart upload.
     *
     * @param destination is the object that the completed upload creates.
     *
     * @param options are applied to the destination object, null fields
     *     are omitted from the request.
     *
     * @return the session which contains the new upload id.
     */
    public UploadSession initiateMultipartUpload(ObjectKey destination, UploadOptions options)
        throws EntityNotFoundException, AccessControlException;

    /**
     * Copy a byte range of source into one part of the upload.
     *
     * @param session as returned from initiateMultipartUpload().
     *
     * @param source is the object to read the range from.
     *
     * @param range the inclusive byte range and the part number to write.
     *
     * @return the result that should be passed to completeMultipartUpload().
     */
    public PartResult copyPart(UploadSession session, ObjectKey source, PartRange range)
        throws EntityNotFoundException, AccessControlException;

    /**
     * Complete a multipart upload.
     *
     * @param session as returned from initiateMultipartUpload().
     *
     * @param parts as returned by copyPart(), ordered by part number.
     *
     * @throws PartTooSmallException if a part other than the last one is
     *     below the minimum part size.
     */
    public CompletedCopy completeMultipartUpload(UploadSession session, List<PartResult> parts)
        throws EntityNotFoundException, AccessControlException, PartTooSmallException;

    public void abortMultipartUpload(UploadSession session)
        throws EntityNotFoundException, AccessControlException;

    /**
     * @return the parts currently stored for this session, all pages
     *     included. A session the store no longer knows has no parts.
     */
    public List<PartResult> listParts(UploadSession session)
        throws AccessControlException;
}
