package com.bucketcopy.objectCopy.impl.s3;

import com.amazonaws.ClientConfiguration;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.AbortMultipartUploadRequest;
import com.amazonaws.services.s3.model.AmazonS3Exception;
import com.amazonaws.services.s3.model.CannedAccessControlList;
import com.amazonaws.services.s3.model.CompleteMultipartUploadRequest;
import com.amazonaws.services.s3.model.CompleteMultipartUploadResult;
import com.amazonaws.services.s3.model.CopyPartRequest;
import com.amazonaws.services.s3.model.CopyPartResult;
import com.amazonaws.services.s3.model.InitiateMultipartUploadRequest;
import com.amazonaws.services.s3.model.ListPartsRequest;
import com.amazonaws.services.s3.model.PartETag;
import com.amazonaws.services.s3.model.PartListing;
import com.amazonaws.services.s3.model.PartSummary;
import com.amazonaws.services.s3.model.StorageClass;
import com.bucketcopy.objectCopy.*;
import com.bucketcopy.objectCopy.impl.CopyStoreBuilder;
import com.google.inject.assistedinject.Assisted;
import java.net.URI;
import java.security.AccessControlException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.persistence.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.bucketcopy.utils.IsEmpty.isEmpty;

public class S3MultipartCopyStore implements MultipartCopyStore {
    private static final Logger LOG = LoggerFactory.getLogger(S3MultipartCopyStore.class);
    private AmazonS3 amazonS3 = null;
    private URI endpoint = null;

    public static interface Factory {
        public S3MultipartCopyStore create(CopyStoreBuilder builder);
    }

    @Inject
    protected S3MultipartCopyStore(@Assisted CopyStoreBuilder builder)
    {
        if ( null == builder.getCredentials() ) {
            throw new NullPointerException("null credentials");
        }
        endpoint = builder.getEndpoint();
        Boolean forceV4Signature = builder.getForceV4Signature();
        ClientConfiguration config = new ClientConfiguration();
        URI proxy = builder.getProxy();
        if ( null != proxy ) {
            config.setProxyHost(proxy.getHost());
            if ( proxy.getPort() > 0 ) {
                config.setProxyPort(proxy.getPort());
            }
        }
        if ( null != forceV4Signature && forceV4Signature ) {
            config.setSignerOverride("AWSS3V4SignerType");
        }
        AmazonS3ClientBuilder s3Builder = AmazonS3ClientBuilder.standard()
            .withCredentials(builder.getCredentials())
            .withClientConfiguration(config);
        if ( null != endpoint ) {
            s3Builder.withEndpointConfiguration(
                new EndpointConfiguration(endpoint.toString(), builder.getRegion()));
        } else if ( null != builder.getRegion() ) {
            s3Builder.withRegion(builder.getRegion());
        }
        if ( Boolean.TRUE.equals(builder.getPathStyleAccess()) ) {
            s3Builder.withPathStyleAccessEnabled(true);
        }
        amazonS3 = s3Builder.build();
    }

    public S3MultipartCopyStore(AmazonS3 amazonS3, URI endpoint) {
        this.amazonS3 = amazonS3;
        this.endpoint = endpoint;
    }

    @Override
    public UploadSession initiateMultipartUpload(ObjectKey destination, UploadOptions options) {
        InitiateMultipartUploadRequest req = toInitiateRequest(destination, options);
        String uploadId = null;
        try {
            uploadId = amazonS3.initiateMultipartUpload(req).getUploadId();
        } catch ( AmazonS3Exception ex ) {
            throw toException(ex, destination);
        }
        return UploadSession.builder()
            .bucket(destination.getBucket())
            .key(destination.getKey())
            .uploadId(uploadId)
            .build();
    }

    @Override
    public PartResult copyPart(UploadSession session, ObjectKey source, PartRange range) {
        CopyPartRequest req = new CopyPartRequest()
            .withSourceBucketName(source.getBucket())
            .withSourceKey(source.getKey())
            .withDestinationBucketName(session.getBucket())
            .withDestinationKey(session.getKey())
            .withUploadId(session.getUploadId())
            .withPartNumber(range.getPartNum())
            .withFirstByte(range.getStart())
            .withLastByte(range.getEnd());
        CopyPartResult result = null;
        try {
            result = amazonS3.copyPart(req);
        } catch ( AmazonS3Exception ex ) {
            throw toException(ex, "source="+source+" range="+range.toHttpRange()+" destination="+session);
        }
        // Only happens when copy constraints are set, which we never do:
        if ( null == result ) {
            throw new IllegalStateException("No CopyPartResult for part="+range.getPartNum()+" of "+session);
        }
        return PartResult.builder()
            .partNum(range.getPartNum())
            .etag(result.getETag())
            .build();
    }

    @Override
    public CompletedCopy completeMultipartUpload(UploadSession session, List<PartResult> parts) {
        List<PartETag> partETags = new ArrayList<>(parts.size());
        for ( PartResult part : parts ) {
            partETags.add(new PartETag(part.getPartNum(), part.getEtag()));
        }
        CompleteMultipartUploadResult result = null;
        try {
            result = amazonS3.completeMultipartUpload(
                new CompleteMultipartUploadRequest()
                .withBucketName(session.getBucket())
                .withKey(session.getKey())
                .withUploadId(session.getUploadId())
                .withPartETags(partETags));
        } catch ( AmazonS3Exception ex ) {
            throw toException(ex, session);
        }
        return CompletedCopy.builder()
            .bucket(result.getBucketName())
            .key(result.getKey())
            .location(result.getLocation())
            .etag(result.getETag())
            .versionId(result.getVersionId())
            .uploadId(session.getUploadId())
            .build();
    }

    @Override
    public void abortMultipartUpload(UploadSession session) {
        try {
            amazonS3.abortMultipartUpload(
                new AbortMultipartUploadRequest(
                    session.getBucket(),
                    session.getKey(),
                    session.getUploadId()));
        } catch ( AmazonS3Exception ex ) {
            throw toException(ex, session);
        }
    }

    @Override
    public List<PartResult> listParts(UploadSession session) {
        ListPartsRequest req = new ListPartsRequest(
            session.getBucket(),
            session.getKey(),
            session.getUploadId());
        List<PartResult> parts = new ArrayList<>();
        PartListing listing;
        do {
            try {
                listing = amazonS3.listParts(req);
            } catch ( AmazonS3Exception ex ) {
                if ( 404 == ex.getStatusCode() && "NoSuchUpload".equals(ex.getErrorCode()) ) {
                    LOG.debug("No such upload, treating as no parts: "+session);
                    return Collections.emptyList();
                }
                throw toException(ex, session);
            }
            for ( PartSummary summary : listing.getParts() ) {
                parts.add(
                    PartResult.builder()
                    .partNum(summary.getPartNumber())
                    .etag(summary.getETag())
                    .size(summary.getSize())
                    .build());
            }
            req.setPartNumberMarker(listing.getNextPartNumberMarker());
        } while ( listing.isTruncated() );
        return Collections.unmodifiableList(parts);
    }

    /**
     * Build the initiate request, only the options that are set end up in
     * the request.
     */
    static InitiateMultipartUploadRequest toInitiateRequest(ObjectKey destination, UploadOptions options) {
        com.amazonaws.services.s3.model.ObjectMetadata meta =
            new com.amazonaws.services.s3.model.ObjectMetadata();
        InitiateMultipartUploadRequest req = new InitiateMultipartUploadRequest(
            destination.getBucket(), destination.getKey(), meta);
        if ( null == options ) return req;

        if ( ! isEmpty(options.getAcl()) ) {
            req.setCannedACL(toCannedACL(options.getAcl()));
        }
        if ( null != options.getExpires() ) {
            meta.setHttpExpiresDate(options.getExpires());
        }
        if ( ! isEmpty(options.getServerSideEncryption()) ) {
            meta.setSSEAlgorithm(options.getServerSideEncryption());
        }
        if ( ! isEmpty(options.getContentType()) ) {
            meta.setContentType(options.getContentType());
        }
        if ( ! isEmpty(options.getContentDisposition()) ) {
            meta.setContentDisposition(options.getContentDisposition());
        }
        if ( ! isEmpty(options.getContentEncoding()) ) {
            meta.setContentEncoding(options.getContentEncoding());
        }
        if ( ! isEmpty(options.getContentLanguage()) ) {
            meta.setContentLanguage(options.getContentLanguage());
        }
        Map<String, String> metadata = options.getMetadata();
        if ( ! isEmpty(metadata) ) {
            meta.setUserMetadata(metadata);
        }
        if ( ! isEmpty(options.getCacheControl()) ) {
            meta.setCacheControl(options.getCacheControl());
        }
        if ( ! isEmpty(options.getStorageClass()) ) {
            try {
                req.setStorageClass(StorageClass.fromValue(options.getStorageClass()));
            } catch ( IllegalArgumentException ex ) {
                throw new InvalidCopyRequestException("Unknown storageClass="+options.getStorageClass(), ex);
            }
        }
        return req;
    }

    private static CannedAccessControlList toCannedACL(String acl) {
        for ( CannedAccessControlList canned : CannedAccessControlList.values() ) {
            if ( canned.toString().equals(acl) ) return canned;
        }
        throw new InvalidCopyRequestException("Unknown acl="+acl);
    }

    private RuntimeException toException(AmazonS3Exception ex, ObjectKey objectKey) {
        return toException(ex, String.valueOf(objectKey));
    }

    private RuntimeException toException(AmazonS3Exception ex, UploadSession session) {
        return toException(ex, String.valueOf(session));
    }

    // The AmazonS3Exception is always kept as the cause:
    private RuntimeException toException(AmazonS3Exception ex, String target) {
        String suffix = target+" endpoint="+endpoint+" errorCode="+ex.getErrorCode();
        switch ( ex.getStatusCode() ) {
        case 400:
            if ( "EntityTooSmall".equals(ex.getErrorCode()) ) {
                return new PartTooSmallException("PartTooSmall: "+suffix, ex);
            }
            break;
        case 404:
            EntityNotFoundException notFound = new EntityNotFoundException("NotFound: "+suffix);
            notFound.initCause(ex);
            return notFound;
        case 401:
        case 403:
            AccessControlException denied = new AccessControlException("AccessDenied: "+suffix);
            denied.initCause(ex);
            return denied;
        }
        return ex;
    }
}
