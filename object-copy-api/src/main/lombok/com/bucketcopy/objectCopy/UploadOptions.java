package com.bucketcopy.objectCopy;

import java.util.Date;
import java.util.Map;
import lombok.Value;
import lombok.Builder;

/**
 * Settings applied to the destination object when the upload is
 * initiated. A null field is not sent to the store.
 */
@Value @Builder(toBuilder=true)
public class UploadOptions {
    public static final String DEFAULT_ACL = "private";

    private String acl;
    private Date expires;
    private String serverSideEncryption;
    private String contentType;
    private String contentDisposition;
    private String contentEncoding;
    private String contentLanguage;
    private Map<String, String> metadata;
    private String cacheControl;
    private String storageClass;
}
