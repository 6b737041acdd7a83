package com.bucketcopy.objectCopy.impl;

import com.bucketcopy.objectCopy.*;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import javax.inject.Singleton;
import javax.json.Json;
import javax.json.JsonNumber;
import javax.json.JsonObject;
import javax.json.JsonReader;
import javax.json.JsonValue;

/**
 * Reads a CopyConfig from a JSON file such as:
 *
 * <pre>
 * {"type":"S3",
 *  "region":"us-east-1",
 *  "profileName":"beta",
 *  "partSize":100000000,
 *  "maxConcurrency":20}
 * </pre>
 */
@Singleton
public class CopyConfigFactoryImpl implements CopyConfig.Factory {
    protected CopyConfigFactoryImpl() {}

    @Override
    public CopyConfig create(File file) {
        if ( ! file.exists() ) {
            throw new IllegalArgumentException("Expected file '"+file+"' to exist");
        }
        JsonObject obj;
        try ( FileInputStream is = new FileInputStream(file);
              JsonReader reader = Json.createReader(is) )
        {
            obj = reader.readObject();
        } catch ( IOException ex ) {
            throw new UncheckedIOException(ex);
        }
        StoreType type = toStoreType(getString(obj, "type"));
        String profileName = getString(obj, "profileName");
        String awsAccessKeyId = getString(obj, "awsAccessKeyId");
        String awsSecretAccessKey = getString(obj, "awsSecretAccessKey");
        if ( null != profileName && ( null != awsAccessKeyId || null != awsSecretAccessKey ) ) {
            throw new IllegalArgumentException(
                "Expected 'awsAccessKeyId' and 'awsSecretAccessKey' "+
                "to not be defined since 'profileName' is set in "+file);
        }
        if ( null == awsAccessKeyId ^ null == awsSecretAccessKey ) {
            throw new IllegalArgumentException(
                "Expected 'awsAccessKeyId' AND 'awsSecretAccessKey'"+
                " to both be set (or both not set) in "+file);
        }
        File diskStorageRoot = toFile(getString(obj, "diskStorageRoot"));
        if ( StoreType.DISK == type && null == diskStorageRoot ) {
            throw new IllegalArgumentException(
                "Expected 'diskStorageRoot' to be set since 'type' is DISK in "+file);
        }
        return CopyConfig.builder()
            .type(type)
            .diskStorageRoot(diskStorageRoot)
            .endpoint(toURI(getString(obj, "endpoint")))
            .region(getString(obj, "region"))
            .profileName(profileName)
            .awsAccessKeyId(awsAccessKeyId)
            .awsSecretAccessKey(awsSecretAccessKey)
            .forceV4Signature(getBoolean(obj, "forceV4Signature"))
            .pathStyleAccess(getBoolean(obj, "pathStyleAccess"))
            .proxy(toURI(getString(obj, "proxy")))
            .partSize(getLong(obj, "partSize"))
            .maxConcurrency(toInteger(getLong(obj, "maxConcurrency")))
            .build();
    }

    private static URI toURI(String str) {
        if ( null == str ) return null;
        return URI.create(str);
    }

    private static File toFile(String str) {
        if ( null == str ) return null;
        return new File(str);
    }

    private static Integer toInteger(Long value) {
        if ( null == value ) return null;
        return Math.toIntExact(value);
    }

    private static Boolean getBoolean(JsonObject obj, String field) {
        if ( null == obj || ! obj.containsKey(field) ) return null;
        JsonValue value = obj.get(field);
        if ( JsonValue.TRUE.equals(value) ) return Boolean.TRUE;
        if ( JsonValue.FALSE.equals(value) ) return Boolean.FALSE;
        String str = getString(obj, field);
        if ( null == str ) return null;
        switch ( str.toLowerCase() ) {
        case "true":  return Boolean.TRUE;
        case "false": return Boolean.FALSE;
        }
        return null;
    }

    private static Long getLong(JsonObject obj, String field) {
        if ( null == obj || ! obj.containsKey(field) ) return null;
        JsonValue value = obj.get(field);
        if ( value instanceof JsonNumber ) {
            return ((JsonNumber)value).longValueExact();
        }
        String str = getString(obj, field);
        if ( null == str ) return null;
        try {
            return Long.parseLong(str);
        } catch ( NumberFormatException ex ) {
            throw new IllegalArgumentException("Expected '"+field+"' to be a number, got "+str, ex);
        }
    }

    private static StoreType toStoreType(String type) {
        if ( null == type ) return null;
        try {
            return StoreType.valueOf(type);
        } catch ( IllegalArgumentException ex ) {
            return null;
        }
    }

    private static String getString(JsonObject obj, String field) {
        if ( null == obj || ! obj.containsKey(field) ) return null;
        try {
            return obj.getString(field);
        } catch ( ClassCastException ex ) {
            return null;
        }
    }
}
