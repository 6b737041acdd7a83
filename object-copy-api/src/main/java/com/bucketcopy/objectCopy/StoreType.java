package com.bucketcopy.objectCopy;

public enum StoreType
{
    S3,
    DISK;

    private static final StoreType[] values = values();

    public static StoreType valueOf(int ordinal) {
        if ( ordinal < 0 || ordinal >= values.length ) return null;
        return values[ordinal];
    }
}
