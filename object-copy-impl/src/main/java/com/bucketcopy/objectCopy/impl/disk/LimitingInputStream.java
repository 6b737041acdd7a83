package com.bucketcopy.objectCopy.impl.disk;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads exactly maxBytesToRead bytes from the wrapped stream, failing
 * with an EOFException if it ends early.
 */
public class LimitingInputStream extends InputStream
{
    private final InputStream _in;
    private final long _maxBytesToRead;
    private long _totalBytesRead = 0;

    public LimitingInputStream(InputStream in, long maxBytesToRead)
    {
        _in = in;
        _maxBytesToRead = maxBytesToRead;
    }

    @Override
    public int available()
        throws IOException
    {
        return (int)Math.min(_in.available(), remaining());
    }

    @Override
    public void close()
        throws IOException
    {
        _in.close();
    }

    @Override
    public boolean markSupported()
    {
        return false;
    }

    @Override
    public int read()
        throws IOException
    {
        if(remaining() <= 0)
            return -1;
        int data = _in.read();
        if(data < 0)
            throw new EOFException("Expected "+remaining()+" more bytes");
        _totalBytesRead++;
        return data;
    }

    @Override
    public int read(byte[] b, int off, int len)
        throws IOException
    {
        if(len == 0)
            return 0;
        long remaining = remaining();
        if(remaining <= 0)
            return -1;
        int bytesRead = _in.read(b, off, (int)Math.min(len, remaining));
        if(bytesRead < 0)
            throw new EOFException("Expected "+remaining+" more bytes");
        _totalBytesRead += bytesRead;
        return bytesRead;
    }

    @Override
    public void reset()
    {
        throw(new UnsupportedOperationException());
    }

    private long remaining()
    {
        return _maxBytesToRead - _totalBytesRead;
    }
}
