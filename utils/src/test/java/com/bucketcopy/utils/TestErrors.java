package com.bucketcopy.utils;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.junit.Test;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class TestErrors {
    @Test
    public void testStitchCauseKeepsUncheckedType() throws Exception {
        IllegalStateException failure = new IllegalStateException("boom");
        CompletableFuture<String> future = new CompletableFuture<>();
        future.completeExceptionally(failure);
        int originalDepth = failure.getStackTrace().length;
        try {
            future.get();
            fail("Expected ExecutionException");
        } catch ( ExecutionException ex ) {
            RuntimeException stitched = Errors.stitchCause(ex);
            assertSame(failure, stitched);
            assertThat(stitched.getStackTrace().length > originalDepth, is(true));
        }
    }

    @Test
    public void testStitchCauseWrapsChecked() {
        IOException io = new IOException("disk");
        RuntimeException stitched = Errors.stitchCause(new ExecutionException(io));
        assertThat(stitched.getClass(), equalTo(RuntimeException.class));
        assertSame(io, stitched.getCause());
    }

    @Test
    public void testRethrowWrapsCheckedExceptions() {
        try {
            Errors.rethrow(() -> { throw new IOException("nope"); });
            fail("Expected RuntimeException");
        } catch ( RuntimeException ex ) {
            assertThat(ex.getCause(), instanceOf(IOException.class));
        }
        assertEquals("ok", Errors.rethrow(() -> "ok"));
    }

    @Test(expected=IllegalArgumentException.class)
    public void testRethrowPassesUncheckedThrough() {
        Errors.rethrow(() -> { throw new IllegalArgumentException("bad"); });
    }

    @Test
    public void testSuppress() {
        RuntimeException primary = new RuntimeException("primary");
        RuntimeException secondary = new RuntimeException("secondary");
        assertSame(primary, Errors.suppress(primary, secondary));
        assertThat(primary.getSuppressed().length, equalTo(1));
        assertSame(secondary, primary.getSuppressed()[0]);

        assertSame(secondary, Errors.suppress(null, secondary));
        // Self suppression is not allowed by Throwable:
        Errors.suppress(primary, primary);
        assertThat(primary.getSuppressed().length, equalTo(1));
    }
}
