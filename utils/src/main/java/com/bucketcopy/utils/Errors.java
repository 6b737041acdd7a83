package com.bucketcopy.utils;

import java.util.Arrays;
import java.util.concurrent.Callable;

public class Errors {
    public interface VoidCallable {
        public void call() throws Exception;
    }

    /**
     * Usage:
     *
     * ... = Errors.rethrow(() -&gt; Files.readAllBytes(path));
     *
     * Rethrows ONLY non-RuntimeExceptions as a new
     * chained RuntimeException.
     *
     * @param <V> is the type of the value returned by fn.
     *
     * @param fn is the function to immediately execute.
     *
     * @return the result of the fn.
     */
    public static <V> V rethrow(Callable<V> fn) {
        try {
            return fn.call();
        } catch ( RuntimeException ex ) {
            throw ex;
        } catch ( Exception ex ) {
            throw new RuntimeException(ex);
        }
    }

    public static void rethrow(VoidCallable fn) {
        rethrow(() -> {
                fn.call();
                return null;
            });
    }

    /**
     * Usage:
     *
     * try {
     *     future.get();
     * } catch ( ExecutionException ee ) {
     *     throw Errors.stitchCause(ee);
     * }
     *
     * The original exception type is retained when it is unchecked,
     * otherwise it is wrapped in a RuntimeException.
     *
     * @param ex an exception with a cause to stitch.
     *
     * @return the cause of ex with the stack trace of ex appended.
     */
    public static RuntimeException stitchCause(Throwable ex) {
        Throwable cause = ex.getCause();
        if ( null == cause ) {
            return ( ex instanceof RuntimeException ) ? (RuntimeException)ex : new RuntimeException(ex);
        }
        stitchStackTrace(cause, ex.getStackTrace());
        if ( cause instanceof RuntimeException ) {
            return (RuntimeException)cause;
        }
        return new RuntimeException(cause);
    }

    /**
     * Attaches secondary to primary as a suppressed exception.
     *
     * @param primary the exception that will be thrown, may be null.
     *
     * @param secondary the exception to attach.
     *
     * @return primary, or secondary if primary is null.
     */
    public static Throwable suppress(Throwable primary, Throwable secondary) {
        if ( null == primary ) return secondary;
        if ( null != secondary && primary != secondary ) {
            primary.addSuppressed(secondary);
        }
        return primary;
    }

    public static <T extends Throwable> T stitchStackTrace(T ex, StackTraceElement[] stackTrace) {
        ex.setStackTrace(concatenate(ex.getStackTrace(), stackTrace));
        return ex;
    }

    private static <T> T[] concatenate(T[] a, T[] b) {
        if ( null == a ) return b;
        if ( null == b ) return a;
        T[] c = Arrays.copyOf(a, a.length+b.length);
        System.arraycopy(b, 0, c, a.length, b.length);
        return c;
    }
}
