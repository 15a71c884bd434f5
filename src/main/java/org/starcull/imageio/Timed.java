package org.starcull.imageio;

import java.io.IOException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility for logging how long a pipeline step took
 * @author tonyj
 */
public class Timed {

    private static final Logger LOG = Logger.getLogger(Timed.class.getName());
    private static final Level DEFAULT_LOG_LEVEL = Level.FINE;

    /**
     * A step which may fail with an I/O or format error.
     * @param <T> The result type
     */
    @FunctionalInterface
    public interface Step<T> {

        T call() throws IOException;
    }

    public static <T> T execute(Step<T> step, String message, Object... args) throws IOException {
        return execute(DEFAULT_LOG_LEVEL, step, message, args);
    }

    public static <T> T execute(Level logLevel, Step<T> step, String message, Object... args) throws IOException {
        long start = System.currentTimeMillis();
        try {
            return step.call();
        } finally {
            long stop = System.currentTimeMillis();
            LOG.log(logLevel, () -> String.format(message, append(args, stop - start)));
        }
    }

    public static <T> T compute(Supplier<T> supplier, String message, Object... args) {
        long start = System.currentTimeMillis();
        try {
            return supplier.get();
        } finally {
            long stop = System.currentTimeMillis();
            LOG.log(DEFAULT_LOG_LEVEL, () -> String.format(message, append(args, stop - start)));
        }
    }

    private static Object[] append(Object[] args, Object... arg) {
        Object[] result = new Object[args.length + arg.length];
        System.arraycopy(args, 0, result, 0, args.length);
        System.arraycopy(arg, 0, result, args.length, arg.length);
        return result;
    }
}
