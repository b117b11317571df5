package org.lsst.fits.linedefect;

import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility for timing a piece of work and logging how long it took.
 *
 * @author tonyj
 */
public class Timed {

    private static final Logger LOG = Logger.getLogger(Timed.class.getName());
    private static final Level DEFAULT_LOG_LEVEL = Level.FINE;

    private Timed() {
    }

    /**
     * Run the callable and log the elapsed time. The message is a format
     * string, the elapsed time in milliseconds is appended to the arguments.
     */
    public static <T> T execute(Callable<T> callable, String message, Object... args) {
        return execute(DEFAULT_LOG_LEVEL, callable, message, args);
    }

    public static <T> T execute(Level logLevel, Callable<T> callable, String message, Object... args) {
        return measure(logLevel, callable, message, args).getValue();
    }

    /**
     * Run the callable, log the elapsed time and return both the value and the
     * time taken.
     */
    public static <T> Timing<T> measure(Level logLevel, Callable<T> callable, String message, Object... args) {
        long start = System.currentTimeMillis();
        try {
            T value = callable.call();
            return new Timing<>(value, System.currentTimeMillis() - start);
        } catch (Exception x) {
            return Timed.sneakyThrow(x);
        } finally {
            long elapsed = System.currentTimeMillis() - start;
            LOG.log(logLevel, () -> String.format(message, append(args, elapsed)));
        }
    }

    @SuppressWarnings("unchecked")
    private static <T extends Exception, R> R sneakyThrow(Exception t) throws T {
        throw (T) t;
    }

    private static Object[] append(Object[] args, Object... arg) {
        Object[] result = new Object[args.length + arg.length];
        System.arraycopy(args, 0, result, 0, args.length);
        System.arraycopy(arg, 0, result, args.length, arg.length);
        return result;
    }

    public static class Timing<T> {

        private final T value;
        private final long elapsedMillis;

        private Timing(T value, long elapsedMillis) {
            this.value = value;
            this.elapsedMillis = elapsedMillis;
        }

        public T getValue() {
            return value;
        }

        public long getElapsedMillis() {
            return elapsedMillis;
        }
    }
}
