package org.lsst.fits.redshift;

import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a pipeline step and logs how long it took.
 */
public class Timed {

    private static final Logger LOG = Logger.getLogger(Timed.class.getName());
    private static final Level DEFAULT_LOG_LEVEL = Level.FINE;

    private Timed() {
    }

    /**
     * Run a step, logging the elapsed time at FINE. The elapsed milliseconds
     * are appended to the message arguments, so the message should end with a
     * <code>%d</code> for them.
     */
    public static <T> T execute(Callable<T> step, String message, Object... args) {
        return execute(DEFAULT_LOG_LEVEL, step, message, args);
    }

    public static <T> T execute(Level logLevel, Callable<T> step, String message, Object... args) {
        long start = System.nanoTime();
        try {
            return step.call();
        } catch (RuntimeException x) {
            throw x;
        } catch (Exception x) {
            return Timed.sneakyThrow(x);
        } finally {
            long elapsed = (System.nanoTime() - start) / 1_000_000;
            LOG.log(logLevel, () -> String.format(message, append(args, elapsed)));
        }
    }

    /**
     * Run a step with no result, such as an in-place conditioning stage.
     */
    public static void run(Runnable step, String message, Object... args) {
        execute(DEFAULT_LOG_LEVEL, () -> {
            step.run();
            return null;
        }, message, args);
    }

    @SuppressWarnings("unchecked")
    private static <T extends Exception, R> R sneakyThrow(Exception t) throws T {
        throw (T) t;
    }

    private static Object[] append(Object[] args, Object arg) {
        Object[] result = new Object[args.length + 1];
        System.arraycopy(args, 0, result, 0, args.length);
        result[args.length] = arg;
        return result;
    }
}
