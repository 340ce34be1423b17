package io.github.yok.blogvault.util;

import io.github.yok.blogvault.error.ArchiveFormatException;
import io.github.yok.blogvault.error.DecodeException;
import io.github.yok.blogvault.error.RestoreException;
import io.github.yok.blogvault.error.TransactionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports fatal CLI errors: full trace to the log, a concise summary to {@code System.err}.
 *
 * <p>
 * The summary names what happened to the database, derived from the backup error type found in
 * the cause chain:
 * </p>
 * <ul>
 * <li>{@link ArchiveFormatException}: the archive was rejected before any transaction began.</li>
 * <li>{@link DecodeException}, {@link RestoreException}, {@link TransactionException}: the
 * restore transaction was rolled back.</li>
 * </ul>
 *
 * <p>
 * The JVM is not terminated here; {@code Main} decides the exit status through
 * {@link #exitStatus(Throwable)}. Tests switch the current thread to throwing
 * {@link IllegalStateException} instead.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_ARCHIVE_REJECTED = 2;
    public static final int EXIT_ROLLED_BACK = 3;

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Makes {@code errorAndExit} throw on the current thread.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restores reporting mode on the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Maps a failure to the process exit status.
     *
     * @param cause failure, may be {@code null}
     * @return {@link #EXIT_ARCHIVE_REJECTED}, {@link #EXIT_ROLLED_BACK} or {@link #EXIT_FAILURE}
     */
    public static int exitStatus(Throwable cause) {
        if (ExceptionUtils.throwableOfType(cause, ArchiveFormatException.class) != null) {
            return EXIT_ARCHIVE_REJECTED;
        }
        if (isRollback(cause)) {
            return EXIT_ROLLED_BACK;
        }
        return EXIT_FAILURE;
    }

    /**
     * Logs a fatal error with its stack trace and echoes the message, the root cause and the
     * outcome for the database.
     *
     * @param message message to report
     * @param cause cause of the failure
     * @throws IllegalStateException when exit is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        Throwable root = ExceptionUtils.getRootCause(cause);
        StringBuilder out = new StringBuilder("ERROR: ").append(message).append('\n')
                .append(root != null ? root.getMessage() : cause.getMessage());
        switch (exitStatus(cause)) {
            case EXIT_ARCHIVE_REJECTED:
                out.append("\nArchive rejected; the database was not touched.");
                break;
            case EXIT_ROLLED_BACK:
                out.append("\nRestore rolled back; the database is unchanged.");
                break;
            default:
                break;
        }
        System.err.println(out);
    }

    /**
     * Logs a fatal error without a cause and echoes it.
     *
     * @param message message to report
     * @throws IllegalStateException when exit is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }

    private static boolean isRollback(Throwable cause) {
        return ExceptionUtils.throwableOfType(cause, DecodeException.class) != null
                || ExceptionUtils.throwableOfType(cause, RestoreException.class) != null
                || ExceptionUtils.throwableOfType(cause, TransactionException.class) != null;
    }
}
