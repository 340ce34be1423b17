package io.github.yok.blogvault.error;

/**
 * Base class of checked failures raised by export and restore.
 *
 * @author Yasuharu.Okawauchi
 */
public class BackupException extends Exception {

    private static final long serialVersionUID = 1L;

    public BackupException(String message) {
        super(message);
    }

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
