package io.github.yok.blogvault.error;

/**
 * A per-table payload could not be decoded into rows.
 *
 * @author Yasuharu.Okawauchi
 */
public class DecodeException extends BackupException {

    private static final long serialVersionUID = 1L;

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
