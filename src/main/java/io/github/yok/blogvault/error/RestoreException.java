package io.github.yok.blogvault.error;

/**
 * Any other fatal restore failure, such as a non-duplicate insert error.
 *
 * @author Yasuharu.Okawauchi
 */
public class RestoreException extends BackupException {

    private static final long serialVersionUID = 1L;

    public RestoreException(String message) {
        super(message);
    }

    public RestoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
