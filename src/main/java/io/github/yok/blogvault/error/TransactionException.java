package io.github.yok.blogvault.error;

/**
 * Begin, commit or rollback of the restore transaction failed.
 *
 * @author Yasuharu.Okawauchi
 */
public class TransactionException extends BackupException {

    private static final long serialVersionUID = 1L;

    public TransactionException(String message) {
        super(message);
    }

    public TransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
