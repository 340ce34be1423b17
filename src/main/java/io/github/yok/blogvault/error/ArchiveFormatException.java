package io.github.yok.blogvault.error;

/**
 * The archive container is unreadable. Raised before any transaction is opened.
 *
 * @author Yasuharu.Okawauchi
 */
public class ArchiveFormatException extends BackupException {

    private static final long serialVersionUID = 1L;

    public ArchiveFormatException(String message) {
        super(message);
    }

    public ArchiveFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
