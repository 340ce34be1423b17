package io.github.yok.blogvault.error;

/**
 * Column metadata of a target table could not be read.
 *
 * @author Yasuharu.Okawauchi
 */
public class SchemaIntrospectionException extends BackupException {

    private static final long serialVersionUID = 1L;

    public SchemaIntrospectionException(String message) {
        super(message);
    }

    public SchemaIntrospectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
