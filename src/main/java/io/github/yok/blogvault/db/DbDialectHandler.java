package io.github.yok.blogvault.db;

/**
 * Aggregate interface for database-dialect behavior.
 *
 * <p>
 * Composes the connection/session, metadata, value binding and SQL capability contracts used by
 * export and restore.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDialectHandler extends DbDialectConnectionOperations,
        DbDialectMetadataOperations, DbDialectValueOperations, DbDialectSqlOperations {
}
