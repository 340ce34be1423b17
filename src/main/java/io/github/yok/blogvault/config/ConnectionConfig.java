package io.github.yok.blogvault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds the {@code connection} section: the blog database that is exported or restored into.
 *
 * <pre>
 * connection:
 *   url: jdbc:mysql://localhost:3306/mx_space
 *   user: mx
 *   password: secret
 *   driver-class: com.mysql.cj.jdbc.Driver
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "connection")
@Data
public class ConnectionConfig {
    // JDBC connection URL
    private String url;
    // Database user name
    private String user;
    // Database password
    private String password;
    // Fully qualified JDBC driver class name; blank relies on JDBC 4 auto-loading
    private String driverClass;
}
