package org.iceforge.quarry.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Embedded H2 database holding the persistent result cache and the token ledger.
 */
@ConfigurationProperties(prefix = "quarry.store")
public class StoreProperties {

    private String jdbcUrl = "jdbc:h2:file:./data/quarry;AUTO_SERVER=TRUE";

    private String username = "sa";

    private String password = "";

    private int maxPoolSize = 5;

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public void setJdbcUrl(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
    }
}
