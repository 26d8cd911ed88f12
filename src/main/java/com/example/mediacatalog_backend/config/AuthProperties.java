package com.example.mediacatalog_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Optional HTTP Basic protection of the API. Off by default.
 */
@ConfigurationProperties(prefix = "catalog.auth")
public class AuthProperties {
    private boolean requireAuth = false;
    private String username = "admin";
    private String password;

    public boolean isRequireAuth() { return requireAuth; }
    public void setRequireAuth(boolean requireAuth) { this.requireAuth = requireAuth; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
}
