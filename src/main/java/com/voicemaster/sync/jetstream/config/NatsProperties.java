package com.voicemaster.sync.jetstream.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * NATS connection settings plus the subject namespace of the platform bridge.
 *
 * <h2>Binding</h2>
 * Bound from Spring Boot config using the prefix {@code voicemaster.nats}, e.g.:
 * <pre>
 * voicemaster:
 *   nats:
 *     url: nats://localhost:4222
 *     user: ...
 *     password: ...
 *     token: ...
 *     creds: /path/to/user.creds
 *     tls: false
 *     request-timeout: 3s
 *     platform-subject-prefix: voicemaster.platform
 * </pre>
 *
 * <h2>Operational notes</h2>
 * <ul>
 *   <li>Secrets (password/token) should come from the environment rather than committed config
 *       files. They are never logged.</li>
 *   <li>{@code requestTimeout} bounds every platform call; a bridge that does not answer in time
 *       is reported as unavailable.</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "voicemaster.nats")
public class NatsProperties {

    private String url = "nats://localhost:4222";

    private String user;

    private String password;

    private String token;

    /** Path to a credentials file (JWT + NKey seed). */
    private String creds;

    private boolean tls = false;

    /** Upper bound on one request/reply round-trip to the platform bridge. */
    private Duration requestTimeout = Duration.ofSeconds(3);

    /** Platform operations are requested on {@code <prefix>.<operation>}. */
    private String platformSubjectPrefix = "voicemaster.platform";

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }

    public String getCreds() { return creds; }
    public void setCreds(String creds) { this.creds = creds; }

    public boolean isTls() { return tls; }
    public void setTls(boolean tls) { this.tls = tls; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    public String getPlatformSubjectPrefix() { return platformSubjectPrefix; }
    public void setPlatformSubjectPrefix(String platformSubjectPrefix) { this.platformSubjectPrefix = platformSubjectPrefix; }
}
