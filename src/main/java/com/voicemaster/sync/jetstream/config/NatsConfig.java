package com.voicemaster.sync.jetstream.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.Nats;
import io.nats.client.Options;

/**
 * Spring configuration that wires up:
 * - the shared NATS {@link Connection}
 * - JetStream client APIs ({@link JetStream} and {@link JetStreamManagement})
 * - property binding for the NATS and event-consumer settings
 *
 * <h2>Connection strategy</h2>
 * <ul>
 *   <li>No auth/TLS configured: {@code Nats.connect(url)}.</li>
 *   <li>Otherwise an {@link Options} instance is built with whichever of user/password, token,
 *       credentials file and TLS are set.</li>
 *   <li>The client reconnects forever; platform calls made while disconnected fail as
 *       unavailable instead of blocking.</li>
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
        NatsProperties.class,
        MemberEventsProperties.class
})
public class NatsConfig {

    private static final Logger log = LoggerFactory.getLogger(NatsConfig.class);

    /**
     * Declared with {@code destroyMethod="close"} so the connection is closed on shutdown.
     * Secrets are never logged; the user name is masked.
     */
    @Bean(destroyMethod = "close")
    public Connection natsConnection(NatsProperties props) throws Exception {
        boolean wantsOptions =
                isSet(props.getUser()) ||
                isSet(props.getPassword()) ||
                isSet(props.getToken()) ||
                isSet(props.getCreds()) ||
                props.isTls();

        if (!wantsOptions) {
            Connection c = Nats.connect(props.getUrl());
            log.info("Connected to NATS (url={})", props.getUrl());
            return c;
        }

        Options.Builder builder = Options.builder()
                .server(props.getUrl())
                .connectionName("voicemaster-coordinator")
                .maxReconnects(-1);

        if (props.isTls()) {
            builder.secure();
        }
        if (isSet(props.getToken())) {
            builder.token(props.getToken().toCharArray());
        }
        if (isSet(props.getUser())) {
            String pass = props.getPassword() == null ? "" : props.getPassword();
            builder.userInfo(props.getUser().toCharArray(), pass.toCharArray());
        }
        if (isSet(props.getCreds())) {
            builder.authHandler(Nats.credentials(props.getCreds()));
        }

        Connection c = Nats.connect(builder.build());
        log.info("Connected to NATS (url={}, tls={}, user={}, creds={})",
                props.getUrl(),
                props.isTls(),
                props.getUser() == null ? "" : mask(props.getUser()),
                props.getCreds() == null ? "" : props.getCreds());
        return c;
    }

    @Bean
    public JetStream jetStream(Connection connection) throws Exception {
        return connection.jetStream();
    }

    @Bean
    public JetStreamManagement jetStreamManagement(Connection connection) throws Exception {
        return connection.jetStreamManagement();
    }

    private static boolean isSet(String v) {
        return v != null && !v.isBlank();
    }

    /** "admin" -> "a***n". Not cryptographic; keeps raw identifiers out of logs. */
    private static String mask(String v) {
        if (v == null || v.isBlank()) return "";
        if (v.length() <= 2) return "**";
        return v.substring(0, 1) + "***" + v.substring(v.length() - 1);
    }
}
