package com.example.realtime.event;

import com.example.realtime.service.exception.ConnectionException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.springframework.util.StringUtils;

/**
 * PostgreSQL {@code LISTEN/NOTIFY} source. Each link is a dedicated JDBC connection opened outside
 * the application pool, since a pooled connection may be handed to other callers and would lose
 * its subscriptions.
 */
@Slf4j
public class PostgresChangeEventSource implements ChangeEventSource {

    private static final Pattern CHANNEL_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");
    private static final String APPLICATION_NAME = "realtime-change-listener";

    private final String url;
    private final String username;
    private final String password;

    public PostgresChangeEventSource(String url, String username, String password) {
        if (!StringUtils.hasText(url)) {
            throw new IllegalArgumentException("A JDBC url is required for the change listener");
        }
        this.url = url;
        this.username = username;
        this.password = password;
    }

    @Override
    public SubscriptionLink open() {
        Properties properties = new Properties();
        if (StringUtils.hasText(username)) {
            properties.setProperty("user", username);
        }
        if (StringUtils.hasText(password)) {
            properties.setProperty("password", password);
        }
        properties.setProperty("ApplicationName", APPLICATION_NAME);
        try {
            Connection connection = DriverManager.getConnection(url, properties);
            connection.setAutoCommit(true);
            PGConnection pgConnection = connection.unwrap(PGConnection.class);
            log.debug("Opened subscription link to {}", redact(url));
            return new PostgresSubscriptionLink(connection, pgConnection);
        } catch (SQLException ex) {
            throw new ConnectionException("Could not open subscription link to " + redact(url), ex);
        }
    }

    @Override
    public boolean supportsChannel(String channel) {
        return isValidChannel(channel);
    }

    static boolean isValidChannel(String channel) {
        return channel != null && CHANNEL_NAME.matcher(channel).matches();
    }

    private static String redact(String jdbcUrl) {
        int query = jdbcUrl.indexOf('?');
        return query < 0 ? jdbcUrl : jdbcUrl.substring(0, query);
    }

    static final class PostgresSubscriptionLink implements SubscriptionLink {

        private final Connection connection;
        private final PGConnection pgConnection;

        PostgresSubscriptionLink(Connection connection, PGConnection pgConnection) {
            this.connection = connection;
            this.pgConnection = pgConnection;
        }

        @Override
        public void subscribe(String channel) {
            if (!isValidChannel(channel)) {
                throw new IllegalArgumentException("Invalid channel name: " + channel);
            }
            try (Statement statement = connection.createStatement()) {
                statement.execute("LISTEN " + channel);
            } catch (SQLException ex) {
                throw new ConnectionException("LISTEN " + channel + " failed", ex);
            }
        }

        @Override
        public List<ChangeNotification> poll(Duration timeout) {
            // pgjdbc treats 0 as "block forever"
            int timeoutMillis = (int) Math.max(1, Math.min(timeout.toMillis(), Integer.MAX_VALUE));
            PGNotification[] notifications;
            try {
                notifications = pgConnection.getNotifications(timeoutMillis);
            } catch (SQLException ex) {
                throw new ConnectionException("Subscription link failed while polling", ex);
            }
            if (notifications == null || notifications.length == 0) {
                return List.of();
            }
            List<ChangeNotification> result = new ArrayList<>(notifications.length);
            for (PGNotification notification : notifications) {
                result.add(new ChangeNotification(notification.getName(), notification.getParameter()));
            }
            return result;
        }

        @Override
        public void close() {
            try {
                connection.close();
            } catch (SQLException ex) {
                throw new ConnectionException("Failed to close subscription link", ex);
            }
        }

        @Override
        public void forceClose() {
            try {
                connection.abort(Runnable::run);
            } catch (SQLException ex) {
                throw new ConnectionException("Failed to abort subscription link", ex);
            }
        }
    }
}
