package io.hookbox.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC delivery stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.hookbox.jdbc.store.AbstractJdbcDeliveryStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AbstractJdbcDeliveryStore store = JdbcDeliveryStores.detect(dataSource);
 * AbstractJdbcDeliveryStore store = JdbcDeliveryStores.detect("jdbc:mysql://localhost/cms");
 * AbstractJdbcDeliveryStore store = JdbcDeliveryStores.get("postgresql");
 * }</pre>
 */
public final class JdbcDeliveryStores {

    private static final List<AbstractJdbcDeliveryStore> STORES;
    private static final Map<String, AbstractJdbcDeliveryStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcDeliveryStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcDeliveryStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcDeliveryStores() {
    }

    /**
     * Returns all registered delivery stores.
     */
    public static List<AbstractJdbcDeliveryStore> all() {
        return STORES;
    }

    /**
     * Gets a delivery store by name.
     *
     * @param name store name (case-insensitive)
     * @throws IllegalArgumentException if no store is registered under that name
     */
    public static AbstractJdbcDeliveryStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcDeliveryStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown delivery store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the delivery store from a DataSource's JDBC URL.
     *
     * @throws IllegalStateException if the URL cannot be read
     */
    public static AbstractJdbcDeliveryStore detect(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection()) {
            return detect(conn.getMetaData().getURL());
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect delivery store from DataSource", e);
        }
    }

    /**
     * Auto-detects the delivery store from a JDBC URL.
     *
     * @throws IllegalArgumentException if no store handles the URL
     */
    public static AbstractJdbcDeliveryStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        String url = jdbcUrl.toLowerCase(Locale.ROOT);
        for (AbstractJdbcDeliveryStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return store;
                }
            }
        }
        throw new IllegalArgumentException("No delivery store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
