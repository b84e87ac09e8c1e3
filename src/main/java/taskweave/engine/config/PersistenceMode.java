package taskweave.engine.config;

import java.util.Locale;

/**
 * Where workflow snapshots are written.
 */
public enum PersistenceMode {
    /** Nothing is persisted */
    NONE,
    /** One JSON file per workflow */
    FILE,
    /** Tables in a JDBC database (H2 by default) */
    JDBC;

    public static PersistenceMode parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
