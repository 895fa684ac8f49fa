package com.sifinder.store;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import com.sifinder.fingerprint.Fingerprint;

/**
 * SQLite file holding one directory's fingerprints. The database runs in WAL mode so scans read a
 * snapshot while an indexing pass commits record by record on the writer connection.
 */
public class SqliteIndexStore implements IndexStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteIndexStore.class);
    private static final int BUSY_TIMEOUT_MS = 10_000;

    private final String name;
    private final Path databasePath;
    private final String jdbcUrl;
    private Connection writer;

    private SqliteIndexStore(String name, Path databasePath) {
        this.name = name;
        this.databasePath = databasePath;
        this.jdbcUrl = "jdbc:sqlite:" + databasePath.toAbsolutePath();
    }

    public static SqliteIndexStore open(String name, Path databasePath) {
        SqliteIndexStore store = new SqliteIndexStore(name, databasePath);
        store.createSchema();
        return store;
    }

    /**
     * Reads one metadata value over a read-only connection without creating the schema, so foreign
     * SQLite files in the data directory are left untouched.
     */
    public static Optional<String> readMeta(Path databasePath, String key) {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + databasePath.toAbsolutePath(), config.toProperties());
                PreparedStatement stmt = connection.prepareStatement("SELECT value FROM info WHERE key = ?")) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read metadata " + key + " from " + databasePath, e);
        }
    }

    @Override
    public String name() {
        return name;
    }

    public Path databasePath() {
        return databasePath;
    }

    @Override
    public synchronized void upsert(String path, Fingerprint fingerprint, long modifiedTime) {
        try (PreparedStatement stmt = writer().prepareStatement(
                "INSERT OR REPLACE INTO images (path, fingerprint, modified_time) VALUES (?, ?, ?)")) {
            stmt.setString(1, path);
            stmt.setString(2, fingerprint.toHex());
            stmt.setLong(3, modifiedTime);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to store fingerprint for " + path + " in " + name, e);
        }
    }

    @Override
    public synchronized OptionalLong modifiedTime(String path) {
        try (PreparedStatement stmt = writer().prepareStatement("SELECT modified_time FROM images WHERE path = ?")) {
            stmt.setString(1, path);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? OptionalLong.of(rs.getLong(1)) : OptionalLong.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read modified time for " + path + " from " + name, e);
        }
    }

    @Override
    public Stream<ImageRecord> scanAll() {
        Connection connection = openConnection();
        try {
            PreparedStatement stmt = connection.prepareStatement(
                    "SELECT path, fingerprint, modified_time FROM images ORDER BY path");
            ResultSet rs = stmt.executeQuery();
            Spliterator<ImageRecord> records = new Spliterators.AbstractSpliterator<>(
                    Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
                @Override
                public boolean tryAdvance(Consumer<? super ImageRecord> action) {
                    try {
                        if (!rs.next()) {
                            return false;
                        }
                        action.accept(toRecord(rs));
                        return true;
                    } catch (SQLException e) {
                        throw new StoreException("Failed to scan records of " + name, e);
                    }
                }
            };
            return StreamSupport.stream(records, false).onClose(() -> closeConnection(connection));
        } catch (SQLException e) {
            closeConnection(connection);
            throw new StoreException("Failed to scan records of " + name, e);
        }
    }

    @Override
    public synchronized boolean removeRecord(String path) {
        try (PreparedStatement stmt = writer().prepareStatement("DELETE FROM images WHERE path = ?")) {
            stmt.setString(1, path);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to remove " + path + " from " + name, e);
        }
    }

    @Override
    public synchronized long recordCount() {
        try (Statement stmt = writer().createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM images")) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new StoreException("Failed to count records of " + name, e);
        }
    }

    @Override
    public synchronized void setMeta(String key, String value) {
        try (PreparedStatement stmt = writer().prepareStatement("INSERT OR REPLACE INTO info (key, value) VALUES (?, ?)")) {
            stmt.setString(1, key);
            stmt.setString(2, value);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to write metadata " + key + " of " + name, e);
        }
    }

    @Override
    public synchronized Optional<String> meta(String key) {
        try (PreparedStatement stmt = writer().prepareStatement("SELECT value FROM info WHERE key = ?")) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read metadata " + key + " of " + name, e);
        }
    }

    @Override
    public synchronized void close() {
        if (writer != null) {
            closeConnection(writer);
            writer = null;
        }
    }

    private void createSchema() {
        try (Statement stmt = writer().createStatement()) {
            stmt.execute("""
                    CREATE TABLE IF NOT EXISTS images (
                        path TEXT PRIMARY KEY,
                        fingerprint TEXT NOT NULL,
                        modified_time INTEGER NOT NULL
                    )
                    """);
            stmt.execute("CREATE TABLE IF NOT EXISTS info (key TEXT PRIMARY KEY, value TEXT)");
        } catch (SQLException e) {
            close();
            throw new StoreException("Failed to initialize index " + name + " at " + databasePath, e);
        }
    }

    private ImageRecord toRecord(ResultSet rs) throws SQLException {
        String path = rs.getString(1);
        try {
            return new ImageRecord(path, Fingerprint.fromHex(rs.getString(2)), rs.getLong(3));
        } catch (IllegalArgumentException e) {
            throw new StoreException("Corrupt fingerprint stored for " + path + " in " + name, e);
        }
    }

    private Connection writer() throws SQLException {
        if (writer == null) {
            writer = openConnectionChecked();
        }
        return writer;
    }

    private Connection openConnection() {
        try {
            return openConnectionChecked();
        } catch (SQLException e) {
            throw new StoreException("Failed to open index " + name + " at " + databasePath, e);
        }
    }

    private Connection openConnectionChecked() throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        return DriverManager.getConnection(jdbcUrl, config.toProperties());
    }

    private void closeConnection(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("store.close.failed index={} reason={}", name, e.getMessage());
        }
    }
}
