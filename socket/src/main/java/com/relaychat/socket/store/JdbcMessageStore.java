package com.relaychat.socket.store;

import com.relaychat.core.error.StoreException;
import com.relaychat.core.model.PersistedRecord;
import com.relaychat.socket.config.SocketConfig;
import org.postgresql.ds.PGSimpleDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL-backed message store.
 * <p>
 * Duplicate delivery from the log is absorbed by the {@code unique_key} constraint:
 * {@code ON CONFLICT DO NOTHING} turns a re-applied record into a no-op instead of an error.
 * Records without a key are always inserted.
 * </p>
 */
public class JdbcMessageStore implements MessageStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcMessageStore.class);

    static final String CREATE_TABLE =
        "CREATE TABLE IF NOT EXISTS messages ("
            + "id BIGSERIAL PRIMARY KEY, "
            + "text TEXT NOT NULL, "
            + "unique_key VARCHAR(255) UNIQUE, "
            + "created_at TIMESTAMPTZ NOT NULL DEFAULT now())";
    static final String INSERT =
        "INSERT INTO messages (text, unique_key) VALUES (?, ?) ON CONFLICT (unique_key) DO NOTHING";
    static final String SELECT_RECENT =
        "SELECT text, unique_key FROM messages ORDER BY id DESC LIMIT ?";

    private final DataSource dataSource;

    public JdbcMessageStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public static JdbcMessageStore fromConfig(SocketConfig config) {
        PGSimpleDataSource dataSource = new PGSimpleDataSource();
        dataSource.setUrl(config.getJdbcUrl());
        dataSource.setUser(config.getJdbcUser());
        dataSource.setPassword(config.getJdbcPassword());
        log.info("Message store configured: {}", config.getJdbcUrl());
        return new JdbcMessageStore(dataSource);
    }

    @Override
    public int insertBatch(List<PersistedRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }

        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement statement = connection.prepareStatement(INSERT)) {
                for (PersistedRecord record : records) {
                    statement.setString(1, record.getText());
                    statement.setString(2, record.getUniqueKey());
                    statement.addBatch();
                }
                int inserted = countInserted(statement.executeBatch());
                connection.commit();
                log.debug("Inserted {} of {} records", inserted, records.size());
                return inserted;
            } catch (SQLException e) {
                rollback(connection);
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Batch insert of " + records.size() + " records failed: " + e.getMessage(), e);
        }
    }

    private static int countInserted(int[] updateCounts) {
        int inserted = 0;
        for (int count : updateCounts) {
            if (count > 0) {
                inserted += count;
            } else if (count == Statement.SUCCESS_NO_INFO) {
                inserted++;
            }
        }
        return inserted;
    }

    private static void rollback(Connection connection) {
        try {
            connection.rollback();
        } catch (SQLException rollbackError) {
            log.warn("Rollback failed: {}", rollbackError.getMessage());
        }
    }

    @Override
    public List<PersistedRecord> findRecent(int limit) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(SELECT_RECENT)) {
            statement.setInt(1, limit);
            List<PersistedRecord> result = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    result.add(new PersistedRecord(rs.getString("text"), rs.getString("unique_key")));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new StoreException("Query of recent messages failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void ensureSchema() {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(CREATE_TABLE);
            log.info("Messages table ready");
        } catch (SQLException e) {
            throw new StoreException("Schema initialization failed: " + e.getMessage(), e);
        }
    }
}
