package com.p14n.eventhub.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import javax.sql.DataSource;

import com.p14n.eventhub.broker.CancellationSignal;
import com.p14n.eventhub.data.EventRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable storage in the PostgreSQL table {@code eventhub.event_records}, see
 * {@link com.p14n.eventhub.db.DatabaseSetup}.
 *
 * <p>
 * Records are delivered oldest first by their identity column and kept until
 * they are purged; delivery only sets {@code is_complete}. SQL selects on the
 * structured criteria of a {@link RecordSearch} and the search predicate is
 * applied to each loaded row.
 * </p>
 */
public class JdbcStorage implements StorageProvider<EventRecord> {
    private static final Logger logger = LoggerFactory.getLogger(JdbcStorage.class);

    private static final String COLS = "id, subscriber_id, event_type, payload, is_complete, expire_on";

    private final DataSource ds;

    public JdbcStorage(DataSource ds) {
        this.ds = ds;
    }

    @Override
    public Set<String> restoreSubscriberIds(RecordSearch<EventRecord> search) throws StorageException {
        String sql = "SELECT id, subscriber_id, event_type, NULL AS payload, is_complete, expire_on "
                + "FROM eventhub.event_records WHERE event_type = ? AND is_complete = false AND expire_on >= ? "
                + "ORDER BY idn";

        try (Connection c = ds.getConnection();
                PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, search.eventType());
            stmt.setTimestamp(2, Timestamp.from(search.now()));

            Set<String> ids = new LinkedHashSet<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    var r = toRecord(rs);
                    if (search.match().test(r)) {
                        ids.add(r.getSubscriberId());
                    }
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new StorageException("Failed to restore subscribers for " + search.eventType(), e);
        }
    }

    @Override
    public void storeEvents(Collection<EventRecord> records, CancellationSignal cancellation)
            throws StorageException {
        String sql = "INSERT INTO eventhub.event_records (" + COLS + ") VALUES (?, ?, ?, ?, ?, ?) "
                + "ON CONFLICT (id) DO NOTHING";

        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement stmt = c.prepareStatement(sql)) {
                for (var r : records) {
                    stmt.setString(1, r.getId());
                    stmt.setString(2, r.getSubscriberId());
                    stmt.setString(3, r.getEventType());
                    stmt.setBytes(4, r.getPayload());
                    stmt.setBoolean(5, r.isComplete());
                    stmt.setTimestamp(6, Timestamp.from(r.getExpireOn()));
                    stmt.addBatch();
                }
                stmt.executeBatch();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to store " + records.size() + " record(s)", e);
        }
    }

    @Override
    public List<EventRecord> getNextBatch(RecordSearch<EventRecord> search) throws StorageException {
        String sql = "SELECT " + COLS + " FROM eventhub.event_records "
                + "WHERE event_type = ? AND subscriber_id = ? AND is_complete = false AND expire_on >= ? "
                + "ORDER BY idn LIMIT ?";

        try (Connection c = ds.getConnection();
                PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, search.eventType());
            stmt.setString(2, search.subscriberId());
            stmt.setTimestamp(3, Timestamp.from(search.now()));
            stmt.setInt(4, search.limit());

            List<EventRecord> records = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    var r = toRecord(rs);
                    if (search.match().test(r)) {
                        records.add(r);
                    }
                }
            }
            return records;
        } catch (SQLException e) {
            throw new StorageException("Failed to read records of subscriber " + search.subscriberId(), e);
        }
    }

    @Override
    public void markComplete(EventRecord record, CancellationSignal cancellation) throws StorageException {
        String sql = "UPDATE eventhub.event_records SET is_complete = true WHERE id = ?";

        try (Connection c = ds.getConnection();
                PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, record.getId());
            stmt.executeUpdate();
            record.setComplete(true);
        } catch (SQLException e) {
            throw new StorageException("Failed to mark record " + record.getId() + " complete", e);
        }
    }

    @Override
    public void purgeStale(RecordSearch<EventRecord> search) throws StorageException {
        String sql = "DELETE FROM eventhub.event_records WHERE event_type = ? AND (is_complete = true OR expire_on < ?)";

        try (Connection c = ds.getConnection();
                PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, search.eventType());
            stmt.setTimestamp(2, Timestamp.from(search.now()));
            int deleted = stmt.executeUpdate();
            logger.atDebug().log("Purged {} stale records for event type {}", deleted, search.eventType());
        } catch (SQLException e) {
            throw new StorageException("Failed to purge records for " + search.eventType(), e);
        }
    }

    private EventRecord toRecord(ResultSet rs) throws SQLException {
        var r = new EventRecord(
                rs.getString("subscriber_id"),
                rs.getString("event_type"),
                rs.getBytes("payload"),
                rs.getTimestamp("expire_on").toInstant());
        r.setId(rs.getString("id"));
        r.setComplete(rs.getBoolean("is_complete"));
        return r;
    }
}
