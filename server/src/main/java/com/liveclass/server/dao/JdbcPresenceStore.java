package com.liveclass.server.dao;

import com.liveclass.server.model.ParticipantRecord;
import com.liveclass.server.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Presence store over the {@code socket_users} table.
 */
public class JdbcPresenceStore implements PresenceStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcPresenceStore.class);

    private static final String DELETE_BY_SOCKET_OR_USER =
            "DELETE FROM socket_users WHERE socket_id = ? OR user_id = ?";

    private static final String DELETE_BY_SOCKET =
            "DELETE FROM socket_users WHERE socket_id = ?";

    private static final String INSERT_USER =
            "INSERT INTO socket_users (user_id, socket_id, name, room_id, role) VALUES (?, ?, ?, ?, ?)";

    private static final String SELECT_BY_SOCKET =
            "SELECT user_id, socket_id, name, room_id, role FROM socket_users WHERE socket_id = ?";

    private static final String UPDATE_NAME =
            "UPDATE socket_users SET name = ? WHERE socket_id = ?";

    private final DataSource dataSource;

    public JdbcPresenceStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void upsertParticipant(String userId, String socketId, String name, String roomId, Role role) {
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);

            // 1. evict stale rows for this socket or this user
            int evicted;
            try (PreparedStatement ps = conn.prepareStatement(DELETE_BY_SOCKET_OR_USER)) {
                ps.setString(1, socketId);
                ps.setString(2, userId);
                evicted = ps.executeUpdate();
            }

            // 2. insert the fresh row
            try (PreparedStatement ps = conn.prepareStatement(INSERT_USER)) {
                ps.setString(1, userId);
                ps.setString(2, socketId);
                ps.setString(3, name);
                ps.setString(4, roomId);
                ps.setString(5, (role == null ? Role.STUDENT : role).wire());
                ps.executeUpdate();
            }

            conn.commit();
            if (evicted > 0) {
                log.debug("Evicted {} stale presence row(s) for user={} socket={}", evicted, userId, socketId);
            }
        } catch (SQLException e) {
            if (conn != null) {
                try {
                    conn.rollback();
                } catch (SQLException ex) {
                    log.error("Failed to rollback presence upsert", ex);
                }
            }
            throw new StorageUnavailableException("upsert failed for socket " + socketId, e);
        } finally {
            if (conn != null) {
                try {
                    conn.setAutoCommit(true);
                    conn.close();
                } catch (SQLException e) {
                    log.warn("Failed to close connection", e);
                }
            }
        }
    }

    @Override
    public Optional<ParticipantRecord> getParticipant(String socketId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_BY_SOCKET)) {
            return Optional.ofNullable(selectOne(ps, socketId));
        } catch (SQLException e) {
            throw new StorageUnavailableException("lookup failed for socket " + socketId, e);
        }
    }

    @Override
    public boolean renameParticipant(String socketId, String newName) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPDATE_NAME)) {
            ps.setString(1, newName);
            ps.setString(2, socketId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StorageUnavailableException("rename failed for socket " + socketId, e);
        }
    }

    @Override
    public void removeParticipant(String socketId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(DELETE_BY_SOCKET)) {
            ps.setString(1, socketId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageUnavailableException("delete failed for socket " + socketId, e);
        }
    }

    @Override
    public List<ParticipantRecord> listParticipants(Collection<String> socketIds) {
        List<ParticipantRecord> out = new ArrayList<>();
        if (socketIds == null || socketIds.isEmpty()) return out;

        // one connection, one prepared statement reused per handle
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_BY_SOCKET)) {
            for (String socketId : socketIds) {
                ParticipantRecord r = selectOne(ps, socketId);
                if (r != null) out.add(r);
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("participant list failed", e);
        }
        return out;
    }

    private ParticipantRecord selectOne(PreparedStatement ps, String socketId) throws SQLException {
        ps.setString(1, socketId);
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) return null;
            return new ParticipantRecord(
                    rs.getString("user_id"),
                    rs.getString("socket_id"),
                    rs.getString("name"),
                    rs.getString("room_id"),
                    parseRole(rs.getString("role")));
        }
    }

    private Role parseRole(String raw) {
        try {
            return Role.fromWire(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown role '{}' in socket_users, treating as student", raw);
            return Role.STUDENT;
        }
    }
}
