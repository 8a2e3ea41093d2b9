package com.liveclass.server.dao;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Flips {@code live_classes.status}.
 */
public class JdbcClassRecordStore implements ClassRecordStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcClassRecordStore.class);

    static final String STATUS_LIVE = "live";
    static final String STATUS_ENDED = "ended";

    private static final String UPDATE_STATUS =
            "UPDATE live_classes SET status = ? WHERE access_code = ?";

    private final DataSource dataSource;

    public JdbcClassRecordStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void markClassLive(String accessCode) {
        updateStatus(STATUS_LIVE, accessCode);
    }

    @Override
    public void markClassEnded(String accessCode) {
        updateStatus(STATUS_ENDED, accessCode);
    }

    private void updateStatus(String status, String accessCode) {
        int rows;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPDATE_STATUS)) {
            ps.setString(1, status);
            ps.setString(2, accessCode);
            rows = ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageUnavailableException("status update failed for class " + accessCode, e);
        }
        if (rows == 0) {
            throw new ClassRecordNotFoundException(accessCode);
        }
        log.info("[CLASS] accessCode={} status={}", accessCode, status);
    }
}
