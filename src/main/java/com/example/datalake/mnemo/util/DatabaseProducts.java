package com.example.datalake.mnemo.util;

import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

@Slf4j
public final class DatabaseProducts {

    private DatabaseProducts() {
    }

    /**
     * False when the connection can't be inspected.
     */
    public static boolean isPostgres(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection()) {
            String driverName = conn.getMetaData().getDriverName();
            return driverName != null && driverName.toLowerCase(Locale.ROOT).contains("postgresql");
        } catch (SQLException e) {
            log.warn("[config] Could not inspect database driver – {}", e.getMessage());
            return false;
        }
    }
}
