package com.clinicbooking.bookingservice.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Creates the directory that holds the SQLite file before the first connection opens.
 */
public final class DatabaseDirectoryInitializer {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseDirectoryInitializer.class);

    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    private DatabaseDirectoryInitializer() {
    }

    public static void ensureDirectoryFor(String jdbcUrl) {
        if (jdbcUrl == null || !jdbcUrl.startsWith(SQLITE_PREFIX)) {
            return;
        }
        String path = jdbcUrl.substring(SQLITE_PREFIX.length());
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        if (path.isEmpty() || path.startsWith(":memory:") || path.startsWith("file:")) {
            return;
        }
        File parent = new File(path).getAbsoluteFile().getParentFile();
        if (parent == null || parent.exists()) {
            return;
        }
        if (parent.mkdirs()) {
            logger.info("[DatabaseDirectoryInitializer] Created data directory: {}", parent);
        } else {
            throw new IllegalStateException("Could not create data directory " + parent);
        }
    }
}
