package eventlog.spi;

import eventlog.model.ProjectionPosition;

import java.sql.Connection;
import java.util.Optional;

/**
 * Persistence of projection positions, one row per projection name.
 *
 * @see eventlog.jdbc.position.JdbcProjectionPositionStore
 */
public interface ProjectionPositionStore {

    Optional<ProjectionPosition> find(Connection conn, String projectionName);

    /**
     * Inserts or replaces the stored position.
     */
    void save(Connection conn, ProjectionPosition position);

    /**
     * Removes the stored position.
     *
     * @return {@code true} if a row was deleted
     */
    boolean delete(Connection conn, String projectionName);
}
