package org.iceforge.heimdall.service.store;

import org.iceforge.heimdall.execution.BackendCredentials;
import org.iceforge.heimdall.execution.BackendDirectory;
import org.iceforge.heimdall.model.BackendInstance;
import org.iceforge.heimdall.model.BackendKind;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Backend instances from the {@code database_instances} table; credentials from configuration, keyed by
 * instance id.
 */
public class JdbcBackendDirectory implements BackendDirectory {

    static final String SELECT_SQL = "SELECT id, name, type, host, port FROM database_instances WHERE id = CAST(? AS UUID)";

    private final DataSource dataSource;
    private final Map<String, BackendCredentials> credentials;

    public JdbcBackendDirectory(DataSource dataSource, Map<String, BackendCredentials> credentials) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.credentials = credentials == null ? Map.of() : Map.copyOf(credentials);
    }

    @Override
    public Optional<BackendInstance> findInstance(String instanceId) {
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(SELECT_SQL)) {
            ps.setString(1, instanceId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new BackendInstance(
                        rs.getString("id"),
                        rs.getString("name"),
                        BackendKind.fromWireName(rs.getString("type")),
                        rs.getString("host"),
                        rs.getInt("port")));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load database instance " + instanceId, e);
        }
    }

    @Override
    public BackendCredentials credentialsFor(BackendInstance instance) {
        return credentials.getOrDefault(instance.id(), BackendCredentials.none());
    }
}
