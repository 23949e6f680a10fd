package org.sqltx.xa;

import lombok.extern.slf4j.Slf4j;
import org.sqltx.commons.SqlStates;
import org.sqltx.datasource.ConnectionPool;
import org.sqltx.xa.dialect.XaDialect;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists the branches a backend holds in the prepared state. Runs on demand only; the
 * caller decides when to sweep.
 */
@Slf4j
public class RecoveryScanner {

    static final String FORMAT_ID_COLUMN = "formatID";
    static final String GTRID_LENGTH_COLUMN = "gtrid_length";
    static final String BQUAL_LENGTH_COLUMN = "bqual_length";
    static final String DATA_COLUMN = "data";

    private final XaDialect dialect;
    private final ConnectionPool pool;

    public RecoveryScanner(XaDialect dialect, ConnectionPool pool) {
        if (dialect == null || pool == null) {
            throw new IllegalArgumentException("dialect and pool are required");
        }
        this.dialect = dialect;
        this.pool = pool;
    }

    /**
     * Runs the recovery query on a fresh connection.
     *
     * @return the prepared branches, in backend order
     */
    public List<TransactionInfo> scan() throws SQLException {
        Connection connection = JdbcTwoPhaseParticipant.acquire(pool, "recover", null);
        boolean healthy = true;
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(dialect.recoveryQuery())) {
            List<TransactionInfo> prepared = new ArrayList<>();
            while (rs.next()) {
                prepared.add(new TransactionInfo(
                        rs.getInt(FORMAT_ID_COLUMN),
                        rs.getInt(GTRID_LENGTH_COLUMN),
                        rs.getInt(BQUAL_LENGTH_COLUMN),
                        rs.getBytes(DATA_COLUMN)));
            }
            log.debug("Recovery on pool '{}' found {} prepared transaction(s)", pool.getName(), prepared.size());
            return prepared;
        } catch (SQLException e) {
            healthy = !SqlStates.isConnectionFailure(e);
            log.error("Recovery query failed on pool '{}': {}", pool.getName(), e.getMessage(), e);
            throw dialect.translate(e, null, "recover");
        } finally {
            if (healthy) {
                pool.release(connection);
            } else {
                pool.invalidate(connection);
            }
        }
    }
}
