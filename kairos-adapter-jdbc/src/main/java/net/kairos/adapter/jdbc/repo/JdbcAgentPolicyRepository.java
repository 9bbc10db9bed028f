package net.kairos.adapter.jdbc.repo;

import net.kairos.core.spi.AgentPolicyRepository;

import javax.sql.DataSource;

import static net.kairos.adapter.jdbc.JdbcUtil.withConnection;

/** agent_ownership.autonomy_enabled. 행이 없으면 false */
public final class JdbcAgentPolicyRepository implements AgentPolicyRepository {
    private final DataSource ds;

    public JdbcAgentPolicyRepository(DataSource ds) {
        this.ds = ds;
    }

    @Override
    public boolean isAutonomyEnabled(String agentName) throws Exception {
        return withConnection(ds, c -> {
            try (var ps = c.prepareStatement("SELECT autonomy_enabled FROM agent_ownership WHERE agent_name = ?")) {
                ps.setString(1, agentName);
                try (var rs = ps.executeQuery()) {
                    return rs.next() && rs.getInt(1) != 0;
                }
            }
        });
    }
}
