package com.acme.grc.sql;

import com.acme.grc.config.GrcSettings;
import com.acme.grc.model.Finding;
import com.acme.grc.model.SampleRows;
import com.acme.grc.model.SqlQuery;
import com.acme.grc.util.DbUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

public final class JdbcSampleQueryExecutor implements SampleQueryExecutor {
    private static final Logger log = LoggerFactory.getLogger(JdbcSampleQueryExecutor.class);

    private final Connection conn;
    private final Dialect dialect;
    private final GrcSettings.Samples samples;

    public JdbcSampleQueryExecutor(Connection conn, Dialect dialect, GrcSettings.Samples samples) {
        this.conn = conn;
        this.dialect = dialect;
        this.samples = samples;
    }

    @Override
    public SampleRows preview(SqlQuery query, int rows) {
        int n = SampleQueryExecutor.clampRows(rows, samples);
        String sql = dialect.limitRows(query.sql(), n);
        try {
            List<Map<String, Object>> out = DbUtil.queryRows(conn, sql, n);
            log.info("{} preview returned {} row(s)", query.kind(), out.size());
            return SampleRows.of(query.kind(), out);
        } catch (SQLException e) {
            log.warn("{} preview failed: {}", query.kind(), e.getMessage());
            return SampleRows.failed(query.kind(), Finding.err("SAMPLE_EXECUTION",
                    "Running the " + query.kind() + " query failed: " + e.getMessage(),
                    Map.of("sqlState", String.valueOf(e.getSQLState()))));
        }
    }
}
