package com.acme.grc.sql;

import com.acme.grc.config.GrcSettings;
import com.acme.grc.model.SampleRows;
import com.acme.grc.model.SqlQuery;

/**
 * Runs one synthesized query against live evidence data and returns a few preview rows.
 * Implementations report failures in the returned {@link SampleRows} rather than throwing.
 */
public interface SampleQueryExecutor {

    SampleRows preview(SqlQuery query, int rows);

    /** Requests outside {@code 1..maxRows} fall back to the default row count. */
    static int clampRows(int requested, GrcSettings.Samples samples) {
        if (requested < 1 || requested > samples.maxRows) return samples.defaultRows;
        return requested;
    }
}
