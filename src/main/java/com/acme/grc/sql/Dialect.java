package com.acme.grc.sql;

import com.acme.grc.model.Enums.DbType;

public final class Dialect {
    private final DbType dbType;

    public Dialect(DbType dbType) {
        this.dbType = (dbType == null || dbType == DbType.AUTO || dbType == DbType.UNKNOWN) ? DbType.ANSI : dbType;
    }

    public DbType dbType() { return dbType; }

    public String quote(String identifier) {
        return switch (dbType) {
            case SQLSERVER -> "[" + identifier.replace("]", "]]") + "]";
            default        -> "\"" + identifier.replace("\"", "\"\"") + "\"";
        };
    }

    public String booleanLiteral(boolean value) {
        return switch (dbType) {
            case SQLSERVER, ORACLE, DB2 -> value ? "1" : "0";
            default                     -> value ? "TRUE" : "FALSE";
        };
    }

    public String stringLiteral(String value) { return "'" + value.replace("'", "''") + "'"; }

    /** Wraps {@code sql} so that at most {@code rows} rows come back. */
    public String limitRows(String sql, int rows) {
        return switch (dbType) {
            case SQLSERVER -> "SELECT TOP " + rows + " * FROM (" + sql + ") sample_rows";
            case ORACLE    -> "SELECT * FROM (" + sql + ") WHERE ROWNUM <= " + rows;
            case POSTGRES  -> "SELECT * FROM (" + sql + ") sample_rows LIMIT " + rows;
            default        -> "SELECT * FROM (" + sql + ") sample_rows FETCH FIRST " + rows + " ROWS ONLY";
        };
    }
}
