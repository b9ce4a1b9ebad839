package com.acme.grc.util;

import com.acme.grc.model.Enums.DbType;

import java.sql.*;
import java.util.*;
import java.util.regex.Pattern;

public final class DbUtil {
    private DbUtil() {}

    public static DbType detectDbType(Connection conn) {
        try {
            String name = conn.getMetaData().getDatabaseProductName().toLowerCase(Locale.ROOT);
            if (name.contains("oracle")) return DbType.ORACLE;
            if (name.contains("db2")) return DbType.DB2;
            if (name.contains("microsoft") || name.contains("sql server")) return DbType.SQLSERVER;
            if (name.contains("postgres")) return DbType.POSTGRES;
            return DbType.ANSI;
        } catch (SQLException ignored) {}
        return DbType.UNKNOWN;
    }

    /**
     * Runs {@code sql} and returns at most {@code maxRows} rows as column-label maps.
     */
    public static List<Map<String, Object>> queryRows(Connection conn, String sql, int maxRows) throws SQLException {
        List<Map<String, Object>> rows = new ArrayList<>();
        try (Statement st = conn.createStatement()) {
            st.setMaxRows(maxRows);
            try (ResultSet rs = st.executeQuery(sql)) {
                ResultSetMetaData md = rs.getMetaData();
                int cols = md.getColumnCount();
                while (rs.next() && rows.size() < maxRows) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= cols; i++) row.put(md.getColumnLabel(i), rs.getObject(i));
                    rows.add(row);
                }
            }
        }
        return rows;
    }

    public static String redactSecrets(String s) {
        if (s == null) return null;
        s = Pattern.compile("(password=)([^;&]+)", Pattern.CASE_INSENSITIVE).matcher(s).replaceAll("$1***");
        s = Pattern.compile("(PWD=)([^;&]+)", Pattern.CASE_INSENSITIVE).matcher(s).replaceAll("$1***");
        return s;
    }
}
