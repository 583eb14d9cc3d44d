package com.europeanalysis.stats.storage;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Null-safe column helpers and a tiny WHERE-clause builder shared by the repositories.
 */
final class JdbcSupport {

    private JdbcSupport() {
    }

    static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        Object value = rs.getObject(column);
        return value == null ? null : ((Number) value).intValue();
    }

    static Integer nullableInt(ResultSet rs, int column) throws SQLException {
        Object value = rs.getObject(column);
        return value == null ? null : ((Number) value).intValue();
    }

    static Double nullableDouble(ResultSet rs, int column) throws SQLException {
        Object value = rs.getObject(column);
        return value == null ? null : ((Number) value).doubleValue();
    }

    /** Accumulates "AND ..." conditions and their bind arguments in order. */
    static final class Where {

        private final StringBuilder sql = new StringBuilder(" WHERE 1 = 1");
        private final List<Object> args = new ArrayList<>();

        Where and(String condition, Object arg) {
            if (arg != null) {
                sql.append(" AND ").append(condition);
                args.add(arg);
            }
            return this;
        }

        Where andRaw(String condition) {
            sql.append(" AND ").append(condition);
            return this;
        }

        String sql() {
            return sql.toString();
        }

        List<Object> args() {
            return args;
        }
    }
}
