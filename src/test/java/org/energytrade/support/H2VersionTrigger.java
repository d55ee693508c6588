package org.energytrade.support;

import org.h2.api.Trigger;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * H2 下的 increment_version() 触发器
 * 每次 UPDATE 后 version 至少为旧值 +1，与 PostgreSQL 触发器行为一致
 */
public class H2VersionTrigger implements Trigger {

    private int versionIndex = -1;

    @Override
    public void init(Connection conn, String schemaName, String triggerName, String tableName,
                     boolean before, int type) throws SQLException {
        try (ResultSet columns = conn.getMetaData().getColumns(null, schemaName, tableName, null)) {
            while (columns.next()) {
                if ("version".equalsIgnoreCase(columns.getString("COLUMN_NAME"))) {
                    versionIndex = columns.getInt("ORDINAL_POSITION") - 1;
                    return;
                }
            }
        }
        throw new SQLException("Table " + schemaName + "." + tableName + " has no version column");
    }

    @Override
    public void fire(Connection conn, Object[] oldRow, Object[] newRow) {
        if (oldRow == null || newRow == null) {
            return;
        }
        long previous = toLong(oldRow[versionIndex]);
        long requested = toLong(newRow[versionIndex]);
        newRow[versionIndex] = Math.max(requested, previous + 1);
    }

    private static long toLong(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }
}
