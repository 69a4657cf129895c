package com.work.archive.core.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 多行 INSERT 的分片：单条语句的绑定参数数 = 行数 * 列数，不能超过存储的上限
 * （PostgreSQL JDBC 驱动以 2 字节有符号整数发送参数个数，即 32767）。同时受 maxRows 约束，避免单条语句过大。
 */
public final class StatementSplitter {

    /** pgjdbc 单条语句可绑定参数的上限（Short.MAX_VALUE）。 */
    public static final int POSTGRES_MAX_PARAMS = Short.MAX_VALUE;

    private StatementSplitter() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 单条语句最多可容纳的行数。
     */
    public static int rowsPerStatement(int columnsPerRow, int maxParams, int maxRows) {
        ValidationUtils.requirePositive(columnsPerRow, "columnsPerRow");
        ValidationUtils.requirePositive(maxParams, "maxParams");
        if (columnsPerRow > maxParams) {
            throw new IllegalArgumentException("columnsPerRow=" + columnsPerRow + " exceeds maxParams=" + maxParams);
        }
        int byParams = maxParams / columnsPerRow;
        return maxRows > 0 ? Math.min(byParams, maxRows) : byParams;
    }

    /**
     * 按顺序切分，保留原有行序（同一高度的行不会被打乱）。
     */
    public static <T> List<List<T>> split(List<T> rows, int columnsPerRow, int maxParams, int maxRows) {
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        int chunk = rowsPerStatement(columnsPerRow, maxParams, maxRows);
        List<List<T>> out = new ArrayList<>((rows.size() + chunk - 1) / chunk);
        for (int from = 0; from < rows.size(); from += chunk) {
            out.add(rows.subList(from, Math.min(rows.size(), from + chunk)));
        }
        return out;
    }
}
