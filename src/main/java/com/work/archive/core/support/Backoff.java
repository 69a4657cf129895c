package com.work.archive.core.support;

import java.time.Duration;

/**
 * 指数退避：base * 2^(attempt-1)，上限 max。attempt 从 1 开始计数。
 */
public final class Backoff {

    private Backoff() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static Duration exponential(int attempt, Duration base, Duration max) {
        long baseMs = Math.max(1L, base.toMillis());
        long maxMs = Math.max(baseMs, max.toMillis());
        long pow = 1L << Math.min(20, Math.max(0, attempt - 1));
        long ms = baseMs * pow;
        if (ms <= 0 || ms > maxMs) {
            ms = maxMs;
        }
        return Duration.ofMillis(ms);
    }
}
