package org.energytrade.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * 全链路追踪工具类
 * - ThreadLocal 保存当前请求的追踪ID，同时写入 MDC 供日志输出
 * - 异步任务通过 {@link #wrap(Runnable)} 把追踪ID带到工作线程
 */
public final class TraceIdUtil {

    public static final String MDC_KEY = "traceId";

    private static final ThreadLocal<String> TRACE_ID_HOLDER = new ThreadLocal<>();

    private TraceIdUtil() {
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static void setTraceId(String traceId) {
        TRACE_ID_HOLDER.set(traceId);
        if (traceId == null) {
            MDC.remove(MDC_KEY);
        } else {
            MDC.put(MDC_KEY, traceId);
        }
    }

    public static String getTraceId() {
        return TRACE_ID_HOLDER.get();
    }

    /**
     * 当前没有追踪ID时生成一个新的（定时任务、MQ消费等非HTTP入口）
     */
    public static String getOrCreateTraceId() {
        String traceId = TRACE_ID_HOLDER.get();
        if (traceId == null) {
            traceId = generateTraceId();
            setTraceId(traceId);
        }
        return traceId;
    }

    public static void clearTraceId() {
        TRACE_ID_HOLDER.remove();
        MDC.remove(MDC_KEY);
    }

    /**
     * 包装任务，使其在执行线程上沿用提交时的追踪ID
     */
    public static Runnable wrap(Runnable task) {
        String traceId = getTraceId();
        return () -> {
            String previous = getTraceId();
            setTraceId(traceId != null ? traceId : generateTraceId());
            try {
                task.run();
            } finally {
                if (previous == null) {
                    clearTraceId();
                } else {
                    setTraceId(previous);
                }
            }
        };
    }
}
