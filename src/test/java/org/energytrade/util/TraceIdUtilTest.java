package org.energytrade.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class TraceIdUtilTest {

    @AfterEach
    void tearDown() {
        TraceIdUtil.clearTraceId();
    }

    @Test
    @DisplayName("设置追踪ID同时写入MDC")
    void setTraceIdWritesMdc() {
        TraceIdUtil.setTraceId("abc");

        assertThat(TraceIdUtil.getTraceId()).isEqualTo("abc");
        assertThat(MDC.get(TraceIdUtil.MDC_KEY)).isEqualTo("abc");

        TraceIdUtil.clearTraceId();
        assertThat(TraceIdUtil.getTraceId()).isNull();
        assertThat(MDC.get(TraceIdUtil.MDC_KEY)).isNull();
    }

    @Test
    @DisplayName("没有追踪ID时生成新的并保持不变")
    void getOrCreateIsStable() {
        String first = TraceIdUtil.getOrCreateTraceId();

        assertThat(first).hasSize(32);
        assertThat(TraceIdUtil.getOrCreateTraceId()).isEqualTo(first);
    }

    @Test
    @DisplayName("包装后的任务在工作线程上沿用提交时的追踪ID")
    void wrapPropagatesToWorkerThread() {
        TraceIdUtil.setTraceId("trace-1");
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> seenMdc = new AtomicReference<>();

        CompletableFuture.runAsync(TraceIdUtil.wrap(() -> {
            seen.set(TraceIdUtil.getTraceId());
            seenMdc.set(MDC.get(TraceIdUtil.MDC_KEY));
        })).join();

        assertThat(seen.get()).isEqualTo("trace-1");
        assertThat(seenMdc.get()).isEqualTo("trace-1");
    }

    @Test
    @DisplayName("任务结束后恢复线程原有追踪ID")
    void wrapRestoresPreviousTraceId() {
        TraceIdUtil.setTraceId("outer");
        Runnable task = TraceIdUtil.wrap(() -> assertThat(TraceIdUtil.getTraceId()).isEqualTo("outer"));

        TraceIdUtil.setTraceId("runner");
        task.run();

        assertThat(TraceIdUtil.getTraceId()).isEqualTo("runner");
    }
}
