package org.synthesis.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 按标签累计墙钟时间的 {@link Profiler} 实现。
 * 同一标签不允许嵌套计时；非线程安全，每个引擎实例持有一个。
 */
public final class TimerProfiler implements Profiler {

    private static final Logger logger = LoggerFactory.getLogger(TimerProfiler.class);

    private final Map<String, Long> startedAt = new HashMap<>();
    // 保持首次出现的顺序，便于输出
    private final Map<String, Long> elapsedNanos = new LinkedHashMap<>();
    private final Map<String, Integer> invocations = new HashMap<>();

    @Override
    public void start(String label) {
        Objects.requireNonNull(label, "Timer label cannot be null.");
        if (startedAt.putIfAbsent(label, System.nanoTime()) != null) {
            logger.error("计时器 {} 已在运行，不能重复启动。", label);
            throw new IllegalStateException("Timer '" + label + "' is already running.");
        }
    }

    @Override
    public void stop(String label) {
        Long start = startedAt.remove(label);
        if (start == null) {
            logger.error("计时器 {} 未启动，无法停止。", label);
            throw new IllegalStateException("Timer '" + label + "' is not running.");
        }
        elapsedNanos.merge(label, System.nanoTime() - start, Long::sum);
        invocations.merge(label, 1, Integer::sum);
    }

    /**
     * @param label 计时标签。
     * @return 该标签累计的毫秒数；未记录过则为 0。
     */
    public long elapsedMillis(String label) {
        return elapsedNanos.getOrDefault(label, 0L) / 1_000_000L;
    }

    /**
     * @param label 计时标签。
     * @return 该标签完成的计时次数。
     */
    public int invocations(String label) {
        return invocations.getOrDefault(label, 0);
    }

    public boolean isRunning(String label) {
        return startedAt.containsKey(label);
    }

    public Map<String, Long> getElapsedNanos() {
        return Collections.unmodifiableMap(elapsedNanos);
    }

    public void reset() {
        startedAt.clear();
        elapsedNanos.clear();
        invocations.clear();
    }

    /**
     * 以 "标签: 毫秒 (次数)" 的形式逐行汇总所有计时。
     */
    public String summary() {
        return elapsedNanos.entrySet().stream()
                .map(entry -> String.format("%s: %d ms (%d)",
                        entry.getKey(), entry.getValue() / 1_000_000L, invocations(entry.getKey())))
                .collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return "TimerProfiler{" + elapsedNanos.keySet() + "}";
    }
}
