package org.synthesis.utils;

/**
 * 计时能力接口。引擎通过它报告各阶段的耗时，自身不持有任何全局计时状态。
 */
public interface Profiler {

    /**
     * 不做任何记录的实现。
     */
    Profiler NONE = new Profiler() {
        @Override
        public void start(String label) {
        }

        @Override
        public void stop(String label) {
        }
    };

    /**
     * 开始对指定标签计时。
     * @param label 计时标签。
     */
    void start(String label);

    /**
     * 停止对指定标签计时，并累计本次耗时。
     * @param label 计时标签。
     */
    void stop(String label);
}
