package org.synthesis.coloring;

import lombok.Getter;

/**
 * 着色引擎的可选检查开关。此类是不可变的，修改总是返回新的实例。
 */
@Getter
public final class ColoringOptions {

    private static final ColoringOptions DEFAULTS = new ColoringOptions(false, false, false);

    /** 选择兼容选项前，先确认子族自身的选项约束可满足 */
    private final boolean checkFamilyConsistency;
    /** 选择兼容选项后，再用求解器确认所选选择存在同一个 hole 赋值 */
    private final boolean checkConsistentSchedulerExistence;
    /** 以 info 级别输出解析出的每个 unsat core 元素 */
    private final boolean logUnsatCore;

    private ColoringOptions(boolean checkFamilyConsistency, boolean checkConsistentSchedulerExistence, boolean logUnsatCore) {
        this.checkFamilyConsistency = checkFamilyConsistency;
        this.checkConsistentSchedulerExistence = checkConsistentSchedulerExistence;
        this.logUnsatCore = logUnsatCore;
    }

    public static ColoringOptions defaults() {
        return DEFAULTS;
    }

    public ColoringOptions withCheckFamilyConsistency(boolean enabled) {
        return new ColoringOptions(enabled, checkConsistentSchedulerExistence, logUnsatCore);
    }

    public ColoringOptions withCheckConsistentSchedulerExistence(boolean enabled) {
        return new ColoringOptions(checkFamilyConsistency, enabled, logUnsatCore);
    }

    public ColoringOptions withLogUnsatCore(boolean enabled) {
        return new ColoringOptions(checkFamilyConsistency, checkConsistentSchedulerExistence, enabled);
    }

    @Override
    public String toString() {
        return "ColoringOptions{checkFamilyConsistency=" + checkFamilyConsistency
                + ", checkConsistentSchedulerExistence=" + checkConsistentSchedulerExistence
                + ", logUnsatCore=" + logUnsatCore + "}";
    }
}
