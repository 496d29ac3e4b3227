package org.synthesis.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 代表一个综合阶段的未知量（hole），其取值为有限的选项下标集合。
 * Hole 保存在决策树的 hole 数组中，下标即其身份；树节点与 Family 只引用下标。
 * 对应的 Z3 变量（主变量与协调孪生变量）由 Z3VariableManager 管理。
 * 此类是不可变的。
 */
@Getter
public final class Hole {

    private static final Logger logger = LoggerFactory.getLogger(Hole.class);

    public static final String ACTION_DOMAIN = "__action__";
    public static final String VARIABLE_DOMAIN = "__variable__";

    public enum Kind {
        /** 内部节点选择用于划分的变量 */
        VARIABLE,
        /** 内部节点对某个变量选择的阈值 */
        DECISION,
        /** 叶子节点选择的动作 */
        ACTION
    }

    private final int index;
    private final String name;
    private final Kind kind;
    private final int node;
    /** DECISION 类型的 hole 所划分的变量下标，其余类型为 -1 */
    private final int variable;
    private final List<String> optionLabels;
    private final String domainDescription;

    private final int hashCode;

    private Hole(int index, String name, Kind kind, int node, int variable,
                 List<String> optionLabels, String domainDescription) {
        this.index = index;
        this.name = Objects.requireNonNull(name, "Hole name cannot be null.");
        this.kind = Objects.requireNonNull(kind, "Hole kind cannot be null.");
        this.node = node;
        this.variable = variable;
        Objects.requireNonNull(optionLabels, "Option labels cannot be null.");
        if (optionLabels.isEmpty()) {
            logger.error("Hole {} 没有任何选项。", name);
            throw new IllegalArgumentException("Hole '" + name + "' has no options.");
        }
        this.optionLabels = Collections.unmodifiableList(optionLabels);
        this.domainDescription = domainDescription;
        this.hashCode = Objects.hash(index, name);
        logger.debug("创建 Hole #{}: {} ({} 个选项)", index, name, optionLabels.size());
    }

    public static Hole variableHole(int index, int node, List<String> variableNames) {
        return new Hole(index, "V_" + node, Kind.VARIABLE, node, -1, variableNames, VARIABLE_DOMAIN);
    }

    public static Hole decisionHole(int index, int node, int variable, ProgramVariable programVariable) {
        // 阈值 t 表示 "取值下标 <= t"，最后一个取值不必作为阈值
        int numThresholds = Math.max(1, programVariable.domainSize() - 1);
        List<String> labels = new ArrayList<>(numThresholds);
        for (int option = 0; option < numThresholds; option++) {
            labels.add(programVariable.labelOf(option));
        }
        return new Hole(index, programVariable.getName() + "_" + node, Kind.DECISION, node, variable,
                labels, programVariable.getName());
    }

    public static Hole actionHole(int index, int node, int numActions) {
        List<String> labels = new ArrayList<>(numActions);
        for (int action = 0; action < numActions; action++) {
            labels.add(Integer.toString(action));
        }
        return new Hole(index, "A_" + node, Kind.ACTION, node, -1, labels, ACTION_DOMAIN);
    }

    public int numOptions() {
        return optionLabels.size();
    }

    public String labelOf(int option) {
        return optionLabels.get(option);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Hole hole = (Hole) o;
        return index == hole.index && name.equals(hole.name);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name;
    }
}
