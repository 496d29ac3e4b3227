package org.synthesis.tree;

import lombok.Getter;

import java.util.Arrays;
import java.util.Objects;

/**
 * 决策树中的一个节点：内部节点（持有变量 hole 与每个变量的阈值 hole）或叶子节点（持有动作 hole）。
 * 节点只保存 hole 下标与子节点下标，所有算法在 {@link DecisionTree} 中按 {@link Kind} 分派。
 * 此类是不可变的。
 */
@Getter
public final class TreeNode {

    public enum Kind {
        INNER,
        TERMINAL
    }

    private final int id;
    private final Kind kind;
    private final int parent;
    private final int childTrue;
    private final int childFalse;

    // INNER: 变量 hole 与按变量下标排列的阈值 hole
    private final int variableHole;
    private final int[] decisionHoles;
    // TERMINAL: 动作 hole
    private final int actionHole;

    private TreeNode(int id, Kind kind, int parent, int childTrue, int childFalse,
                     int variableHole, int[] decisionHoles, int actionHole) {
        this.id = id;
        this.kind = Objects.requireNonNull(kind, "Node kind cannot be null.");
        this.parent = parent;
        this.childTrue = childTrue;
        this.childFalse = childFalse;
        this.variableHole = variableHole;
        this.decisionHoles = decisionHoles;
        this.actionHole = actionHole;
    }

    static TreeNode inner(int id, int parent, int childTrue, int childFalse, int variableHole, int[] decisionHoles) {
        return new TreeNode(id, Kind.INNER, parent, childTrue, childFalse, variableHole, decisionHoles.clone(), -1);
    }

    static TreeNode terminal(int id, int parent, int actionHole) {
        return new TreeNode(id, Kind.TERMINAL, parent, -1, -1, -1, new int[0], actionHole);
    }

    public boolean isTerminal() {
        return kind == Kind.TERMINAL;
    }

    /**
     * @param direction true 表示走 "取值 <= 阈值" 的分支。
     * @return 对应的子节点下标。
     */
    public int child(boolean direction) {
        return direction ? childTrue : childFalse;
    }

    public int[] getDecisionHoles() {
        return decisionHoles.clone();
    }

    int decisionHole(int variable) {
        return decisionHoles[variable];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TreeNode node = (TreeNode) o;
        return id == node.id && kind == node.kind && parent == node.parent
                && childTrue == node.childTrue && childFalse == node.childFalse
                && variableHole == node.variableHole && actionHole == node.actionHole
                && Arrays.equals(decisionHoles, node.decisionHoles);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, parent, childTrue, childFalse);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case INNER -> "Inner(" + id + ", V=" + variableHole + ", T=" + childTrue + ", F=" + childFalse + ")";
            case TERMINAL -> "Terminal(" + id + ", A=" + actionHole + ")";
        };
    }
}
