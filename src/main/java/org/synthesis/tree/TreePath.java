package org.synthesis.tree;

import lombok.Getter;

import java.util.Arrays;

/**
 * 一条从根到叶子的路径，由每一步的分支方向确定。
 * nodes[i] 是第 i 步所在的节点，最后一个元素是叶子节点。
 */
@Getter
public final class TreePath {

    private final int index;
    private final boolean[] directions;
    private final int[] nodes;
    private final int actionHole;

    TreePath(int index, boolean[] directions, int[] nodes, int actionHole) {
        this.index = index;
        this.directions = directions;
        this.nodes = nodes;
        this.actionHole = actionHole;
    }

    /**
     * @return 内部节点上的决策步数；加上叶子上的动作步，路径共有 depth()+1 步。
     */
    public int depth() {
        return directions.length;
    }

    public boolean getDirection(int step) {
        return directions[step];
    }

    public int getNode(int step) {
        return nodes[step];
    }

    public int getTerminalNode() {
        return nodes[nodes.length - 1];
    }

    public boolean[] getDirections() {
        return directions.clone();
    }

    public int[] getNodes() {
        return nodes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TreePath path = (TreePath) o;
        return index == path.index && Arrays.equals(directions, path.directions);
    }

    @Override
    public int hashCode() {
        return 31 * index + Arrays.hashCode(directions);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("path").append(index).append('[');
        for (boolean direction : directions) {
            builder.append(direction ? 'T' : 'F');
        }
        return builder.append(']').toString();
    }
}
