package org.synthesis.tree;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.Model;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Triple;
import org.synthesis.core.Family;
import org.synthesis.core.Hole;
import org.synthesis.core.ProgramVariable;
import org.synthesis.symbolic.TrackedLiteral;
import org.synthesis.symbolic.Z3Oracle;
import org.synthesis.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 代表一族候选控制器的决策树模板：内部节点的划分谓词与叶子节点的动作均为 hole。
 * 树由 (parent, childTrue, childFalse) 三元组构造，childTrue == childFalse == 节点数 表示叶子，节点 0 是根。
 * 状态在内部节点上取 "所选变量的取值下标 <= 所选阈值" 为真分支。
 * 路径的模板表达式是其各步表达式的析取，含义为 "若状态沿此路径到达叶子，则叶子的动作 hole 取该动作"。
 */
public final class DecisionTree {

    private static final Logger logger = LoggerFactory.getLogger(DecisionTree.class);

    @Getter
    private final List<ProgramVariable> variables;
    @Getter
    private final int numActions;
    @Getter
    private final List<TreeNode> nodes;
    @Getter
    private final List<Hole> holes;
    @Getter
    private final List<TreePath> paths;

    /**
     * @param variables 被跟踪的程序变量，顺序决定变量 hole 的选项。
     * @param treeList 每个节点的 (parent, childTrue, childFalse)。
     * @param numActions 动作标签全集的大小。
     * @throws IllegalArgumentException 如果树结构不合法。
     */
    public DecisionTree(List<ProgramVariable> variables, List<Triple<Integer, Integer, Integer>> treeList, int numActions) {
        this.variables = List.copyOf(Objects.requireNonNull(variables, "Variables cannot be null."));
        Objects.requireNonNull(treeList, "Tree list cannot be null.");
        if (treeList.isEmpty()) {
            logger.error("决策树没有任何节点。");
            throw new IllegalArgumentException("Decision tree has no nodes.");
        }
        if (numActions <= 0) {
            logger.error("动作全集为空: {}", numActions);
            throw new IllegalArgumentException("Number of actions must be positive.");
        }
        this.numActions = numActions;

        int numNodes = treeList.size();
        for (int node = 0; node < numNodes; node++) {
            Triple<Integer, Integer, Integer> triple = treeList.get(node);
            int childTrue = triple.getMiddle();
            int childFalse = triple.getRight();
            if ((childTrue != numNodes) != (childFalse != numNodes)) {
                logger.error("内部节点 {} 只有一个子节点: {}", node, triple);
                throw new IllegalArgumentException("Inner node " + node + " has only one child.");
            }
            if (childTrue < 0 || childTrue > numNodes || childFalse < 0 || childFalse > numNodes) {
                logger.error("节点 {} 的子节点超出范围: {}", node, triple);
                throw new IllegalArgumentException("Child of node " + node + " out of range.");
            }
            if (childTrue != numNodes && this.variables.isEmpty()) {
                logger.error("内部节点 {} 需要至少一个被跟踪的变量。", node);
                throw new IllegalArgumentException("Inner nodes require at least one tracked variable.");
            }
        }

        // 从根开始先序遍历，依次创建节点与 hole
        TreeNode[] createdNodes = new TreeNode[numNodes];
        List<Hole> createdHoles = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(0);
        while (!stack.isEmpty()) {
            int node = stack.pop();
            if (createdNodes[node] != null) {
                logger.error("节点 {} 被多次访问，树中存在共享子树或环。", node);
                throw new IllegalArgumentException("Node " + node + " is reachable along more than one route.");
            }
            Triple<Integer, Integer, Integer> triple = treeList.get(node);
            int childTrue = triple.getMiddle();
            int childFalse = triple.getRight();
            if (childTrue == numNodes) {
                Hole actionHole = Hole.actionHole(createdHoles.size(), node, numActions);
                createdHoles.add(actionHole);
                createdNodes[node] = TreeNode.terminal(node, triple.getLeft(), actionHole.getIndex());
                continue;
            }
            Hole variableHole = Hole.variableHole(createdHoles.size(), node,
                    this.variables.stream().map(ProgramVariable::getName).toList());
            createdHoles.add(variableHole);
            int[] decisionHoles = new int[this.variables.size()];
            for (int variable = 0; variable < this.variables.size(); variable++) {
                Hole decisionHole = Hole.decisionHole(createdHoles.size(), node, variable, this.variables.get(variable));
                createdHoles.add(decisionHole);
                decisionHoles[variable] = decisionHole.getIndex();
            }
            createdNodes[node] = TreeNode.inner(node, triple.getLeft(), childTrue, childFalse,
                    variableHole.getIndex(), decisionHoles);
            // 先压入假分支，使真分支先被访问
            stack.push(childFalse);
            stack.push(childTrue);
        }
        for (int node = 0; node < numNodes; node++) {
            if (createdNodes[node] == null) {
                logger.error("节点 {} 无法从根到达。", node);
                throw new IllegalArgumentException("Node " + node + " is not reachable from the root.");
            }
        }
        this.nodes = List.of(createdNodes);
        this.holes = Collections.unmodifiableList(createdHoles);
        this.paths = Collections.unmodifiableList(createPaths());

        logger.info("创建决策树: {} 个节点，{} 个 hole，{} 条路径。", numNodes, holes.size(), paths.size());
    }

    private List<TreePath> createPaths() {
        List<TreePath> created = new ArrayList<>();
        collectPaths(getRoot(), new ArrayList<>(), new ArrayList<>(), created);
        return created;
    }

    private void collectPaths(TreeNode node, List<Boolean> directions, List<Integer> visited, List<TreePath> created) {
        visited.add(node.getId());
        switch (node.getKind()) {
            case TERMINAL -> {
                boolean[] pathDirections = new boolean[directions.size()];
                for (int step = 0; step < directions.size(); step++) {
                    pathDirections[step] = directions.get(step);
                }
                int[] pathNodes = visited.stream().mapToInt(Integer::intValue).toArray();
                created.add(new TreePath(created.size(), pathDirections, pathNodes, node.getActionHole()));
            }
            case INNER -> {
                for (boolean direction : new boolean[]{true, false}) {
                    directions.add(direction);
                    collectPaths(nodes.get(node.child(direction)), directions, visited, created);
                    directions.remove(directions.size() - 1);
                }
            }
        }
        visited.remove(visited.size() - 1);
    }

    public TreeNode getRoot() {
        return nodes.get(0);
    }

    public int numNodes() {
        return nodes.size();
    }

    public int numHoles() {
        return holes.size();
    }

    public int numPaths() {
        return paths.size();
    }

    /**
     * @return 包含所有 hole 全部选项的设计空间。
     */
    public Family getFamily() {
        return Family.of(holes);
    }

    /**
     * @return 每个 hole 的 (下标, 名称, 取值域描述)。
     */
    public List<Triple<Integer, String, String>> getFamilyInfo() {
        List<Triple<Integer, String, String>> info = new ArrayList<>(holes.size());
        for (Hole hole : holes) {
            info.add(Triple.of(hole.getIndex(), hole.getName(), hole.getDomainDescription()));
        }
        return info;
    }

    // --- 路径表达式 ---

    /**
     * 构造路径的各步表达式，其中状态变量与动作以替换槽位表示。
     * 内部节点上的步为 "状态不走这条分支"，叶子上的步为 "动作 hole 等于动作槽位"。
     * @return 按步排列的表达式，长度为 path.depth()+1。
     */
    public List<BoolExpr> getPathStepExpressions(TreePath path, Context ctx, Z3VariableManager varManager) {
        List<BoolExpr> steps = new ArrayList<>(path.depth() + 1);
        for (int step = 0; step < path.depth(); step++) {
            TreeNode node = nodes.get(path.getNode(step));
            BoolExpr condition = decisionCondition(node, ctx, varManager);
            steps.add(path.getDirection(step) ? ctx.mkNot(condition) : condition);
        }
        TreeNode terminal = nodes.get(path.getTerminalNode());
        steps.add(ctx.mkEq(varManager.getZ3Var(holes.get(terminal.getActionHole())), varManager.getActionVar()));
        return steps;
    }

    /**
     * @return 路径的模板表达式：各步表达式的析取。
     */
    public BoolExpr getPathExpression(TreePath path, Context ctx, Z3VariableManager varManager) {
        return ctx.mkOr(getPathStepExpressions(path, ctx, varManager).toArray(new BoolExpr[0]));
    }

    /**
     * 构造路径的协调变体：原路径表达式，或者对路径上任一步中出现的任一 hole h，
     * "协调选择变量 == h 且该步在以 h 的孪生变量代替 h 后成立"。
     */
    public BoolExpr getHarmonizingPathExpression(TreePath path, Context ctx, Z3VariableManager varManager) {
        List<BoolExpr> steps = getPathStepExpressions(path, ctx, varManager);
        List<List<Integer>> stepHoles = getPathStepHoles(path);
        List<BoolExpr> variants = new ArrayList<>();
        variants.add(ctx.mkOr(steps.toArray(new BoolExpr[0])));
        for (int step = 0; step < steps.size(); step++) {
            for (int hole : stepHoles.get(step)) {
                Hole h = holes.get(hole);
                BoolExpr substituted = (BoolExpr) steps.get(step).substitute(
                        varManager.getZ3Var(h), varManager.getZ3HarmonizingVar(h));
                variants.add(ctx.mkAnd(
                        ctx.mkEq(varManager.getHarmonizingVar(), ctx.mkInt(hole)),
                        substituted));
            }
        }
        return ctx.mkOr(variants.toArray(new BoolExpr[0]));
    }

    /**
     * @return 每一步中出现的 hole：内部节点为变量 hole 与全部阈值 hole，叶子为动作 hole。
     */
    public List<List<Integer>> getPathStepHoles(TreePath path) {
        List<List<Integer>> stepHoles = new ArrayList<>(path.depth() + 1);
        for (int step = 0; step < path.depth(); step++) {
            stepHoles.add(nodeHoles(nodes.get(path.getNode(step))));
        }
        stepHoles.add(nodeHoles(nodes.get(path.getTerminalNode())));
        return stepHoles;
    }

    private List<Integer> nodeHoles(TreeNode node) {
        return switch (node.getKind()) {
            case INNER -> innerNodeHoles(node);
            case TERMINAL -> List.of(node.getActionHole());
        };
    }

    private List<Integer> innerNodeHoles(TreeNode node) {
        List<Integer> nodeHoles = new ArrayList<>();
        nodeHoles.add(node.getVariableHole());
        for (int variable = 0; variable < variables.size(); variable++) {
            nodeHoles.add(node.decisionHole(variable));
        }
        return nodeHoles;
    }

    // OR_v (V == v AND x_v <= D_v)
    private BoolExpr decisionCondition(TreeNode node, Context ctx, Z3VariableManager varManager) {
        IntExpr variableHole = varManager.getZ3Var(holes.get(node.getVariableHole()));
        BoolExpr[] alternatives = new BoolExpr[variables.size()];
        for (int variable = 0; variable < variables.size(); variable++) {
            IntExpr threshold = varManager.getZ3Var(holes.get(node.decisionHole(variable)));
            alternatives[variable] = ctx.mkAnd(
                    ctx.mkEq(variableHole, ctx.mkInt(variable)),
                    ctx.mkLe(varManager.getStateVar(variable), threshold));
        }
        return alternatives.length == 1 ? alternatives[0] : ctx.mkOr(alternatives);
    }

    // --- 基于取值的判断 ---

    /**
     * 判断在给定子族下是否存在某个赋值，使取值为 valuation 的状态沿该路径到达叶子。
     * 动作不参与判断。
     * @param path 路径。
     * @param family 子族。
     * @param valuation 状态的取值域下标元组。
     */
    public boolean isPathEnabledInState(TreePath path, Family family, int[] valuation) {
        for (int step = 0; step < path.depth(); step++) {
            TreeNode node = nodes.get(path.getNode(step));
            if (!isStepEnabled(node, path.getDirection(step), family, valuation)) {
                return false;
            }
        }
        return true;
    }

    private boolean isStepEnabled(TreeNode node, boolean direction, Family family, int[] valuation) {
        for (int variable : family.holeOptions(node.getVariableHole())) {
            int value = valuation[variable];
            for (int threshold : family.holeOptions(node.decisionHole(variable))) {
                if (direction ? value <= threshold : value > threshold) {
                    return true;
                }
            }
        }
        return false;
    }

    // --- 设计空间编码与模型解码 ---

    /**
     * 为每个 hole 断言子族的选项约束（主变量与孪生变量），并以 hole 为标签跟踪。
     */
    public void addFamilyEncoding(Family family, Z3Oracle oracle) {
        Context ctx = oracle.getContext();
        Z3VariableManager varManager = oracle.getVarManager();
        for (int hole = 0; hole < family.numHoles(); hole++) {
            oracle.track(family.holeEncoding(hole, ctx, varManager), TrackedLiteral.holeDomain(hole));
            oracle.track(family.harmonizingHoleEncoding(hole, ctx, varManager), TrackedLiteral.harmonizingDomain(hole));
        }
    }

    /**
     * @return 每个 hole 在模型中的主变量取值，各为单元素列表。
     */
    public List<List<Integer>> loadHoleAssignmentFromModel(Model model, Z3VariableManager varManager) {
        List<List<Integer>> holeOptions = new ArrayList<>(holes.size());
        for (Hole hole : holes) {
            List<Integer> options = new ArrayList<>(2);
            options.add(Z3Oracle.evalInt(model, varManager.getZ3Var(hole)));
            holeOptions.add(options);
        }
        return holeOptions;
    }

    /**
     * 将协调 hole 的孪生变量取值追加到其选项列表中。
     */
    public void loadHoleAssignmentFromModelHarmonizing(Model model, Z3VariableManager varManager,
                                                       List<List<Integer>> holeOptions, int harmonizingHole) {
        Hole hole = holes.get(harmonizingHole);
        holeOptions.get(harmonizingHole).add(Z3Oracle.evalInt(model, varManager.getZ3HarmonizingVar(hole)));
    }

    @Override
    public String toString() {
        return "DecisionTree(nodes=" + nodes.size() + ", holes=" + holes.size() + ", paths=" + paths.size() + ")";
    }
}
