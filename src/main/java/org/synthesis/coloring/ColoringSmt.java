package org.synthesis.coloring;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.Model;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;
import org.synthesis.core.Family;
import org.synthesis.core.ProgramVariable;
import org.synthesis.models.TransitionSystem;
import org.synthesis.symbolic.TrackedLiteral;
import org.synthesis.symbolic.Z3Oracle;
import org.synthesis.symbolic.Z3VariableManager;
import org.synthesis.tree.DecisionTree;
import org.synthesis.tree.TreePath;
import org.synthesis.utils.Profiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * 基于决策树族的选择着色与一致性引擎。
 * <p>
 * 构造时为每个 (选择, 路径) 预先计算一个只含 hole 变量的布尔表达式：把路径模板中的状态槽位代入选择所属状态的取值，
 * 动作槽位代入选择的动作。之后在综合循环的每次迭代中：
 * <ul>
 *     <li>{@link #selectCompatibleChoices(Family)} 不调用求解器，从初始状态出发选出与子族结构兼容且可达的选择；</li>
 *     <li>{@link #areChoicesConsistent(BitSet, Family)} 判断所选选择能否由同一个 hole 赋值实现，
 *     不能时给出以协调 hole 泛化的冲突解释。</li>
 * </ul>
 * 所有求解器交互都在同一个 {@link Z3Oracle} 上以嵌套作用域完成，因此本类非线程安全，且任何操作都不可重入。
 */
public final class ColoringSmt implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ColoringSmt.class);

    static final String CONSTRUCTOR_TIMER = "ColoringSmt";
    static final String CHOICE_COLORS_TIMER = "ColoringSmt::create choice colors";
    static final String HARMONIZING_VARIANTS_TIMER = "ColoringSmt::create harmonizing variants";
    static final String SELECT_TIMER = "selectCompatibleChoices";
    static final String EXPLORATION_TIMER = "selectCompatibleChoices::state exploration";
    static final String CONSISTENT_TIMER = "areChoicesConsistent";
    static final String SCHEDULER_CONSISTENT_TIMER = "areChoicesConsistent::1 is scheduler consistent?";
    static final String BETTER_CORE_TIMER = "areChoicesConsistent::2 better unsat core";
    static final String CORE_ANALYSIS_TIMER = "areChoicesConsistent::3 unsat core analysis";
    static final String LOAD_CORE_TIMER = "loadUnsatCore";

    @Getter
    private final TransitionSystem model;
    @Getter
    private final List<ProgramVariable> variables;
    @Getter
    private final DecisionTree tree;
    @Getter
    private final ColoringOptions options;
    @Getter
    private final boolean oneConsistencyCheck;
    private final Profiler profiler;
    private final Z3Oracle oracle;

    /** 每个状态的取值域下标元组 */
    private final int[][] stateValuation;
    private final BoolExpr[][] choicePathExpression;
    /** 仅一次一致性检查模式下为 null */
    private final BoolExpr[][] choicePathExpressionHarm;

    // 每个状态上结构上可走的路径，随子族变化而重新计算
    private final BitSet[] statePathEnabled;
    private final BitSet statePathEnabledComputed;
    private Family statePathEnabledFamily;

    private List<ChoicePath> unsatCore = new ArrayList<>();

    public ColoringSmt(TransitionSystem model, List<ProgramVariable> variables,
                       List<Triple<Integer, Integer, Integer>> treeList, boolean oneConsistencyCheck) {
        this(model, variables, treeList, oneConsistencyCheck, ColoringOptions.defaults(), Profiler.NONE);
    }

    /**
     * @param model 迁移系统。
     * @param variables 被跟踪的程序变量及其声明的取值域。
     * @param treeList 决策树的 (parent, childTrue, childFalse) 三元组。
     * @param oneConsistencyCheck 为 true 时不构造协调变体，一致性检查退化为直接报告不一致。
     * @param options 可选检查开关。
     * @param profiler 计时能力。
     * @throws IllegalArgumentException 如果状态取值不在声明的取值域中、模型缺少变量或树结构不合法。
     */
    public ColoringSmt(TransitionSystem model, List<ProgramVariable> variables,
                       List<Triple<Integer, Integer, Integer>> treeList, boolean oneConsistencyCheck,
                       ColoringOptions options, Profiler profiler) {
        this.model = Objects.requireNonNull(model, "Transition system cannot be null.");
        this.variables = List.copyOf(Objects.requireNonNull(variables, "Variables cannot be null."));
        this.options = Objects.requireNonNull(options, "Options cannot be null.");
        this.profiler = Objects.requireNonNull(profiler, "Profiler cannot be null.");
        this.oneConsistencyCheck = oneConsistencyCheck;

        profiler.start(CONSTRUCTOR_TIMER);
        try {
            this.stateValuation = computeStateValuations();
            this.tree = new DecisionTree(this.variables, treeList, model.numActions());
            this.oracle = new Z3Oracle(tree.getHoles(),
                    this.variables.stream().map(ProgramVariable::getName).toList(), profiler);
            try {
                this.statePathEnabled = new BitSet[model.numStates()];
                for (int state = 0; state < model.numStates(); state++) {
                    statePathEnabled[state] = new BitSet(numPaths());
                }
                this.statePathEnabledComputed = new BitSet(model.numStates());

                Context ctx = oracle.getContext();
                Z3VariableManager varManager = oracle.getVarManager();
                Expr<?>[] substitutionVars = varManager.getSubstitutionVars();

                List<BoolExpr> pathExpressions = new ArrayList<>(numPaths());
                for (TreePath path : tree.getPaths()) {
                    pathExpressions.add(tree.getPathExpression(path, ctx, varManager));
                }
                profiler.start(CHOICE_COLORS_TIMER);
                try {
                    this.choicePathExpression = groundPathExpressions(pathExpressions, substitutionVars);
                } finally {
                    profiler.stop(CHOICE_COLORS_TIMER);
                }

                if (oneConsistencyCheck) {
                    this.choicePathExpressionHarm = null;
                    logger.info("仅一次一致性检查模式：跳过协调变体的构造。");
                } else {
                    profiler.start(HARMONIZING_VARIANTS_TIMER);
                    try {
                        List<BoolExpr> harmonizingExpressions = new ArrayList<>(numPaths());
                        for (TreePath path : tree.getPaths()) {
                            harmonizingExpressions.add(tree.getHarmonizingPathExpression(path, ctx, varManager));
                        }
                        this.choicePathExpressionHarm = groundPathExpressions(harmonizingExpressions, substitutionVars);
                    } finally {
                        profiler.stop(HARMONIZING_VARIANTS_TIMER);
                    }
                }
            } catch (RuntimeException e) {
                oracle.close();
                throw e;
            }
        } finally {
            profiler.stop(CONSTRUCTOR_TIMER);
        }
        logger.info("ColoringSmt 初始化完成: {} 个状态，{} 个选择，{} 个 hole，{} 条路径。",
                numStates(), numChoices(), numHoles(), numPaths());
    }

    private int[][] computeStateValuations() {
        List<String> modelVariables = model.getVariableNames();
        int[] columns = new int[variables.size()];
        for (int variable = 0; variable < variables.size(); variable++) {
            String name = variables.get(variable).getName();
            columns[variable] = modelVariables.indexOf(name);
            if (columns[variable] < 0) {
                logger.error("模型中不存在变量 {}，已知变量: {}", name, modelVariables);
                throw new IllegalArgumentException("Unexpected variable name: " + name);
            }
        }
        long[][] values = model.getStateValues();
        int[][] valuations = new int[model.numStates()][variables.size()];
        for (int state = 0; state < model.numStates(); state++) {
            for (int variable = 0; variable < variables.size(); variable++) {
                valuations[state][variable] = variables.get(variable).optionOf(values[state][columns[variable]]);
            }
        }
        return valuations;
    }

    private BoolExpr[][] groundPathExpressions(List<BoolExpr> pathExpressions, Expr<?>[] substitutionVars) {
        Z3VariableManager varManager = oracle.getVarManager();
        BoolExpr[][] grounded = new BoolExpr[numChoices()][numPaths()];
        for (int choice = 0; choice < numChoices(); choice++) {
            Expr<?>[] values = varManager.getSubstitutionValues(
                    stateValuation[model.stateOf(choice)], model.actionOf(choice));
            for (int path = 0; path < numPaths(); path++) {
                grounded[choice][path] = (BoolExpr) pathExpressions.get(path).substitute(substitutionVars, values);
            }
        }
        return grounded;
    }

    // --- 基本信息 ---

    public int numStates() {
        return model.numStates();
    }

    public int numChoices() {
        return model.numChoices();
    }

    public int numPaths() {
        return tree.numPaths();
    }

    public int numHoles() {
        return tree.numHoles();
    }

    public Family getFamily() {
        return tree.getFamily();
    }

    /**
     * @return 每个 hole 的 (下标, 名称, 取值域描述)。
     */
    public List<Triple<Integer, String, String>> getFamilyInfo() {
        return tree.getFamilyInfo();
    }

    public int[] getStateValuation(int state) {
        return stateValuation[state].clone();
    }

    /**
     * @return 最近一次不一致检查解析出的 (选择, 路径) 冲突集合。
     */
    public List<ChoicePath> getUnsatCore() {
        return Collections.unmodifiableList(unsatCore);
    }

    /**
     * @return 当前缓存中该状态结构上可走的路径。
     */
    public BitSet getStatePathEnabled(int state) {
        return (BitSet) statePathEnabled[state].clone();
    }

    BoolExpr getChoicePathExpression(int choice, int path) {
        return choicePathExpression[choice][path];
    }

    BoolExpr getChoicePathExpressionHarm(int choice, int path) {
        if (choicePathExpressionHarm == null) {
            throw new IllegalStateException("Harmonizing variants are not available in one-consistency-check mode.");
        }
        return choicePathExpressionHarm[choice][path];
    }

    Z3Oracle getOracle() {
        return oracle;
    }

    // --- 兼容选择 ---

    /**
     * 以全部选择为基础，选出与子族兼容且可达的选择。
     * @see #selectCompatibleChoices(Family, BitSet)
     */
    public BitSet selectCompatibleChoices(Family subfamily) {
        BitSet allChoices = new BitSet(numChoices());
        allChoices.set(0, numChoices());
        return selectCompatibleChoices(subfamily, allChoices);
    }

    /**
     * 从初始状态出发做广度优先遍历，选出与子族结构兼容的选择：
     * 某条在该状态上可走的路径，其动作 hole 在子族中的选项包含选择的动作。
     * 只有被选中选择的后继才会被继续探索。
     * <p>
     * 若某个状态没有任何兼容选择：子族是赋值时选取该状态的最后一个选择（默认动作）并继续；
     * 否则子族无法从初始状态实现一个完整调度器，返回空集。
     *
     * @param subfamily 子族。
     * @param baseChoices 允许被选择的选择。
     * @return 被选中的选择；子族无法实现调度器时为空。
     */
    public BitSet selectCompatibleChoices(Family subfamily, BitSet baseChoices) {
        Objects.requireNonNull(subfamily, "Subfamily cannot be null.");
        Objects.requireNonNull(baseChoices, "Base choices cannot be null.");
        checkSubfamily(subfamily);
        profiler.start(SELECT_TIMER);
        try {
            if (options.isCheckFamilyConsistency()) {
                checkFamilyIsSat(subfamily);
            }

            BitSet selection;
            profiler.start(EXPLORATION_TIMER);
            try {
                selection = exploreCompatibleChoices(subfamily, baseChoices);
            } finally {
                profiler.stop(EXPLORATION_TIMER);
            }

            if (!selection.isEmpty() && options.isCheckConsistentSchedulerExistence()) {
                verifySelection(selection, subfamily);
            }
            logger.debug("selectCompatibleChoices: 子族 {} 选中 {} 个选择。", subfamily, selection.cardinality());
            return selection;
        } finally {
            profiler.stop(SELECT_TIMER);
        }
    }

    private BitSet exploreCompatibleChoices(Family subfamily, BitSet baseChoices) {
        resetPathEnabledCache(subfamily);
        List<TreePath> paths = tree.getPaths();
        BitSet selection = new BitSet(numChoices());
        Deque<Integer> unexploredStates = new ArrayDeque<>();
        BitSet stateReached = new BitSet(numStates());
        unexploredStates.add(model.getInitialState());
        stateReached.set(model.getInitialState());

        while (!unexploredStates.isEmpty()) {
            int state = unexploredStates.poll();
            BitSet enabledPaths = enabledPaths(state, subfamily);

            boolean anyChoiceEnabled = false;
            for (int choice = model.firstChoice(state); choice < model.endChoice(state); choice++) {
                if (!baseChoices.get(choice)) {
                    continue;
                }
                int action = model.actionOf(choice);
                for (int path = enabledPaths.nextSetBit(0); path >= 0; path = enabledPaths.nextSetBit(path + 1)) {
                    if (subfamily.holeContains(paths.get(path).getActionHole(), action)) {
                        selection.set(choice);
                        anyChoiceEnabled = true;
                        reachDestinations(choice, unexploredStates, stateReached);
                        break;
                    }
                }
            }

            if (!anyChoiceEnabled) {
                if (!subfamily.isAssignment()) {
                    logger.debug("状态 {} 没有兼容的选择，子族无法实现调度器。", state);
                    selection.clear();
                    return selection;
                }
                // 赋值必须诱导出确定的系统：选取最后一个选择，即执行随机动作的默认选择
                int choice = model.endChoice(state) - 1;
                logger.debug("状态 {} 没有兼容的选择，选取默认选择 {}。", state, choice);
                selection.set(choice);
                reachDestinations(choice, unexploredStates, stateReached);
            }
        }
        return selection;
    }

    private void reachDestinations(int choice, Deque<Integer> unexploredStates, BitSet stateReached) {
        for (int index = 0; index < model.numDestinations(choice); index++) {
            int destination = model.destinationOf(choice, index);
            if (!stateReached.get(destination)) {
                unexploredStates.add(destination);
                stateReached.set(destination);
            }
        }
    }

    private void checkFamilyIsSat(Family subfamily) {
        try (Z3Oracle.Scope scope = oracle.scope()) {
            oracle.add(subfamily.toZ3BoolExpr(oracle.getContext(), oracle.getVarManager()));
            if (!oracle.check()) {
                logger.error("子族的选项约束不可满足: {}", subfamily);
                throw new IllegalStateException("Family is UNSAT: " + subfamily);
            }
        }
    }

    private void verifySelection(BitSet selection, Family subfamily) {
        try (Z3Oracle.Scope scope = oracle.scope()) {
            tree.addFamilyEncoding(subfamily, oracle);
            for (int choice = selection.nextSetBit(0); choice >= 0; choice = selection.nextSetBit(choice + 1)) {
                BitSet enabledPaths = enabledPaths(model.stateOf(choice), subfamily);
                for (int path = enabledPaths.nextSetBit(0); path >= 0; path = enabledPaths.nextSetBit(path + 1)) {
                    oracle.add(choicePathExpression[choice][path]);
                }
            }
            if (!oracle.check()) {
                if (subfamily.isAssignment()) {
                    logger.warn("Hole 赋值 {} 没有诱导出确定的系统。", subfamily);
                } else {
                    logger.debug("子族 {} 的兼容选择不存在一致的 hole 赋值。", subfamily);
                }
                selection.clear();
            }
        }
    }

    // --- 路径可走性缓存 ---

    private void resetPathEnabledCache(Family subfamily) {
        statePathEnabledFamily = subfamily;
        statePathEnabledComputed.clear();
    }

    private BitSet enabledPaths(int state, Family subfamily) {
        if (!subfamily.equals(statePathEnabledFamily)) {
            resetPathEnabledCache(subfamily);
        }
        if (!statePathEnabledComputed.get(state)) {
            BitSet enabled = statePathEnabled[state];
            enabled.clear();
            List<TreePath> paths = tree.getPaths();
            for (int path = 0; path < paths.size(); path++) {
                if (tree.isPathEnabledInState(paths.get(path), subfamily, stateValuation[state])) {
                    enabled.set(path);
                }
            }
            statePathEnabledComputed.set(state);
        }
        return statePathEnabled[state];
    }

    // --- 一致性检查 ---

    /**
     * 判断所给选择能否由子族中的同一个 hole 赋值实现。
     * 不能时，先按状态逐步重放断言得到较小的 unsat core，再以协调变体放宽冲突，
     * 得到恰有一个 hole 取两个不同选项的泛化解释。
     *
     * @param choices 选择，通常来自对同一子族的 {@link #selectCompatibleChoices(Family)}。
     * @param subfamily 子族。
     * @return 一致时携带赋值，不一致时携带冲突解释。
     * @throws IllegalStateException 如果遍历了所有可达状态仍未得到 unsat core，或协调后的冲突仍不可满足。
     */
    public ConsistencyResult areChoicesConsistent(BitSet choices, Family subfamily) {
        Objects.requireNonNull(choices, "Choices cannot be null.");
        Objects.requireNonNull(subfamily, "Subfamily cannot be null.");
        checkSubfamily(subfamily);
        profiler.start(CONSISTENT_TIMER);
        try {
            if (oneConsistencyCheck) {
                logger.debug("仅一次一致性检查模式：直接报告不一致。");
                return ConsistencyResult.unexplained(numHoles());
            }

            try (Z3Oracle.Scope familyScope = oracle.scope()) {
                tree.addFamilyEncoding(subfamily, oracle);

                profiler.start(SCHEDULER_CONSISTENT_TIMER);
                try (Z3Oracle.Scope choiceScope = oracle.scope()) {
                    for (int choice = choices.nextSetBit(0); choice >= 0; choice = choices.nextSetBit(choice + 1)) {
                        assertChoicePaths(choice, subfamily);
                    }
                    if (oracle.check()) {
                        List<List<Integer>> assignment =
                                tree.loadHoleAssignmentFromModel(oracle.getModel(), oracle.getVarManager());
                        logger.debug("选择一致，赋值: {}", assignment);
                        return ConsistencyResult.consistent(assignment);
                    }
                } finally {
                    profiler.stop(SCHEDULER_CONSISTENT_TIMER);
                }

                profiler.start(BETTER_CORE_TIMER);
                try (Z3Oracle.Scope coreScope = oracle.scope()) {
                    Deque<Integer> unexploredStates = new ArrayDeque<>();
                    BitSet stateReached = new BitSet(numStates());
                    unexploredStates.add(model.getInitialState());
                    stateReached.set(model.getInitialState());
                    if (assertIncrementally(choices, subfamily, unexploredStates, stateReached)) {
                        logger.error("遍历了所有状态仍未找到 unsat core。");
                        throw new IllegalStateException("All states explored but UNSAT core not found.");
                    }
                    loadUnsatCore(oracle.getUnsatCore(), subfamily);
                } finally {
                    profiler.stop(BETTER_CORE_TIMER);
                }

                return harmonizeUnsatCore();
            }
        } finally {
            profiler.stop(CONSISTENT_TIMER);
        }
    }

    /**
     * 与 {@link #areChoicesConsistent(BitSet, Family)} 相同，但直接以增量方式断言，
     * 并优先从上一次 unsat core 涉及的状态开始遍历，初始状态随后加入。
     *
     * @param unsatCoreHint 上一次的 (选择, 路径) 冲突集合。
     */
    public ConsistencyResult areChoicesConsistentUseHint(BitSet choices, Family subfamily,
                                                         List<Pair<Integer, Integer>> unsatCoreHint) {
        Objects.requireNonNull(choices, "Choices cannot be null.");
        Objects.requireNonNull(subfamily, "Subfamily cannot be null.");
        Objects.requireNonNull(unsatCoreHint, "Unsat core hint cannot be null.");
        checkSubfamily(subfamily);
        profiler.start(CONSISTENT_TIMER);
        try {
            if (oneConsistencyCheck) {
                logger.debug("仅一次一致性检查模式：直接报告不一致。");
                return ConsistencyResult.unexplained(numHoles());
            }

            try (Z3Oracle.Scope familyScope = oracle.scope()) {
                tree.addFamilyEncoding(subfamily, oracle);

                profiler.start(BETTER_CORE_TIMER);
                try (Z3Oracle.Scope coreScope = oracle.scope()) {
                    Deque<Integer> unexploredStates = new ArrayDeque<>();
                    BitSet stateReached = new BitSet(numStates());
                    for (Pair<Integer, Integer> choicePath : unsatCoreHint) {
                        int choice = choicePath.getLeft();
                        if (choice < 0 || choice >= numChoices()) {
                            logger.error("unsat core 提示中的选择 {} 超出范围。", choice);
                            throw new IllegalArgumentException("Hinted choice out of range: " + choice);
                        }
                        int state = model.stateOf(choice);
                        if (!stateReached.get(state)) {
                            unexploredStates.add(state);
                            stateReached.set(state);
                        }
                    }
                    if (!stateReached.get(model.getInitialState())) {
                        unexploredStates.add(model.getInitialState());
                        stateReached.set(model.getInitialState());
                    }
                    if (assertIncrementally(choices, subfamily, unexploredStates, stateReached)) {
                        List<List<Integer>> assignment =
                                tree.loadHoleAssignmentFromModel(oracle.getModel(), oracle.getVarManager());
                        logger.debug("选择一致，赋值: {}", assignment);
                        return ConsistencyResult.consistent(assignment);
                    }
                    loadUnsatCore(oracle.getUnsatCore(), subfamily);
                } finally {
                    profiler.stop(BETTER_CORE_TIMER);
                }

                return harmonizeUnsatCore();
            }
        } finally {
            profiler.stop(CONSISTENT_TIMER);
        }
    }

    /**
     * 从给定的状态出发做广度优先遍历，逐个断言所选选择在其可走路径上的表达式，
     * 每断言一个选择就检查一次，第一次不可满足时停止。
     * @return true 表示遍历结束时断言集合仍可满足（此时求解器持有模型）。
     */
    private boolean assertIncrementally(BitSet choices, Family subfamily,
                                        Deque<Integer> unexploredStates, BitSet stateReached) {
        boolean checked = false;
        while (!unexploredStates.isEmpty()) {
            int state = unexploredStates.poll();
            for (int choice = model.firstChoice(state); choice < model.endChoice(state); choice++) {
                if (!choices.get(choice)) {
                    continue;
                }
                assertChoicePaths(choice, subfamily);
                checked = true;
                if (!oracle.check()) {
                    logger.debug("加入状态 {} 的选择 {} 后不可满足。", state, choice);
                    return false;
                }
                reachDestinations(choice, unexploredStates, stateReached);
            }
        }
        return checked || oracle.check();
    }

    private void assertChoicePaths(int choice, Family subfamily) {
        BitSet enabledPaths = enabledPaths(model.stateOf(choice), subfamily);
        for (int path = enabledPaths.nextSetBit(0); path >= 0; path = enabledPaths.nextSetBit(path + 1)) {
            oracle.track(choicePathExpression[choice][path], TrackedLiteral.choicePath(choice, path));
        }
    }

    /**
     * 将求解器的 unsat core 解析为 (选择, 路径) 列表，忽略 hole 选项约束与协调相关的标签。
     */
    private void loadUnsatCore(List<TrackedLiteral> core, Family subfamily) {
        profiler.start(LOAD_CORE_TIMER);
        try {
            List<ChoicePath> loaded = new ArrayList<>();
            for (TrackedLiteral literal : core) {
                if (!literal.isChoicePath()) {
                    continue;
                }
                ChoicePath choicePath = ChoicePath.of(literal.getChoice(), literal.getPath());
                loaded.add(choicePath);
                if (options.isLogUnsatCore()) {
                    int actionHole = tree.getPaths().get(choicePath.getPath()).getActionHole();
                    boolean actionEnabled = subfamily.holeContains(actionHole, model.actionOf(choicePath.getChoice()));
                    logger.info("choice = {}, path = {}, enabled = {}: {}", choicePath.getChoice(), choicePath.getPath(),
                            actionEnabled, choicePathExpression[choicePath.getChoice()][choicePath.getPath()]);
                }
            }
            if (loaded.isEmpty()) {
                logger.error("unsat core 中没有任何 (选择, 路径) 元素: {}", core);
                throw new IllegalStateException("UNSAT core does not contain any choice-path literal.");
            }
            this.unsatCore = loaded;
            logger.debug("unsat core 共 {} 个元素: {}", loaded.size(), loaded);
        } finally {
            profiler.stop(LOAD_CORE_TIMER);
        }
    }

    /**
     * 在当前子族作用域中断言 unsat core 的协调变体，允许恰有一个 hole 在冲突的不同部分取不同的值。
     */
    private ConsistencyResult harmonizeUnsatCore() {
        profiler.start(CORE_ANALYSIS_TIMER);
        try (Z3Oracle.Scope harmonizingScope = oracle.scope()) {
            Context ctx = oracle.getContext();
            IntExpr harmonizingVar = oracle.getVarManager().getHarmonizingVar();
            oracle.track(ctx.mkAnd(
                            ctx.mkLe(ctx.mkInt(0), harmonizingVar),
                            ctx.mkLt(harmonizingVar, ctx.mkInt(numHoles()))),
                    TrackedLiteral.harmonizingSelector());
            for (ChoicePath choicePath : unsatCore) {
                oracle.add(getChoicePathExpressionHarm(choicePath.getChoice(), choicePath.getPath()));
            }
            if (!oracle.check()) {
                logger.error("协调后的 unsat core 仍不可满足: {}", unsatCore);
                throw new IllegalStateException("Harmonized UNSAT core is not SAT.");
            }
            Model witness = oracle.getModel();
            int harmonizingHole = Z3Oracle.evalInt(witness, harmonizingVar);

            List<List<Integer>> holeOptions = tree.loadHoleAssignmentFromModel(witness, oracle.getVarManager());
            tree.loadHoleAssignmentFromModelHarmonizing(witness, oracle.getVarManager(), holeOptions, harmonizingHole);
            List<Integer> alternatives = holeOptions.get(harmonizingHole);
            if (alternatives.get(0) > alternatives.get(1)) {
                Collections.swap(alternatives, 0, 1);
            }
            logger.debug("协调 hole {} 的候选选项 {}", tree.getHoles().get(harmonizingHole), alternatives);
            return ConsistencyResult.inconsistent(holeOptions, harmonizingHole);
        } finally {
            profiler.stop(CORE_ANALYSIS_TIMER);
        }
    }

    private void checkSubfamily(Family subfamily) {
        if (!subfamily.getHoles().equals(tree.getHoles())) {
            logger.error("子族 {} 不是定义在此引擎的 hole 上。", subfamily);
            throw new IllegalArgumentException("Subfamily is not defined over the holes of this engine.");
        }
    }

    @Override
    public void close() {
        oracle.close();
    }
}
