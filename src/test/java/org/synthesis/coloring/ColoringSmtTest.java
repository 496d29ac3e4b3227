package org.synthesis.coloring;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.synthesis.core.Family;
import org.synthesis.core.ProgramVariable;
import org.synthesis.models.TransitionSystem;
import org.synthesis.symbolic.Z3Oracle;
import org.synthesis.utils.Profiler;
import org.synthesis.utils.TimerProfiler;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ColoringSmtTest {

    // --- Test Setup ---
    // 两个状态，每个状态有动作 0 与动作 1 两个选择；x 在状态 0 为 false，在状态 1 为 true
    private static final List<ProgramVariable> VARIABLES = List.of(ProgramVariable.bool("x"));

    private static final List<Triple<Integer, Integer, Integer>> SINGLE_LEAF = List.of(Triple.of(0, 1, 1));

    // 根节点按 x 划分：x 为 false 时到叶子 1，为 true 时到叶子 2
    private static final List<Triple<Integer, Integer, Integer>> DEPTH_ONE =
            List.of(Triple.of(3, 1, 2), Triple.of(0, 3, 3), Triple.of(0, 3, 3));

    // 选择 0: s0 动作0 -> s1, 选择 1: s0 动作1 -> s1, 选择 2: s1 动作0 -> s1, 选择 3: s1 动作1 -> s0
    private static TransitionSystem twoStates() {
        return TransitionSystem.builder("x")
                .addState(0)
                .addChoice(0, 0, 1)
                .addChoice(0, 1, 1)
                .addState(1)
                .addChoice(1, 0, 1)
                .addChoice(1, 1, 0)
                .initialState(0)
                .build();
    }

    private static BitSet bits(int... indices) {
        BitSet bitSet = new BitSet();
        for (int index : indices) {
            bitSet.set(index);
        }
        return bitSet;
    }

    /**
     * 检查每个被选中的选择所在的状态都能从初始状态经由被选中的选择到达。
     */
    private static boolean selectionIsReachable(TransitionSystem model, BitSet selection) {
        BitSet reached = new BitSet();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(model.getInitialState());
        reached.set(model.getInitialState());
        while (!queue.isEmpty()) {
            int state = queue.poll();
            for (int choice = model.firstChoice(state); choice < model.endChoice(state); choice++) {
                if (!selection.get(choice)) {
                    continue;
                }
                for (int destination : model.destinationsOf(choice)) {
                    if (!reached.get(destination)) {
                        reached.set(destination);
                        queue.add(destination);
                    }
                }
            }
        }
        for (int choice = selection.nextSetBit(0); choice >= 0; choice = selection.nextSetBit(choice + 1)) {
            if (!reached.get(model.stateOf(choice))) {
                return false;
            }
        }
        return true;
    }

    @Nested
    @TestInstance(TestInstance.Lifecycle.PER_CLASS)
    @DisplayName("单叶子树 (Single terminal tree)")
    class SingleLeafTests {

        private TransitionSystem model;
        private ColoringSmt engine;

        @BeforeAll
        void setUp() {
            model = twoStates();
            engine = new ColoringSmt(model, VARIABLES, SINGLE_LEAF, false);
        }

        @AfterAll
        void tearDown() {
            engine.close();
        }

        @Test
        @DisplayName("引擎的基本规模")
        void testDimensions() {
            assertAll("Dimensions",
                    () -> assertEquals(2, engine.numStates()),
                    () -> assertEquals(4, engine.numChoices()),
                    () -> assertEquals(1, engine.numHoles()),
                    () -> assertEquals(1, engine.numPaths()),
                    () -> assertEquals(List.of(Triple.of(0, "A_0", "__action__")), engine.getFamilyInfo()),
                    () -> assertArrayEquals(new int[]{1}, engine.getStateValuation(1))
            );
        }

        @Test
        @DisplayName("动作 hole 固定为 0 时，每个可达状态恰好选中动作 0 的选择")
        void testSelect_FixedAction() {
            Family sub = engine.getFamily().assumeHoleOptions(0, List.of(0));
            assertEquals(bits(0, 2), engine.selectCompatibleChoices(sub));
        }

        @Test
        @DisplayName("状态没有任何允许的选择且子族不是赋值时返回空集")
        void testSelect_NoCompatibleChoice_ReturnsEmpty() {
            BitSet selection = engine.selectCompatibleChoices(engine.getFamily(), bits(0, 1));
            assertTrue(selection.isEmpty());
        }

        @Test
        @DisplayName("子族是赋值时，没有兼容选择的状态选取其最后一个选择")
        void testSelect_AssignmentFallsBackToLastChoice() {
            Family assignment = engine.getFamily().assumeHoleOptions(0, List.of(0));
            BitSet selection = engine.selectCompatibleChoices(assignment, bits(0));

            assertEquals(bits(0, 3), selection);
        }

        @Test
        @DisplayName("同一状态下的动作相同则一致，并给出该动作作为赋值")
        void testConsistent_SameAction() {
            ConsistencyResult result = engine.areChoicesConsistent(bits(1, 3), engine.getFamily());

            assertAll(
                    () -> assertTrue(result.isConsistent()),
                    () -> assertEquals(List.of(List.of(1)), result.getHoleOptions()),
                    () -> assertFalse(result.hasExplanation())
            );
        }

        @Test
        @DisplayName("两个状态要求同一动作 hole 取不同值时，协调 hole 即该动作 hole")
        void testInconsistent_HarmonizesActionHole() {
            ConsistencyResult result = engine.areChoicesConsistent(bits(0, 3), engine.getFamily());

            assertAll("Conflict explanation",
                    () -> assertFalse(result.isConsistent()),
                    () -> assertTrue(result.hasExplanation()),
                    () -> assertEquals(0, result.getHarmonizingHole()),
                    () -> assertEquals(List.of(List.of(0, 1)), result.getHoleOptions()),
                    () -> assertEquals(List.of(ChoicePath.of(0, 0), ChoicePath.of(3, 0)),
                            engine.getUnsatCore().stream().sorted().toList())
            );
        }

        @Test
        @DisplayName("所选选择从初始状态不可达时，遍历结束仍未得到 unsat core 属于内部错误")
        void testUnreachableConflict_ShouldThrow() {
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> engine.areChoicesConsistent(bits(2, 3), engine.getFamily()));

            assertAll(
                    () -> assertEquals("All states explored but UNSAT core not found.", e.getMessage()),
                    () -> assertEquals(0, engine.getOracle().getScopeDepth())
            );
        }

        @Test
        @DisplayName("赋值的默认选择与其冲突时，协调后的冲突不可满足属于内部错误")
        void testFallbackConflictUnderAssignment_ShouldThrow() {
            Family assignment = engine.getFamily().assumeHoleOptions(0, List.of(0));
            BitSet selection = engine.selectCompatibleChoices(assignment, bits(0));
            assertEquals(bits(0, 3), selection);

            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> engine.areChoicesConsistent(selection, assignment));

            assertAll(
                    () -> assertEquals("Harmonized UNSAT core is not SAT.", e.getMessage()),
                    () -> assertEquals(0, engine.getOracle().getScopeDepth()),
                    () -> assertTrue(engine.areChoicesConsistent(bits(0, 2), engine.getFamily()).isConsistent())
            );
        }

        @Test
        @DisplayName("求解器作用域在每次调用后都被完全弹出")
        void testScopesAreBalanced() {
            engine.selectCompatibleChoices(engine.getFamily());
            engine.areChoicesConsistent(bits(0, 3), engine.getFamily());
            engine.areChoicesConsistent(bits(0, 2), engine.getFamily());

            assertEquals(0, engine.getOracle().getScopeDepth());
        }
    }

    @Nested
    @TestInstance(TestInstance.Lifecycle.PER_CLASS)
    @DisplayName("深度为一的树 (Depth-one tree)")
    class DepthOneTests {

        private TransitionSystem model;
        private ColoringSmt engine;
        private Family family;

        @BeforeAll
        void setUp() {
            model = twoStates();
            engine = new ColoringSmt(model, VARIABLES, DEPTH_ONE, false);
            family = engine.getFamily();
        }

        @AfterAll
        void tearDown() {
            engine.close();
        }

        @Test
        @DisplayName("hole 依次为 V_0, x_0, A_1, A_2，每个状态只有一条可走路径")
        void testHolesAndEnabledPaths() {
            engine.selectCompatibleChoices(family);

            assertAll(
                    () -> assertEquals(List.of("V_0", "x_0", "A_1", "A_2"),
                            engine.getFamilyInfo().stream().map(Triple::getMiddle).toList()),
                    () -> assertEquals(bits(0), engine.getStatePathEnabled(0)),
                    () -> assertEquals(bits(1), engine.getStatePathEnabled(1))
            );
        }

        @Test
        @DisplayName("完整设计空间下选中所有可达的选择")
        void testSelect_FullFamily() {
            BitSet selection = engine.selectCompatibleChoices(family);

            assertAll(
                    () -> assertEquals(bits(0, 1, 2, 3), selection),
                    () -> assertTrue(selectionIsReachable(model, selection))
            );
        }

        @Test
        @DisplayName("赋值在每个可达状态上恰好选中一个选择")
        void testSelect_AssignmentIsTotal() {
            Family assignment = family.assumeOptions(List.of(List.of(0), List.of(0), List.of(1), List.of(0)));
            BitSet selection = engine.selectCompatibleChoices(assignment);

            assertAll(
                    () -> assertEquals(bits(1, 2), selection),
                    () -> assertTrue(selectionIsReachable(model, selection))
            );
            for (int state = 0; state < model.numStates(); state++) {
                BitSet inState = (BitSet) selection.clone();
                inState.and(bits(model.firstChoice(state), model.endChoice(state) - 1));
                assertEquals(1, inState.cardinality(), "state " + state);
            }
        }

        @Test
        @DisplayName("重复调用结果相同，子族的选择是父族选择的子集")
        void testSelect_IdempotentAndMonotone() {
            Family sub = family.assumeHoleOptions(2, List.of(0));
            BitSet first = engine.selectCompatibleChoices(sub);
            BitSet second = engine.selectCompatibleChoices(sub);
            BitSet full = engine.selectCompatibleChoices(family);

            BitSet outside = (BitSet) first.clone();
            outside.andNot(full);
            assertAll(
                    () -> assertEquals(first, second),
                    () -> assertEquals(bits(0, 2, 3), first),
                    () -> assertTrue(outside.isEmpty())
            );
        }

        @Test
        @DisplayName("按 x 区分动作的调度器是一致的，且赋值能重新选出同样的选择")
        void testConsistent_RoundTrip() {
            BitSet scheduler = bits(0, 3);
            ConsistencyResult result = engine.areChoicesConsistent(scheduler, family);
            assertTrue(result.isConsistent());
            assertEquals(List.of(List.of(0), List.of(0), List.of(0), List.of(1)), result.getHoleOptions());

            Family assignment = family.assumeOptions(result.getHoleOptions());
            assertAll(
                    () -> assertTrue(assignment.isAssignment()),
                    () -> assertEquals(scheduler, engine.selectCompatibleChoices(assignment)),
                    () -> assertTrue(engine.areChoicesConsistent(scheduler, assignment).isConsistent())
            );
        }

        @Test
        @DisplayName("同一状态的两个动作冲突时，解释以该叶子的动作 hole 协调")
        void testInconsistent_Explanation() {
            ConsistencyResult result = engine.areChoicesConsistent(bits(0, 1, 2), family);
            int hole = result.getHarmonizingHole();
            List<Integer> alternatives = result.getHoleOptions().get(hole);

            assertAll("Explanation",
                    () -> assertFalse(result.isConsistent()),
                    () -> assertEquals(2, hole),
                    () -> assertEquals(List.of(0, 1), alternatives),
                    () -> assertTrue(family.holeContains(hole, alternatives.get(0))),
                    () -> assertTrue(family.holeContains(hole, alternatives.get(1))),
                    () -> assertEquals(List.of(0), result.getHoleOptions().get(0)),
                    () -> assertEquals(List.of(0), result.getHoleOptions().get(1)),
                    () -> assertTrue(engine.getUnsatCore().contains(ChoicePath.of(0, 0))),
                    () -> assertTrue(engine.getUnsatCore().contains(ChoicePath.of(1, 0)))
            );
        }

        @Test
        @DisplayName("把协调 hole 固定为任一候选选项，冲突仍然存在")
        void testInconsistent_EitherAlternativeStillConflicts() {
            ConsistencyResult result = engine.areChoicesConsistent(bits(0, 1, 2), family);
            int hole = result.getHarmonizingHole();

            List<ChoicePath> core = engine.getUnsatCore();
            Z3Oracle oracle = engine.getOracle();

            for (int option : result.getHoleOptions().get(hole)) {
                Family fixed = family.assumeHoleOptions(hole, List.of(option));
                try (Z3Oracle.Scope scope = oracle.scope()) {
                    engine.getTree().addFamilyEncoding(fixed, oracle);
                    for (ChoicePath choicePath : core) {
                        oracle.add(engine.getChoicePathExpression(choicePath.getChoice(), choicePath.getPath()));
                    }
                    assertFalse(oracle.check(), "option " + option);
                }
            }
        }

        @Test
        @DisplayName("使用 unsat core 提示时，结果与不带提示的检查一致")
        void testUseHint() {
            ConsistencyResult inconsistent = engine.areChoicesConsistentUseHint(
                    bits(0, 1, 2), family, List.of(Pair.of(1, 0)));
            ConsistencyResult consistent = engine.areChoicesConsistentUseHint(
                    bits(0, 3), family, List.of(Pair.of(3, 1)));

            assertAll(
                    () -> assertFalse(inconsistent.isConsistent()),
                    () -> assertEquals(2, inconsistent.getHarmonizingHole()),
                    () -> assertEquals(List.of(0, 1), inconsistent.getHoleOptions().get(2)),
                    () -> assertTrue(consistent.isConsistent()),
                    () -> assertEquals(List.of(1), consistent.getHoleOptions().get(3)),
                    () -> assertThrows(IllegalArgumentException.class, () -> engine.areChoicesConsistentUseHint(
                            bits(0), family, List.of(Pair.of(7, 0))))
            );
        }

        @Test
        @DisplayName("空的选择集合总是一致的")
        void testConsistent_EmptySelection() {
            assertAll(
                    () -> assertTrue(engine.areChoicesConsistent(new BitSet(), family).isConsistent()),
                    () -> assertTrue(engine.areChoicesConsistentUseHint(new BitSet(), family, List.of()).isConsistent())
            );
        }

        @Test
        @DisplayName("定义在其他 hole 上的子族被拒绝")
        void testForeignFamily_ShouldThrow() {
            try (ColoringSmt other = new ColoringSmt(model, VARIABLES, SINGLE_LEAF, false)) {
                assertThrows(IllegalArgumentException.class, () -> engine.selectCompatibleChoices(other.getFamily()));
            }
        }
    }

    @Nested
    @DisplayName("可选检查与计时 (Options and profiling)")
    class OptionsTests {

        @Test
        @DisplayName("双重检查发现赋值没有诱导出确定系统时清空选择")
        void testSchedulerExistenceCheck_ClearsFallbackSelection() {
            ColoringOptions options = ColoringOptions.defaults().withCheckConsistentSchedulerExistence(true);
            try (ColoringSmt engine = new ColoringSmt(twoStates(), VARIABLES, SINGLE_LEAF, false, options, Profiler.NONE)) {
                Family assignment = engine.getFamily().assumeHoleOptions(0, List.of(0));

                assertAll(
                        () -> assertTrue(engine.selectCompatibleChoices(assignment, bits(0)).isEmpty()),
                        () -> assertEquals(bits(0, 2), engine.selectCompatibleChoices(assignment))
                );
            }
        }

        @Test
        @DisplayName("子族一致性预检查与 unsat core 日志不改变结果")
        void testFamilyCheckAndCoreLogging() {
            ColoringOptions options = ColoringOptions.defaults()
                    .withCheckFamilyConsistency(true)
                    .withLogUnsatCore(true);
            try (ColoringSmt engine = new ColoringSmt(twoStates(), VARIABLES, DEPTH_ONE, false, options, Profiler.NONE)) {
                assertAll(
                        () -> assertEquals(bits(0, 1, 2, 3), engine.selectCompatibleChoices(engine.getFamily())),
                        () -> assertEquals(2, engine.areChoicesConsistent(bits(0, 1, 2), engine.getFamily())
                                .getHarmonizingHole())
                );
            }
        }

        @Test
        @DisplayName("各阶段通过传入的 Profiler 计时，调用结束后没有计时器在运行")
        void testProfiler() {
            TimerProfiler profiler = new TimerProfiler();
            try (ColoringSmt engine = new ColoringSmt(twoStates(), VARIABLES, DEPTH_ONE, false,
                    ColoringOptions.defaults(), profiler)) {
                engine.selectCompatibleChoices(engine.getFamily());
                engine.areChoicesConsistent(bits(0, 1, 2), engine.getFamily());
            }

            assertAll(
                    () -> assertEquals(1, profiler.invocations(ColoringSmt.SELECT_TIMER)),
                    () -> assertEquals(1, profiler.invocations(ColoringSmt.CONSISTENT_TIMER)),
                    () -> assertEquals(1, profiler.invocations(ColoringSmt.HARMONIZING_VARIANTS_TIMER)),
                    () -> assertTrue(profiler.invocations("solver.check()") >= 3),
                    () -> assertFalse(profiler.isRunning(ColoringSmt.CONSISTENT_TIMER)),
                    () -> assertEquals(1, profiler.invocations(ColoringSmt.CONSTRUCTOR_TIMER))
            );
        }

        @Test
        @DisplayName("仅一次一致性检查模式下，一致性检查直接报告不一致且没有解释")
        void testOneConsistencyCheck() {
            try (ColoringSmt engine = new ColoringSmt(twoStates(), VARIABLES, DEPTH_ONE, true)) {
                ConsistencyResult result = engine.areChoicesConsistent(bits(0, 3), engine.getFamily());

                assertAll(
                        () -> assertFalse(result.isConsistent()),
                        () -> assertFalse(result.hasExplanation()),
                        () -> assertEquals(4, result.getHoleOptions().size()),
                        () -> assertTrue(result.getHoleOptions().stream().allMatch(List::isEmpty)),
                        () -> assertEquals(bits(0, 1, 2, 3), engine.selectCompatibleChoices(engine.getFamily())),
                        () -> assertThrows(IllegalStateException.class, () -> engine.getChoicePathExpressionHarm(0, 0))
                );
            }
        }
    }

    @Nested
    @DisplayName("非法输入 (Malformed input)")
    class MalformedInputTests {

        @Test
        @DisplayName("状态取值不在变量的取值域中时构造失败")
        void testValueOutsideDomain_ShouldThrow() {
            TransitionSystem model = TransitionSystem.builder("x")
                    .addState(2)
                    .addChoice(0, 0, 0)
                    .build();
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> new ColoringSmt(model, VARIABLES, SINGLE_LEAF, false));
            assertTrue(e.getMessage().contains("no matching domain option"));
        }

        @Test
        @DisplayName("模型中缺少被跟踪的变量时构造失败")
        void testUnknownVariable_ShouldThrow() {
            List<ProgramVariable> variables = List.of(ProgramVariable.bool("y"));
            assertThrows(IllegalArgumentException.class,
                    () -> new ColoringSmt(twoStates(), variables, DEPTH_ONE, false));
        }

        @Test
        @DisplayName("树结构不合法时构造失败")
        void testMalformedTree_ShouldThrow() {
            List<Triple<Integer, Integer, Integer>> tree =
                    List.of(Triple.of(3, 1, 3), Triple.of(0, 3, 3), Triple.of(0, 3, 3));
            assertThrows(IllegalArgumentException.class,
                    () -> new ColoringSmt(twoStates(), VARIABLES, tree, false));
        }
    }
}
