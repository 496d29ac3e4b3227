package org.synthesis.models;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransitionSystemTest {

    private static TransitionSystem twoStates() {
        return TransitionSystem.builder("x", "y")
                .addState(0, 5)
                .addChoice(0, 0, 1)
                .addChoice(0, 2, 0, 1)
                .addState(1, 9)
                .addChoice(1, 1, 1)
                .initialState(0)
                .build();
    }

    @Nested
    @DisplayName("结构查询 (Structure)")
    class StructureTests {

        @Test
        @DisplayName("选择区间连续且 choiceToState 与之对应")
        void testRowGroups() {
            TransitionSystem system = twoStates();

            assertAll("Row groups",
                    () -> assertEquals(2, system.numStates()),
                    () -> assertEquals(3, system.numChoices()),
                    () -> assertEquals(0, system.firstChoice(0)),
                    () -> assertEquals(2, system.endChoice(0)),
                    () -> assertEquals(2, system.firstChoice(1)),
                    () -> assertEquals(3, system.endChoice(1)),
                    () -> assertEquals(0, system.stateOf(1)),
                    () -> assertEquals(1, system.stateOf(2))
            );
        }

        @Test
        @DisplayName("动作全集大小为最大标签加一")
        void testNumActions() {
            TransitionSystem system = twoStates();

            assertAll(
                    () -> assertEquals(3, system.numActions()),
                    () -> assertEquals(2, system.actionOf(1)),
                    () -> assertArrayEquals(new int[]{0, 1}, system.destinationsOf(1))
            );
        }

        @Test
        @DisplayName("修改返回的数组不会改变迁移系统")
        void testReturnedArrays_AreCopies() {
            TransitionSystem system = twoStates();
            system.destinationsOf(0)[0] = 0;
            system.getChoiceToAction()[0] = 1;
            system.getChoiceToState()[2] = 0;
            system.getRowGroups()[1] = 3;
            system.getChoiceDestinations()[1][0] = 1;
            system.getStateValues()[0][1] = 7;

            assertAll("Unchanged model",
                    () -> assertArrayEquals(new int[]{1}, system.destinationsOf(0)),
                    () -> assertEquals(1, system.numDestinations(0)),
                    () -> assertEquals(1, system.destinationOf(0, 0)),
                    () -> assertEquals(0, system.actionOf(0)),
                    () -> assertEquals(1, system.stateOf(2)),
                    () -> assertEquals(2, system.endChoice(0)),
                    () -> assertArrayEquals(new int[]{0, 1}, system.destinationsOf(1)),
                    () -> assertEquals(5, system.getValue(0, "y"))
            );
        }

        @Test
        @DisplayName("按变量名读取状态取值，未知变量名抛出异常")
        void testGetValue() {
            TransitionSystem system = twoStates();

            assertAll(
                    () -> assertEquals(5, system.getValue(0, "y")),
                    () -> assertEquals(1, system.getValue(1, "x")),
                    () -> assertThrows(IllegalArgumentException.class, () -> system.getValue(0, "z"))
            );
        }
    }

    @Nested
    @DisplayName("构建校验 (Builder validation)")
    class ValidationTests {

        @Test
        @DisplayName("没有选择的状态被拒绝")
        void testBuild_StateWithoutChoices_ShouldThrow() {
            TransitionSystem.Builder builder = TransitionSystem.builder("x")
                    .addState(0)
                    .addChoice(0, 0, 1)
                    .addState(1);
            assertThrows(IllegalArgumentException.class, builder::build);
        }

        @Test
        @DisplayName("后继越界被拒绝")
        void testBuild_DestinationOutOfRange_ShouldThrow() {
            TransitionSystem.Builder builder = TransitionSystem.builder("x")
                    .addState(0)
                    .addChoice(0, 0, 3);
            assertThrows(IllegalArgumentException.class, builder::build);
        }

        @Test
        @DisplayName("初始状态越界被拒绝")
        void testBuild_InitialStateOutOfRange_ShouldThrow() {
            TransitionSystem.Builder builder = TransitionSystem.builder("x")
                    .addState(0)
                    .addChoice(0, 0, 0)
                    .initialState(1);
            assertThrows(IllegalArgumentException.class, builder::build);
        }

        @Test
        @DisplayName("选择必须添加到最近的状态，取值个数必须与变量个数一致")
        void testBuilder_OutOfOrder_ShouldThrow() {
            TransitionSystem.Builder builder = TransitionSystem.builder("x").addState(0);

            assertAll(
                    () -> assertThrows(IllegalArgumentException.class, () -> builder.addChoice(1, 0, 0)),
                    () -> assertThrows(IllegalArgumentException.class, () -> builder.addChoice(0, -1, 0)),
                    () -> assertThrows(IllegalArgumentException.class, () -> builder.addState(0, 1)),
                    () -> assertThrows(IllegalArgumentException.class, () -> TransitionSystem.builder("x").build())
            );
        }
    }
}
