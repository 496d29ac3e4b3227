package org.synthesis.models;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 代表一个有限状态的随机迁移系统（非确定性模型）。
 * 每个状态拥有一段连续的、半开区间的选择（choice）：[rowGroups[s], rowGroups[s+1])。
 * 每个选择带有一个整数动作标签与一组后继状态。
 * 每个状态还保存被跟踪的程序变量的具体取值（布尔值以 0/1 表示）。
 * 此类是不可变的。
 */
public final class TransitionSystem {

    private static final Logger logger = LoggerFactory.getLogger(TransitionSystem.class);

    @Getter
    private final List<String> variableNames;
    @Getter
    private final int initialState;
    private final int[] rowGroups;
    private final int[] choiceToState;
    private final int[] choiceToAction;
    private final int[][] choiceDestinations;
    private final long[][] stateValues;

    private TransitionSystem(List<String> variableNames, int initialState, int[] rowGroups,
                             int[] choiceToAction, int[][] choiceDestinations, long[][] stateValues) {
        this.variableNames = Collections.unmodifiableList(new ArrayList<>(variableNames));
        this.initialState = initialState;
        this.rowGroups = rowGroups;
        this.choiceToAction = choiceToAction;
        this.choiceDestinations = choiceDestinations;
        this.stateValues = stateValues;

        this.choiceToState = new int[rowGroups[rowGroups.length - 1]];
        for (int state = 0; state < numStates(); state++) {
            for (int choice = rowGroups[state]; choice < rowGroups[state + 1]; choice++) {
                choiceToState[choice] = state;
            }
        }
        logger.info("创建 TransitionSystem: {} 个状态，{} 个选择，{} 个变量。",
                numStates(), numChoices(), variableNames.size());
    }

    public static Builder builder(String... variableNames) {
        return new Builder(Arrays.asList(variableNames));
    }

    public static Builder builder(List<String> variableNames) {
        return new Builder(variableNames);
    }

    public int numStates() {
        return rowGroups.length - 1;
    }

    public int numChoices() {
        return rowGroups[rowGroups.length - 1];
    }

    /**
     * @return 动作标签的全集大小，即最大标签加一。
     */
    public int numActions() {
        int max = -1;
        for (int action : choiceToAction) {
            max = Math.max(max, action);
        }
        return max + 1;
    }

    public int firstChoice(int state) {
        return rowGroups[state];
    }

    /**
     * @return 状态之后第一个不属于它的选择下标（不包含）。
     */
    public int endChoice(int state) {
        return rowGroups[state + 1];
    }

    public int stateOf(int choice) {
        return choiceToState[choice];
    }

    public int actionOf(int choice) {
        return choiceToAction[choice];
    }

    /**
     * @return 选择的后继状态（副本）。
     */
    public int[] destinationsOf(int choice) {
        return choiceDestinations[choice].clone();
    }

    public int numDestinations(int choice) {
        return choiceDestinations[choice].length;
    }

    public int destinationOf(int choice, int index) {
        return choiceDestinations[choice][index];
    }

    public int[] getRowGroups() {
        return rowGroups.clone();
    }

    public int[] getChoiceToState() {
        return choiceToState.clone();
    }

    public int[] getChoiceToAction() {
        return choiceToAction.clone();
    }

    /**
     * @return 每个选择的后继状态（深拷贝）。
     */
    public int[][] getChoiceDestinations() {
        int[][] copied = new int[choiceDestinations.length][];
        for (int choice = 0; choice < choiceDestinations.length; choice++) {
            copied[choice] = choiceDestinations[choice].clone();
        }
        return copied;
    }

    /**
     * @return 每个状态的变量取值（深拷贝）。
     */
    public long[][] getStateValues() {
        long[][] copied = new long[stateValues.length][];
        for (int state = 0; state < stateValues.length; state++) {
            copied[state] = stateValues[state].clone();
        }
        return copied;
    }

    /**
     * 按变量名读取状态中的取值。
     * @param state 状态下标。
     * @param variableName 变量名。
     * @return 取值。
     * @throws IllegalArgumentException 如果模型没有该变量。
     */
    public long getValue(int state, String variableName) {
        int variable = variableNames.indexOf(variableName);
        if (variable < 0) {
            logger.error("模型中不存在变量 {}，已知变量: {}", variableName, variableNames);
            throw new IllegalArgumentException("Unexpected variable name: " + variableName);
        }
        return stateValues[state][variable];
    }

    @Override
    public String toString() {
        return "TransitionSystem(states=" + numStates() + ", choices=" + numChoices()
                + ", initial=" + initialState + ", variables=" + variableNames + ")";
    }

    /**
     * 按状态顺序逐个添加状态与选择的构建器，以保证每个状态的选择区间连续。
     */
    public static final class Builder {

        private final List<String> variableNames;
        private final List<long[]> stateValues = new ArrayList<>();
        private final List<Integer> rowGroups = new ArrayList<>();
        private final List<Integer> choiceToAction = new ArrayList<>();
        private final List<int[]> choiceDestinations = new ArrayList<>();
        private int initialState = 0;

        private Builder(List<String> variableNames) {
            this.variableNames = new ArrayList<>(Objects.requireNonNull(variableNames, "Variable names cannot be null."));
            rowGroups.add(0);
        }

        /**
         * 添加一个状态。
         * 新状态的下标等于此前已添加的状态个数。
         * @param values 按变量名顺序给出的取值。
         */
        public Builder addState(long... values) {
            if (values.length != variableNames.size()) {
                logger.error("状态取值个数 {} 与变量个数 {} 不一致。", values.length, variableNames.size());
                throw new IllegalArgumentException("Expected " + variableNames.size() + " values per state.");
            }
            stateValues.add(values.clone());
            rowGroups.add(rowGroups.get(rowGroups.size() - 1));
            return this;
        }

        /**
         * 为最近添加的状态追加一个选择。
         * @param state 状态下标，必须是最近添加的状态。
         * @param action 动作标签。
         * @param destinations 后继状态。
         */
        public Builder addChoice(int state, int action, int... destinations) {
            if (state != stateValues.size() - 1) {
                logger.error("选择必须按状态顺序添加：当前状态 {}，收到 {}。", stateValues.size() - 1, state);
                throw new IllegalArgumentException("Choices must be added to the most recently added state.");
            }
            if (action < 0) {
                throw new IllegalArgumentException("Action label must be non-negative: " + action);
            }
            choiceToAction.add(action);
            choiceDestinations.add(destinations.clone());
            rowGroups.set(rowGroups.size() - 1, rowGroups.get(rowGroups.size() - 1) + 1);
            return this;
        }

        public Builder initialState(int state) {
            this.initialState = state;
            return this;
        }

        public TransitionSystem build() {
            int numStates = stateValues.size();
            if (numStates == 0) {
                logger.error("迁移系统没有任何状态。");
                throw new IllegalArgumentException("Transition system has no states.");
            }
            if (initialState < 0 || initialState >= numStates) {
                logger.error("初始状态 {} 超出范围 [0, {})。", initialState, numStates);
                throw new IllegalArgumentException("Initial state out of range: " + initialState);
            }
            int[] groups = rowGroups.stream().mapToInt(Integer::intValue).toArray();
            for (int state = 0; state < numStates; state++) {
                if (groups[state] == groups[state + 1]) {
                    logger.error("状态 {} 没有任何选择。", state);
                    throw new IllegalArgumentException("State " + state + " has no choices.");
                }
            }
            for (int choice = 0; choice < choiceDestinations.size(); choice++) {
                for (int destination : choiceDestinations.get(choice)) {
                    if (destination < 0 || destination >= numStates) {
                        logger.error("选择 {} 的后继 {} 超出范围。", choice, destination);
                        throw new IllegalArgumentException("Destination " + destination + " of choice " + choice + " out of range.");
                    }
                }
            }
            return new TransitionSystem(
                    variableNames,
                    initialState,
                    groups,
                    choiceToAction.stream().mapToInt(Integer::intValue).toArray(),
                    choiceDestinations.toArray(new int[0][]),
                    stateValues.toArray(new long[0][]));
        }
    }
}
