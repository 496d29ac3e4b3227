package org.synthesis.coloring;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 一致性检查的结果。
 * 一致时，holeOptions 为每个 hole 给出唯一的选项（一个实现所选调度器的赋值）。
 * 不一致时，holeOptions 是泛化的冲突解释：协调 hole 给出两个升序的候选选项，其余 hole 各给出一个被强制的选项。
 * 在仅做一次一致性检查的模式下，不一致结果不携带解释，holeOptions 中每个列表都为空。
 */
@Getter
public final class ConsistencyResult {

    private final boolean consistent;
    private final List<List<Integer>> holeOptions;
    /** 不一致且有解释时为协调 hole 的下标，否则为 -1 */
    private final int harmonizingHole;

    private ConsistencyResult(boolean consistent, List<List<Integer>> holeOptions, int harmonizingHole) {
        this.consistent = consistent;
        List<List<Integer>> copied = new ArrayList<>(holeOptions.size());
        for (List<Integer> options : Objects.requireNonNull(holeOptions, "Hole options cannot be null.")) {
            copied.add(List.copyOf(options));
        }
        this.holeOptions = Collections.unmodifiableList(copied);
        this.harmonizingHole = harmonizingHole;
    }

    static ConsistencyResult consistent(List<List<Integer>> assignment) {
        return new ConsistencyResult(true, assignment, -1);
    }

    static ConsistencyResult inconsistent(List<List<Integer>> explanation, int harmonizingHole) {
        return new ConsistencyResult(false, explanation, harmonizingHole);
    }

    static ConsistencyResult unexplained(int numHoles) {
        return new ConsistencyResult(false, Collections.nCopies(numHoles, List.of()), -1);
    }

    public boolean hasExplanation() {
        return !consistent && harmonizingHole >= 0;
    }

    @Override
    public String toString() {
        return (consistent ? "consistent " : "inconsistent ") + holeOptions
                + (harmonizingHole >= 0 ? " harmonizing=" + harmonizingHole : "");
    }
}
