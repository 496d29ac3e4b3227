package org.synthesis.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import lombok.Getter;
import org.synthesis.core.Hole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 负责管理 Hole 与替换槽位到 Z3 整数变量的映射。
 * 每个 hole 有两个 Z3 变量：主变量与仅用于冲突泛化的协调孪生变量。
 * 替换槽位按 "被跟踪变量在前、动作在后" 的顺序排列，路径模板表达式中的状态与动作即通过它们代入。
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    private final List<Hole> holes;
    // 以 hole 下标为索引的数组，hole 数组本身就是 arena
    private final IntExpr[] holeZ3Vars;
    private final IntExpr[] holeHarmonizingZ3Vars;

    private final List<String> variableNames;
    private final IntExpr[] stateZ3Vars;
    private final IntExpr actionZ3Var;
    private final IntExpr harmonizingZ3Var;

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     * @param holes 所有 hole，下标与 hole 的 index 一致。
     * @param variableNames 被跟踪的程序变量名，决定替换槽位的顺序。
     */
    public Z3VariableManager(Context ctx, List<Hole> holes, List<String> variableNames) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.holes = List.copyOf(Objects.requireNonNull(holes, "Holes cannot be null."));
        this.variableNames = List.copyOf(Objects.requireNonNull(variableNames, "Variable names cannot be null."));

        this.holeZ3Vars = new IntExpr[this.holes.size()];
        this.holeHarmonizingZ3Vars = new IntExpr[this.holes.size()];
        for (Hole hole : this.holes) {
            // 名称带上下标，避免 hole 名与变量名冲突
            holeZ3Vars[hole.getIndex()] = ctx.mkIntConst("h" + hole.getIndex() + ":" + hole.getName());
            holeHarmonizingZ3Vars[hole.getIndex()] = ctx.mkIntConst("z" + hole.getIndex() + ":" + hole.getName());
        }

        this.stateZ3Vars = new IntExpr[this.variableNames.size()];
        for (int variable = 0; variable < this.variableNames.size(); variable++) {
            stateZ3Vars[variable] = ctx.mkIntConst("$" + this.variableNames.get(variable));
        }
        this.actionZ3Var = ctx.mkIntConst("$act");
        this.harmonizingZ3Var = ctx.mkIntConst("__harm__");

        logger.debug("Z3VariableManager 初始化完成，管理 {} 个 hole，{} 个替换槽位。",
                this.holes.size(), this.variableNames.size() + 1);
    }

    /**
     * 获取指定 Hole 对应的 Z3 主变量。
     * @param hole Hole 对象。
     * @return 对应的 Z3 IntExpr 变量。
     */
    public IntExpr getZ3Var(Hole hole) {
        return holeZ3Vars[checkHole(hole)];
    }

    /**
     * 获取指定 Hole 对应的协调孪生变量。
     * @param hole Hole 对象。
     * @return 对应的 Z3 IntExpr 变量。
     */
    public IntExpr getZ3HarmonizingVar(Hole hole) {
        return holeHarmonizingZ3Vars[checkHole(hole)];
    }

    /**
     * @return 动作替换槽位。
     */
    public IntExpr getActionVar() {
        return actionZ3Var;
    }

    /**
     * @return 协调选择变量，取值为某个 hole 的下标。
     */
    public IntExpr getHarmonizingVar() {
        return harmonizingZ3Var;
    }

    public IntExpr getStateVar(int variable) {
        return stateZ3Vars[variable];
    }

    /**
     * @return 替换槽位：所有被跟踪变量，最后是动作槽位。
     */
    public Expr<?>[] getSubstitutionVars() {
        Expr<?>[] substitution = new Expr<?>[stateZ3Vars.length + 1];
        System.arraycopy(stateZ3Vars, 0, substitution, 0, stateZ3Vars.length);
        substitution[stateZ3Vars.length] = actionZ3Var;
        return substitution;
    }

    /**
     * 构造与 {@link #getSubstitutionVars()} 对齐的代入值。
     * @param valuation 状态的取值域下标元组。
     * @param action 选择的动作标签。
     * @return 整数常量数组。
     */
    public Expr<?>[] getSubstitutionValues(int[] valuation, int action) {
        if (valuation.length != stateZ3Vars.length) {
            logger.error("状态取值元组长度 {} 与变量个数 {} 不一致。", valuation.length, stateZ3Vars.length);
            throw new IllegalArgumentException("Valuation length does not match the number of variables.");
        }
        Expr<?>[] values = new Expr<?>[valuation.length + 1];
        for (int variable = 0; variable < valuation.length; variable++) {
            values[variable] = ctx.mkInt(valuation[variable]);
        }
        values[valuation.length] = ctx.mkInt(action);
        return values;
    }

    private int checkHole(Hole hole) {
        int index = hole.getIndex();
        if (index < 0 || index >= holes.size() || !holes.get(index).equals(hole)) {
            logger.error("未知的 hole: {}", hole);
            throw new IllegalArgumentException("Unknown hole: " + hole);
        }
        return index;
    }
}
