package org.synthesis.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Model;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import lombok.Getter;
import org.synthesis.core.Hole;
import org.synthesis.utils.Profiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 封装一个 Z3 Context 与一个增量求解器。
 * 断言通过 {@link #scope()} 获得的作用域分层管理，作用域关闭时自动 pop，
 * 因此任何退出路径（包括异常）都不会遗留不匹配的作用域。
 * 带标签的断言通过旁表把跟踪常量映射回 {@link TrackedLiteral}。
 * 非线程安全：作用域纪律不可重入，每个工作线程需要自己的 Oracle。
 */
public final class Z3Oracle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    public static final String CHECK_TIMER = "solver.check()";

    @Getter
    private final Context context;
    private final Solver solver;
    @Getter
    private final Z3VariableManager varManager;
    private final Profiler profiler;

    private final Map<TrackedLiteral, BoolExpr> trackingConstants = new HashMap<>();
    private final Map<BoolExpr, TrackedLiteral> trackedLiterals = new HashMap<>();

    @Getter
    private int scopeDepth = 0;
    private boolean closed = false;

    /**
     * @param holes 所有 hole，下标与 hole 的 index 一致。
     * @param variableNames 被跟踪的程序变量名。
     * @param profiler 计时能力。
     */
    public Z3Oracle(List<Hole> holes, List<String> variableNames, Profiler profiler) {
        this.profiler = Objects.requireNonNull(profiler, "Profiler cannot be null.");
        this.context = new Context();
        this.solver = context.mkSolver();
        this.varManager = new Z3VariableManager(context, holes, variableNames);
        logger.debug("Z3Oracle 初始化完成。");
    }

    /**
     * 进入一个新的断言作用域。
     * @return 关闭时执行 pop 的作用域对象，应在 try-with-resources 中使用。
     */
    public Scope scope() {
        ensureOpen();
        solver.push();
        scopeDepth++;
        logger.debug("solver.push()，当前深度 {}", scopeDepth);
        return new Scope(scopeDepth);
    }

    /**
     * 在当前作用域中断言一个不带标签的约束。
     */
    public void add(BoolExpr constraint) {
        ensureOpen();
        solver.add(constraint);
    }

    /**
     * 在当前作用域中断言一个带标签的约束，以便之后出现在 unsat core 中。
     * @param constraint 约束。
     * @param literal 标签。
     */
    public void track(BoolExpr constraint, TrackedLiteral literal) {
        ensureOpen();
        BoolExpr tracking = trackingConstants.computeIfAbsent(literal, l -> {
            BoolExpr constant = context.mkBoolConst(l.symbolName());
            trackedLiterals.put(constant, l);
            return constant;
        });
        solver.assertAndTrack(constraint, tracking);
    }

    /**
     * 检查当前断言集合的可满足性。
     * @return true 表示 SAT，false 表示 UNSAT。
     * @throws IllegalStateException 如果求解器返回 UNKNOWN。
     */
    public boolean check() {
        ensureOpen();
        profiler.start(CHECK_TIMER);
        Status status;
        try {
            status = solver.check();
        } finally {
            profiler.stop(CHECK_TIMER);
        }
        logger.debug("solver.check() = {}", status);
        return switch (status) {
            case SATISFIABLE -> true;
            case UNSATISFIABLE -> false;
            case UNKNOWN -> {
                logger.error("Z3 返回 UNKNOWN: {}", solver.getReasonUnknown());
                throw new IllegalStateException("Solver returned UNKNOWN: " + solver.getReasonUnknown());
            }
        };
    }

    public Model getModel() {
        ensureOpen();
        return solver.getModel();
    }

    /**
     * 取回最近一次 UNSAT 检查的 unsat core，并通过旁表解析为标签。
     * @return 按求解器返回顺序排列的标签。
     */
    public List<TrackedLiteral> getUnsatCore() {
        ensureOpen();
        BoolExpr[] core = solver.getUnsatCore();
        List<TrackedLiteral> literals = new ArrayList<>(core.length);
        for (BoolExpr constant : core) {
            TrackedLiteral literal = trackedLiterals.get(constant);
            if (literal == null) {
                logger.error("unsat core 中出现未登记的跟踪常量 {}", constant);
                throw new IllegalStateException("Unknown tracking literal in unsat core: " + constant);
            }
            literals.add(literal);
        }
        logger.debug("unsat core: {}", literals);
        return literals;
    }

    /**
     * 在模型中求值一个整数变量，未出现在约束中的变量按模型补全取值。
     */
    public static int evalInt(Model model, IntExpr variable) {
        IntNum value = (IntNum) model.eval(variable, true);
        return value.getInt();
    }

    public int numAssertions() {
        ensureOpen();
        return solver.getAssertions().length;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Z3Oracle is already closed.");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        if (scopeDepth != 0) {
            logger.warn("关闭 Z3Oracle 时仍有 {} 个未关闭的作用域。", scopeDepth);
        }
        closed = true;
        trackingConstants.clear();
        trackedLiterals.clear();
        context.close();
        logger.debug("Z3Oracle 已关闭。");
    }

    /**
     * 一个求解器作用域。关闭时 pop 一次；作用域必须按后进先出的顺序关闭。
     */
    public final class Scope implements AutoCloseable {

        private final int depth;
        private boolean popped = false;

        private Scope(int depth) {
            this.depth = depth;
        }

        @Override
        public void close() {
            if (popped) {
                return;
            }
            if (depth != scopeDepth) {
                logger.error("作用域关闭顺序错误：期望深度 {}，当前深度 {}", depth, scopeDepth);
                throw new IllegalStateException("Solver scopes must be closed in LIFO order.");
            }
            popped = true;
            if (closed) {
                return;
            }
            solver.pop();
            scopeDepth--;
            logger.debug("solver.pop()，当前深度 {}", scopeDepth);
        }
    }
}
