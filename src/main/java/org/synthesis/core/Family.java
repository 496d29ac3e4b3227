package org.synthesis.core;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import lombok.Getter;
import org.synthesis.expressions.ToZ3BoolExpr;
import org.synthesis.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * 代表一个设计空间（family）：每个 hole 当前允许的选项集合。
 * 子族（subfamily）缩小部分 hole 的选项；若每个 hole 恰好只剩一个选项，则称为赋值（assignment）。
 * 此类是不可变的，所有收缩操作都返回新的实例。
 */
public final class Family implements ToZ3BoolExpr {

    private static final Logger logger = LoggerFactory.getLogger(Family.class);

    @Getter
    private final List<Hole> holes;
    private final BitSet[] domains;

    private final int hashCode;

    private Family(List<Hole> holes, BitSet[] domains) {
        this.holes = holes;
        this.domains = domains;
        for (int hole = 0; hole < domains.length; hole++) {
            if (domains[hole].isEmpty()) {
                logger.error("Hole {} 的选项集合为空。", holes.get(hole));
                throw new IllegalArgumentException("Hole '" + holes.get(hole).getName() + "' has an empty domain.");
            }
            if (domains[hole].length() > holes.get(hole).numOptions()) {
                logger.error("Hole {} 的选项 {} 超出取值范围。", holes.get(hole), domains[hole]);
                throw new IllegalArgumentException("Hole '" + holes.get(hole).getName() + "' has an option out of range.");
            }
        }
        int hash = holes.hashCode();
        for (BitSet domain : domains) {
            hash = 31 * hash + domain.hashCode();
        }
        this.hashCode = hash;
    }

    /**
     * 创建包含所有 hole 全部选项的设计空间。
     * @param holes hole 数组，下标与 hole 的 index 一致。
     * @return 完整的 Family。
     */
    public static Family of(List<Hole> holes) {
        Objects.requireNonNull(holes, "Holes cannot be null.");
        BitSet[] domains = new BitSet[holes.size()];
        for (int hole = 0; hole < holes.size(); hole++) {
            if (holes.get(hole).getIndex() != hole) {
                logger.error("Hole {} 的下标 {} 与其位置 {} 不一致。", holes.get(hole), holes.get(hole).getIndex(), hole);
                throw new IllegalArgumentException("Hole index does not match its position.");
            }
            domains[hole] = new BitSet();
            domains[hole].set(0, holes.get(hole).numOptions());
        }
        logger.debug("创建完整 Family，共 {} 个 hole。", holes.size());
        return new Family(Collections.unmodifiableList(new ArrayList<>(holes)), domains);
    }

    public int numHoles() {
        return holes.size();
    }

    public Hole getHole(int hole) {
        return holes.get(hole);
    }

    /**
     * @param hole hole 下标。
     * @return 该 hole 当前允许的选项（升序）。
     */
    public List<Integer> holeOptions(int hole) {
        return domains[hole].stream().boxed().collect(Collectors.toList());
    }

    public boolean holeContains(int hole, int option) {
        return option >= 0 && domains[hole].get(option);
    }

    public int holeNumOptions(int hole) {
        return domains[hole].cardinality();
    }

    /**
     * @return 如果每个 hole 都只剩一个选项则为 true。
     */
    public boolean isAssignment() {
        for (BitSet domain : domains) {
            if (domain.cardinality() != 1) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return 设计空间的大小，即各 hole 选项数之积。
     */
    public BigInteger size() {
        BigInteger size = BigInteger.ONE;
        for (BitSet domain : domains) {
            size = size.multiply(BigInteger.valueOf(domain.cardinality()));
        }
        return size;
    }

    /**
     * 将某个 hole 限制到给定的选项集合。
     * @param hole hole 下标。
     * @param options 新的选项集合。
     * @return 新的 Family。
     */
    public Family assumeHoleOptions(int hole, List<Integer> options) {
        BitSet[] copied = copyDomains();
        copied[hole] = toBitSet(options);
        return new Family(holes, copied);
    }

    /**
     * 为每个 hole 指定新的选项集合。
     * @param holeOptions 按 hole 下标排列的选项列表。
     * @return 新的 Family。
     */
    public Family assumeOptions(List<List<Integer>> holeOptions) {
        Objects.requireNonNull(holeOptions, "Hole options cannot be null.");
        if (holeOptions.size() != numHoles()) {
            logger.error("选项列表长度 {} 与 hole 数量 {} 不一致。", holeOptions.size(), numHoles());
            throw new IllegalArgumentException("Expected options for " + numHoles() + " holes.");
        }
        BitSet[] copied = new BitSet[numHoles()];
        for (int hole = 0; hole < numHoles(); hole++) {
            copied[hole] = toBitSet(holeOptions.get(hole));
        }
        return new Family(holes, copied);
    }

    /**
     * @return 每个 hole 取其最小选项得到的赋值。
     */
    public Family pickAny() {
        BitSet[] copied = new BitSet[numHoles()];
        for (int hole = 0; hole < numHoles(); hole++) {
            copied[hole] = new BitSet();
            copied[hole].set(domains[hole].nextSetBit(0));
        }
        return new Family(holes, copied);
    }

    /**
     * @param holeOptions 部分赋值：hole 下标到选项。
     * @return 如果每个给定选项都在对应 hole 的选项集合中则为 true。
     */
    public boolean includes(Map<Integer, Integer> holeOptions) {
        for (Map.Entry<Integer, Integer> entry : holeOptions.entrySet()) {
            if (!holeContains(entry.getKey(), entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param other 另一个定义在同一 hole 数组上的 Family。
     * @return 如果每个 hole 的选项集合都包含于 other 中对应的集合则为 true。
     */
    public boolean isSubfamilyOf(Family other) {
        for (int hole = 0; hole < numHoles(); hole++) {
            BitSet remaining = (BitSet) domains[hole].clone();
            remaining.andNot(other.domains[hole]);
            if (!remaining.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    public Family copy() {
        return new Family(holes, copyDomains());
    }

    // --- Z3 转换 ---

    /**
     * 单个 hole 主变量的选项约束：OR (h == o)。
     */
    public BoolExpr holeEncoding(int hole, Context ctx, Z3VariableManager varManager) {
        return domainEncoding(hole, varManager.getZ3Var(holes.get(hole)), ctx);
    }

    /**
     * 单个 hole 协调孪生变量的选项约束，与主变量使用同一选项集合。
     */
    public BoolExpr harmonizingHoleEncoding(int hole, Context ctx, Z3VariableManager varManager) {
        return domainEncoding(hole, varManager.getZ3HarmonizingVar(holes.get(hole)), ctx);
    }

    private BoolExpr domainEncoding(int hole, IntExpr variable, Context ctx) {
        BoolExpr[] options = domains[hole].stream()
                .mapToObj(option -> ctx.mkEq(variable, ctx.mkInt(option)))
                .toArray(BoolExpr[]::new);
        return options.length == 1 ? options[0] : ctx.mkOr(options);
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        BoolExpr[] encodings = IntStream.range(0, numHoles())
                .mapToObj(hole -> holeEncoding(hole, ctx, varManager))
                .toArray(BoolExpr[]::new);
        if (encodings.length == 0) {
            return ctx.mkTrue();
        }
        return ctx.mkAnd(encodings);
    }

    private BitSet[] copyDomains() {
        BitSet[] copied = new BitSet[domains.length];
        for (int hole = 0; hole < domains.length; hole++) {
            copied[hole] = (BitSet) domains[hole].clone();
        }
        return copied;
    }

    private static BitSet toBitSet(List<Integer> options) {
        Objects.requireNonNull(options, "Options cannot be null.");
        BitSet bitSet = new BitSet();
        for (Integer option : options) {
            if (option == null || option < 0) {
                throw new IllegalArgumentException("Invalid hole option: " + option);
            }
            bitSet.set(option);
        }
        return bitSet;
    }

    // --- Object 方法 ---

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Family family = (Family) o;
        if (!holes.equals(family.holes)) {
            return false;
        }
        for (int hole = 0; hole < domains.length; hole++) {
            if (!domains[hole].equals(family.domains[hole])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return IntStream.range(0, numHoles())
                .mapToObj(this::holeToString)
                .collect(Collectors.joining(", "));
    }

    private String holeToString(int hole) {
        Hole h = holes.get(hole);
        List<String> labels = domains[hole].stream().mapToObj(h::labelOf).toList();
        if (labels.size() == 1) {
            return h.getName() + "=" + labels.get(0);
        }
        return h.getName() + ": {" + String.join(",", labels) + "}";
    }
}
