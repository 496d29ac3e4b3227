package org.synthesis.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 代表一个被决策树跟踪的程序变量，以及它声明的有序取值域。
 * 状态中的具体取值总是先映射为其在取值域中的下标（domain option）再参与推理。
 * 此类是不可变的。
 */
@Getter
public final class ProgramVariable {

    private static final Logger logger = LoggerFactory.getLogger(ProgramVariable.class);

    public enum Type {
        BOOLEAN,
        INTEGER
    }

    private final String name;
    private final Type type;
    private final List<Long> domain;

    private final int hashCode;

    private ProgramVariable(String name, Type type, List<Long> domain) {
        this.name = Objects.requireNonNull(name, "Variable name cannot be null.");
        this.type = Objects.requireNonNull(type, "Variable type cannot be null.");
        Objects.requireNonNull(domain, "Variable domain cannot be null.");
        if (domain.isEmpty()) {
            logger.error("变量 {} 的取值域为空。", name);
            throw new IllegalArgumentException("Domain of variable '" + name + "' is empty.");
        }
        this.domain = Collections.unmodifiableList(new ArrayList<>(domain));
        this.hashCode = Objects.hash(name, type, this.domain);
        logger.debug("创建 ProgramVariable: {} {}", name, this.domain);
    }

    /**
     * 创建一个布尔变量，取值域为 {0 (false), 1 (true)}。
     * @param name 变量名。
     * @return 新的 ProgramVariable。
     */
    public static ProgramVariable bool(String name) {
        return new ProgramVariable(name, Type.BOOLEAN, List.of(0L, 1L));
    }

    /**
     * 创建一个整数变量。取值下标即取值在声明中的位置，阈值判断按该顺序进行。
     * @param name 变量名。
     * @param values 按声明顺序给出的取值域。
     * @return 新的 ProgramVariable。
     * @throws IllegalArgumentException 如果取值域中有重复的取值。
     */
    public static ProgramVariable integer(String name, long... values) {
        List<Long> domain = new ArrayList<>(values.length);
        for (long value : values) {
            domain.add(value);
        }
        return integer(name, domain);
    }

    public static ProgramVariable integer(String name, List<Long> values) {
        Objects.requireNonNull(values, "Variable domain cannot be null.");
        if (new HashSet<>(values).size() != values.size()) {
            logger.error("变量 {} 的取值域 {} 中有重复的取值。", name, values);
            throw new IllegalArgumentException("Domain of variable '" + name + "' contains duplicate values.");
        }
        return new ProgramVariable(name, Type.INTEGER, values);
    }

    public int domainSize() {
        return domain.size();
    }

    /**
     * 查找具体取值在取值域中的下标。
     * @param value 状态中的具体取值。
     * @return 下标。
     * @throws IllegalArgumentException 如果取值不在声明的取值域中。
     */
    public int optionOf(long value) {
        int option = domain.indexOf(value);
        if (option < 0) {
            logger.error("变量 {} 的取值 {} 不在取值域 {} 中。", name, value, domain);
            throw new IllegalArgumentException(
                    "Value " + value + " of variable '" + name + "' has no matching domain option.");
        }
        return option;
    }

    /**
     * @param option 取值域下标。
     * @return 该下标对应取值的可读标签；布尔变量输出 true/false。
     */
    public String labelOf(int option) {
        long value = domain.get(option);
        if (type == Type.BOOLEAN) {
            return value == 0 ? "false" : "true";
        }
        return Long.toString(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ProgramVariable that = (ProgramVariable) o;
        return name.equals(that.name) && type == that.type && domain.equals(that.domain);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name + ":" + domain.stream().map(String::valueOf).collect(Collectors.joining(",", "{", "}"));
    }
}
