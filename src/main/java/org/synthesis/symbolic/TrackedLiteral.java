package org.synthesis.symbolic;

import lombok.Getter;

import java.util.Objects;

/**
 * 被跟踪断言的类型化标签。每个带标签的断言都对应一个布尔跟踪常量，
 * 求解器返回的 unsat core 通过旁表解析回这些标签，而不是解析字符串。
 * 此类是不可变的。
 */
@Getter
public final class TrackedLiteral {

    public enum Kind {
        /** 某个选择在某条路径上的表达式 */
        CHOICE_PATH,
        /** hole 主变量的选项约束 */
        HOLE_DOMAIN,
        /** hole 协调孪生变量的选项约束 */
        HARMONIZING_DOMAIN,
        /** 协调选择变量的取值范围 [0, numHoles) */
        HARMONIZING_SELECTOR
    }

    private final Kind kind;
    private final int choice;
    private final int path;
    private final int hole;

    private final int hashCode;

    private TrackedLiteral(Kind kind, int choice, int path, int hole) {
        this.kind = kind;
        this.choice = choice;
        this.path = path;
        this.hole = hole;
        this.hashCode = Objects.hash(kind, choice, path, hole);
    }

    public static TrackedLiteral choicePath(int choice, int path) {
        return new TrackedLiteral(Kind.CHOICE_PATH, choice, path, -1);
    }

    public static TrackedLiteral holeDomain(int hole) {
        return new TrackedLiteral(Kind.HOLE_DOMAIN, -1, -1, hole);
    }

    public static TrackedLiteral harmonizingDomain(int hole) {
        return new TrackedLiteral(Kind.HARMONIZING_DOMAIN, -1, -1, hole);
    }

    public static TrackedLiteral harmonizingSelector() {
        return new TrackedLiteral(Kind.HARMONIZING_SELECTOR, -1, -1, -1);
    }

    public boolean isChoicePath() {
        return kind == Kind.CHOICE_PATH;
    }

    /**
     * @return 跟踪常量在 Z3 中使用的符号名，仅用于调试输出。
     */
    public String symbolName() {
        return switch (kind) {
            case CHOICE_PATH -> "p" + choice + "_" + path;
            case HOLE_DOMAIN -> "h" + hole;
            case HARMONIZING_DOMAIN -> "z" + hole;
            case HARMONIZING_SELECTOR -> "harmonizing_domain";
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TrackedLiteral that = (TrackedLiteral) o;
        return kind == that.kind && choice == that.choice && path == that.path && hole == that.hole;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return symbolName();
    }
}
