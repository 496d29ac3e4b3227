package org.synthesis.coloring;

import lombok.Getter;

import java.util.Objects;

/**
 * unsat core 中的一个元素：某个选择在某条树路径上的表达式。
 * 此类是不可变的。
 */
@Getter
public final class ChoicePath implements Comparable<ChoicePath> {

    private final int choice;
    private final int path;

    private ChoicePath(int choice, int path) {
        this.choice = choice;
        this.path = path;
    }

    public static ChoicePath of(int choice, int path) {
        return new ChoicePath(choice, path);
    }

    @Override
    public int compareTo(ChoicePath other) {
        int cmp = Integer.compare(this.choice, other.choice);
        if (cmp != 0) {
            return cmp;
        }
        return Integer.compare(this.path, other.path);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ChoicePath that = (ChoicePath) o;
        return choice == that.choice && path == that.path;
    }

    @Override
    public int hashCode() {
        return Objects.hash(choice, path);
    }

    @Override
    public String toString() {
        return "(" + choice + ", " + path + ")";
    }
}
