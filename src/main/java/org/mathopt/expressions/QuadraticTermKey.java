package org.mathopt.expressions;

import lombok.Getter;
import org.mathopt.core.Variable;
import org.mathopt.exceptions.TypeMismatchException;

import java.util.Objects;

/**
 * 二次项的无序变量对，按 id 升序存储，因此 (x, y) 与 (y, x) 相等。
 * @author Ayalyt
 */
@Getter
public final class QuadraticTermKey implements Comparable<QuadraticTermKey> {

    private final Variable first;

    private final Variable second;

    private final int hashCode;

    private QuadraticTermKey(Variable first, Variable second) {
        this.first = first;
        this.second = second;
        this.hashCode = Objects.hash(first, second);
    }

    public static QuadraticTermKey of(Variable first, Variable second) {
        Objects.requireNonNull(first, "QuadraticTermKey: first 不能为 null");
        Objects.requireNonNull(second, "QuadraticTermKey: second 不能为 null");
        if (first.getElemental() != second.getElemental()) {
            throw new TypeMismatchException("Quadratic term mixes variables from different models: "
                    + first + ", " + second);
        }
        return first.getId() <= second.getId()
                ? new QuadraticTermKey(first, second)
                : new QuadraticTermKey(second, first);
    }

    @Override
    public int compareTo(QuadraticTermKey other) {
        int cmp = first.compareTo(other.first);
        if (cmp != 0) {
            return cmp;
        }
        return second.compareTo(other.second);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        QuadraticTermKey that = (QuadraticTermKey) o;
        return first.equals(that.first) && second.equals(that.second);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return first + " * " + second;
    }
}
