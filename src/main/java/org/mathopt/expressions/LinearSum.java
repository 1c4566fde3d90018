package org.mathopt.expressions;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 若干线性表达式之和。求大量项之和时应直接用 {@link #of(Iterable)}，避免形成很深的树。
 */
@Getter
public final class LinearSum extends LinearBase {

    private final List<LinearBase> elements;

    private LinearSum(List<LinearBase> elements) {
        this.elements = Collections.unmodifiableList(elements);
    }

    public static LinearSum of(LinearBase... elements) {
        List<LinearBase> list = new ArrayList<>(elements.length);
        for (LinearBase element : elements) {
            list.add(checkOperand(element));
        }
        return new LinearSum(list);
    }

    public static LinearSum of(Iterable<? extends LinearBase> elements) {
        List<LinearBase> list = new ArrayList<>();
        for (LinearBase element : elements) {
            list.add(checkOperand(element));
        }
        return new LinearSum(list);
    }

    @Override
    protected void flattenOnceAndAddTo(double scale, ProcessedElements processed,
                                       ToProcessElements<? super LinearBase> queue) {
        for (LinearBase element : elements) {
            queue.append(element, scale);
        }
    }

    @Override
    public String toString() {
        return elements.stream().map(Object::toString).collect(Collectors.joining(" + ", "(", ")"));
    }
}
