package org.mathopt.expressions;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.mathopt.expressions.LinearBase.checkOperand;

/**
 * 若干线性或二次表达式之和。
 */
@Getter
public final class QuadraticSum extends QuadraticBase {

    private final List<ExpressionNode> elements;

    private QuadraticSum(List<ExpressionNode> elements) {
        this.elements = Collections.unmodifiableList(elements);
    }

    public static QuadraticSum of(ExpressionNode... elements) {
        List<ExpressionNode> list = new ArrayList<>(elements.length);
        for (ExpressionNode element : elements) {
            list.add(checkOperand(element));
        }
        return new QuadraticSum(list);
    }

    public static QuadraticSum of(Iterable<? extends ExpressionNode> elements) {
        List<ExpressionNode> list = new ArrayList<>();
        for (ExpressionNode element : elements) {
            list.add(checkOperand(element));
        }
        return new QuadraticSum(list);
    }

    @Override
    public void quadraticFlattenOnceAndAddTo(double scale, QuadraticProcessedElements processed,
                                             ToProcessElements<ExpressionNode> queue) {
        for (ExpressionNode element : elements) {
            queue.append(element, scale);
        }
    }

    @Override
    public String toString() {
        return elements.stream().map(Object::toString).collect(Collectors.joining(" + ", "(", ")"));
    }
}
