package org.mathopt.expressions.bounded;

import org.mathopt.expressions.ExpressionNode;

/**
 * 比较运算的结果：{@code lowerBound <= expression <= upperBound}。
 * 未给出的一侧为 ±∞。不提供任何到布尔值的转换。
 *
 * @param <E> 表达式类型，{@code LinearBase} 或 {@code QuadraticBase}。
 */
public interface BoundedTypes<E extends ExpressionNode> {

    double getLowerBound();

    double getUpperBound();

    E getExpression();
}
