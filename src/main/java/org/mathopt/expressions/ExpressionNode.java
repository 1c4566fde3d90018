package org.mathopt.expressions;

/**
 * 线性或二次表达式树中的一个节点。节点不可变，只在展平时被消费。
 */
public interface ExpressionNode {

    /**
     * 把本节点展平一层：常数、单项和规范表达式直接累加到 {@code processed}，
     * 其余节点把子节点连同调整后的系数压入 {@code queue}。
     *
     * @param scale     本节点在整棵树中的累计系数。
     * @param processed 累加器。
     * @param queue     待处理节点队列。
     */
    void quadraticFlattenOnceAndAddTo(double scale, QuadraticProcessedElements processed,
                                      ToProcessElements<ExpressionNode> queue);
}
