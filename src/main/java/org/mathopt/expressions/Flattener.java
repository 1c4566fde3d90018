package org.mathopt.expressions;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 把表达式树展平为规范形式。用显式工作队列迭代处理，时间与节点数成线性，
 * 栈深度与树深度无关。
 * @author Ayalyt
 */
public final class Flattener {

    private static final Logger logger = LoggerFactory.getLogger(Flattener.class);

    private Flattener() {
    }

    public static LinearExpression asFlatLinearExpression(LinearBase expression) {
        if (expression instanceof LinearExpression linearExpression) {
            return linearExpression;
        }
        ProcessedElements processed = new ProcessedElements();
        ToProcessElements<LinearBase> queue = new ToProcessElements<>();
        queue.append(LinearBase.checkOperand(expression), 1.0);
        int visited = 0;
        while (!queue.isEmpty()) {
            Pair<LinearBase, Double> next = queue.pop();
            next.getLeft().flattenOnceAndAddTo(next.getRight(), processed, queue);
            visited++;
        }
        logger.debug("线性展平处理了 {} 个节点", visited);
        return processed.toLinearExpression();
    }

    public static QuadraticExpression asFlatQuadraticExpression(ExpressionNode expression) {
        if (expression instanceof QuadraticExpression quadraticExpression) {
            return quadraticExpression;
        }
        QuadraticProcessedElements processed = new QuadraticProcessedElements();
        ToProcessElements<ExpressionNode> queue = new ToProcessElements<>();
        queue.append(LinearBase.checkOperand(expression), 1.0);
        int visited = 0;
        while (!queue.isEmpty()) {
            Pair<ExpressionNode, Double> next = queue.pop();
            next.getLeft().quadraticFlattenOnceAndAddTo(next.getRight(), processed, queue);
            visited++;
        }
        logger.debug("二次展平处理了 {} 个节点", visited);
        return processed.toQuadraticExpression();
    }
}
