package org.mathopt.expressions;

import lombok.Getter;
import org.mathopt.core.Variable;

import java.util.Map;

import static org.mathopt.expressions.LinearBase.checkOperand;

/**
 * 两个线性表达式的乘积。展平时先把两侧分别展平为线性规范形式，再逐项展开：
 * (o1 + Σa_i x_i)(o2 + Σb_j y_j) = o1 o2 + o1 Σb_j y_j + o2 Σa_i x_i + ΣΣ a_i b_j x_i y_j。
 */
@Getter
public final class LinearLinearProduct extends QuadraticBase {

    private final LinearBase first;

    private final LinearBase second;

    private LinearLinearProduct(LinearBase first, LinearBase second) {
        this.first = first;
        this.second = second;
    }

    public static LinearLinearProduct of(LinearBase first, LinearBase second) {
        return new LinearLinearProduct(checkOperand(first), checkOperand(second));
    }

    @Override
    public void quadraticFlattenOnceAndAddTo(double scale, QuadraticProcessedElements processed,
                                             ToProcessElements<ExpressionNode> queue) {
        LinearExpression left = Flattener.asFlatLinearExpression(first);
        LinearExpression right = Flattener.asFlatLinearExpression(second);
        processed.addOffset(scale * left.getOffset() * right.getOffset());
        for (Map.Entry<Variable, Double> term : right.getTerms().entrySet()) {
            processed.addTerm(term.getKey(), scale * left.getOffset() * term.getValue());
        }
        for (Map.Entry<Variable, Double> term : left.getTerms().entrySet()) {
            processed.addTerm(term.getKey(), scale * right.getOffset() * term.getValue());
        }
        for (Map.Entry<Variable, Double> leftTerm : left.getTerms().entrySet()) {
            for (Map.Entry<Variable, Double> rightTerm : right.getTerms().entrySet()) {
                processed.addQuadraticTerm(QuadraticTermKey.of(leftTerm.getKey(), rightTerm.getKey()),
                        scale * leftTerm.getValue() * rightTerm.getValue());
            }
        }
    }

    @Override
    public String toString() {
        return first + " * " + second;
    }
}
