package org.mathopt.expressions;

import lombok.Getter;

/**
 * 标量乘线性表达式。
 */
@Getter
public final class LinearProduct extends LinearBase {

    private final double scalar;

    private final LinearBase linear;

    private LinearProduct(double scalar, LinearBase linear) {
        this.scalar = scalar;
        this.linear = linear;
    }

    public static LinearProduct of(double scalar, LinearBase linear) {
        return new LinearProduct(scalar, checkOperand(linear));
    }

    @Override
    protected void flattenOnceAndAddTo(double scale, ProcessedElements processed,
                                       ToProcessElements<? super LinearBase> queue) {
        queue.append(linear, scale * scalar);
    }

    @Override
    public String toString() {
        return scalar + " * " + linear;
    }
}
