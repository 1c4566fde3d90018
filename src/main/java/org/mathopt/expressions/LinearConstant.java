package org.mathopt.expressions;

import lombok.Getter;

/**
 * 常数节点。
 */
@Getter
public final class LinearConstant extends LinearBase {

    private final double constant;

    private LinearConstant(double constant) {
        this.constant = constant;
    }

    public static LinearConstant of(double constant) {
        return new LinearConstant(constant);
    }

    @Override
    protected void flattenOnceAndAddTo(double scale, ProcessedElements processed,
                                       ToProcessElements<? super LinearBase> queue) {
        processed.addOffset(scale * constant);
    }

    @Override
    public String toString() {
        return Double.toString(constant);
    }
}
