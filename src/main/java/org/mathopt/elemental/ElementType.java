package org.mathopt.elemental;

/**
 * 模型中元素的种类。每一种元素拥有独立的 id 序列。
 */
public enum ElementType {
    VARIABLE,
    LINEAR_CONSTRAINT,
    QUADRATIC_CONSTRAINT,
    INDICATOR_CONSTRAINT,
    AUXILIARY_OBJECTIVE
}
