package org.mathopt.core;

import lombok.Getter;
import org.mathopt.elemental.AttrKey;
import org.mathopt.elemental.BoolAttr1;
import org.mathopt.elemental.DoubleAttr1;
import org.mathopt.elemental.ElementType;
import org.mathopt.elemental.Elemental;
import org.mathopt.expressions.LinearBase;
import org.mathopt.expressions.LinearTerm;
import org.mathopt.expressions.ProcessedElements;
import org.mathopt.expressions.ToProcessElements;
import org.mathopt.expressions.bounded.VarEqVar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 决策变量的句柄：所属存储加上元素 id。变量删除后，通过句柄读写属性会抛出
 * {@link org.mathopt.exceptions.UnknownElementException}。
 * @author Ayalyt
 */
public final class Variable extends LinearBase implements Comparable<Variable> {

    private static final Logger logger = LoggerFactory.getLogger(Variable.class);

    @Getter
    private final Elemental elemental;

    @Getter
    private final long id;

    private final int hashCode;

    Variable(Elemental elemental, long id) {
        this.elemental = Objects.requireNonNull(elemental, "Variable: elemental 不能为 null");
        this.id = id;
        this.hashCode = Objects.hash(System.identityHashCode(elemental), id);
    }

    public String getName() {
        return elemental.getElementName(ElementType.VARIABLE, id);
    }

    public double getLowerBound() {
        return elemental.getAttr(DoubleAttr1.VAR_LB, key());
    }

    public void setLowerBound(double lowerBound) {
        elemental.setAttr(DoubleAttr1.VAR_LB, key(), lowerBound);
    }

    public double getUpperBound() {
        return elemental.getAttr(DoubleAttr1.VAR_UB, key());
    }

    public void setUpperBound(double upperBound) {
        elemental.setAttr(DoubleAttr1.VAR_UB, key(), upperBound);
    }

    public boolean isInteger() {
        return elemental.getAttr(BoolAttr1.VAR_INTEGER, key());
    }

    public void setInteger(boolean integer) {
        elemental.setAttr(BoolAttr1.VAR_INTEGER, key(), integer);
    }

    private AttrKey key() {
        return AttrKey.of(id);
    }

    @Override
    protected void flattenOnceAndAddTo(double scale, ProcessedElements processed,
                                       ToProcessElements<? super LinearBase> queue) {
        processed.addTerm(this, scale);
    }

    @Override
    public LinearBase times(double scalar) {
        return LinearTerm.of(this, scalar);
    }

    @Override
    public LinearBase negate() {
        return LinearTerm.of(this, -1.0);
    }

    /**
     * 两个变量相等的约束。
     */
    public VarEqVar eq(Variable other) {
        return VarEqVar.of(this, other);
    }

    @Override
    public int compareTo(Variable o) {
        return Long.compare(this.id, o.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Variable variable = (Variable) o;
        return id == variable.id && elemental == variable.elemental;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (!elemental.elementExists(ElementType.VARIABLE, id)) {
            logger.debug("打印已删除的变量 {}", id);
            return "<deleted variable " + id + ">";
        }
        String name = getName();
        return name.isEmpty() ? "variable_" + id : name;
    }
}
