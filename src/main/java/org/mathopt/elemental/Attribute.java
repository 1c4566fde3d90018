package org.mathopt.elemental;

import java.util.List;
import java.util.Optional;

/**
 * 模型属性：从元素 id 元组到标量的稀疏映射，只存储非默认值。
 *
 * @param <V> 属性值的类型。
 */
public interface Attribute<V> {

    String name();

    /**
     * @return 键中每个位置对应的元素种类。长度即属性的元数。
     */
    List<ElementType> getKeyTypes();

    V getDefaultValue();

    Class<V> getValueType();

    default int arity() {
        return getKeyTypes().size();
    }

    default Symmetry getSymmetry() {
        return Symmetry.NONE;
    }

    /**
     * 值本身引用某种元素的属性 (例如指示约束的指示变量) 返回该元素种类。
     */
    default Optional<ElementType> getValueElementType() {
        return Optional.empty();
    }

    default AttrKey canonicalize(AttrKey key) {
        return getSymmetry().canonicalize(key);
    }

    /**
     * 浮点值按原始值比较，因此 -0.0 与默认值 0.0 相等。
     */
    default boolean valuesEqual(V first, V second) {
        if (first instanceof Double d1 && second instanceof Double d2) {
            return d1.doubleValue() == d2.doubleValue();
        }
        return first.equals(second);
    }

    default boolean isDefault(V value) {
        return valuesEqual(value, getDefaultValue());
    }
}
