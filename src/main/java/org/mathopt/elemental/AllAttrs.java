package org.mathopt.elemental;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 所有属性的固定列表，顺序即导出顺序。
 */
public final class AllAttrs {

    public static final List<Attribute<?>> ALL;

    static {
        List<Attribute<?>> all = new ArrayList<>();
        all.addAll(Arrays.asList(BoolAttr0.values()));
        all.addAll(Arrays.asList(IntAttr0.values()));
        all.addAll(Arrays.asList(DoubleAttr0.values()));
        all.addAll(Arrays.asList(BoolAttr1.values()));
        all.addAll(Arrays.asList(IntAttr1.values()));
        all.addAll(Arrays.asList(DoubleAttr1.values()));
        all.addAll(Arrays.asList(DoubleAttr2.values()));
        all.addAll(Arrays.asList(SymmetricDoubleAttr2.values()));
        all.addAll(Arrays.asList(SymmetricDoubleAttr3.values()));
        all.addAll(Arrays.asList(VariableAttr1.values()));
        ALL = Collections.unmodifiableList(all);
    }

    private AllAttrs() {
    }
}
