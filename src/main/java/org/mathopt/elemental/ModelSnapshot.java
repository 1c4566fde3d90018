package org.mathopt.elemental;

import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 模型在某一时刻的完整导出：所有元素以及所有非默认属性值，均按 id 升序。
 * 两次导出一个未改动的模型得到相等的快照。此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class ModelSnapshot {

    private final String name;

    private final String primaryObjectiveName;

    private final Map<ElementType, SortedMap<Long, String>> elements;

    /**
     * 只包含至少有一个非默认值的属性。
     */
    private final Map<Attribute<?>, SortedMap<AttrKey, ?>> attributes;

    private final int hashCode;

    ModelSnapshot(String name, String primaryObjectiveName,
                  Map<ElementType, SortedMap<Long, String>> elements,
                  Map<Attribute<?>, SortedMap<AttrKey, ?>> attributes) {
        this.name = Objects.requireNonNull(name, "ModelSnapshot: name 不能为 null");
        this.primaryObjectiveName = Objects.requireNonNull(primaryObjectiveName, "ModelSnapshot: primaryObjectiveName 不能为 null");
        EnumMap<ElementType, SortedMap<Long, String>> elementCopy = new EnumMap<>(ElementType.class);
        for (ElementType type : ElementType.values()) {
            SortedMap<Long, String> ofType = elements.get(type);
            elementCopy.put(type, Collections.unmodifiableSortedMap(
                    ofType == null ? new TreeMap<>() : new TreeMap<>(ofType)));
        }
        this.elements = Collections.unmodifiableMap(elementCopy);
        Map<Attribute<?>, SortedMap<AttrKey, ?>> attributeCopy = new LinkedHashMap<>();
        for (Attribute<?> attribute : AllAttrs.ALL) {
            SortedMap<AttrKey, ?> values = attributes.get(attribute);
            if (values != null && !values.isEmpty()) {
                attributeCopy.put(attribute, Collections.unmodifiableSortedMap(new TreeMap<>(values)));
            }
        }
        this.attributes = Collections.unmodifiableMap(attributeCopy);
        this.hashCode = Objects.hash(this.name, this.primaryObjectiveName, this.elements, this.attributes);
    }

    public SortedMap<Long, String> getElements(ElementType type) {
        return elements.get(type);
    }

    public <V> SortedMap<AttrKey, V> getAttribute(Attribute<V> attribute) {
        SortedMap<AttrKey, ?> values = attributes.get(attribute);
        if (values == null) {
            return Collections.emptySortedMap();
        }
        SortedMap<AttrKey, V> typed = new TreeMap<>();
        values.forEach((key, value) -> typed.put(key, attribute.getValueType().cast(value)));
        return Collections.unmodifiableSortedMap(typed);
    }

    /**
     * @return 键对应的值，未出现在快照中时返回属性默认值。
     */
    public <V> V getAttrValue(Attribute<V> attribute, AttrKey key) {
        SortedMap<AttrKey, ?> values = attributes.get(attribute);
        Object value = values == null ? null : values.get(attribute.canonicalize(key));
        return value == null ? attribute.getDefaultValue() : attribute.getValueType().cast(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ModelSnapshot that = (ModelSnapshot) o;
        return name.equals(that.name)
                && primaryObjectiveName.equals(that.primaryObjectiveName)
                && elements.equals(that.elements)
                && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "ModelSnapshot{name='" + name + "', elements=" + elements + ", attributes=" + attributes + "}";
    }
}
