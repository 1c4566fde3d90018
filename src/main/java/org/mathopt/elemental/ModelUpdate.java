package org.mathopt.elemental;

import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 自某个 Diff 检查点以来的变更：被删除的旧元素、新元素，以及每个属性需要写入的键值。
 * 属性更新中的值可能是默认值，表示该键被重置。此类是不可变的。
 */
@Getter
public final class ModelUpdate {

    private final Map<ElementType, SortedSet<Long>> deletedElements;

    private final Map<ElementType, SortedMap<Long, String>> newElements;

    private final Map<Attribute<?>, SortedMap<AttrKey, ?>> attributeUpdates;

    ModelUpdate(Map<ElementType, SortedSet<Long>> deletedElements,
                Map<ElementType, SortedMap<Long, String>> newElements,
                Map<Attribute<?>, SortedMap<AttrKey, ?>> attributeUpdates) {
        EnumMap<ElementType, SortedSet<Long>> deletedCopy = new EnumMap<>(ElementType.class);
        EnumMap<ElementType, SortedMap<Long, String>> newCopy = new EnumMap<>(ElementType.class);
        for (ElementType type : ElementType.values()) {
            SortedSet<Long> deleted = deletedElements.get(type);
            deletedCopy.put(type, Collections.unmodifiableSortedSet(
                    deleted == null ? new TreeSet<>() : new TreeSet<>(deleted)));
            SortedMap<Long, String> added = newElements.get(type);
            newCopy.put(type, Collections.unmodifiableSortedMap(
                    added == null ? new TreeMap<>() : new TreeMap<>(added)));
        }
        this.deletedElements = Collections.unmodifiableMap(deletedCopy);
        this.newElements = Collections.unmodifiableMap(newCopy);
        Map<Attribute<?>, SortedMap<AttrKey, ?>> attributeCopy = new LinkedHashMap<>();
        for (Attribute<?> attribute : AllAttrs.ALL) {
            SortedMap<AttrKey, ?> values = attributeUpdates.get(attribute);
            if (values != null && !values.isEmpty()) {
                attributeCopy.put(attribute, Collections.unmodifiableSortedMap(new TreeMap<>(values)));
            }
        }
        this.attributeUpdates = Collections.unmodifiableMap(attributeCopy);
    }

    public SortedSet<Long> getDeletedElements(ElementType type) {
        return deletedElements.get(type);
    }

    public SortedMap<Long, String> getNewElements(ElementType type) {
        return newElements.get(type);
    }

    public <V> SortedMap<AttrKey, V> getAttributeUpdates(Attribute<V> attribute) {
        SortedMap<AttrKey, ?> values = attributeUpdates.get(attribute);
        if (values == null) {
            return Collections.emptySortedMap();
        }
        SortedMap<AttrKey, V> typed = new TreeMap<>();
        values.forEach((key, value) -> typed.put(key, attribute.getValueType().cast(value)));
        return Collections.unmodifiableSortedMap(typed);
    }

    public boolean isEmpty() {
        return deletedElements.values().stream().allMatch(SortedSet::isEmpty)
                && newElements.values().stream().allMatch(SortedMap::isEmpty)
                && attributeUpdates.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ModelUpdate that = (ModelUpdate) o;
        return deletedElements.equals(that.deletedElements)
                && newElements.equals(that.newElements)
                && attributeUpdates.equals(that.attributeUpdates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deletedElements, newElements, attributeUpdates);
    }

    @Override
    public String toString() {
        return "ModelUpdate{deleted=" + deletedElements + ", new=" + newElements
                + ", attributes=" + attributeUpdates + "}";
    }
}
