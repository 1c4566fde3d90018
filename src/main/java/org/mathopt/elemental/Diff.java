package org.mathopt.elemental;

import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 一个独立的变更视图。每种元素有一个检查点 (创建或推进时的下一个 id)：
 * 检查点之前的元素逐键跟踪，检查点之后的新元素在导出时整体输出。
 */
final class Diff {

    @Getter
    private final long id;

    private final EnumMap<ElementType, Long> checkpoints = new EnumMap<>(ElementType.class);

    private final EnumMap<ElementType, SortedSet<Long>> deletedElements = new EnumMap<>(ElementType.class);

    private final Map<Attribute<?>, Set<AttrKey>> modifiedKeys = new HashMap<>();

    Diff(long id, Map<ElementType, Long> nextIds) {
        this.id = id;
        advance(nextIds);
    }

    void advance(Map<ElementType, Long> nextIds) {
        checkpoints.putAll(nextIds);
        deletedElements.clear();
        modifiedKeys.clear();
    }

    long checkpoint(ElementType type) {
        return checkpoints.get(type);
    }

    /**
     * @return 键中的每个元素是否都早于检查点。
     */
    boolean isBeforeCheckpoint(Attribute<?> attribute, AttrKey key) {
        for (int i = 0; i < key.size(); i++) {
            if (key.get(i) >= checkpoint(attribute.getKeyTypes().get(i))) {
                return false;
            }
        }
        return true;
    }

    void elementDeleted(ElementType type, long elementId) {
        if (elementId < checkpoint(type)) {
            deletedElements.computeIfAbsent(type, t -> new TreeSet<>()).add(elementId);
        }
    }

    void keyModified(Attribute<?> attribute, AttrKey key) {
        if (isBeforeCheckpoint(attribute, key)) {
            modifiedKeys.computeIfAbsent(attribute, a -> new HashSet<>()).add(key);
        }
    }

    void keyRemoved(Attribute<?> attribute, AttrKey key) {
        Set<AttrKey> keys = modifiedKeys.get(attribute);
        if (keys != null) {
            keys.remove(key);
        }
    }

    SortedSet<Long> deletedElements(ElementType type) {
        SortedSet<Long> deleted = deletedElements.get(type);
        return deleted == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(deleted);
    }

    Set<AttrKey> modifiedKeys(Attribute<?> attribute) {
        Set<AttrKey> keys = modifiedKeys.get(attribute);
        return keys == null ? Collections.emptySet() : Collections.unmodifiableSet(keys);
    }
}
