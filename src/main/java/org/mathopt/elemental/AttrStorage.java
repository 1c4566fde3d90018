package org.mathopt.elemental;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单个属性的稀疏存储。只保存非默认值，并为键的每个位置维护 id 到键的索引，
 * 元素删除和行/列查询都依赖这些索引。值引用元素的属性还维护一个反向索引。
 *
 * @param <V> 属性值类型。
 * @author Ayalyt
 */
final class AttrStorage<V> {

    private final Attribute<V> attribute;

    private final Map<AttrKey, V> values = new HashMap<>();

    private final List<Map<Long, Set<AttrKey>>> positionIndex;

    private final Map<Long, Set<AttrKey>> valueIndex;

    AttrStorage(Attribute<V> attribute) {
        this.attribute = attribute;
        this.positionIndex = new ArrayList<>(attribute.arity());
        for (int i = 0; i < attribute.arity(); i++) {
            positionIndex.add(new HashMap<>());
        }
        this.valueIndex = attribute.getValueElementType().isPresent() ? new HashMap<>() : null;
    }

    V get(AttrKey key) {
        V value = values.get(key);
        return value == null ? attribute.getDefaultValue() : value;
    }

    boolean isNonDefault(AttrKey key) {
        return values.containsKey(key);
    }

    /**
     * 写入一个值，写入默认值等价于删除条目。
     * @return 值是否发生了变化。
     */
    boolean set(AttrKey key, V value) {
        V old = values.get(key);
        if (old == null) {
            if (attribute.isDefault(value)) {
                return false;
            }
            values.put(key, value);
            index(key, value);
            return true;
        }
        if (attribute.valuesEqual(old, value)) {
            return false;
        }
        unindex(key, old);
        if (attribute.isDefault(value)) {
            values.remove(key);
        } else {
            values.put(key, value);
            index(key, value);
        }
        return true;
    }

    boolean erase(AttrKey key) {
        return set(key, attribute.getDefaultValue());
    }

    Set<AttrKey> keysAt(int position, long id) {
        Set<AttrKey> keys = positionIndex.get(position).get(id);
        return keys == null ? Collections.emptySet() : Collections.unmodifiableSet(keys);
    }

    Set<AttrKey> keysReferencing(long valueId) {
        if (valueIndex == null) {
            return Collections.emptySet();
        }
        Set<AttrKey> keys = valueIndex.get(valueId);
        return keys == null ? Collections.emptySet() : Collections.unmodifiableSet(keys);
    }

    Set<AttrKey> nonDefaultKeys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    int size() {
        return values.size();
    }

    void clear() {
        values.clear();
        positionIndex.forEach(Map::clear);
        if (valueIndex != null) {
            valueIndex.clear();
        }
    }

    AttrStorage<V> copy() {
        AttrStorage<V> copy = new AttrStorage<>(attribute);
        values.forEach(copy::set);
        return copy;
    }

    private void index(AttrKey key, V value) {
        for (int i = 0; i < positionIndex.size(); i++) {
            positionIndex.get(i).computeIfAbsent(key.get(i), k -> new HashSet<>()).add(key);
        }
        if (valueIndex != null) {
            valueIndex.computeIfAbsent((Long) value, k -> new HashSet<>()).add(key);
        }
    }

    private void unindex(AttrKey key, V value) {
        for (int i = 0; i < positionIndex.size(); i++) {
            removeFromIndex(positionIndex.get(i), key.get(i), key);
        }
        if (valueIndex != null) {
            removeFromIndex(valueIndex, (Long) value, key);
        }
    }

    private static void removeFromIndex(Map<Long, Set<AttrKey>> index, long id, AttrKey key) {
        Set<AttrKey> keys = index.get(id);
        if (keys != null) {
            keys.remove(key);
            if (keys.isEmpty()) {
                index.remove(id);
            }
        }
    }
}
