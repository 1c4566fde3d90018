package org.mathopt.elemental;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 单一种类元素的存储：id 到名称的映射以及下一个可用 id。
 * id 单调递增分配且不复用，因此插入顺序就是 id 的升序。
 */
final class ElementStorage {

    private final LinkedHashMap<Long, String> elements = new LinkedHashMap<>();

    private long nextId;

    long add(String name) {
        long id = nextId++;
        elements.put(id, name);
        return id;
    }

    boolean delete(long id) {
        return elements.remove(id) != null;
    }

    boolean exists(long id) {
        return elements.containsKey(id);
    }

    String name(long id) {
        return elements.get(id);
    }

    int size() {
        return elements.size();
    }

    long nextId() {
        return nextId;
    }

    void ensureNextIdAtLeast(long id) {
        nextId = Math.max(nextId, id);
    }

    List<Long> ids() {
        return Collections.unmodifiableList(new ArrayList<>(elements.keySet()));
    }

    /**
     * @return id 不小于 {@code start} 的所有元素，升序。
     */
    SortedMap<Long, String> from(long start) {
        SortedMap<Long, String> result = new TreeMap<>();
        for (Map.Entry<Long, String> entry : elements.entrySet()) {
            if (entry.getKey() >= start) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    ElementStorage copy() {
        ElementStorage copy = new ElementStorage();
        copy.elements.putAll(elements);
        copy.nextId = nextId;
        return copy;
    }
}
