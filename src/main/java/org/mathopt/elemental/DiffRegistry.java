package org.mathopt.elemental;

import org.mathopt.exceptions.UsedAfterRemovalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 存储拥有的所有存活 Diff。每次修改都同步广播给全部 Diff。
 * @author Ayalyt
 */
final class DiffRegistry {

    private static final Logger logger = LoggerFactory.getLogger(DiffRegistry.class);

    private final Map<Long, Diff> live = new LinkedHashMap<>();

    private long nextDiffId;

    Diff create(Map<ElementType, Long> nextIds) {
        Diff diff = new Diff(nextDiffId++, nextIds);
        live.put(diff.getId(), diff);
        return diff;
    }

    Diff lookup(long diffId) {
        Diff diff = live.get(diffId);
        if (diff == null) {
            logger.error("使用了已被移除的 Diff: {}", diffId);
            throw new UsedAfterRemovalException("Diff " + diffId + " has already been removed");
        }
        return diff;
    }

    void remove(long diffId) {
        lookup(diffId);
        live.remove(diffId);
    }

    int size() {
        return live.size();
    }

    void elementDeleted(ElementType type, long elementId) {
        for (Diff diff : live.values()) {
            diff.elementDeleted(type, elementId);
        }
    }

    void keyModified(Attribute<?> attribute, AttrKey key) {
        for (Diff diff : live.values()) {
            diff.keyModified(attribute, key);
        }
    }

    void keyRemoved(Attribute<?> attribute, AttrKey key) {
        for (Diff diff : live.values()) {
            diff.keyRemoved(attribute, key);
        }
    }
}
