package org.mathopt.elemental;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * 把存储导出为完整快照，或根据 Diff 导出增量更新。
 */
final class ModelExporter {

    private static final Logger logger = LoggerFactory.getLogger(ModelExporter.class);

    private ModelExporter() {
    }

    static ModelSnapshot exportModel(Elemental elemental, boolean removeNames) {
        Map<ElementType, SortedMap<Long, String>> elements = new EnumMap<>(ElementType.class);
        for (ElementType type : ElementType.values()) {
            elements.put(type, withNames(elemental.elementStorage(type).from(0), removeNames));
        }
        Map<Attribute<?>, SortedMap<AttrKey, ?>> attributes = new LinkedHashMap<>();
        for (Attribute<?> attribute : AllAttrs.ALL) {
            attributes.put(attribute, nonDefaultValues(elemental.storage(attribute)));
        }
        ModelSnapshot snapshot = new ModelSnapshot(
                removeNames ? "" : elemental.getModelName(),
                removeNames ? "" : elemental.getPrimaryObjectiveName(),
                elements, attributes);
        logger.debug("导出模型 {}", elemental.getModelName());
        return snapshot;
    }

    /**
     * 更新由三部分组成：检查点之前被删除的元素；检查点之后新增的元素；
     * 以及每个属性中被修改且仍然存在的旧键，加上涉及新元素的所有非默认键。
     */
    static Optional<ModelUpdate> exportModelUpdate(Elemental elemental, Diff diff, boolean removeNames) {
        Map<ElementType, SortedSet<Long>> deleted = new EnumMap<>(ElementType.class);
        Map<ElementType, SortedMap<Long, String>> added = new EnumMap<>(ElementType.class);
        for (ElementType type : ElementType.values()) {
            deleted.put(type, diff.deletedElements(type));
            added.put(type, withNames(elemental.elementStorage(type).from(diff.checkpoint(type)), removeNames));
        }
        Map<Attribute<?>, SortedMap<AttrKey, ?>> attributes = new LinkedHashMap<>();
        for (Attribute<?> attribute : AllAttrs.ALL) {
            attributes.put(attribute, attributeUpdates(elemental, diff, attribute));
        }
        ModelUpdate update = new ModelUpdate(deleted, added, attributes);
        if (update.isEmpty()) {
            logger.debug("Diff {} 没有待导出的变更", diff.getId());
            return Optional.empty();
        }
        logger.debug("Diff {} 导出更新: {}", diff.getId(), update);
        return Optional.of(update);
    }

    private static <V> SortedMap<AttrKey, V> attributeUpdates(Elemental elemental, Diff diff, Attribute<V> attribute) {
        AttrStorage<V> storage = elemental.storage(attribute);
        SortedMap<AttrKey, V> updates = new TreeMap<>();
        for (AttrKey key : diff.modifiedKeys(attribute)) {
            if (allElementsExist(elemental, attribute, key)) {
                updates.put(key, storage.get(key));
            }
        }
        for (AttrKey key : storage.nonDefaultKeys()) {
            if (!diff.isBeforeCheckpoint(attribute, key)) {
                updates.put(key, storage.get(key));
            }
        }
        return updates;
    }

    private static boolean allElementsExist(Elemental elemental, Attribute<?> attribute, AttrKey key) {
        for (int i = 0; i < key.size(); i++) {
            if (!elemental.elementExists(attribute.getKeyTypes().get(i), key.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static <V> SortedMap<AttrKey, V> nonDefaultValues(AttrStorage<V> storage) {
        SortedMap<AttrKey, V> values = new TreeMap<>();
        for (AttrKey key : storage.nonDefaultKeys()) {
            values.put(key, storage.get(key));
        }
        return values;
    }

    private static SortedMap<Long, String> withNames(SortedMap<Long, String> elements, boolean removeNames) {
        if (removeNames) {
            elements.replaceAll((id, name) -> "");
        }
        return elements;
    }
}
