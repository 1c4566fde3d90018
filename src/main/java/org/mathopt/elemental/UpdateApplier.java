package org.mathopt.elemental;

import org.mathopt.exceptions.UnknownElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 把 {@link ModelUpdate} 应用到存储上。先整体校验，通过后按
 * 删除元素、新增元素、写入属性的顺序修改。
 * @author Ayalyt
 */
final class UpdateApplier {

    private static final Logger logger = LoggerFactory.getLogger(UpdateApplier.class);

    private UpdateApplier() {
    }

    static void apply(Elemental elemental, ModelUpdate update) {
        Objects.requireNonNull(update, "UpdateApplier: update 不能为 null");
        validate(elemental, update);
        for (ElementType type : ElementType.values()) {
            for (long id : update.getDeletedElements(type)) {
                elemental.deleteElement(type, id);
            }
        }
        for (ElementType type : ElementType.values()) {
            for (Map.Entry<Long, String> entry : update.getNewElements(type).entrySet()) {
                elemental.ensureNextElementIdAtLeast(type, entry.getKey());
                elemental.addElement(type, entry.getValue());
            }
        }
        for (Attribute<?> attribute : update.getAttributeUpdates().keySet()) {
            applyAttribute(elemental, update, attribute);
        }
        logger.info("模型 {} 应用了更新", elemental.getModelName());
    }

    private static <V> void applyAttribute(Elemental elemental, ModelUpdate update, Attribute<V> attribute) {
        update.getAttributeUpdates(attribute).forEach((key, value) -> elemental.setAttr(attribute, key, value));
    }

    private static void validate(Elemental elemental, ModelUpdate update) {
        for (ElementType type : ElementType.values()) {
            for (long id : update.getDeletedElements(type)) {
                if (!elemental.elementExists(type, id)) {
                    logger.error("更新删除了不存在的元素 {} {}", type, id);
                    throw new UnknownElementException(type, id);
                }
            }
            long nextId = elemental.nextElementId(type);
            for (long id : update.getNewElements(type).keySet()) {
                if (id < nextId) {
                    logger.error("更新新增的元素 {} {} 小于下一个可用 id {}", type, id, nextId);
                    throw new IllegalArgumentException("New element " + type + " " + id
                            + " must not be below the next free id " + nextId);
                }
            }
        }
        for (Attribute<?> attribute : update.getAttributeUpdates().keySet()) {
            validateAttribute(elemental, update, attribute);
        }
    }

    private static <V> void validateAttribute(Elemental elemental, ModelUpdate update, Attribute<V> attribute) {
        Optional<ElementType> valueType = attribute.getValueElementType();
        for (Map.Entry<AttrKey, V> entry : update.getAttributeUpdates(attribute).entrySet()) {
            AttrKey key = entry.getKey();
            if (key.size() != attribute.arity()) {
                logger.error("更新中属性 {} 的键长度错误: {}", attribute, key);
                throw new IllegalArgumentException("Attribute " + attribute + " expects a key of size "
                        + attribute.arity() + ", got " + key);
            }
            for (int i = 0; i < key.size(); i++) {
                checkExistsAfter(elemental, update, attribute.getKeyTypes().get(i), key.get(i));
            }
            V value = Objects.requireNonNull(entry.getValue(), "更新中的属性值不能为 null");
            if (valueType.isPresent() && !attribute.isDefault(value)) {
                checkExistsAfter(elemental, update, valueType.get(), (Long) value);
            }
        }
    }

    private static void checkExistsAfter(Elemental elemental, ModelUpdate update, ElementType type, long id) {
        boolean existsAfter = (elemental.elementExists(type, id) && !update.getDeletedElements(type).contains(id))
                || update.getNewElements(type).containsKey(id);
        if (!existsAfter) {
            logger.error("更新引用了应用后不存在的元素 {} {}", type, id);
            throw new UnknownElementException(type, id);
        }
    }
}
