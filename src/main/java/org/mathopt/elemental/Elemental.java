package org.mathopt.elemental;

import lombok.Getter;
import org.mathopt.exceptions.DuplicateKeyException;
import org.mathopt.exceptions.UnknownElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * 以属性为中心的模型存储。
 * <p>
 * 元素按种类分配单调递增、永不复用的 id；属性是从元素 id 元组到标量的稀疏映射，
 * 只存储非默认值。删除元素时，所有键中含有该元素的属性条目一并删除。
 * 每一次修改都会同步通知所有存活的 {@link Diff}，从而可以导出增量更新。
 * <p>
 * 非线程安全，每个存储只能在单个线程中使用。
 * @author Ayalyt
 */
public final class Elemental {

    private static final Logger logger = LoggerFactory.getLogger(Elemental.class);

    @Getter
    private final String modelName;

    @Getter
    private final String primaryObjectiveName;

    private final EnumMap<ElementType, ElementStorage> elements = new EnumMap<>(ElementType.class);

    private final Map<Attribute<?>, AttrStorage<?>> attributes = new LinkedHashMap<>();

    private final DiffRegistry diffs = new DiffRegistry();

    public Elemental(String modelName, String primaryObjectiveName) {
        this.modelName = Objects.requireNonNull(modelName, "Elemental: modelName 不能为 null");
        this.primaryObjectiveName = Objects.requireNonNull(primaryObjectiveName, "Elemental: primaryObjectiveName 不能为 null");
        for (ElementType type : ElementType.values()) {
            elements.put(type, new ElementStorage());
        }
        for (Attribute<?> attribute : AllAttrs.ALL) {
            attributes.put(attribute, new AttrStorage<>(attribute));
        }
        logger.debug("创建 Elemental: {}", modelName);
    }

    public Elemental() {
        this("", "");
    }

    /**
     * 从快照重建一个存储。各种元素的下一个 id 为快照中最大 id 加一。
     */
    public static Elemental fromSnapshot(ModelSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "Elemental-fromSnapshot: snapshot 不能为 null");
        Elemental elemental = new Elemental(snapshot.getName(), snapshot.getPrimaryObjectiveName());
        for (ElementType type : ElementType.values()) {
            for (Map.Entry<Long, String> entry : snapshot.getElements(type).entrySet()) {
                elemental.ensureNextElementIdAtLeast(type, entry.getKey());
                elemental.addElement(type, entry.getValue());
            }
        }
        for (Attribute<?> attribute : snapshot.getAttributes().keySet()) {
            copyAttribute(snapshot, attribute, elemental);
        }
        logger.info("从快照重建 Elemental: {}", snapshot.getName());
        return elemental;
    }

    private static <V> void copyAttribute(ModelSnapshot snapshot, Attribute<V> attribute, Elemental target) {
        snapshot.getAttribute(attribute).forEach((key, value) -> target.setAttr(attribute, key, value));
    }

    /**
     * 复制模型数据 (元素、属性、下一个 id)，不复制任何 Diff。
     */
    public Elemental copy(String newModelName) {
        Elemental copy = new Elemental(newModelName == null ? modelName : newModelName, primaryObjectiveName);
        elements.forEach((type, storage) -> copy.elements.put(type, storage.copy()));
        attributes.forEach((attribute, storage) -> copy.attributes.put(attribute, storage.copy()));
        logger.info("复制 Elemental {} 为 {}", modelName, copy.modelName);
        return copy;
    }

    // --- 元素 ---

    public long addElement(ElementType type, String name) {
        Objects.requireNonNull(type, "Elemental-addElement: type 不能为 null");
        long id = elements.get(type).add(name == null ? "" : name);
        logger.debug("添加元素 {} {}，名称 '{}'", type, id, name);
        return id;
    }

    public List<Long> addElements(ElementType type, int count) {
        List<Long> ids = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ids.add(addElement(type, ""));
        }
        return ids;
    }

    /**
     * 删除一个元素以及所有键中含有它的属性条目。
     * @return 元素不存在 (或已被删除) 时返回 false。
     */
    public boolean deleteElement(ElementType type, long id) {
        ElementStorage storage = elements.get(type);
        if (!storage.delete(id)) {
            logger.debug("删除不存在的元素 {} {}，忽略", type, id);
            return false;
        }
        diffs.elementDeleted(type, id);
        for (Map.Entry<Attribute<?>, AttrStorage<?>> entry : attributes.entrySet()) {
            Attribute<?> attribute = entry.getKey();
            AttrStorage<?> attrStorage = entry.getValue();
            for (int position = 0; position < attribute.arity(); position++) {
                if (attribute.getKeyTypes().get(position) != type) {
                    continue;
                }
                for (AttrKey key : new ArrayList<>(attrStorage.keysAt(position, id))) {
                    attrStorage.erase(key);
                    diffs.keyRemoved(attribute, key);
                }
            }
            if (attribute.getValueElementType().orElse(null) == type) {
                for (AttrKey key : new ArrayList<>(attrStorage.keysReferencing(id))) {
                    attrStorage.erase(key);
                    diffs.keyModified(attribute, key);
                }
            }
        }
        logger.info("删除元素 {} {}", type, id);
        return true;
    }

    public boolean elementExists(ElementType type, long id) {
        return elements.get(type).exists(id);
    }

    public int numElements(ElementType type) {
        return elements.get(type).size();
    }

    public long nextElementId(ElementType type) {
        return elements.get(type).nextId();
    }

    /**
     * @return 该种类所有存活元素的 id，升序。
     */
    public List<Long> allElements(ElementType type) {
        return elements.get(type).ids();
    }

    public String getElementName(ElementType type, long id) {
        String name = elements.get(type).name(id);
        if (name == null) {
            logger.error("读取不存在元素的名称: {} {}", type, id);
            throw new UnknownElementException(type, id);
        }
        return name;
    }

    /**
     * 保证下一个分配的 id 不小于给定值。只会增大计数器。
     */
    public void ensureNextElementIdAtLeast(ElementType type, long id) {
        elements.get(type).ensureNextIdAtLeast(id);
    }

    // --- 属性 ---

    public <V> V getAttr(Attribute<V> attribute, AttrKey key) {
        AttrKey canonical = checkKey(attribute, key);
        return storage(attribute).get(canonical);
    }

    public <V> List<V> getAttrs(Attribute<V> attribute, List<AttrKey> keys) {
        List<V> values = new ArrayList<>(keys.size());
        for (AttrKey key : keys) {
            values.add(getAttr(attribute, key));
        }
        return values;
    }

    /**
     * 写入属性值。写入默认值会删除稀疏条目；值未改变时不通知 Diff。
     */
    public <V> void setAttr(Attribute<V> attribute, AttrKey key, V value) {
        AttrKey canonical = checkKey(attribute, key);
        checkValue(attribute, value);
        if (storage(attribute).set(canonical, value)) {
            diffs.keyModified(attribute, canonical);
        }
    }

    /**
     * 批量写入。先校验全部键和值，任一失败则不写入任何内容。
     * @throws DuplicateKeyException 规范化后有重复的键。
     * @throws UnknownElementException 某个键引用了不存在的元素。
     */
    public <V> void setAttrs(Attribute<V> attribute, List<AttrKey> keys, List<V> values) {
        Objects.requireNonNull(keys, "Elemental-setAttrs: keys 不能为 null");
        Objects.requireNonNull(values, "Elemental-setAttrs: values 不能为 null");
        if (keys.size() != values.size()) {
            logger.error("批量写入 {} 时键和值的数量不一致: {} vs {}", attribute, keys.size(), values.size());
            throw new IllegalArgumentException("keys and values must have the same size, got "
                    + keys.size() + " and " + values.size());
        }
        List<AttrKey> canonicalKeys = new ArrayList<>(keys.size());
        Set<AttrKey> seen = new HashSet<>();
        for (int i = 0; i < keys.size(); i++) {
            AttrKey canonical = checkKey(attribute, keys.get(i));
            checkValue(attribute, values.get(i));
            if (!seen.add(canonical)) {
                logger.error("批量写入 {} 时出现重复键: {}", attribute, canonical);
                throw new DuplicateKeyException("Duplicate key " + canonical + " for attribute " + attribute);
            }
            canonicalKeys.add(canonical);
        }
        AttrStorage<V> storage = storage(attribute);
        for (int i = 0; i < canonicalKeys.size(); i++) {
            if (storage.set(canonicalKeys.get(i), values.get(i))) {
                diffs.keyModified(attribute, canonicalKeys.get(i));
            }
        }
    }

    public boolean attrIsNonDefault(Attribute<?> attribute, AttrKey key) {
        AttrKey canonical = checkKey(attribute, key);
        return storage(attribute).isNonDefault(canonical);
    }

    public int attrNumNonDefaults(Attribute<?> attribute) {
        return storage(attribute).size();
    }

    /**
     * @return 所有非默认值的键，升序。
     */
    public List<AttrKey> attrNonDefaults(Attribute<?> attribute) {
        return sorted(storage(attribute).nonDefaultKeys());
    }

    /**
     * 把属性的所有条目重置为默认值，每个被重置的键都会记入 Diff。
     */
    public void attrClear(Attribute<?> attribute) {
        AttrStorage<?> storage = storage(attribute);
        for (AttrKey key : storage.nonDefaultKeys()) {
            diffs.keyModified(attribute, key);
        }
        storage.clear();
        logger.debug("清空属性 {}", attribute);
    }

    /**
     * 键的第 {@code position} 个位置等于 {@code id} 的所有非默认键，升序。
     * 对称属性在对称位置上取两个位置的并集。
     */
    public List<AttrKey> slice(Attribute<?> attribute, int position, long id) {
        return sorted(sliceKeys(attribute, position, id));
    }

    public int sliceSize(Attribute<?> attribute, int position, long id) {
        return sliceKeys(attribute, position, id).size();
    }

    private Set<AttrKey> sliceKeys(Attribute<?> attribute, int position, long id) {
        if (position < 0 || position >= attribute.arity()) {
            logger.error("属性 {} 的切片位置越界: {}", attribute, position);
            throw new IndexOutOfBoundsException("Position " + position + " out of range for attribute "
                    + attribute + " of arity " + attribute.arity());
        }
        ElementType type = attribute.getKeyTypes().get(position);
        if (!elementExists(type, id)) {
            logger.error("对不存在的元素切片: {} {}", type, id);
            throw new UnknownElementException(type, id);
        }
        AttrStorage<?> storage = storage(attribute);
        Symmetry symmetry = attribute.getSymmetry();
        if (!symmetry.covers(position)) {
            return storage.keysAt(position, id);
        }
        Set<AttrKey> union = new HashSet<>(storage.keysAt(symmetry.getFirst(), id));
        union.addAll(storage.keysAt(symmetry.getSecond(), id));
        return union;
    }

    // --- Diff ---

    public DiffHandle addDiff() {
        Diff diff = diffs.create(nextIds());
        logger.info("模型 {} 新建 Diff {}", modelName, diff.getId());
        return new DiffHandle(diff.getId(), this);
    }

    public void deleteDiff(DiffHandle handle) {
        checkOwner(handle);
        diffs.remove(handle.getId());
        logger.info("模型 {} 移除 Diff {}", modelName, handle.getId());
    }

    /**
     * 把检查点推进到当前的下一个 id，并清空该 Diff 的待导出变更。
     */
    public void advanceDiff(DiffHandle handle) {
        checkOwner(handle);
        diffs.lookup(handle.getId()).advance(nextIds());
        logger.debug("模型 {} 推进 Diff {}", modelName, handle.getId());
    }

    public int numDiffs() {
        return diffs.size();
    }

    // --- 导出与应用 ---

    public ModelSnapshot exportModel(boolean removeNames) {
        return ModelExporter.exportModel(this, removeNames);
    }

    /**
     * @return 自检查点以来没有任何变更时返回空。
     */
    public Optional<ModelUpdate> exportModelUpdate(DiffHandle handle, boolean removeNames) {
        checkOwner(handle);
        return ModelExporter.exportModelUpdate(this, diffs.lookup(handle.getId()), removeNames);
    }

    /**
     * 应用一个更新，使本存储与导出该更新的存储表示同一个模型。先整体校验再修改。
     */
    public void applyUpdate(ModelUpdate update) {
        UpdateApplier.apply(this, update);
    }

    // --- 内部 ---

    @SuppressWarnings("unchecked")
    <V> AttrStorage<V> storage(Attribute<V> attribute) {
        AttrStorage<?> storage = attributes.get(Objects.requireNonNull(attribute, "attribute 不能为 null"));
        return (AttrStorage<V>) storage;
    }

    ElementStorage elementStorage(ElementType type) {
        return elements.get(type);
    }

    private Map<ElementType, Long> nextIds() {
        EnumMap<ElementType, Long> nextIds = new EnumMap<>(ElementType.class);
        elements.forEach((type, storage) -> nextIds.put(type, storage.nextId()));
        return nextIds;
    }

    private AttrKey checkKey(Attribute<?> attribute, AttrKey key) {
        Objects.requireNonNull(attribute, "attribute 不能为 null");
        Objects.requireNonNull(key, "key 不能为 null");
        if (key.size() != attribute.arity()) {
            logger.error("属性 {} 的键长度错误: {}", attribute, key);
            throw new IllegalArgumentException("Attribute " + attribute + " expects a key of size "
                    + attribute.arity() + ", got " + key);
        }
        for (int i = 0; i < key.size(); i++) {
            ElementType type = attribute.getKeyTypes().get(i);
            if (!elementExists(type, key.get(i))) {
                logger.error("属性 {} 的键 {} 引用了不存在的元素 {} {}", attribute, key, type, key.get(i));
                throw new UnknownElementException(type, key.get(i));
            }
        }
        return attribute.canonicalize(key);
    }

    private <V> void checkValue(Attribute<V> attribute, V value) {
        Objects.requireNonNull(value, "属性值不能为 null");
        Optional<ElementType> valueType = attribute.getValueElementType();
        if (valueType.isPresent() && !attribute.isDefault(value)
                && !elementExists(valueType.get(), (Long) value)) {
            logger.error("属性 {} 的值引用了不存在的元素 {} {}", attribute, valueType.get(), value);
            throw new UnknownElementException(valueType.get(), (Long) value);
        }
    }

    private void checkOwner(DiffHandle handle) {
        Objects.requireNonNull(handle, "DiffHandle 不能为 null");
        if (handle.getOwner() != this) {
            logger.error("DiffHandle {} 不属于模型 {}", handle, modelName);
            throw new IllegalArgumentException("Diff handle " + handle.getId() + " belongs to another model");
        }
    }

    private static List<AttrKey> sorted(Set<AttrKey> keys) {
        return Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(keys)));
    }

    @Override
    public String toString() {
        return "Elemental{" + modelName + "}";
    }
}
