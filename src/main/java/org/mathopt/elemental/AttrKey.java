package org.mathopt.elemental;

import java.util.Arrays;
import java.util.Objects;

/**
 * 属性键：定长的元素 id 元组。按字典序比较。
 * 此类是不可变的。
 */
public final class AttrKey implements Comparable<AttrKey> {

    public static final AttrKey EMPTY = new AttrKey(new long[0]);

    private final long[] ids;

    private final int hashCode;

    private AttrKey(long[] ids) {
        this.ids = ids;
        this.hashCode = Arrays.hashCode(ids);
    }

    public static AttrKey of(long... ids) {
        Objects.requireNonNull(ids, "AttrKey-of: ids 不能为 null");
        if (ids.length == 0) {
            return EMPTY;
        }
        return new AttrKey(ids.clone());
    }

    public int size() {
        return ids.length;
    }

    public long get(int position) {
        return ids[position];
    }

    /**
     * 交换两个位置上的 id，返回新键。
     */
    AttrKey swap(int first, int second) {
        long[] swapped = ids.clone();
        swapped[first] = ids[second];
        swapped[second] = ids[first];
        return new AttrKey(swapped);
    }

    public long[] toArray() {
        return ids.clone();
    }

    @Override
    public int compareTo(AttrKey other) {
        return Arrays.compare(this.ids, other.ids);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AttrKey attrKey = (AttrKey) o;
        return Arrays.equals(ids, attrKey.ids);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < ids.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(ids[i]);
        }
        return sb.append(")").toString();
    }
}
