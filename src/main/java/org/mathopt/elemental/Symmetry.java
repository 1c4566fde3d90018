package org.mathopt.elemental;

import lombok.Getter;

/**
 * 属性键中可以互换的一对位置。对称属性的键在写入和读取前都按升序规范化。
 */
@Getter
public enum Symmetry {
    NONE(-1, -1),
    FIRST_PAIR(0, 1),
    LAST_PAIR(1, 2);

    private final int first;
    private final int second;

    Symmetry(int first, int second) {
        this.first = first;
        this.second = second;
    }

    public boolean isSymmetric() {
        return this != NONE;
    }

    public boolean covers(int position) {
        return isSymmetric() && (position == first || position == second);
    }

    /**
     * 对称位置上较小的 id 放在前面。
     */
    public AttrKey canonicalize(AttrKey key) {
        if (!isSymmetric() || key.get(first) <= key.get(second)) {
            return key;
        }
        return key.swap(first, second);
    }
}
