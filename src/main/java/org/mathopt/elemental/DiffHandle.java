package org.mathopt.elemental;

import lombok.Getter;

/**
 * 指向某个存储中一个 Diff 的句柄。句柄只记录 id 和所属存储，
 * Diff 本身由存储持有。
 */
@Getter
public final class DiffHandle {

    private final long id;

    private final Elemental owner;

    DiffHandle(long id, Elemental owner) {
        this.id = id;
        this.owner = owner;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DiffHandle that = (DiffHandle) o;
        return id == that.id && owner == that.owner;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id) * 31 + System.identityHashCode(owner);
    }

    @Override
    public String toString() {
        return "DiffHandle{" + id + "}";
    }
}
