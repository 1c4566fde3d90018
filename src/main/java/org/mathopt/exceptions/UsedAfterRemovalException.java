package org.mathopt.exceptions;

/**
 * Diff 或更新跟踪器在被移除之后仍被使用。
 */
public class UsedAfterRemovalException extends IllegalStateException {

    public UsedAfterRemovalException(String message) {
        super(message);
    }
}
