package org.mathopt.exceptions;

import lombok.Getter;
import org.mathopt.elemental.ElementType;

/**
 * 引用了不存在 (从未创建或已被删除) 的元素。
 */
@Getter
public class UnknownElementException extends IllegalArgumentException {

    private final ElementType elementType;
    private final long elementId;

    public UnknownElementException(ElementType elementType, long elementId) {
        super("Element " + elementType + " with id " + elementId + " does not exist");
        this.elementType = elementType;
        this.elementId = elementId;
    }

    public UnknownElementException(ElementType elementType, long elementId, String message) {
        super(message);
        this.elementType = elementType;
        this.elementId = elementId;
    }
}
