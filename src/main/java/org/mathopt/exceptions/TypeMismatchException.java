package org.mathopt.exceptions;

/**
 * 操作数类型不符，或者把属于另一个模型的句柄/表达式交给了当前模型。
 */
public class TypeMismatchException extends IllegalArgumentException {

    public TypeMismatchException(String message) {
        super(message);
    }
}
