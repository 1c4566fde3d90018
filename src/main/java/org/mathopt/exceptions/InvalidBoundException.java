package org.mathopt.exceptions;

/**
 * 规范化时表达式的常数项不是有限值。
 */
public class InvalidBoundException extends IllegalArgumentException {

    public InvalidBoundException(String message) {
        super(message);
    }
}
