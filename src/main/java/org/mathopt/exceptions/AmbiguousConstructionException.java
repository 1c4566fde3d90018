package org.mathopt.exceptions;

/**
 * 同时给出了有界表达式和 lb/ub/expr 中的任意一项。
 */
public class AmbiguousConstructionException extends IllegalArgumentException {

    public AmbiguousConstructionException(String message) {
        super(message);
    }
}
