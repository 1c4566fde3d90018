package org.mathopt.exceptions;

/**
 * 批量写入属性时，同一个键 (对称属性按规范化后的键计) 出现了多次。
 */
public class DuplicateKeyException extends IllegalArgumentException {

    public DuplicateKeyException(String message) {
        super(message);
    }
}
