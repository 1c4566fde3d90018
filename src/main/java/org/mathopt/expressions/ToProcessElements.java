package org.mathopt.expressions;

import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayDeque;

/**
 * 展平过程中待处理的 (节点, 累计系数) 队列。用显式队列代替递归，
 * 因此任意深度的表达式树都不会耗尽调用栈。
 *
 * @param <T> 节点类型。
 */
public final class ToProcessElements<T> {

    private final ArrayDeque<Pair<T, Double>> queue = new ArrayDeque<>();

    public void append(T node, double scale) {
        queue.addLast(Pair.of(node, scale));
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public Pair<T, Double> pop() {
        return queue.pollLast();
    }
}
