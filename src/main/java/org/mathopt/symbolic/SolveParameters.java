package org.mathopt.symbolic;

import lombok.Getter;

import java.time.Duration;
import java.util.Objects;

/**
 * 与具体求解器无关的求解参数。此类是不可变的。
 */
@Getter
public final class SolveParameters {

    private static final SolveParameters DEFAULTS = new SolveParameters(null, false);

    /**
     * 求解时间上限，null 表示不限制。
     */
    private final Duration timeLimit;

    /**
     * 是否在日志中输出传给求解器的完整问题。
     */
    private final boolean enableOutput;

    private SolveParameters(Duration timeLimit, boolean enableOutput) {
        this.timeLimit = timeLimit;
        this.enableOutput = enableOutput;
    }

    public static SolveParameters defaults() {
        return DEFAULTS;
    }

    public SolveParameters withTimeLimit(Duration timeLimit) {
        Objects.requireNonNull(timeLimit, "SolveParameters: timeLimit 不能为 null");
        if (timeLimit.isNegative()) {
            throw new IllegalArgumentException("Time limit must not be negative, got " + timeLimit);
        }
        return new SolveParameters(timeLimit, enableOutput);
    }

    public SolveParameters withEnableOutput(boolean enableOutput) {
        return new SolveParameters(timeLimit, enableOutput);
    }

    @Override
    public String toString() {
        return "SolveParameters{timeLimit=" + timeLimit + ", enableOutput=" + enableOutput + "}";
    }
}
