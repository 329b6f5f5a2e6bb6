package ai.pipestream.funnel.job;

import com.google.common.base.Preconditions;

import java.time.Duration;

/**
 * Delay before retrying after the {@code n}-th failed attempt: {@code base * 2^(n-1)}, capped at {@code max}.
 */
public final class ExponentialBackoff {

    // 2^30 already overflows any sensible base
    private static final int MAX_SHIFT = 30;

    private final Duration base;
    private final Duration max;

    public ExponentialBackoff(Duration base, Duration max) {
        Preconditions.checkArgument(!base.isNegative() && !base.isZero(), "base must be positive, was %s", base);
        Preconditions.checkArgument(max.compareTo(base) >= 0, "max (%s) must not be below base (%s)", max, base);
        this.base = base;
        this.max = max;
    }

    /**
     * @param attempt 1-based index of the attempt that just failed
     */
    public Duration delayFor(int attempt) {
        Preconditions.checkArgument(attempt >= 1, "attempt must be >= 1, was %s", attempt);
        int shift = Math.min(attempt - 1, MAX_SHIFT);
        long millis;
        try {
            millis = Math.multiplyExact(base.toMillis(), 1L << shift);
        } catch (ArithmeticException overflow) {
            return max;
        }
        Duration delay = Duration.ofMillis(millis);
        return delay.compareTo(max) > 0 ? max : delay;
    }

    public Duration base() {
        return base;
    }

    public Duration max() {
        return max;
    }
}
