package net.hourglass.core.spi;

import java.time.Duration;

/** 재시도 대기/지터 대기용. 테스트에서는 기록용 구현으로 대체 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    static Sleeper system() {
        return d -> {
            if (!d.isNegative() && !d.isZero()) Thread.sleep(d.toMillis());
        };
    }
}
