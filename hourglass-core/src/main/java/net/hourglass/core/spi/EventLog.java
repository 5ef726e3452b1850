package net.hourglass.core.spi;

import java.util.Map;

/** 감사용 이벤트 싱크. 구현은 기록 실패를 호출자에게 던지지 않는다 */
@FunctionalInterface
public interface EventLog {
    void append(String type, Map<String, Object> fields);
}
