package net.hourglass.core.service;

public enum DispatchResult {
    DISPATCHED,   // Run 생성 + 비동기 실행 제출
    LOCKED,       // 다른 보유자가 job 락 보유 중
    SATURATED,    // 동시 실행 한도 초과
    DUPLICATE,    // 같은 scheduled_time Run 이미 존재
    FAILED        // 저장소 오류 등
}
