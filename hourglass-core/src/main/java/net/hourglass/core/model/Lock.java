package net.hourglass.core.model;

import java.time.Instant;

public record Lock(
        String name,        // 예: "job:42"
        String owner,       // 보유자 토큰
        Instant expiresAt,  // 절대 만료 시각 (하트비트 없음)
        Instant createdAt
) {
    public boolean isExpired(Instant now) {
        return expiresAt.isBefore(now);
    }
}
