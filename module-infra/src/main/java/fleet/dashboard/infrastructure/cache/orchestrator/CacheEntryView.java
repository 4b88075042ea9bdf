package fleet.dashboard.infrastructure.cache.orchestrator;

import java.time.Instant;
import java.util.Set;

/** 관리 화면용 로컬 엔트리 요약 (값 본문은 노출하지 않음) */
public record CacheEntryView(
    String key,
    Instant staleAt,
    Instant expiresAt,
    long expiresInSeconds,
    boolean stale,
    Set<String> tags) {}
