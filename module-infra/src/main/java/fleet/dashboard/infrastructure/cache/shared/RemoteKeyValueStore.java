package fleet.dashboard.infrastructure.cache.shared;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 공유 캐시가 사용하는 원격 Key-Value 저장소 포트
 *
 * <p>모든 키는 이미 네임스페이스가 적용된 물리 키입니다. 구현체는 실패 시 예외를 그대로 던지며, 흡수/백오프는 {@link SharedCacheAdapter}의
 * 책임입니다.
 */
public interface RemoteKeyValueStore extends AutoCloseable {

  Optional<String> get(String key);

  /** 단일 multi-get. 존재하지 않는 키는 결과 Map에 포함되지 않습니다. */
  Map<String, String> getAll(Collection<String> keys);

  /** 단일 파이프라인으로 쓰기와 삭제를 함께 실행 */
  void writeAll(List<RemoteWrite> writes);

  long delete(Collection<String> keys);

  /** 멤버를 추가하고, 집합의 남은 TTL이 {@code ttl}보다 짧을 때만 만료를 연장합니다. */
  void addToSet(String setKey, Collection<String> members, Duration ttl);

  Set<String> members(String setKey);

  /** prefix로 시작하는 키 수 (SCAN 기반) */
  long countByPrefix(String prefix);

  /** prefix로 시작하는 키 전체 삭제 (SCAN 기반) */
  long deleteByPrefix(String prefix);

  boolean ping();

  /** INFO 결과 (섹션 구분 없이 평탄화된 key → value) */
  Map<String, String> info();

  @Override
  void close();
}
