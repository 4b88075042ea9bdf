package fleet.dashboard.infrastructure.cache.shared;

import java.time.Duration;
import java.util.Objects;

/**
 * 파이프라인 쓰기 단위
 *
 * @param key 저장할 물리 키
 * @param value 저장할 문자열 값
 * @param ttl 만료 시간
 * @param obsoleteKey 함께 삭제할 반대편 변형 키 (압축/비압축), 없으면 null
 */
public record RemoteWrite(String key, String value, Duration ttl, String obsoleteKey) {
  public RemoteWrite {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(ttl, "ttl");
  }
}
