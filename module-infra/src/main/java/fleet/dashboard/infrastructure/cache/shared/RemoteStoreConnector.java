package fleet.dashboard.infrastructure.cache.shared;

/**
 * 원격 저장소 연결 팩토리
 *
 * <p>{@link SharedCacheAdapter}가 첫 연산 시점에 호출합니다 (Lazy 연결). 연결 실패는 예외로 알립니다.
 */
@FunctionalInterface
public interface RemoteStoreConnector {

  RemoteKeyValueStore connect() throws Exception;
}
