package fleet.dashboard.infrastructure.cache.shared;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;

/**
 * REDIS_URL 기반 Redisson 단일 서버 연결
 *
 * <ul>
 *   <li>REDIS_PASSWORD가 있으면 URL의 userinfo로 주입 ({@code redis://:password@host:port})
 *   <li>userinfo와 DB 번호(path)는 Redisson 설정(username/password/database)으로 분리
 *   <li>{@link Redisson#create(Config)}는 즉시 연결을 시도하므로 연결 실패는 여기서 예외로 드러남
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class RedissonStoreConnector implements RemoteStoreConnector {

  private static final int DEFAULT_PORT = 6379;

  private final String url;
  private final String password;
  private final int connectTimeoutMs;
  private final int timeoutMs;

  @Override
  public RemoteKeyValueStore connect() {
    URI uri = URI.create(withPassword(url, password));
    Config config = new Config();
    SingleServerConfig server =
        config
            .useSingleServer()
            .setAddress(uri.getScheme() + "://" + uri.getHost() + ":" + port(uri))
            .setConnectTimeout(connectTimeoutMs)
            .setTimeout(timeoutMs)
            .setRetryAttempts(1)
            .setRetryInterval(500)
            .setConnectionPoolSize(16)
            .setConnectionMinimumIdleSize(2);
    applyCredentials(server, uri.getRawUserInfo());
    applyDatabase(server, uri.getPath());

    log.info("[SharedCache] Redis 연결 시도: {}://{}:{}", uri.getScheme(), uri.getHost(), port(uri));
    return new RedissonKeyValueStore(Redisson.create(config));
  }

  /**
   * URL에 userinfo가 없고 비밀번호가 주어지면 {@code :password@}를 주입합니다.
   *
   * @return 비밀번호가 반영된 URL
   */
  public static String withPassword(String url, String password) {
    if (password == null || password.isBlank()) {
      return url;
    }
    URI uri = URI.create(url);
    if (uri.getRawUserInfo() != null) {
      return url;
    }
    String encoded = URLEncoder.encode(password, StandardCharsets.UTF_8);
    return url.replaceFirst("://", "://:" + encoded + "@");
  }

  private static int port(URI uri) {
    return uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT;
  }

  private static void applyCredentials(SingleServerConfig server, String rawUserInfo) {
    if (rawUserInfo == null || rawUserInfo.isEmpty()) {
      return;
    }
    int colon = rawUserInfo.indexOf(':');
    if (colon < 0) {
      server.setPassword(decode(rawUserInfo));
      return;
    }
    String username = decode(rawUserInfo.substring(0, colon));
    if (!username.isEmpty()) {
      server.setUsername(username);
    }
    server.setPassword(decode(rawUserInfo.substring(colon + 1)));
  }

  private static void applyDatabase(SingleServerConfig server, String path) {
    if (path == null || path.length() <= 1) {
      return;
    }
    server.setDatabase(Integer.parseInt(path.substring(1)));
  }

  private static String decode(String value) {
    return URLDecoder.decode(value, StandardCharsets.UTF_8);
  }
}
