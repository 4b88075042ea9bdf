package fleet.dashboard.infrastructure.external;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 컨테이너 라벨 마스킹
 *
 * <p>compose 설정 파일 경로, Docker Desktop bind 라벨, 호스트 경로처럼 보이는 값({@code /}, {@code ~/}, {@code C:\})은
 * {@value #REDACTED}로 치환합니다.
 */
public final class ContainerLabelSanitizer {

  public static final String REDACTED = "[REDACTED]";

  private static final Set<String> SENSITIVE_KEYS = Set.of("com.docker.compose.project.config_files");
  private static final String BIND_KEY_PREFIX = "desktop.docker.io/binds/";
  private static final Pattern HOST_PATH = Pattern.compile("^(/|~/|[A-Za-z]:[\\\\/])");

  private ContainerLabelSanitizer() {}

  public static Map<String, String> sanitize(Map<String, String> labels) {
    if (labels == null || labels.isEmpty()) {
      return Map.of();
    }
    Map<String, String> sanitized = new LinkedHashMap<>();
    labels.forEach((key, value) -> sanitized.put(key, shouldRedact(key, value) ? REDACTED : value));
    return sanitized;
  }

  static boolean shouldRedact(String key, String value) {
    return SENSITIVE_KEYS.contains(key)
        || key.startsWith(BIND_KEY_PREFIX)
        || (value != null && HOST_PATH.matcher(value).find());
  }
}
