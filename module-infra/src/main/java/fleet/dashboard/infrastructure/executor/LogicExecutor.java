package fleet.dashboard.infrastructure.executor;

import fleet.dashboard.infrastructure.executor.strategy.ExceptionTranslator;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * 예외 번역과 {@code logic.executor} 타이머를 한 곳으로 모은 실행 템플릿
 *
 * <ul>
 *   <li>{@link #executeOrDefault}: 실패 시 기본값 (INFO 필드 파싱 등 결과가 없어도 되는 작업)
 *   <li>{@link #executeOrCatch}: 실패 시 번역된 예외를 복구 함수로 전달 (공유 캐시 장애 흡수)
 *   <li>{@link #executeWithTranslation}: 지정한 번역기로 변환하여 전파 (업스트림 응답 역직렬화, 원격 저장소 연결)
 * </ul>
 *
 * <p>{@link Error}는 어떤 메서드에서도 번역하거나 삼키지 않습니다.
 */
public interface LogicExecutor {

  <T> T executeOrDefault(Callable<T> task, T defaultValue, TaskContext context);

  <T> T executeOrCatch(Callable<T> task, Function<Throwable, T> recovery, TaskContext context);

  <T> T executeWithTranslation(
      Callable<T> task, ExceptionTranslator translator, TaskContext context);
}
