package fleet.dashboard.infrastructure.cache.shared;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import org.redisson.api.BatchOptions;
import org.redisson.api.RBatch;
import org.redisson.api.RBucket;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.api.redisnode.RedisNode;
import org.redisson.api.redisnode.RedisNodes;
import org.redisson.api.redisnode.RedisSingle;
import org.redisson.client.codec.StringCodec;

/**
 * Redisson 기반 {@link RemoteKeyValueStore}
 *
 * <ul>
 *   <li>값은 {@link StringCodec}으로 저장 (JSON 또는 Base64 압축 문자열)
 *   <li>multi-get: {@code getBuckets().get(keys...)} 한 번의 MGET
 *   <li>파이프라인 쓰기: {@link RBatch} 한 번의 execute
 *   <li>태그 집합: SADD + PEXPIRE를 Lua 스크립트 한 번으로 실행. TTL은 늘어나기만 함
 * </ul>
 */
@RequiredArgsConstructor
public class RedissonKeyValueStore implements RemoteKeyValueStore {

  /**
   * KEYS[1] = 태그 집합, ARGV[1] = TTL(ms), ARGV[2..] = 멤버
   *
   * <p>PTTL이 -1(만료 없음) 또는 -2(키 없음)이면 SADD 이후 새 TTL이 적용됩니다.
   */
  static final String ADD_TO_SET_EXTEND_TTL =
      "redis.call('SADD', KEYS[1], unpack(ARGV, 2)) "
          + "local current = redis.call('PTTL', KEYS[1]) "
          + "if current < tonumber(ARGV[1]) then "
          + "redis.call('PEXPIRE', KEYS[1], ARGV[1]) "
          + "end "
          + "return current";

  private final RedissonClient redissonClient;

  @Override
  public Optional<String> get(String key) {
    RBucket<String> bucket = redissonClient.getBucket(key, StringCodec.INSTANCE);
    return Optional.ofNullable(bucket.get());
  }

  @Override
  public Map<String, String> getAll(Collection<String> keys) {
    if (keys.isEmpty()) {
      return Map.of();
    }
    Map<String, String> found =
        redissonClient.getBuckets(StringCodec.INSTANCE).get(keys.toArray(String[]::new));
    return new HashMap<>(found);
  }

  @Override
  public void writeAll(List<RemoteWrite> writes) {
    if (writes.isEmpty()) {
      return;
    }
    RBatch batch = redissonClient.createBatch(BatchOptions.defaults());
    for (RemoteWrite write : writes) {
      batch
          .<String>getBucket(write.key(), StringCodec.INSTANCE)
          .setAsync(write.value(), write.ttl().toMillis(), TimeUnit.MILLISECONDS);
      if (write.obsoleteKey() != null) {
        batch.getBucket(write.obsoleteKey(), StringCodec.INSTANCE).deleteAsync();
      }
    }
    batch.execute();
  }

  @Override
  public long delete(Collection<String> keys) {
    if (keys.isEmpty()) {
      return 0L;
    }
    return redissonClient.getKeys().delete(keys.toArray(String[]::new));
  }

  @Override
  public void addToSet(String setKey, Collection<String> members, Duration ttl) {
    if (members.isEmpty()) {
      return;
    }
    List<Object> args = new ArrayList<>(members.size() + 1);
    args.add(String.valueOf(ttl.toMillis()));
    args.addAll(members);
    redissonClient
        .getScript(StringCodec.INSTANCE)
        .eval(
            RScript.Mode.READ_WRITE,
            ADD_TO_SET_EXTEND_TTL,
            RScript.ReturnType.INTEGER,
            List.of(setKey),
            args.toArray());
  }

  @Override
  public Set<String> members(String setKey) {
    return redissonClient.<String>getSet(setKey, StringCodec.INSTANCE).readAll();
  }

  @Override
  public long countByPrefix(String prefix) {
    long count = 0;
    for (String ignored : redissonClient.getKeys().getKeysByPattern(prefix + "*")) {
      count++;
    }
    return count;
  }

  @Override
  public long deleteByPrefix(String prefix) {
    return redissonClient.getKeys().deleteByPattern(prefix + "*");
  }

  @Override
  public boolean ping() {
    return redissonClient.getRedisNodes(RedisNodes.SINGLE).pingAll();
  }

  @Override
  public Map<String, String> info() {
    RedisSingle single = redissonClient.getRedisNodes(RedisNodes.SINGLE);
    return single.getInstance().info(RedisNode.InfoSection.ALL);
  }

  @Override
  public void close() {
    redissonClient.shutdown();
  }
}
