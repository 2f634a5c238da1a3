package alert.grouping.infrastructure.redis;

import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.DisposableBean;

/**
 * RedissonClient 지연 생성기
 *
 * <p>Redis 가 기동 시점에 내려가 있어도 애플리케이션은 in-process fallback 으로 시작해야 하므로 클라이언트를 첫 사용 시점에 만듭니다. 생성에
 * 실패하면 예외(RedisConnectionException)를 그대로 던지고, 다음 호출(헬스체크 포함)에서 다시 시도합니다.
 */
@Slf4j
public class RedissonClientProvider implements DisposableBean {

  private final Supplier<RedissonClient> factory;
  private volatile RedissonClient client;

  public RedissonClientProvider(Supplier<RedissonClient> factory) {
    this.factory = factory;
  }

  /** 이미 생성된 클라이언트를 감싸는 provider (테스트/외부 관리 클라이언트용) */
  public static RedissonClientProvider of(RedissonClient client) {
    RedissonClientProvider provider = new RedissonClientProvider(() -> client);
    provider.client = client;
    return provider;
  }

  public RedissonClient get() {
    RedissonClient current = client;
    if (current != null) {
      return current;
    }
    synchronized (this) {
      if (client == null) {
        client = factory.get();
        log.info("[RedissonClientProvider] Redis 클라이언트 생성 완료");
      }
      return client;
    }
  }

  @Override
  public void destroy() {
    RedissonClient current = client;
    if (current != null && !current.isShutdown()) {
      current.shutdown();
    }
  }
}
