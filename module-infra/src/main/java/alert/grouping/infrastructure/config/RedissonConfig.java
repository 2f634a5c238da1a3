package alert.grouping.infrastructure.config;

import alert.grouping.infrastructure.redis.RedissonClientProvider;
import java.util.Arrays;
import org.redisson.Redisson;
import org.redisson.config.Config;
import org.redisson.config.ReadMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 클라이언트 설정 (단일 서버 / Sentinel)
 *
 * <p>클라이언트는 {@link RedissonClientProvider} 가 첫 사용 시 생성합니다. Redis 가 내려가 있어도 애플리케이션은 fallback 저장소로
 * 기동됩니다.
 */
@Configuration
public class RedissonConfig {

  private static final String REDISSON_HOST_PREFIX = "redis://";

  @Value("${spring.data.redis.sentinel.master:}")
  private String masterName;

  @Value("${spring.data.redis.sentinel.nodes:}")
  private String sentinelNodes;

  @Value("${spring.data.redis.host:localhost}")
  private String host;

  @Value("${spring.data.redis.port:6379}")
  private int port;

  @Value("${spring.data.redis.password:}")
  private String password;

  // 명령 타임아웃: 저장소 호출의 마감 시간
  @Value("${redis.timeout-ms:3000}")
  private int timeoutMs;

  @Value("${redis.connect-timeout-ms:3000}")
  private int connectTimeoutMs;

  @Bean
  public RedissonClientProvider redissonClientProvider() {
    Config config = new Config();
    if (isSentinelMode()) {
      configureSentinel(config);
    } else {
      configureSingleServer(config);
    }
    return new RedissonClientProvider(() -> Redisson.create(config));
  }

  private boolean isSentinelMode() {
    return !masterName.isEmpty() && !sentinelNodes.isEmpty();
  }

  private void configureSentinel(Config config) {
    String[] addresses =
        Arrays.stream(sentinelNodes.split(","))
            .map(node -> REDISSON_HOST_PREFIX + node.trim())
            .toArray(String[]::new);

    var sentinelConfig =
        config
            .useSentinelServers()
            .setMasterName(masterName)
            .addSentinelAddress(addresses)
            .setCheckSentinelsList(false)
            .setReadMode(ReadMode.MASTER)
            .setRetryAttempts(2)
            .setRetryInterval(500)
            .setTimeout(timeoutMs)
            .setConnectTimeout(connectTimeoutMs);
    if (!password.isEmpty()) {
      sentinelConfig.setPassword(password);
    }
  }

  private void configureSingleServer(Config config) {
    var serverConfig =
        config
            .useSingleServer()
            .setAddress(REDISSON_HOST_PREFIX + host + ":" + port)
            .setRetryAttempts(2)
            .setRetryInterval(500)
            .setTimeout(timeoutMs)
            .setConnectTimeout(connectTimeoutMs)
            .setConnectionPoolSize(32)
            .setConnectionMinimumIdleSize(4);
    if (!password.isEmpty()) {
      serverConfig.setPassword(password);
    }
  }
}
