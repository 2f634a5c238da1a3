package alert.grouping.infrastructure.redis.script;

import alert.grouping.infrastructure.executor.LogicExecutor;
import alert.grouping.infrastructure.executor.TaskContext;
import alert.grouping.infrastructure.redis.RedissonClientProvider;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RScript;
import org.redisson.client.codec.StringCodec;

/**
 * Lua 스크립트 SHA 캐시 + NOSCRIPT 자동 재로드
 *
 * <p>Redis 재시작(스크립트 캐시 유실) 후에도 첫 실행에서 스크립트를 다시 로드하고 재시도합니다.
 */
@Slf4j
public class GroupLuaScriptProvider {

  private static final String NOSCRIPT_ERROR_PREFIX = "NOSCRIPT";

  private final RedissonClientProvider clientProvider;
  private final LogicExecutor executor;
  private final AtomicReference<String> compareAndStoreShaRef = new AtomicReference<>();

  public GroupLuaScriptProvider(RedissonClientProvider clientProvider, LogicExecutor executor) {
    this.clientProvider = clientProvider;
    this.executor = executor;
  }

  /**
   * 시작 시 스크립트 로드 (웜업)
   *
   * <p>Redis 연결 실패해도 기동에는 영향 없음. 첫 호출 시 다시 로드합니다.
   */
  public void loadScripts() {
    boolean loaded =
        executor.executeOrDefault(
            () -> {
              compareAndStoreShaRef.set(load(GroupLuaScripts.COMPARE_AND_STORE, "CompareAndStore"));
              return true;
            },
            false,
            TaskContext.of("LuaScript", "LoadAll"));
    if (!loaded) {
      log.warn("[GroupLuaScriptProvider] 시작 시 스크립트 로드 실패 - 첫 호출 시 재시도");
    }
  }

  /**
   * CAS 스크립트 실행
   *
   * @param scriptExecutor SHA 를 받아 evalSha 를 수행하는 함수
   */
  public <T> T executeCompareAndStore(Function<String, T> scriptExecutor) {
    return executeWithNoscriptHandling(
        compareAndStoreShaRef,
        GroupLuaScripts.COMPARE_AND_STORE,
        scriptExecutor,
        "CompareAndStore");
  }

  private <T> T executeWithNoscriptHandling(
      AtomicReference<String> shaRef,
      String scriptSource,
      Function<String, T> scriptExecutor,
      String scriptName) {
    return executor.executeWithFallback(
        () ->
            scriptExecutor.apply(
                shaRef.updateAndGet(sha -> sha != null ? sha : load(scriptSource, scriptName))),
        e -> {
          if (!isNoscriptError(e)) {
            throw asRuntime(e);
          }
          log.warn("[NOSCRIPT] 스크립트 재로드 필요: {}", scriptName);
          String newSha = load(scriptSource, scriptName);
          shaRef.set(newSha);
          return scriptExecutor.apply(newSha);
        },
        TaskContext.of("LuaScript", "Execute", scriptName));
  }

  private String load(String scriptSource, String scriptName) {
    RScript script = clientProvider.get().getScript(StringCodec.INSTANCE);
    String sha = script.scriptLoad(scriptSource);
    log.info("[GroupLuaScriptProvider] 스크립트 로드 완료 - {}: {}", scriptName, sha);
    return sha;
  }

  private static boolean isNoscriptError(Throwable e) {
    Throwable current = e;
    while (current != null) {
      String message = current.getMessage();
      if (message != null && message.contains(NOSCRIPT_ERROR_PREFIX)) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private static RuntimeException asRuntime(Throwable e) {
    if (e instanceof Error err) {
      throw err;
    }
    return e instanceof RuntimeException re ? re : new IllegalStateException(e);
  }
}
