package alert.grouping.infrastructure.redis.script;

/**
 * 그룹 저장소 Lua 스크립트 모음
 *
 * <p>문서 쓰기와 인덱스 갱신을 하나의 원자 단위로 실행합니다.
 */
public final class GroupLuaScripts {

  private GroupLuaScripts() {}

  /**
   * 버전 비교 후 저장 (Compare-And-Swap)
   *
   * <pre>
   * KEYS[1] = 그룹 문서 키 (group:{key})
   * KEYS[2] = 정렬 인덱스 키 (group:index)
   * ARGV[1] = 기대 버전 (레코드가 없으면 0 만 허용)
   * ARGV[2] = 새 문서 JSON (metadata.version = 기대 버전 + 1)
   * ARGV[3] = TTL (ms)
   * ARGV[4] = 인덱스 score (updatedAt epoch ms)
   * ARGV[5] = 인덱스 member (그룹 키)
   *
   * 반환: {1, 새 버전} 성공 / {0, 현재 버전} 불일치 (손상된 문서는 현재 버전 -1)
   * </pre>
   */
  public static final String COMPARE_AND_STORE =
      """
      local expected = tonumber(ARGV[1])
      local current = 0
      local raw = redis.call('GET', KEYS[1])
      if raw then
        local ok, doc = pcall(cjson.decode, raw)
        if ok and type(doc) == 'table' and type(doc['metadata']) == 'table' then
          current = tonumber(doc['metadata']['version']) or 0
        else
          current = -1
        end
      end
      if current ~= expected then
        return {0, current}
      end
      redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3])
      redis.call('ZADD', KEYS[2], ARGV[4], ARGV[5])
      return {1, expected + 1}
      """;
}
