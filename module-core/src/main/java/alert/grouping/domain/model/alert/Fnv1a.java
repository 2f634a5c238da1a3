package alert.grouping.domain.model.alert;

import java.nio.charset.StandardCharsets;

/** 64-bit FNV-1a 해시 (그룹 키 축약, fingerprint 계산용) */
public final class Fnv1a {

  private static final long OFFSET_BASIS = 0xcbf29ce484222325L;
  private static final long PRIME = 0x100000001b3L;

  private Fnv1a() {}

  public static long hash64(String input) {
    long hash = OFFSET_BASIS;
    for (byte b : input.getBytes(StandardCharsets.UTF_8)) {
      hash ^= (b & 0xff);
      hash *= PRIME;
    }
    return hash;
  }

  /** 16자리 고정 길이 소문자 hex */
  public static String hex64(String input) {
    return String.format("%016x", hash64(input));
  }
}
