package fleet.dashboard.util;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GZIP 압축 유틸리티
 *
 * <p>공유 캐시는 문자열 값만 저장하므로 압축 결과는 Base64 문자열로 주고받습니다.
 */
public final class GzipUtils {

  private GzipUtils() {}

  /**
   * 바이트 배열을 GZIP 압축합니다.
   *
   * @param raw 압축할 바이트 배열
   * @return 압축된 바이트 배열
   * @throws IOException 압축 중 I/O 오류 발생 시
   */
  public static byte[] compress(byte[] raw) throws IOException {
    if (raw == null || raw.length == 0) {
      return new byte[0];
    }

    ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, raw.length / 4));
    try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
      gzip.write(raw);
    }
    return out.toByteArray();
  }

  /**
   * GZIP 압축된 바이트 배열을 해제합니다. GZIP 매직 넘버가 없으면 입력을 그대로 돌려줍니다.
   *
   * @param compressed 압축된 바이트 배열
   * @return 압축 해제된 바이트 배열
   * @throws IOException 압축 해제 중 I/O 오류 발생 시
   */
  public static byte[] decompress(byte[] compressed) throws IOException {
    if (compressed == null || compressed.length == 0) {
      return new byte[0];
    }

    if (!isGzipped(compressed)) {
      return compressed;
    }

    try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
      return gzip.readAllBytes();
    }
  }

  /** 압축 후 Base64 인코딩 */
  public static String compressToBase64(byte[] raw) throws IOException {
    return Base64.getEncoder().encodeToString(compress(raw));
  }

  /** Base64 디코딩 후 압축 해제 */
  public static byte[] decompressFromBase64(String encoded) throws IOException {
    return decompress(Base64.getDecoder().decode(encoded));
  }

  public static boolean isGzipped(byte[] data) {
    return data.length >= 2
        && data[0] == (byte) (GZIPInputStream.GZIP_MAGIC)
        && data[1] == (byte) (GZIPInputStream.GZIP_MAGIC >> 8);
  }
}
