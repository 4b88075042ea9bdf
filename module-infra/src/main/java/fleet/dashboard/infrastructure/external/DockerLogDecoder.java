package fleet.dashboard.infrastructure.external;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Docker 로그 스트림 디코더
 *
 * <p>TTY가 없는 컨테이너의 로그는 프레임 단위로 다중화되어 옵니다: {@code [stream(0|1|2), 0, 0, 0, size(uint32 BE)] +
 * payload}. 처음부터 끝까지 프레임으로 해석되는 경우에만 payload를 이어 붙이고, 그 외에는 원문을 UTF-8 텍스트로 반환합니다.
 */
public final class DockerLogDecoder {

  static final int HEADER_SIZE = 8;

  private DockerLogDecoder() {}

  public static String decode(byte[] payload) {
    if (payload.length < HEADER_SIZE) {
      return new String(payload, StandardCharsets.UTF_8);
    }

    ByteBuffer buffer = ByteBuffer.wrap(payload);
    ByteArrayOutputStream frames = new ByteArrayOutputStream(payload.length);
    int offset = 0;
    boolean framed = false;

    while (offset + HEADER_SIZE <= payload.length) {
      if (!isFrameHeader(payload, offset)) {
        break;
      }
      long size = Integer.toUnsignedLong(buffer.getInt(offset + 4));
      long end = offset + HEADER_SIZE + size;
      if (end > payload.length) {
        break;
      }
      frames.write(payload, offset + HEADER_SIZE, (int) size);
      framed = true;
      offset = (int) end;
    }

    if (framed && offset == payload.length) {
      return frames.toString(StandardCharsets.UTF_8);
    }
    return new String(payload, StandardCharsets.UTF_8);
  }

  private static boolean isFrameHeader(byte[] payload, int offset) {
    byte stream = payload[offset];
    boolean padded = payload[offset + 1] == 0 && payload[offset + 2] == 0 && payload[offset + 3] == 0;
    return padded && stream >= 0 && stream <= 2;
  }
}
