package com.codeclass.backend.execution.executor;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * 최대 크기까지만 보관하는 출력 버퍼. 넘치는 바이트는 버리되 계속 받아서 프로세스가 파이프에서 막히지
 * 않게 한다.
 */
class BoundedOutputBuffer extends OutputStream {
  static final String TRUNCATED_MARKER = "\n...[output truncated]";

  private final int maxBytes;
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private boolean truncated;

  BoundedOutputBuffer(int maxBytes) {
    this.maxBytes = maxBytes;
  }

  @Override
  public synchronized void write(int b) {
    if (buffer.size() < maxBytes) {
      buffer.write(b);
    } else {
      truncated = true;
    }
  }

  @Override
  public synchronized void write(byte[] b, int off, int len) {
    int room = maxBytes - buffer.size();
    if (len > room) {
      truncated = true;
    }
    if (room > 0) {
      buffer.write(b, off, Math.min(room, len));
    }
  }

  // 스트림이 닫힐 때까지 읽는다
  void drain(InputStream in) throws IOException {
    byte[] chunk = new byte[8192];
    int read;
    while ((read = in.read(chunk)) != -1) {
      write(chunk, 0, read);
    }
  }

  synchronized String asString() {
    String text = new String(buffer.toByteArray(), StandardCharsets.UTF_8);
    return truncated ? text + TRUNCATED_MARKER : text;
  }
}
