package com.codeclass.backend.execution.service;

import com.codeclass.backend.execution.config.ExecutionProperties;
import com.codeclass.backend.execution.model.ExecutionPayload;
import com.codeclass.backend.execution.model.SourceFile;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 재현용 요청과 소스 스냅샷의 직렬화/해시.
 */
@Component
public class RunPayloadCodec {
  private final ObjectMapper objectMapper;
  private final long snapshotSizeThreshold;

  @Autowired
  public RunPayloadCodec(ObjectMapper objectMapper, ExecutionProperties properties) {
    this(objectMapper, properties.getSnapshotSizeThreshold());
  }

  public RunPayloadCodec(ObjectMapper objectMapper, long snapshotSizeThreshold) {
    this.objectMapper = objectMapper;
    this.snapshotSizeThreshold = snapshotSizeThreshold;
  }

  public String encode(ExecutionPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize execution request", e);
    }
  }

  public ExecutionPayload decode(String requestJson) throws JsonProcessingException {
    if (requestJson == null || requestJson.isBlank()) {
      throw new IllegalArgumentException("Run has no stored request");
    }
    return objectMapper.readValue(requestJson, ExecutionPayload.class);
  }

  public Snapshot snapshot(List<SourceFile> files) {
    List<SnapshotEntry> entries = files.stream()
            .map(f -> new SnapshotEntry(f.getName(), f.getPath(), f.getContent()))
            .collect(Collectors.toList());
    String json;
    try {
      json = objectMapper.writeValueAsString(entries);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize snapshot", e);
    }
    byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
    String hash = sha256(bytes);
    // 크기를 넘으면 해시만 남긴다
    return new Snapshot(bytes.length <= snapshotSizeThreshold ? json : null, hash, bytes.length);
  }

  private static String sha256(byte[] bytes) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  @JsonPropertyOrder({"name", "path", "content"})
  static final class SnapshotEntry {
    @JsonProperty("name")
    final String name;
    @JsonProperty("path")
    final String path;
    @JsonProperty("content")
    final String content;

    SnapshotEntry(String name, String path, String content) {
      this.name = name;
      this.path = path;
      this.content = content;
    }
  }

  /**
   * 스냅샷 결과. {@code content}는 임계값을 넘으면 null.
   */
  public static final class Snapshot {
    private final String content;
    private final String hash;
    private final long sizeBytes;

    Snapshot(String content, String hash, long sizeBytes) {
      this.content = content;
      this.hash = hash;
      this.sizeBytes = sizeBytes;
    }

    public String getContent() {
      return content;
    }

    public String getHash() {
      return hash;
    }

    public long getSizeBytes() {
      return sizeBytes;
    }
  }
}
