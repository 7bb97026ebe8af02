package com.astrolitetech.directory.storage;

import com.astrolitetech.directory.exception.DirectoryException;
import com.astrolitetech.directory.exception.ErrorKind;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

/** Validates employee photos and writes accepted ones as {@code <millis>-<random>-<name>}. */
@Slf4j
public class MediaAttachmentHandler {

  public static final long DEFAULT_MAX_BYTES = 5L * 1024 * 1024;

  static final Set<String> ACCEPTED_TYPES =
      Set.of(MediaType.IMAGE_JPEG_VALUE, MediaType.IMAGE_PNG_VALUE);

  private static final int RANDOM_BOUND = 1_000_000_000;
  private static final String FALLBACK_NAME = "upload";

  private final Path uploadDir;
  private final String urlPrefix;
  private final long maxBytes;
  private final Clock clock;

  public MediaAttachmentHandler(Path uploadDir, String urlPrefix, long maxBytes, Clock clock) {
    this.uploadDir = uploadDir;
    this.urlPrefix = StringUtils.trimTrailingCharacter(urlPrefix, '/');
    this.maxBytes = maxBytes;
    this.clock = clock;
  }

  // a part without a filename is an untouched file input; a named part counts even when empty
  public static boolean isAttached(MultipartFile file) {
    return file != null && StringUtils.hasText(file.getOriginalFilename());
  }

  public void validate(MultipartFile file) {
    if (!isAttached(file)) {
      return;
    }
    String contentType = file.getContentType();
    if (contentType == null || !ACCEPTED_TYPES.contains(contentType)) {
      log.warn(
          "Rejected upload '{}' with content type {}", file.getOriginalFilename(), contentType);
      throw DirectoryException.of(ErrorKind.UNSUPPORTED_MEDIA_TYPE);
    }
    if (file.getSize() > maxBytes) {
      log.warn(
          "Rejected upload '{}' of {} bytes (limit {})",
          file.getOriginalFilename(),
          file.getSize(),
          maxBytes);
      throw DirectoryException.of(ErrorKind.PAYLOAD_TOO_LARGE);
    }
  }

  /** Returns {@code <url-prefix>/<generated-name>}, or empty when no photo was attached. */
  public Optional<String> store(MultipartFile file) {
    if (!isAttached(file)) {
      return Optional.empty();
    }
    validate(file);

    String storedName = generateName(file.getOriginalFilename());
    try {
      Files.createDirectories(uploadDir);
      Path target = uploadDir.resolve(storedName);
      try (InputStream in = file.getInputStream()) {
        Files.copy(in, target);
      }
      log.info("Stored upload {} ({} bytes)", target, file.getSize());
    } catch (IOException e) {
      log.error("Failed to store upload {}: {}", storedName, e.getMessage());
      throw DirectoryException.storeError("Failed to store upload: " + e.getMessage(), e);
    }
    return Optional.of(urlPrefix + "/" + storedName);
  }

  String generateName(String originalFilename) {
    return clock.millis()
        + "-"
        + ThreadLocalRandom.current().nextInt(RANDOM_BOUND)
        + "-"
        + baseName(originalFilename);
  }

  // only the last path segment of a client-supplied name is used
  static String baseName(String originalFilename) {
    if (!StringUtils.hasText(originalFilename)) {
      return FALLBACK_NAME;
    }
    String name = StringUtils.getFilename(StringUtils.cleanPath(originalFilename));
    if (!StringUtils.hasText(name) || "..".equals(name) || ".".equals(name)) {
      return FALLBACK_NAME;
    }
    return name;
  }
}
