package com.flamingo.ai.studyplanner.service.document;

import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.enums.DocumentKind;
import com.flamingo.ai.studyplanner.domain.model.DocumentRef;
import com.flamingo.ai.studyplanner.exception.DocumentProcessingException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Implementation of the DocumentService on the local file system. Files are laid out as {@code
 * <base>/<session>/<course>/<kind>/<file>}, every segment sanitized.
 */
@Service
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  private static final Set<String> SUPPORTED_MIME_TYPES =
      Set.of("application/pdf", "text/plain", "text/markdown");

  private static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".pdf", ".txt", ".md");

  private final Path basePath;
  private final MeterRegistry meterRegistry;

  public DocumentServiceImpl(PlannerConfig plannerConfig, MeterRegistry meterRegistry) {
    this.basePath = Paths.get(plannerConfig.getStorage().getBasePath()).toAbsolutePath();
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "document.upload", description = "Time to store an uploaded document")
  public DocumentRef store(
      String sessionId, String courseId, DocumentKind kind, MultipartFile file) {
    String original = file.getOriginalFilename();
    String fileName = sanitize(original == null ? "document" : original);
    log.info(
        "Storing {} '{}' for course {} in session {}", kind.label(), fileName, courseId, sessionId);

    validateFile(file, fileName);

    Path directory = directoryFor(sessionId, courseId, kind);
    Path target = directory.resolve(fileName);
    try {
      Files.createDirectories(directory);
      clearDirectory(directory);
      try (InputStream in = file.getInputStream()) {
        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      log.error("Failed to store {}: {}", target, e.getMessage());
      throw new DocumentProcessingException(fileName, "Failed to store file: " + e.getMessage(), e);
    }

    meterRegistry.counter("document.uploaded", "kind", kind.label()).increment();
    return new DocumentRef(courseId, kind, target);
  }

  @Override
  public Optional<DocumentRef> find(String sessionId, String courseId, DocumentKind kind) {
    Path directory = directoryFor(sessionId, courseId, kind);
    if (!Files.isDirectory(directory)) {
      return Optional.empty();
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .filter(Files::isRegularFile)
          .sorted()
          .findFirst()
          .map(path -> new DocumentRef(courseId, kind, path));
    } catch (IOException e) {
      log.warn("Failed to list {}: {}", directory, e.getMessage());
      return Optional.empty();
    }
  }

  private Path directoryFor(String sessionId, String courseId, DocumentKind kind) {
    return basePath.resolve(sanitize(sessionId)).resolve(sanitize(courseId)).resolve(kind.label());
  }

  /** One document per kind and course: a new upload replaces the previous one. */
  private void clearDirectory(Path directory) throws IOException {
    try (Stream<Path> files = Files.list(directory)) {
      for (Path path : files.filter(Files::isRegularFile).toList()) {
        Files.delete(path);
      }
    }
  }

  private void validateFile(MultipartFile file, String fileName) {
    if (file.isEmpty()) {
      throw new DocumentProcessingException(
          fileName, "File is empty", "Please upload a valid file");
    }

    String contentType = file.getContentType();
    boolean supportedType = contentType != null && SUPPORTED_MIME_TYPES.contains(contentType);
    if (!supportedType && !SUPPORTED_EXTENSIONS.contains(extension(fileName))) {
      throw new DocumentProcessingException(
          fileName, "Unsupported file type: " + contentType, "Supported formats: PDF, TXT, MD");
    }
  }

  private static String extension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
  }

  /** Keeps a path segment inside its parent directory. */
  static String sanitize(String segment) {
    if (segment == null || segment.isBlank()) {
      return "_";
    }
    String cleaned = segment.trim().replaceAll("[^A-Za-z0-9._-]", "_");
    if (cleaned.chars().allMatch(c -> c == '.')) {
      return "_";
    }
    return cleaned;
  }
}
