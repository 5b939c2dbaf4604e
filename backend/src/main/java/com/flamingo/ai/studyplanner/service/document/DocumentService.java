package com.flamingo.ai.studyplanner.service.document;

import com.flamingo.ai.studyplanner.domain.enums.DocumentKind;
import com.flamingo.ai.studyplanner.domain.model.DocumentRef;
import java.util.Optional;
import org.springframework.web.multipart.MultipartFile;

/** Service for storing and locating uploaded course documents. */
public interface DocumentService {

  /**
   * Stores an uploaded document for a course, replacing any earlier upload of the same kind.
   *
   * @throws com.flamingo.ai.studyplanner.exception.DocumentProcessingException if the file is
   *     empty, of an unsupported type, or cannot be written
   */
  DocumentRef store(String sessionId, String courseId, DocumentKind kind, MultipartFile file);

  /** The document of the given kind for a course, if one was uploaded. */
  Optional<DocumentRef> find(String sessionId, String courseId, DocumentKind kind);
}
