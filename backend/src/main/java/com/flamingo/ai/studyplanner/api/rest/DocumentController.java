package com.flamingo.ai.studyplanner.api.rest;

import com.flamingo.ai.studyplanner.api.dto.response.UploadResponse;
import com.flamingo.ai.studyplanner.domain.enums.DocumentKind;
import com.flamingo.ai.studyplanner.domain.model.DocumentRef;
import com.flamingo.ai.studyplanner.service.document.DocumentService;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for course document uploads. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentService documentService;

  /** Uploads a syllabus, exam overview or textbook for a course. */
  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<UploadResponse> uploadDocument(
      @RequestParam("sessionId") String sessionId,
      @RequestParam("courseId") String courseId,
      @RequestParam("docType") String docType,
      @RequestParam("file") MultipartFile file) {
    DocumentKind kind = DocumentKind.fromLabel(docType);
    DocumentRef document = documentService.store(sessionId, courseId, kind, file);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            UploadResponse.builder()
                .id(UUID.randomUUID().toString())
                .name(document.fileName())
                .path(document.handle().toString())
                .status("complete")
                .build());
  }
}
