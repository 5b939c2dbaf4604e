package com.flamingo.ai.studyplanner.service.document;

import com.flamingo.ai.studyplanner.domain.model.DocumentRef;

/**
 * Reads text out of stored documents. Page numbers are 1-indexed and inclusive; a plain-text
 * document counts as a single page.
 *
 * <p>All methods throw {@link com.flamingo.ai.studyplanner.exception.DocumentProcessingException}
 * when the document cannot be read.
 */
public interface DocumentTextSource {

  /** Full text of the document. */
  String extractText(DocumentRef document);

  /**
   * Text of pages {@code firstPage..lastPage}, each prefixed with a {@code [Page n]} marker. Pages
   * outside the document are ignored.
   */
  String extractPages(DocumentRef document, int firstPage, int lastPage);

  int pageCount(DocumentRef document);
}
