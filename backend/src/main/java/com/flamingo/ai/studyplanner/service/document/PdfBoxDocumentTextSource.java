package com.flamingo.ai.studyplanner.service.document;

import com.flamingo.ai.studyplanner.domain.model.DocumentRef;
import com.flamingo.ai.studyplanner.exception.DocumentProcessingException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentTextSource} backed by Apache PDFBox 3.x for PDFs; other documents are read as
 * UTF-8 text. A document is a PDF when its name ends in {@code .pdf} or its content starts with
 * the PDF header, so uploads that lost their extension are still parsed.
 */
@Service
@Slf4j
public class PdfBoxDocumentTextSource implements DocumentTextSource {

  private static final byte[] PDF_HEADER = "%PDF-".getBytes(StandardCharsets.US_ASCII);

  @Override
  public String extractText(DocumentRef document) {
    if (!isPdf(document)) {
      return readPlainText(document);
    }
    try (PDDocument pdf = Loader.loadPDF(document.handle().toFile())) {
      return new PDFTextStripper().getText(pdf);
    } catch (IOException e) {
      throw failure(document, e);
    }
  }

  @Override
  public String extractPages(DocumentRef document, int firstPage, int lastPage) {
    if (!isPdf(document)) {
      return firstPage <= 1 && lastPage >= 1 ? pageBlock(1, readPlainText(document)) : "";
    }
    try (PDDocument pdf = Loader.loadPDF(document.handle().toFile())) {
      int from = Math.max(1, firstPage);
      int to = Math.min(lastPage, pdf.getNumberOfPages());
      PDFTextStripper stripper = new PDFTextStripper();
      List<String> pages = new ArrayList<>();
      for (int page = from; page <= to; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String text = stripper.getText(pdf);
        if (!text.isBlank()) {
          pages.add(pageBlock(page, text));
        }
      }
      log.debug("Read pages {}-{} of {}", from, to, document.fileName());
      return String.join("\n\n", pages);
    } catch (IOException e) {
      throw failure(document, e);
    }
  }

  @Override
  public int pageCount(DocumentRef document) {
    if (!isPdf(document)) {
      return 1;
    }
    try (PDDocument pdf = Loader.loadPDF(document.handle().toFile())) {
      return pdf.getNumberOfPages();
    } catch (IOException e) {
      throw failure(document, e);
    }
  }

  private String readPlainText(DocumentRef document) {
    try {
      return Files.readString(document.handle(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw failure(document, e);
    }
  }

  private static String pageBlock(int page, String text) {
    return "[Page " + page + "]\n" + text.strip();
  }

  private boolean isPdf(DocumentRef document) {
    if (document.fileName().toLowerCase(Locale.ROOT).endsWith(".pdf")) {
      return true;
    }
    try (InputStream in = Files.newInputStream(document.handle())) {
      return Arrays.equals(in.readNBytes(PDF_HEADER.length), PDF_HEADER);
    } catch (IOException e) {
      throw failure(document, e);
    }
  }

  private static DocumentProcessingException failure(DocumentRef document, IOException e) {
    log.error("Failed to read {}: {}", document.fileName(), e.getMessage());
    return new DocumentProcessingException(
        document.fileName(), "Failed to read document: " + e.getMessage(), e);
  }
}
