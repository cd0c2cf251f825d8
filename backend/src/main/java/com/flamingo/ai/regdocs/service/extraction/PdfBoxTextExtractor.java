package com.flamingo.ai.regdocs.service.extraction;

import com.flamingo.ai.regdocs.exception.TextExtractionException;
import java.io.IOException;
import java.nio.file.Path;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** First tier: PDFBox text stripping in content-stream order. */
@Component
@Order(1)
public class PdfBoxTextExtractor implements TextExtractor {

  @Override
  public String name() {
    return "pdfbox";
  }

  @Override
  public String extract(Path pdfFile, int maxPages) {
    try (PDDocument document = Loader.loadPDF(pdfFile.toFile())) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setStartPage(1);
      stripper.setEndPage(Math.min(maxPages, document.getNumberOfPages()));
      return stripper.getText(document);
    } catch (IOException e) {
      throw new TextExtractionException(name(), e.getMessage(), e);
    }
  }
}
