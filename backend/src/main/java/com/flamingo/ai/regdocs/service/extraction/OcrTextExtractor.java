package com.flamingo.ai.regdocs.service.extraction;

import com.flamingo.ai.regdocs.config.RegDocsConfig;
import com.flamingo.ai.regdocs.exception.TextExtractionException;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Last tier: renders the leading pages with PDFBox and runs Tesseract OCR over them. Needed for
 * scanned approval letters that carry no text layer.
 */
@Component
@Order(3)
@RequiredArgsConstructor
@Slf4j
public class OcrTextExtractor implements TextExtractor {

  private final RegDocsConfig config;

  @Override
  public String name() {
    return "ocr";
  }

  @Override
  public String extract(Path pdfFile, int maxPages) {
    RegDocsConfig.Extraction extraction = config.getExtraction();
    StringBuilder text = new StringBuilder();

    try (PDDocument document = Loader.loadPDF(pdfFile.toFile())) {
      // Tesseract instances are not thread-safe
      Tesseract tesseract = newTesseract();
      PDFRenderer renderer = new PDFRenderer(document);
      int pages = Math.min(maxPages, document.getNumberOfPages());
      for (int i = 0; i < pages; i++) {
        BufferedImage image =
            renderer.renderImageWithDPI(i, extraction.getOcrDpi(), ImageType.GRAY);
        String pageText = tesseract.doOCR(image);
        text.append("Page ").append(i + 1).append(":\n").append(pageText).append("\n\n");
      }
    } catch (IOException | TesseractException e) {
      throw new TextExtractionException(name(), e.getMessage(), e);
    } catch (LinkageError e) {
      // libtesseract missing or incompatible
      throw new TextExtractionException(name(), "native OCR library unavailable: " + e, e);
    }
    log.debug("OCR produced {} characters from {}", text.length(), pdfFile.getFileName());
    return text.toString();
  }

  Tesseract newTesseract() {
    RegDocsConfig.Extraction extraction = config.getExtraction();
    Tesseract tesseract = new Tesseract();
    if (extraction.getTessdataPath() != null && !extraction.getTessdataPath().isBlank()) {
      tesseract.setDatapath(extraction.getTessdataPath());
    }
    tesseract.setLanguage(extraction.getOcrLanguage());
    return tesseract;
  }
}
