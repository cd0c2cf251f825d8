package com.flamingo.ai.regdocs.service.extraction;

import com.flamingo.ai.regdocs.exception.TextExtractionException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.pdf.PDFParser;
import org.apache.tika.parser.pdf.PDFParserConfig;
import org.apache.tika.sax.BodyContentHandler;
import org.apache.tika.sax.ToTextContentHandler;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

/**
 * Second tier: Apache Tika's PDF parser with position-sorted layout analysis. Recovers text from
 * files whose content streams draw glyphs out of reading order.
 */
@Component
@Order(2)
public class TikaLayoutTextExtractor implements TextExtractor {

  @Override
  public String name() {
    return "tika-layout";
  }

  @Override
  public String extract(Path pdfFile, int maxPages) {
    PDFParserConfig parserConfig = new PDFParserConfig();
    parserConfig.setSortByPosition(true);
    parserConfig.setExtractInlineImages(false);
    parserConfig.setExtractAnnotationText(false);

    ParseContext context = new ParseContext();
    context.set(PDFParserConfig.class, parserConfig);

    ToTextContentHandler text = new ToTextContentHandler();
    BodyContentHandler body =
        new BodyContentHandler(new PageLimitingContentHandler(text, maxPages));

    try (InputStream in = Files.newInputStream(pdfFile)) {
      new PDFParser().parse(in, body, new Metadata(), context);
      return text.toString();
    } catch (IOException | SAXException | TikaException e) {
      throw new TextExtractionException(name(), e.getMessage(), e);
    }
  }
}
