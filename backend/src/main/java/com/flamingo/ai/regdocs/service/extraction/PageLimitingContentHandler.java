package com.flamingo.ai.regdocs.service.extraction;

import org.apache.tika.sax.ContentHandlerDecorator;
import org.xml.sax.Attributes;
import org.xml.sax.ContentHandler;
import org.xml.sax.SAXException;

/**
 * Passes character content through only for the first {@code maxPages} pages. Tika's PDF parser
 * wraps every page in {@code <div class="page">}.
 */
class PageLimitingContentHandler extends ContentHandlerDecorator {

  private final int maxPages;
  private int pageCount;

  PageLimitingContentHandler(ContentHandler handler, int maxPages) {
    super(handler);
    this.maxPages = maxPages;
  }

  @Override
  public void startElement(String uri, String localName, String name, Attributes atts)
      throws SAXException {
    if ("div".equals(localName) && "page".equals(atts.getValue("class"))) {
      pageCount++;
    }
    super.startElement(uri, localName, name, atts);
  }

  @Override
  public void characters(char[] ch, int start, int length) throws SAXException {
    if (withinLimit()) {
      super.characters(ch, start, length);
    }
  }

  @Override
  public void ignorableWhitespace(char[] ch, int start, int length) throws SAXException {
    if (withinLimit()) {
      super.ignorableWhitespace(ch, start, length);
    }
  }

  private boolean withinLimit() {
    return pageCount <= maxPages;
  }
}
