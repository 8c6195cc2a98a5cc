package com.flamingo.ai.manualkb.service.extraction;

import com.flamingo.ai.manualkb.domain.enums.ExtractionEngine;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.PagedText;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.ToXMLContentHandler;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * {@link TextExtractionBackend} built on Apache Tika.
 *
 * <p>Tika's PDF parser renders each page as a {@code <div class="page">} in its XHTML output; the
 * DOM is walked once and every page div becomes one page text. Tika exposes no glyph positions,
 * so no positioned lines are produced.
 */
@Component
@Slf4j
public class TikaExtractionBackend implements TextExtractionBackend {

  private static final Set<String> BLOCK_TAGS =
      Set.of("p", "div", "li", "h1", "h2", "h3", "h4", "h5", "h6", "tr", "br");

  @Override
  public ExtractionEngine engine() {
    return ExtractionEngine.TIKA;
  }

  @Override
  public BackendExtraction extract(Path pdf) throws IOException {
    Metadata metadata = new Metadata();
    metadata.set(Metadata.CONTENT_TYPE, "application/pdf");
    byte[] xhtml;
    try (InputStream in = Files.newInputStream(pdf)) {
      xhtml = toXhtml(in, metadata);
    } catch (SAXException | TikaException e) {
      throw new IOException("Tika could not parse " + pdf.getFileName(), e);
    }

    Map<Integer, String> pageTexts = new HashMap<>();
    Set<Integer> failedPages = new HashSet<>();
    List<String> pages = splitPages(xhtml);
    for (int i = 0; i < pages.size(); i++) {
      int page = i + 1;
      String text = pages.get(i);
      if (text.isBlank()) {
        failedPages.add(page);
      } else {
        pageTexts.put(page, text);
      }
    }

    Integer declaredPages = metadata.getInt(PagedText.N_PAGES);
    int pageCount = Math.max(pages.size(), declaredPages == null ? 0 : declaredPages);
    for (int page = pages.size() + 1; page <= pageCount; page++) {
      failedPages.add(page);
    }
    log.debug("Tika extracted {}/{} pages from {}", pageTexts.size(), pageCount, pdf.getFileName());

    return new BackendExtraction(
        ExtractionEngine.TIKA,
        pageTexts,
        Map.of(),
        failedPages,
        pageCount,
        blankToNull(metadata.get(TikaCoreProperties.TITLE)),
        blankToNull(metadata.get(TikaCoreProperties.CREATOR)),
        PdfDates.parse(metadata.get(TikaCoreProperties.CREATED)));
  }

  // ---- private helpers ----

  private byte[] toXhtml(InputStream in, Metadata metadata)
      throws IOException, SAXException, TikaException {
    AutoDetectParser parser = new AutoDetectParser();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ToXMLContentHandler handler = new ToXMLContentHandler(out, StandardCharsets.UTF_8.name());
    parser.parse(in, handler, metadata, new ParseContext());
    return out.toByteArray();
  }

  private List<String> splitPages(byte[] xhtml) throws IOException {
    org.w3c.dom.Document dom;
    try {
      DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
      dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      dbf.setNamespaceAware(true);
      dom = dbf.newDocumentBuilder().parse(new ByteArrayInputStream(xhtml));
    } catch (ParserConfigurationException | SAXException e) {
      throw new IOException("Tika produced unreadable XHTML", e);
    }

    List<String> pages = new ArrayList<>();
    NodeList divs = dom.getElementsByTagNameNS("*", "div");
    for (int i = 0; i < divs.getLength(); i++) {
      Element div = (Element) divs.item(i);
      if ("page".equals(div.getAttribute("class"))) {
        StringBuilder sb = new StringBuilder();
        collectText(div, sb);
        pages.add(sb.toString());
      }
    }
    if (pages.isEmpty()) {
      // Non-paged output: treat the whole body as one page
      StringBuilder sb = new StringBuilder();
      collectText(dom.getDocumentElement(), sb);
      pages.add(sb.toString());
    }
    return pages;
  }

  private void collectText(Element el, StringBuilder sb) {
    NodeList children = el.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child.getNodeType() == Node.TEXT_NODE) {
        sb.append(child.getTextContent());
      } else if (child.getNodeType() == Node.ELEMENT_NODE) {
        Element element = (Element) child;
        String tag = element.getLocalName() != null ? element.getLocalName() : element.getTagName();
        if ("head".equalsIgnoreCase(tag)) {
          continue;
        }
        collectText(element, sb);
        if (BLOCK_TAGS.contains(tag.toLowerCase(Locale.ROOT))) {
          sb.append('\n');
        }
      }
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.strip();
  }
}
