package com.flamingo.ai.manualkb.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.manualkb.domain.enums.DocumentType;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DocumentTypeClassifierTest {

  @ParameterizedTest(name = "{0} / {1} -> {2}")
  @CsvSource({
    "'Troubleshooting Guide', 'guide.pdf', TROUBLESHOOTING",
    ", 'HP_E475_PC.pdf', PARTS_CATALOG",
    "'Parts Catalog', 'catalog.pdf', PARTS_CATALOG",
    ", 'bizhub_C658_UG.pdf', USER_GUIDE",
    "'Operator Manual', 'x.pdf', USER_GUIDE",
    "'Service Manual', 'HP_E475_SM.pdf', SERVICE_MANUAL",
    ", , SERVICE_MANUAL"
  })
  void shouldClassifyByKeywords(String title, String fileName, DocumentType expected) {
    assertThat(DocumentTypeClassifier.classify(title, fileName)).isEqualTo(expected);
  }
}
