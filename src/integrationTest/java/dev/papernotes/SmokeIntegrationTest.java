package dev.papernotes;

import static org.assertj.core.api.Assertions.assertThat;

import dev.papernotes.gateway.EmbeddingGateway;
import dev.papernotes.index.PgVectorIndex;
import dev.papernotes.index.VectorIndex;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class SmokeIntegrationTest extends BaseIntegrationTest {

  @Autowired VectorIndex index;

  @Autowired EmbeddingGateway gateway;

  @Test
  void contextLoadsWithPgvectorIndexAndMigratedSchema() {
    assertThat(index).isInstanceOf(PgVectorIndex.class);
    assertThat(index.count()).isZero();
  }

  @Test
  void unconfiguredModelsReportNotReady() {
    assertThat(gateway.status())
        .containsEntry("image:clip", false)
        .containsEntry("ocr:a", false)
        .containsEntry("text", true);
  }
}
