package dev.papernotes.config;

import dev.papernotes.index.InMemoryVectorIndex;
import dev.papernotes.index.PgVectorIndex;
import dev.papernotes.index.VectorIndex;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Selects the {@link VectorIndex} implementation with {@code papernotes.index.store}: {@code
 * pgvector} (default) or {@code memory}.
 */
@Configuration
public class IndexConfig {

  @Bean
  @ConditionalOnProperty(
      name = "papernotes.index.store",
      havingValue = "pgvector",
      matchIfMissing = true)
  public VectorIndex pgVectorIndex(JdbcTemplate jdbcTemplate) {
    return new PgVectorIndex(jdbcTemplate);
  }

  @Bean
  @ConditionalOnProperty(name = "papernotes.index.store", havingValue = "memory")
  public VectorIndex inMemoryVectorIndex() {
    return new InMemoryVectorIndex();
  }
}
