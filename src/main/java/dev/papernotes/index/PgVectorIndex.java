package dev.papernotes.index;

import com.pgvector.PGvector;
import dev.langchain4j.data.embedding.Embedding;
import dev.papernotes.note.EmbeddingField;
import dev.papernotes.note.FieldVector;
import dev.papernotes.note.NoteRecord;
import dev.papernotes.note.OcrReading;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link VectorIndex} backed by PostgreSQL with pgvector: one row per note in the {@code notes}
 * table, one {@code vector} column per field, each with an HNSW cosine index.
 *
 * <p>Schema and indexes are managed by Flyway. A new record is one {@code INSERT ... RETURNING id};
 * a re-scan is one {@code UPDATE ... WHERE id = ?}. When the row is gone by the time of the update
 * the record is inserted under a fresh id, so a deleted id never comes back.
 */
public class PgVectorIndex implements VectorIndex {

  private static final Logger log = LoggerFactory.getLogger(PgVectorIndex.class);

  private static final List<String> SCALAR_COLUMNS =
      List.of(
          "title",
          "image_path",
          "collection",
          "ocr_text_a",
          "ocr_confidence_a",
          "ocr_text_b",
          "ocr_confidence_b",
          "updated_at");

  private static final List<String> COLUMNS =
      Stream.concat(
              SCALAR_COLUMNS.stream(), Stream.of(EmbeddingField.values()).map(EmbeddingField::column))
          .toList();

  private static final String INSERT_SQL =
      "INSERT INTO notes ("
          + String.join(", ", COLUMNS)
          + ") VALUES ("
          + COLUMNS.stream().map(c -> "?").collect(Collectors.joining(", "))
          + ") RETURNING id";

  private static final String UPDATE_SQL =
      "UPDATE notes SET "
          + COLUMNS.stream().map(c -> c + " = ?").collect(Collectors.joining(", "))
          + " WHERE id = ?";

  private static final String SELECT_SQL =
      "SELECT id, " + String.join(", ", COLUMNS) + " FROM notes";

  private final JdbcTemplate jdbcTemplate;
  private final RowMapper<NoteRecord> rowMapper = this::mapRow;

  public PgVectorIndex(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public NoteRecord upsert(NoteRecord note) {
    if (note.id() != null) {
      long id = note.id();
      int updated =
          jdbcTemplate.update(
              UPDATE_SQL,
              ps -> {
                int next = bind(ps, note);
                ps.setLong(next, id);
              });
      if (updated > 0) {
        return note;
      }
      log.info("Note {} no longer exists, storing the scan as a new note", id);
    }

    List<Long> ids =
        jdbcTemplate.query(INSERT_SQL, ps -> bind(ps, note), (rs, rowNum) -> rs.getLong(1));
    if (ids.isEmpty()) {
      throw new IllegalStateException("INSERT into notes returned no id");
    }
    return note.withId(ids.get(0));
  }

  @Override
  public List<NeighborMatch> nearestNeighbors(EmbeddingField field, Embedding query, int k) {
    String column = field.column();
    String sql =
        "SELECT id, "
            + column
            + " <=> ? AS distance FROM notes WHERE "
            + column
            + " IS NOT NULL ORDER BY "
            + column
            + " <=> ? LIMIT ?";
    PGvector vector = new PGvector(query.vector());
    return jdbcTemplate.query(
        sql,
        ps -> {
          ps.setObject(1, vector);
          ps.setObject(2, vector);
          ps.setInt(3, k);
        },
        (rs, rowNum) -> new NeighborMatch(rs.getLong("id"), rs.getDouble("distance")));
  }

  @Override
  public Optional<NoteRecord> get(long id) {
    return jdbcTemplate.query(SELECT_SQL + " WHERE id = ?", rowMapper, id).stream().findFirst();
  }

  @Override
  public long count() {
    Long count = jdbcTemplate.queryForObject("SELECT count(*) FROM notes", Long.class);
    return count == null ? 0L : count;
  }

  @Override
  public boolean delete(long id) {
    return jdbcTemplate.update("DELETE FROM notes WHERE id = ?", id) > 0;
  }

  /** Binds every column of {@link #COLUMNS} in order; returns the next parameter index. */
  private static int bind(PreparedStatement ps, NoteRecord note) throws SQLException {
    int i = 1;
    ps.setString(i++, note.title());
    ps.setString(i++, note.imagePath());
    ps.setString(i++, note.collection());
    ps.setString(i++, note.ocrA().text());
    ps.setFloat(i++, note.ocrA().confidence());
    ps.setString(i++, note.ocrB().text());
    ps.setFloat(i++, note.ocrB().confidence());
    ps.setTimestamp(i++, Timestamp.from(note.timestamp()));
    for (EmbeddingField field : EmbeddingField.values()) {
      Optional<Embedding> embedding = note.vector(field).embedding();
      if (embedding.isPresent()) {
        ps.setObject(i++, new PGvector(embedding.get().vector()));
      } else {
        ps.setNull(i++, Types.OTHER);
      }
    }
    return i;
  }

  private NoteRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    Map<EmbeddingField, FieldVector> vectors = new EnumMap<>(EmbeddingField.class);
    for (EmbeddingField field : EmbeddingField.values()) {
      vectors.put(field, FieldVector.ofNullable(toEmbedding(rs.getString(field.column()))));
    }
    return new NoteRecord(
        rs.getLong("id"),
        rs.getString("title"),
        rs.getString("image_path"),
        rs.getString("collection"),
        vectors,
        new OcrReading(rs.getString("ocr_text_a"), rs.getFloat("ocr_confidence_a")),
        new OcrReading(rs.getString("ocr_text_b"), rs.getFloat("ocr_confidence_b")),
        rs.getTimestamp("updated_at").toInstant());
  }

  private static @Nullable Embedding toEmbedding(@Nullable String value) throws SQLException {
    return value == null ? null : Embedding.from(new PGvector(value).toArray());
  }
}
