package db.migration;

import com.taggernews.ingest.taxonomy.TagTaxonomy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/** Level 1 tags are canonical and always present; lower levels are created on demand. */
public class V2__seed_canonical_tags extends BaseJavaMigration {

  @Override
  public void migrate(Context context) throws Exception {
    Connection connection = context.getConnection();
    Timestamp now = Timestamp.from(Instant.now());
    for (String name : TagTaxonomy.LEVEL_ONE) {
      insertIfMissing(connection, name, 1, null, now);
    }
  }

  private void insertIfMissing(
      Connection connection, String name, int level, String category, Timestamp now)
      throws SQLException {
    String slug = TagTaxonomy.slugify(name);
    if (slugExists(connection, slug)) {
      return;
    }
    String sql =
        "INSERT INTO tags (name, slug, level, category, created_at) VALUES (?, ?, ?, ?, ?)";
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      ps.setString(1, name);
      ps.setString(2, slug);
      ps.setInt(3, level);
      ps.setString(4, category);
      ps.setTimestamp(5, now);
      ps.executeUpdate();
    }
  }

  private boolean slugExists(Connection connection, String slug) throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement("SELECT 1 FROM tags WHERE slug = ?")) {
      ps.setString(1, slug);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }
}
