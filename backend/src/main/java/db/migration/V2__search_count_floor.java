package db.migration;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public class V2__search_count_floor extends BaseJavaMigration {
  private static final String CONSTRAINT_NAME = "search_terms_search_count_floor";

  @Override
  public void migrate(Context context) throws Exception {
    try (Statement statement = context.getConnection().createStatement()) {
      statement.executeUpdate(
          "UPDATE search_terms SET search_count = 1 "
              + "WHERE search_count IS NULL OR search_count < 1");
    }

    if (!constraintExists(context.getConnection())) {
      try (Statement statement = context.getConnection().createStatement()) {
        statement.executeUpdate(
            "ALTER TABLE search_terms "
                + "ADD CONSTRAINT "
                + CONSTRAINT_NAME
                + " CHECK (search_count IS NULL OR search_count >= 1)");
      }
    }
  }

  private boolean constraintExists(Connection connection) throws SQLException {
    String sql =
        "SELECT 1 FROM information_schema.table_constraints "
            + "WHERE LOWER(table_name) = 'search_terms' "
            + "AND LOWER(constraint_name) = ?";
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      ps.setString(1, CONSTRAINT_NAME);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }
}
