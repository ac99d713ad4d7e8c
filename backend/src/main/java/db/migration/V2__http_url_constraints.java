package db.migration;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/**
 * Restricts stored job links and source base URLs to http(s).
 */
public class V2__http_url_constraints extends BaseJavaMigration {
  private static final String JOB_URL_CONSTRAINT = "job_postings_source_url_http";
  private static final String SOURCE_URL_CONSTRAINT = "government_sources_base_url_http";

  @Override
  public void migrate(Context context) throws Exception {
    Connection connection = context.getConnection();
    addCheck(connection, "job_postings", JOB_URL_CONSTRAINT, httpCheck("source_url"));
    addCheck(connection, "government_sources", SOURCE_URL_CONSTRAINT, httpCheck("base_url"));
  }

  private static String httpCheck(String column) {
    return "(LOWER(" + column + ") LIKE 'http://%' OR LOWER(" + column + ") LIKE 'https://%')";
  }

  private void addCheck(Connection connection, String table, String name, String condition) throws SQLException {
    if (constraintExists(connection, table, name)) {
      return;
    }
    try (Statement statement = connection.createStatement()) {
      statement.executeUpdate("ALTER TABLE " + table + " ADD CONSTRAINT " + name + " CHECK " + condition);
    }
  }

  private boolean constraintExists(Connection connection, String table, String name) throws SQLException {
    String sql =
        "SELECT 1 FROM information_schema.table_constraints "
            + "WHERE LOWER(table_name) = ? AND LOWER(constraint_name) = ?";
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      ps.setString(1, table);
      ps.setString(2, name);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }
}
