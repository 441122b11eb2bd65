package dev.granary.storage;

import java.sql.SQLException;
import org.springframework.dao.DuplicateKeyException;

/**
 * Recognises unique-constraint violations behind Spring's exception translation.
 *
 * <p>JPA surfaces them as a generic {@code DataIntegrityViolationException}, so the SQL state
 * ({@code 23505}, PostgreSQL {@code unique_violation}) is read from the cause chain.
 */
public final class UniqueViolations {

  static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

  private UniqueViolations() {
    // utility class
  }

  public static boolean isUniqueViolation(Throwable error) {
    for (Throwable cause = error; cause != null; cause = cause.getCause()) {
      if (cause instanceof DuplicateKeyException) {
        return true;
      }
      if (cause instanceof SQLException sql
          && UNIQUE_VIOLATION_SQL_STATE.equals(sql.getSQLState())) {
        return true;
      }
      if (cause.getCause() == cause) {
        break;
      }
    }
    return false;
  }
}
