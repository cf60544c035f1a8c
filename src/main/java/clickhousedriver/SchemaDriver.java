package clickhousedriver;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import clickhousedriver.SchemaMetadata.Column;
import clickhousedriver.SchemaMetadata.ForeignKey;
import clickhousedriver.SchemaMetadata.PrimaryKey;

/**
 * Operations a code generator needs from a database backend. Implementations hold one connection
 * between {@link #open()} and {@link #close()} and are not thread-safe.
 */
public interface SchemaDriver extends AutoCloseable
{
  void open() throws SQLException;

  @Override
  void close() throws SQLException;

  /**
   * Lists the tables of a database. A non-empty whitelist restricts the result to the named
   * tables; otherwise a non-empty blacklist excludes the named tables.
   */
  List<String> tableNames(String database, List<String> whitelist, List<String> blacklist) throws SQLException;

  /** Columns of a table in catalog order, not yet translated. */
  List<Column> columns(String database, String table) throws SQLException;

  Optional<PrimaryKey> primaryKeyInfo(String database, String table) throws SQLException;

  List<ForeignKey> foreignKeyInfo(String database, String table) throws SQLException;

  Column translateColumnType(Column column);

  char leftQuote();

  char rightQuote();

  boolean useLastInsertId();

  boolean useTopClause();

  boolean useIndexPlaceholders();
}
