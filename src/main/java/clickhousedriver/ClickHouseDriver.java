package clickhousedriver;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import clickhousedriver.SchemaMetadata.Column;
import clickhousedriver.SchemaMetadata.ForeignKey;
import clickhousedriver.SchemaMetadata.PrimaryKey;

/**
 * Reads table, column and primary key metadata from the ClickHouse {@code system.tables} and
 * {@code system.columns} catalog tables. Call {@link #open()} before use and {@link #close()}
 * afterwards.
 */
public class ClickHouseDriver implements SchemaDriver
{
  private static final Logger log = LoggerFactory.getLogger(ClickHouseDriver.class);

  static final String TABLE_NAMES_SQL =
    "select name from system.tables where database = ? and database <> 'system'";

  static final String COLUMNS_SQL = """
    select name, type, default_expression
      from system.columns
    where table = ? and database = ?;
    """;

  static final String PRIMARY_KEY_SQL = """
    select name, engine_full
    from system.tables
    where name = ? and database = ?;""";

  /** Opens the single connection a driver instance works with. */
  @FunctionalInterface
  public interface ConnectionFactory
  {
    Connection connect() throws SQLException;
  }

  private final String connStr;
  private final ConnectionFactory connectionFactory;
  private final TypeTranslator typeTranslator;
  private @Nullable Connection conn;

  public ClickHouseDriver(ClickHouseDriverConfig config, TypeTranslator typeTranslator)
  {
    this(
      ConnectionStrings.build(config),
      () -> DriverManager.getConnection(ConnectionStrings.jdbcUrl(config), ConnectionStrings.jdbcProperties(config)),
      typeTranslator
    );
  }

  ClickHouseDriver
    (
      String connStr,
      ConnectionFactory connectionFactory,
      TypeTranslator typeTranslator
    )
  {
    this.connStr = connStr;
    this.connectionFactory = connectionFactory;
    this.typeTranslator = typeTranslator;
  }

  /** The native-protocol connection string built from the configuration. */
  public String connectionString() { return connStr; }

  @Override
  public void open() throws SQLException
  {
    if ( conn != null )
      return;
    log.debug("Opening ClickHouse connection to {}", connStr.replaceAll("password=[^&]*", "password=***"));
    conn = connectionFactory.connect();
  }

  @Override
  public void close() throws SQLException
  {
    if ( conn == null )
      return;
    try
    {
      conn.close();
      log.debug("Closed ClickHouse connection");
    }
    finally
    {
      conn = null;
    }
  }

  @Override
  public List<String> tableNames
    (
      String database,
      List<String> whitelist,
      List<String> blacklist
    )
    throws SQLException
  {
    StringBuilder sql = new StringBuilder(TABLE_NAMES_SQL);
    List<String> args = new ArrayList<>();
    args.add(database);

    if ( !whitelist.isEmpty() )
    {
      sql.append(" and name in (").append(placeholders(whitelist.size())).append(");");
      args.addAll(whitelist);
    }
    else if ( !blacklist.isEmpty() )
    {
      sql.append(" and name not in (").append(placeholders(blacklist.size())).append(");");
      args.addAll(blacklist);
    }

    try (PreparedStatement ps = connection().prepareStatement(sql.toString()))
    {
      for (int i = 0; i < args.size(); ++i)
        ps.setString(i + 1, args.get(i));

      try (ResultSet rs = ps.executeQuery())
      {
        List<String> names = new ArrayList<>();
        while (rs.next())
          names.add(rs.getString(1));
        return names;
      }
    }
  }

  @Override
  public List<Column> columns(String database, String table) throws SQLException
  {
    try (PreparedStatement ps = connection().prepareStatement(COLUMNS_SQL))
    {
      ps.setString(1, table);
      ps.setString(2, database);

      try (ResultSet rs = ps.executeQuery())
      {
        List<Column> columns = new ArrayList<>();
        while (rs.next())
          columns.add(scanColumn(rs, table));
        return columns;
      }
    }
  }

  private static Column scanColumn(ResultSet rs, String table) throws ScanException
  {
    try
    {
      @Nullable String name = rs.getString(1);
      @Nullable String fullType = rs.getString(2);
      @Nullable String defaultValue = rs.getString(3);

      if ( name == null || fullType == null )
        throw new SQLException("null column name or type");

      return Column.fromCatalog(name, fullType, defaultValue != null ? defaultValue : "");
    }
    catch(SQLException e)
    {
      throw new ScanException(table, e);
    }
  }

  @Override
  public Optional<PrimaryKey> primaryKeyInfo(String database, String table) throws SQLException
  {
    @Nullable String name;
    @Nullable String engineFull;

    try (PreparedStatement ps = connection().prepareStatement(PRIMARY_KEY_SQL))
    {
      ps.setString(1, table);
      ps.setString(2, database);

      try (ResultSet rs = ps.executeQuery())
      {
        if ( !rs.next() )
          return Optional.empty();

        name = rs.getString(1);
        engineFull = rs.getString(2);
      }
    }

    EngineDescriptor engine;
    try
    {
      engine = EngineDescriptor.parse(engineFull != null ? engineFull : "");
    }
    catch(EngineParseException e)
    {
      throw new EngineParseException("bad engine=`" + engineFull + "`: " + e.getMessage(), e);
    }

    return Optional.of(new PrimaryKey(name != null ? name : table, engine.primaryKey()));
  }

  // The catalog has no declarative foreign keys.
  @Override
  public List<ForeignKey> foreignKeyInfo(String database, String table)
  {
    return Collections.emptyList();
  }

  @Override
  public Column translateColumnType(Column column)
  {
    return typeTranslator.translate(column);
  }

  @Override
  public char leftQuote() { return '`'; }

  @Override
  public char rightQuote() { return '`'; }

  @Override
  public boolean useLastInsertId() { return false; }

  @Override
  public boolean useTopClause() { return false; }

  @Override
  public boolean useIndexPlaceholders() { return false; }

  private Connection connection()
  {
    if ( conn == null )
      throw new IllegalStateException("ClickHouse driver is not open.");
    return conn;
  }

  private static String placeholders(int count)
  {
    return String.join(",", Collections.nCopies(count, "?"));
  }
}
