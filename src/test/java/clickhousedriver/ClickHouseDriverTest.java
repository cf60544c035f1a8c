package clickhousedriver;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import clickhousedriver.SchemaMetadata.Column;
import clickhousedriver.SchemaMetadata.PrimaryKey;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ClickHouseDriverTest
{
  private Connection conn;
  private PreparedStatement ps;
  private ResultSet rs;
  private ClickHouseDriver driver;

  @BeforeEach
  void setUp() throws SQLException
  {
    conn = mock(Connection.class);
    ps = mock(PreparedStatement.class);
    rs = mock(ResultSet.class);
    when(conn.prepareStatement(anyString())).thenReturn(ps);
    when(ps.executeQuery()).thenReturn(rs);

    driver = new ClickHouseDriver("tcp://localhost:9000?database=db", () -> conn, new TypeTranslator(false));
    driver.open();
  }

  @Test
  void listsAllTablesWithoutFilters() throws SQLException
  {
    when(rs.next()).thenReturn(true, true, false);
    when(rs.getString(1)).thenReturn("hits", "visits");

    List<String> names = driver.tableNames("db", List.of(), List.of());

    assertThat(names).containsExactly("hits", "visits");
    verify(conn).prepareStatement("select name from system.tables where database = ? and database <> 'system'");
    verify(ps).setString(1, "db");
  }

  @Test
  void whitelistRestrictsTables() throws SQLException
  {
    when(rs.next()).thenReturn(false);

    driver.tableNames("db", List.of("a", "b"), List.of());

    verify(conn).prepareStatement(
      "select name from system.tables where database = ? and database <> 'system' and name in (?,?);"
    );
    verify(ps).setString(2, "a");
    verify(ps).setString(3, "b");
  }

  @Test
  void blacklistExcludesTables() throws SQLException
  {
    when(rs.next()).thenReturn(false);

    driver.tableNames("db", List.of(), List.of("tmp"));

    verify(conn).prepareStatement(
      "select name from system.tables where database = ? and database <> 'system' and name not in (?);"
    );
    verify(ps).setString(2, "tmp");
  }

  @Test
  void whitelistTakesPrecedenceOverBlacklist() throws SQLException
  {
    when(rs.next()).thenReturn(false);

    driver.tableNames("db", List.of("a"), List.of("b", "c"));

    verify(conn).prepareStatement(
      "select name from system.tables where database = ? and database <> 'system' and name in (?);"
    );
    verify(ps).setString(2, "a");
    verify(ps, never()).setString(3, "c");
  }

  @Test
  void transportFailurePropagatesUnchanged() throws SQLException
  {
    SQLException failure = new SQLException("connection reset");
    when(ps.executeQuery()).thenThrow(failure);

    assertThatThrownBy(() -> driver.tableNames("db", List.of(), List.of())).isSameAs(failure);
  }

  @Test
  void readsColumnsWithBaseTypes() throws SQLException
  {
    when(rs.next()).thenReturn(true, true, false);
    when(rs.getString(1)).thenReturn("id", "code");
    when(rs.getString(2)).thenReturn("UInt64", "FixedString(16)");
    when(rs.getString(3)).thenReturn("", "'xx'");

    List<Column> columns = driver.columns("db", "hits");

    assertThat(columns).containsExactly(
      new Column("id", "UInt64", "UInt64", "", null),
      new Column("code", "FixedString(16)", "FixedString", "'xx'", null)
    );
    verify(conn).prepareStatement(ClickHouseDriver.COLUMNS_SQL);
    verify(ps).setString(1, "hits");
    verify(ps).setString(2, "db");
  }

  @Test
  void columnDecodeFailureNamesTable() throws SQLException
  {
    when(rs.next()).thenReturn(true, true, false);
    when(rs.getString(1)).thenReturn("id").thenThrow(new SQLException("bad value"));
    when(rs.getString(2)).thenReturn("UInt64");
    when(rs.getString(3)).thenReturn("");

    assertThatThrownBy(() -> driver.columns("db", "hits"))
      .isInstanceOf(ScanException.class)
      .hasMessage("unable to scan for table hits")
      .hasRootCauseMessage("bad value");
  }

  @Test
  void primaryKeyFromEngine() throws SQLException
  {
    when(rs.next()).thenReturn(true);
    when(rs.getString(1)).thenReturn("hits");
    when(rs.getString(2)).thenReturn("MergeTree(EventDate, (CounterID, EventDate), 8192)");

    Optional<PrimaryKey> pk = driver.primaryKeyInfo("db", "hits");

    assertThat(pk).contains(new PrimaryKey("hits", List.of("CounterID", "EventDate")));
    verify(conn).prepareStatement(ClickHouseDriver.PRIMARY_KEY_SQL);
    verify(ps).setString(1, "hits");
    verify(ps).setString(2, "db");
  }

  @Test
  void missingTableHasNoPrimaryKey() throws SQLException
  {
    when(rs.next()).thenReturn(false);

    assertThat(driver.primaryKeyInfo("db", "nope")).isEmpty();
  }

  @Test
  void unparsableEngineIsReportedWithDescriptor() throws SQLException
  {
    when(rs.next()).thenReturn(true);
    when(rs.getString(1)).thenReturn("logs");
    when(rs.getString(2)).thenReturn("TinyLog");

    assertThatThrownBy(() -> driver.primaryKeyInfo("db", "logs"))
      .isInstanceOf(EngineParseException.class)
      .hasMessageContaining("bad engine=`TinyLog`")
      .hasMessageContaining("open bracket not found");
  }

  @Test
  void foreignKeysAreAlwaysEmpty()
  {
    assertThat(driver.foreignKeyInfo("db", "hits")).isEmpty();
  }

  @Test
  void hostContractConstants()
  {
    assertThat(driver.leftQuote()).isEqualTo('`');
    assertThat(driver.rightQuote()).isEqualTo('`');
    assertThat(driver.useLastInsertId()).isFalse();
    assertThat(driver.useTopClause()).isFalse();
    assertThat(driver.useIndexPlaceholders()).isFalse();
  }

  @Test
  void translatesThroughConfiguredTranslator() throws SQLException
  {
    var boolDriver = new ClickHouseDriver("tcp://h:1?database=db", () -> conn, new TypeTranslator(true));

    assertThat(boolDriver.translateColumnType(Column.fromCatalog("flag", "UInt8", "")).type()).isEqualTo("boolean");
    assertThat(driver.translateColumnType(Column.fromCatalog("flag", "UInt8", "")).type()).isEqualTo("short");
  }

  @Test
  void closeReleasesConnectionOnce() throws SQLException
  {
    driver.close();
    driver.close();

    verify(conn).close();
    assertThatThrownBy(() -> driver.columns("db", "hits")).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void connectionStringFromConfig()
  {
    var configured = new ClickHouseDriver(ClickHouseDriverConfig.of("ch1", 9000, "db"), new TypeTranslator(false));

    assertThat(configured.connectionString()).isEqualTo("tcp://ch1:9000?database=db&debug=false&no_delay=true");
  }
}
