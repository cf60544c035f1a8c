package clickhousedriver;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import clickhousedriver.SchemaMetadata.Column;
import clickhousedriver.SchemaMetadata.PrimaryKey;
import clickhousedriver.SchemaMetadata.Table;

public final class Schemas
{
  private static final Logger log = LoggerFactory.getLogger(Schemas.class);

  private Schemas() {}

  /**
   * Reads the tables of a database through an open driver, with translated column types and
   * primary keys. Any failure aborts the whole read.
   */
  public static List<Table> tables
    (
      SchemaDriver driver,
      String database,
      List<String> whitelist,
      List<String> blacklist
    )
    throws SQLException
  {
    List<String> names = driver.tableNames(database, whitelist, blacklist);
    log.debug("Found {} tables in database {}", names.size(), database);

    List<Table> tables = new ArrayList<>(names.size());
    for (String name: names)
    {
      List<Column> columns =
        driver.columns(database, name).stream()
        .map(driver::translateColumnType)
        .toList();

      @Nullable PrimaryKey pk = driver.primaryKeyInfo(database, name).orElse(null);

      tables.add(new Table(name, columns, pk, driver.foreignKeyInfo(database, name)));
    }

    return tables;
  }

  /** Opens a driver for the configuration, reads its tables and closes the driver. */
  public static List<Table> tables(GeneratorConfig config) throws SQLException
  {
    try (ClickHouseDriver driver = config.createDriver())
    {
      driver.open();
      return tables(driver, config.database(), config.whitelist(), config.blacklist());
    }
  }

  public static void write(List<Table> tables, Path outputFile, ObjectMapper objMapper) throws IOException
  {
    objMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(outputFile.toFile(), tables);
  }
}
