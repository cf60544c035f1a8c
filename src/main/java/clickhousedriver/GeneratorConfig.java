package clickhousedriver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Settings a generator run passes to the driver, read from a json file of the form:
 * <pre>
 * {
 *   "database": "analytics",
 *   "whitelist": ["hits"],
 *   "blacklist": [],
 *   "uint8AsBool": true,
 *   "clickhouse": { "host": "localhost", "port": 9000, "username": "default", ... }
 * }
 * </pre>
 * When {@code database} is absent the database of the clickhouse block is used.
 */
public record GeneratorConfig
(
  String database,
  List<String> whitelist,
  List<String> blacklist,
  boolean uint8AsBool,
  ClickHouseDriverConfig clickhouse
)
{
  public GeneratorConfig
    (
      @Nullable String database,
      @Nullable List<String> whitelist,
      @Nullable List<String> blacklist,
      boolean uint8AsBool,
      @Nullable ClickHouseDriverConfig clickhouse
    )
  {
    this.clickhouse = clickhouse != null ? clickhouse : ClickHouseDriverConfig.of("localhost", 0, "default");
    this.database = database != null && !database.isEmpty() ? database : this.clickhouse.database();
    this.whitelist = whitelist != null ? List.copyOf(whitelist) : List.of();
    this.blacklist = blacklist != null ? List.copyOf(blacklist) : List.of();
    this.uint8AsBool = uint8AsBool;
  }

  public static GeneratorConfig load(Path configFile, ObjectMapper objMapper) throws IOException
  {
    if ( !Files.isRegularFile(configFile) )
      throw new RuntimeException("Generator configuration file was not found: " + configFile);

    return objMapper.readValue(configFile.toFile(), GeneratorConfig.class);
  }

  public ClickHouseDriver createDriver()
  {
    return new ClickHouseDriver(clickhouse, new TypeTranslator(uint8AsBool));
  }
}
