package clickhousedriver;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

import static java.util.stream.Collectors.joining;

/**
 * Builds connection strings from a {@link ClickHouseDriverConfig}: the native {@code tcp://} form
 * and the JDBC URL and properties used to open connections from the JVM.
 */
public final class ConnectionStrings
{
  private ConnectionStrings() {}

  public static String build(ClickHouseDriverConfig config)
  {
    Map<String,String> params = new TreeMap<>();

    if ( !config.username().isEmpty() )
      params.put("username", config.username());
    if ( !config.password().isEmpty() )
      params.put("password", config.password());
    params.put("database", config.database());

    if ( config.readTimeout() != 0 )
      params.put("read_timeout", Integer.toString(config.readTimeout()));
    if ( config.writeTimeout() != 0 )
      params.put("write_timeout", Integer.toString(config.writeTimeout()));

    params.put("no_delay", Boolean.toString(!config.nagle()));

    if ( !config.altHosts().isEmpty() )
      params.put("alt_hosts", String.join(",", config.altHosts()));
    if ( !config.connectionOpenStrategy().isEmpty() )
      params.put("connection_open_strategy", config.connectionOpenStrategy());
    if ( config.blockSize() > 0 )
      params.put("block_size", Integer.toString(config.blockSize()));

    params.put("debug", Boolean.toString(config.debug()));

    String query =
      params.entrySet().stream()
      .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
      .collect(joining("&"));

    return "tcp://" + config.host() + ":" + config.port() + "?" + query;
  }

  public static String jdbcUrl(ClickHouseDriverConfig config)
  {
    return "jdbc:clickhouse://" + config.host() + ":" + config.port() + "/" + config.database();
  }

  public static Properties jdbcProperties(ClickHouseDriverConfig config)
  {
    Properties props = new Properties();

    if ( !config.username().isEmpty() )
      props.setProperty("user", config.username());
    if ( !config.password().isEmpty() )
      props.setProperty("password", config.password());

    props.setProperty("ssl", Boolean.toString(config.secure()));
    if ( config.secure() )
      props.setProperty("sslmode", config.skipVerify() ? "none" : "strict");

    long timeoutSecs = Math.max(config.readTimeout(), config.writeTimeout());
    if ( timeoutSecs > 0 )
      props.setProperty("socket_timeout", Long.toString(timeoutSecs * 1000L));

    return props;
  }

  private static String encode(String s)
  {
    return URLEncoder.encode(s, StandardCharsets.UTF_8);
  }
}
