package clickhousedriver;

import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Connection parameters for a ClickHouse server. Timeouts are in seconds; zero leaves the
 * transport default in place.
 * <p>
 * The constructor fills in defaults for values a json config may omit: a null host becomes
 * {@code localhost}, port 0 becomes {@link #DEFAULT_PORT}, null strings become empty and null
 * alternate hosts an empty list. Connection strings are built from the values after this step.
 */
public record ClickHouseDriverConfig
(
  String host,
  int port,
  String username,
  String password,
  String database,
  int readTimeout,
  int writeTimeout,
  boolean nagle,
  List<String> altHosts,
  String connectionOpenStrategy,
  int blockSize,
  boolean debug,
  boolean secure,
  boolean skipVerify
)
{
  public static final int DEFAULT_PORT = 9000;

  public ClickHouseDriverConfig
    (
      @Nullable String host,
      int port,
      @Nullable String username,
      @Nullable String password,
      @Nullable String database,
      int readTimeout,
      int writeTimeout,
      boolean nagle,
      @Nullable List<String> altHosts,
      @Nullable String connectionOpenStrategy,
      int blockSize,
      boolean debug,
      boolean secure,
      boolean skipVerify
    )
  {
    this.host = host != null ? host : "localhost";
    this.port = port != 0 ? port : DEFAULT_PORT;
    this.username = username != null ? username : "";
    this.password = password != null ? password : "";
    this.database = database != null ? database : "";
    this.readTimeout = readTimeout;
    this.writeTimeout = writeTimeout;
    this.nagle = nagle;
    this.altHosts = altHosts != null ? List.copyOf(altHosts) : List.of();
    this.connectionOpenStrategy = connectionOpenStrategy != null ? connectionOpenStrategy : "";
    this.blockSize = blockSize;
    this.debug = debug;
    this.secure = secure;
    this.skipVerify = skipVerify;
  }

  public static ClickHouseDriverConfig of(String host, int port, String database)
  {
    return new ClickHouseDriverConfig(host, port, null, null, database, 0, 0, false, null, null, 0, false, false, false);
  }

  public ClickHouseDriverConfig withCredentials(String username, String password)
  {
    return new ClickHouseDriverConfig(host, port, username, password, database, readTimeout, writeTimeout,
      nagle, altHosts, connectionOpenStrategy, blockSize, debug, secure, skipVerify);
  }
}
