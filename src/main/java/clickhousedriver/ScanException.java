package clickhousedriver;

import java.sql.SQLException;

public class ScanException extends SQLException
{
  private final String table;

  public ScanException(String table, Throwable cause)
  {
    super("unable to scan for table " + table, cause);
    this.table = table;
  }

  public String table() { return table; }
}
