package clickhousedriver;

import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Schema structures handed to a code generator. Columns come back from the catalog untranslated
 * ({@code type} is null) until passed through a {@link TypeTranslator}.
 */
public final class SchemaMetadata
{
  private SchemaMetadata() {}

  public record Column
  (
    String name,
    String fullDbType,
    String dbType,
    String defaultValue,
    @Nullable String type
  )
  {
    public static Column fromCatalog(String name, String fullDbType, String defaultValue)
    {
      return new Column(name, fullDbType, baseType(fullDbType), defaultValue, null);
    }

    public Column withType(String type)
    {
      return new Column(name, fullDbType, dbType, defaultValue, type);
    }
  }

  public record PrimaryKey
  (
    String name,
    List<String> columns
  )
  {
    public PrimaryKey
    {
      columns = List.copyOf(columns);
    }
  }

  public record ForeignKey
  (
    String name,
    String column,
    String foreignTable,
    String foreignColumn
  ) {}

  public record Table
  (
    String name,
    List<Column> columns,
    @Nullable PrimaryKey primaryKey,
    List<ForeignKey> foreignKeys
  )
  {
    public Table
    {
      columns = List.copyOf(columns);
      foreignKeys = List.copyOf(foreignKeys);
    }
  }

  // Strips a parameter list, e.g. "FixedString(16)" -> "FixedString".
  public static String baseType(String fullDbType)
  {
    int ix = fullDbType.indexOf('(');
    return ix > 0 ? fullDbType.substring(0, ix) : fullDbType;
  }
}
