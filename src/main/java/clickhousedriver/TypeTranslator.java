package clickhousedriver;

import clickhousedriver.SchemaMetadata.Column;
import clickhousedriver.types.FixedString;

/**
 * Maps ClickHouse base types (without parameter lists) to Java type names for generated sources.
 * Unrecognized types map to {@code byte[]}.
 */
public class TypeTranslator
{
  private final boolean uint8AsBool;

  public TypeTranslator(boolean uint8AsBool)
  {
    this.uint8AsBool = uint8AsBool;
  }

  public boolean uint8AsBool() { return uint8AsBool; }

  public Column translate(Column column)
  {
    return column.withType(javaTypeName(column.dbType()));
  }

  public String javaTypeName(String dbType)
  {
    return switch (dbType)
    {
      case "UInt8" -> uint8AsBool ? "boolean" : "short";
      case "UInt16" -> "int";
      case "UInt32" -> "long";
      case "UInt64" -> "java.math.BigInteger";
      case "Int8" -> "byte";
      case "Int16" -> "short";
      case "Int32" -> "int";
      case "Int64" -> "long";
      case "Float32" -> "float";
      case "Float64" -> "double";
      case "Date" -> "java.time.LocalDate";
      case "DateTime" -> "java.time.LocalDateTime";
      case "FixedString" -> FixedString.class.getName();
      case "String" -> "String";
      default -> "byte[]";
    };
  }
}
