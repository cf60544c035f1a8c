package clickhousedriver.types;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Value of a ClickHouse {@code FixedString(N)} column. ClickHouse pads short values with NUL bytes,
 * which are removed from both ends.
 */
public final class FixedString
{
  private final String value;

  private FixedString(String value)
  {
    this.value = trimZero(value);
  }

  public static FixedString of(String value)
  {
    return new FixedString(value);
  }

  /** Converts a value read from a result set. */
  public static FixedString from(Object src)
  {
    if ( src instanceof String s )
      return new FixedString(s);
    if ( src instanceof byte[] bytes )
      return new FixedString(new String(bytes, StandardCharsets.UTF_8));
    throw new IllegalArgumentException("incompatible type for FixedString");
  }

  private static String trimZero(String s)
  {
    int start = 0;
    int end = s.length();
    while ( start < end && s.charAt(start) == '\0' ) ++start;
    while ( end > start && s.charAt(end - 1) == '\0' ) --end;
    return s.substring(start, end);
  }

  @Override
  public String toString() { return value; }

  @Override
  public boolean equals(@Nullable Object o)
  {
    return o instanceof FixedString other && value.equals(other.value);
  }

  @Override
  public int hashCode() { return Objects.hash(value); }
}
