package clickhousedriver;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parsed form of a legacy-syntax table engine as reported in {@code system.tables.engine_full}, e.g.
 * {@code MergeTree(EventDate, (CounterID, EventDate), 8192)} or, with a sampling expression,
 * {@code MergeTree(EventDate, intHash32(UserID), (CounterID, EventDate, intHash32(UserID)), 8192)}.
 */
public record EngineDescriptor
(
  String name,
  String partitioningKey,
  @Nullable String samplingKey,
  List<String> primaryKey,
  int granularity
)
{
  private static final Pattern ASCII_INTEGER = Pattern.compile("[+-]?[0-9]+");

  public EngineDescriptor
  {
    primaryKey = List.copyOf(primaryKey);
  }

  /**
   * Parses an engine descriptor. The first field is the partitioning key, the last the granularity
   * (ASCII decimal digits only) and the field before the granularity the primary key. A multi-column
   * primary key must therefore be written as a tuple, {@code (a, b)}: in {@code MergeTree(d, a, b, 8192)}
   * the field {@code a} is taken as the sampling key and the primary key is {@code [b]}.
   *
   * @throws EngineParseException if the descriptor does not have that form
   */
  public static EngineDescriptor parse(String engineFull)
  {
    int openIx = engineFull.indexOf('(');
    if ( openIx == -1 )
      throw new EngineParseException("open bracket not found");

    String name = engineFull.substring(0, openIx).trim();
    String body = stripOuterParens(engineFull.substring(openIx).trim());

    List<String> params = splitTopLevel(body);
    if ( params.size() < 2 )
      throw new EngineParseException("partitioning key not found");
    if ( params.size() < 3 )
      throw new EngineParseException("granularity not found");

    String granularityText = params.get(params.size() - 1);
    int granularity;
    try
    {
      if ( !ASCII_INTEGER.matcher(granularityText).matches() )
        throw new NumberFormatException("For input string: \"" + granularityText + "\"");
      granularity = Integer.parseInt(granularityText);
    }
    catch(NumberFormatException e)
    {
      throw new EngineParseException("parsing granularity failed: '" + granularityText + "'", e);
    }

    String partitioningKey = params.get(0);
    String primaryKeyExpr = params.get(params.size() - 2);
    @Nullable String samplingKey = params.size() > 3
      ? String.join(", ", params.subList(1, params.size() - 2))
      : null;

    List<String> primaryKey = splitTopLevel(stripOuterParens(primaryKeyExpr));

    return new EngineDescriptor(name, partitioningKey, samplingKey, primaryKey, granularity);
  }

  // Removes one pair of enclosing parentheses, only when they match each other.
  private static String stripOuterParens(String s)
  {
    String t = s.trim();
    if ( t.length() >= 2 && t.charAt(0) == '(' && closingParenIndex(t) == t.length() - 1 )
      return t.substring(1, t.length() - 1).trim();
    return t;
  }

  private static int closingParenIndex(String s)
  {
    int depth = 0;
    @Nullable Character quote = null;
    for (int i = 0; i < s.length(); ++i)
    {
      char c = s.charAt(i);
      if ( quote != null )
      {
        if ( c == '\\' ) ++i;
        else if ( c == quote ) quote = null;
        continue;
      }
      switch (c)
      {
        case '\'', '"', '`' -> quote = c;
        case '(' -> ++depth;
        case ')' -> { if ( --depth == 0 ) return i; }
        default -> {}
      }
    }
    return -1;
  }

  // Splits on commas which are not nested in brackets or quotes, trimming each part.
  private static List<String> splitTopLevel(String s)
  {
    List<String> parts = new ArrayList<>();
    if ( s.isBlank() )
      return parts;

    int depth = 0;
    @Nullable Character quote = null;
    int start = 0;
    for (int i = 0; i < s.length(); ++i)
    {
      char c = s.charAt(i);
      if ( quote != null )
      {
        if ( c == '\\' ) ++i;
        else if ( c == quote ) quote = null;
        continue;
      }
      switch (c)
      {
        case '\'', '"', '`' -> quote = c;
        case '(', '[' -> ++depth;
        case ')', ']' -> --depth;
        case ',' ->
        {
          if ( depth == 0 )
          {
            parts.add(s.substring(start, i).trim());
            start = i + 1;
          }
        }
        default -> {}
      }
    }
    parts.add(s.substring(start).trim());

    return parts;
  }
}
