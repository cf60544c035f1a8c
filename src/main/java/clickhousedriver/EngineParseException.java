package clickhousedriver;

/** An engine descriptor from system.tables did not have the expected positional form. */
public class EngineParseException extends RuntimeException
{
  public EngineParseException(String message)
  {
    super(message);
  }

  public EngineParseException(String message, Throwable cause)
  {
    super(message, cause);
  }
}
