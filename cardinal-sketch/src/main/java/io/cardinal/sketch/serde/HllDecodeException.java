package io.cardinal.sketch.serde;

import java.io.IOException;

/**
 * Thrown when a serialized sketch is malformed or does not fit the expected precision.
 */
public class HllDecodeException extends IOException
{
  public HllDecodeException(String message)
  {
    super(message);
  }

  public HllDecodeException(String message, Throwable cause)
  {
    super(message, cause);
  }
}
