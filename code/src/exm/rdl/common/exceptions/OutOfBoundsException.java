package exm.rdl.common.exceptions;

import exm.rdl.frontend.Context;

/**
 * Array index outside of [0, length).
 */
public class OutOfBoundsException
extends UserException
{
  public OutOfBoundsException(Context context, String message)
  {
    super(context, message);
  }

  private static final long serialVersionUID = 1L;
}
