package exm.rdl.common.exceptions;

import exm.rdl.frontend.Context;

/**
 * The tree handed to the elaborator has a shape it cannot make sense of.
 */
public class InvalidSyntaxException
extends UserException
{
  public InvalidSyntaxException(Context context, String message)
  {
    super(context, message);
  }

  private static final long serialVersionUID = 1L;
}
