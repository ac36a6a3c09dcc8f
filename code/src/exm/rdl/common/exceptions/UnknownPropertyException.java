package exm.rdl.common.exceptions;

import exm.rdl.frontend.Context;

/**
 * Assignment to a property that no property definition applicable to the
 * target component kind declares.
 */
public class UnknownPropertyException
extends UserException
{
  public UnknownPropertyException(Context context, String message)
  {
    super(context, message);
  }

  private static final long serialVersionUID = 1L;
}
