package exm.rdl.common.exceptions;

import exm.rdl.frontend.Context;

public class DoubleDefineException
extends UserException
{
  public DoubleDefineException(Context context, String message)
  {
    super(context, message);
  }

  private static final long serialVersionUID = 1L;
}
