package exm.rdl.common.exceptions;

import exm.rdl.frontend.Context;

public class InvalidExtentException
extends UserException
{
  public InvalidExtentException(Context context, String message)
  {
    super(context, message);
  }

  public InvalidExtentException(String message)
  {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
