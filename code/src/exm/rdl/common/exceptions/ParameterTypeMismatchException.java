package exm.rdl.common.exceptions;

import exm.rdl.frontend.Context;

/**
 * A value supplied for, or defaulted into, a component parameter does not
 * match the parameter's declared type.
 */
public class ParameterTypeMismatchException
extends TypeMismatchException
{
  public ParameterTypeMismatchException(Context context, String message)
  {
    super(context, message);
  }

  private static final long serialVersionUID = 1L;
}
