package exm.rdl.common.exceptions;

import exm.rdl.frontend.Context;

/**
 * A property assignment whose value does not match the property type.
 */
public class PropertyTypeMismatchException
extends TypeMismatchException
{
  public PropertyTypeMismatchException(Context context, String message)
  {
    super(context, message);
  }

  private static final long serialVersionUID = 1L;
}
