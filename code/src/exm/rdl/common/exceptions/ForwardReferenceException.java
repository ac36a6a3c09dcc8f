package exm.rdl.common.exceptions;

import exm.rdl.frontend.Context;

/**
 * A parameter default referred to a parameter declared after it.
 */
public class ForwardReferenceException
extends UserException
{
  public ForwardReferenceException(Context context, String message)
  {
    super(context, message);
  }

  private static final long serialVersionUID = 1L;
}
