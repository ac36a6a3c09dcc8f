package exm.rdl.common.exceptions;

import exm.rdl.frontend.Context;

public class UnknownParameterException
extends UserException
{
  public UnknownParameterException(Context context, String templateName,
                                   String paramName)
  {
    super(context, "Component " + templateName + " has no parameter called "
          + paramName);
  }

  private static final long serialVersionUID = 1L;
}
