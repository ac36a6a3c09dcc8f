package exm.rdl.common.exceptions;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.rdl.frontend.Context;

/**
 * A component template instantiates itself, directly or through other
 * templates.
 */
public class InstantiationCycleException
extends UserException
{
  public InstantiationCycleException(Context context, List<String> chain)
  {
    super(context, "Cyclic component instantiation: " +
                   StringUtils.join(chain, " -> "));
  }

  private static final long serialVersionUID = 1L;
}
