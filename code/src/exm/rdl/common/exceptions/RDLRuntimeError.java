
package exm.rdl.common.exceptions;

/**
 * This represents an elaborator internal error.
 * These always indicate an elaborator bug (or a malformed tree handed
 * over by the parser).
 * */
public class RDLRuntimeError extends RuntimeException
{
  public RDLRuntimeError(String msg)
  {
    super(msg);
  }

  public RDLRuntimeError(String msg, Throwable cause)
  {
    super(msg, cause);
  }

  private static final long serialVersionUID = 1L;
}
