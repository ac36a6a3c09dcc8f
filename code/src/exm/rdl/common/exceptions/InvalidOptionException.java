package exm.rdl.common.exceptions;

/**
 * Bad value for one of the elaborator settings
 */
public class InvalidOptionException extends Exception {

  public InvalidOptionException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
