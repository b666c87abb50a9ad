package kara.karac.common.exceptions;

/**
 * Used to signal that program should quit.
 */
public class KaracFatal extends RuntimeException {
  private static final long serialVersionUID = 1L;
  public final int exitCode;

  public KaracFatal(int exitCode) {
    super();
    this.exitCode = exitCode;
  }

  public KaracFatal(int exitCode, String message) {
    super(message);
    this.exitCode = exitCode;
  }

}
