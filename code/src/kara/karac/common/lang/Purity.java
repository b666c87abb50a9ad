package kara.karac.common.lang;

/**
 * Whether a callable unit may have side effects.  Declared by keyword
 * (fn is pure, flow is impure) and inferred by the purity analysis.
 */
public enum Purity {
  PURE("fn"),
  IMPURE("flow");

  private final String keyword;

  private Purity(String keyword) {
    this.keyword = keyword;
  }

  /**
   * @return keyword used to declare a definition with this purity
   */
  public String keyword() {
    return keyword;
  }

  public static Purity join(Purity a, Purity b) {
    return (a == IMPURE || b == IMPURE) ? IMPURE : PURE;
  }
}
