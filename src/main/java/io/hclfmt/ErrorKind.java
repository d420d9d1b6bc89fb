package io.hclfmt;

/** The type of error that occurred while formatting. */
public enum ErrorKind {
  /** Syntax error - the input is not valid HCL native syntax. */
  SYNTAX("syntax"),
  /** I/O error - a configuration file could not be read or written. */
  IO("io"),
  /** Tree error - one or more files of a directory tree failed to format. */
  FORMAT_TREE("formatting tree");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
