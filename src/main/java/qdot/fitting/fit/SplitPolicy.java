package qdot.fitting.fit;

/**
 * How a double-Gaussian series is divided into the halves that each seed one peak of the
 * initial guess.
 */
public enum SplitPolicy {

  /**
   * Split at the middle sample. This assumes the samples of the two populations are mostly
   * separated in acquisition order, i.e., a histogram whose x-axis runs from the low level to the
   * high level.
   */
  INDEX,

  /**
   * Split at the first sample whose x value reaches the midpoint of the x range.
   */
  VALUE;

  /**
   * Get the index of the first sample of the second half. The result always leaves at least two
   * samples on each side.
   *
   * @param x Independent variable, non-decreasing, at least four samples
   * @return Index to split at
   */
  public int splitIndex(double[] x) {
    int idx;
    if (this == INDEX) {
      idx = x.length / 2;
    } else {
      double midpoint = (x[0] + x[x.length - 1]) / 2;
      idx = 0;
      while (idx < x.length && x[idx] < midpoint) {
        ++idx;
      }
    }
    return Math.max(2, Math.min(x.length - 2, idx));
  }
}
