package io.netguard.application.classify;

/**
 * Confusion counts from {@link GamblingClassifier#validate}.
 *
 * @param truePositives gambling examples scored at or above the threshold
 * @param falsePositives benign examples scored at or above the threshold
 * @param trueNegatives benign examples scored below the threshold
 * @param falseNegatives gambling examples scored below the threshold
 * @param modelVersion model that was validated
 */
public record ValidationReport(
    int truePositives, int falsePositives, int trueNegatives, int falseNegatives, long modelVersion) {

  public int total() {
    return truePositives + falsePositives + trueNegatives + falseNegatives;
  }

  /** @return fraction of correct predictions, {@code 0} for an empty test set */
  public double accuracy() {
    int total = total();
    return total == 0 ? 0.0 : (double) (truePositives + trueNegatives) / total;
  }
}
