package io.netguard.application.decision;

/**
 * Operator overrides consulted before the classifier score.
 *
 * @since 0.1.0
 */
public interface ManualOverrides {
  boolean isManuallyBlocked(String domain);

  boolean isManuallyAllowed(String domain);

  ManualOverrides NONE = new ManualOverrides() {
    @Override public boolean isManuallyBlocked(String domain) {
      return false;
    }

    @Override public boolean isManuallyAllowed(String domain) {
      return false;
    }
  };
}
