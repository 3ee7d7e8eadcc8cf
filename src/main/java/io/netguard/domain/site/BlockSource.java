package io.netguard.domain.site;

/** Origin of a block list entry. */
public enum BlockSource {
  /** Added by the detection pipeline after a classifier block verdict. */
  AUTO,
  /** Added by an operator. */
  MANUAL
}
