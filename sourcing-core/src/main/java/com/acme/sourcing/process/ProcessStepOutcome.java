package com.acme.sourcing.process;

/** What a process manager did with one trigger event. */
public enum ProcessStepOutcome {
  /** Follow-up command accepted by its handler. */
  DISPATCHED,
  /** Source aggregate no longer in the expected state; nothing done. */
  SKIPPED,
  /** Source stream is empty. */
  SOURCE_MISSING,
  /** Source stream could not be loaded or rebuilt. */
  LOAD_FAILED,
  /** Follow-up command was rejected or threw; needs reconciliation. */
  DISPATCH_FAILED
}
