package com.workflow.core;

public final class DuplicatePreprocessorException extends DuplicateActionException {
  private final PreprocessorKind existing;
  private final PreprocessorKind attempted;

  public DuplicatePreprocessorException(PreprocessorKind existing, PreprocessorKind attempted) {
    super(message(existing, attempted));
    this.existing = existing;
    this.attempted = attempted;
  }

  public PreprocessorKind existing() { return existing; }
  public PreprocessorKind attempted() { return attempted; }

  private static String message(PreprocessorKind existing, PreprocessorKind attempted) {
    if (existing == attempted) {
      return "A `" + existing.label() + "` action has already been added to this workflow.";
    }
    return "A `" + attempted.label() + "` cannot be added when a `" + existing.label()
        + "` already exists. Use `update` or `remove` first.";
  }
}
