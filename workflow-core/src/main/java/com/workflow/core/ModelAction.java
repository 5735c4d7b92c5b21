package com.workflow.core;

import com.workflow.core.model.ModelSpec;

import java.util.Objects;

/** The model slot of a workflow: an untrained spec plus the role it plays. */
public record ModelAction(ModelSpec spec, String role) {
  public static final String DEFAULT_ROLE = "model";

  public ModelAction {
    spec = Objects.requireNonNull(spec, "spec");
    role = Objects.requireNonNull(role, "role");
    if (role.isBlank()) throw new IllegalArgumentException("role must be non-empty");
  }
}
