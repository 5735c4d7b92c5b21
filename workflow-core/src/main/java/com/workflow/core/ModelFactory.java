package com.workflow.core;

import com.workflow.core.model.ModelSpec;

/** Creates a model spec by type name; {@code engine} and {@code mode} may be {@code null}. */
@FunctionalInterface
public interface ModelFactory {
  ModelSpec create(String engine, String mode);
}
