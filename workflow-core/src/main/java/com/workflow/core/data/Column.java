package com.workflow.core.data;

/** A named, fixed-length column of a {@link DataFrame}. */
public sealed interface Column permits NumericColumn, FactorColumn {
  String name();

  int size();

  Column rename(String newName);
}
