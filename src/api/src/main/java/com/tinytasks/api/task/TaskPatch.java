package com.tinytasks.api.task;

import java.util.Objects;
import java.util.Optional;

/**
 * Partial update of a task: each mutable field is either present with a new value or absent.
 */
public record TaskPatch(Optional<String> title, Optional<Boolean> done) {

  public static final TaskPatch EMPTY = new TaskPatch(Optional.empty(), Optional.empty());

  public TaskPatch {
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(done, "done");
  }

  public static TaskPatch ofTitle(String title) {
    return new TaskPatch(Optional.of(title), Optional.empty());
  }

  public static TaskPatch ofDone(boolean done) {
    return new TaskPatch(Optional.empty(), Optional.of(done));
  }

  public boolean isEmpty() {
    return title.isEmpty() && done.isEmpty();
  }
}
