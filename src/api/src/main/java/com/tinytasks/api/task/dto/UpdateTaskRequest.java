package com.tinytasks.api.task.dto;

import com.tinytasks.api.task.TaskPatch;

import java.util.Optional;

/**
 * PATCH body. A property that is absent or explicitly {@code null} is treated as not supplied.
 */
public record UpdateTaskRequest(
    String title,
    Boolean done
) {

  public TaskPatch toPatch() {
    return new TaskPatch(Optional.ofNullable(title), Optional.ofNullable(done));
  }
}
