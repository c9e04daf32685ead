package com.tinytasks.api.task.dto;

import jakarta.validation.constraints.NotNull;

// trimming and length rules live in TaskTitles, they need the trimmed value
public record CreateTaskRequest(
    @NotNull(message = "is required") String title
) {
}
