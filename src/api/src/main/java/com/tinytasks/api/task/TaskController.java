package com.tinytasks.api.task;

import com.tinytasks.api.task.dto.CreateTaskRequest;
import com.tinytasks.api.task.dto.TaskResponse;
import com.tinytasks.api.task.dto.UpdateTaskRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/tasks")
public class TaskController {

  private final TaskService taskService;

  @PostMapping
  public ResponseEntity<TaskResponse> create(@Valid @RequestBody CreateTaskRequest req) {
    return ResponseEntity.ok(taskService.create(req.title()));
  }

  @GetMapping
  public ResponseEntity<List<TaskResponse>> list(
      @RequestParam(required = false) Boolean done,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) Integer offset
  ) {
    return ResponseEntity.ok(taskService.list(done, limit, offset));
  }

  @GetMapping("/{taskId}")
  public ResponseEntity<TaskResponse> get(@PathVariable String taskId) {
    return ResponseEntity.ok(taskService.get(taskId));
  }

  @PatchMapping("/{taskId}")
  public ResponseEntity<TaskResponse> update(@PathVariable String taskId,
                                             @RequestBody(required = false) UpdateTaskRequest req) {
    TaskPatch patch = req == null ? TaskPatch.EMPTY : req.toPatch();
    return ResponseEntity.ok(taskService.update(taskId, patch));
  }

  @DeleteMapping("/{taskId}")
  public ResponseEntity<Void> delete(@PathVariable String taskId) {
    taskService.delete(taskId);
    return ResponseEntity.noContent().build();
  }
}
