package com.tinytasks.api.task;

import com.tinytasks.api.infra.tx.TransactionalExecutor;
import com.tinytasks.api.task.dto.TaskResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Task lifecycle: create, page, read, partially update and delete.
 *
 * <p>Input is validated before any store access. Each operation runs in one transaction, so a
 * failure never leaves a partial write behind. Ids and timestamps are assigned here, never taken
 * from the client.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskService {

  public static final int DEFAULT_LIMIT = 50;
  public static final int MAX_LIMIT = 200;

  private final TransactionalExecutor tx;
  private final TaskRepository taskRepository;
  private final Clock clock;

  public TaskResponse create(String rawTitle) {
    String title = TaskTitles.normalize(rawTitle);
    return tx.execute(() -> {
      OffsetDateTime now = now();
      TaskResponse task = new TaskResponse(UUID.randomUUID().toString(), title, false, now, now);
      taskRepository.insert(task);
      log.info("task created id={}", task.id());
      return task;
    });
  }

  public List<TaskResponse> list(Boolean done, Integer limit, Integer offset) {
    int pageLimit = limit == null ? DEFAULT_LIMIT : limit;
    int pageOffset = offset == null ? 0 : offset;
    if (pageLimit < 1 || pageLimit > MAX_LIMIT) {
      throw TaskValidationException.invalid("limit", "limit must be between 1 and " + MAX_LIMIT);
    }
    if (pageOffset < 0) {
      throw TaskValidationException.invalid("offset", "offset must be greater than or equal to 0");
    }
    return tx.query(() -> taskRepository.list(done, pageLimit, pageOffset));
  }

  public TaskResponse get(String taskId) {
    return tx.query(() -> taskRepository.findById(taskId)
        .orElseThrow(TaskNotFoundException::new));
  }

  public TaskResponse update(String taskId, TaskPatch patch) {
    if (patch == null || patch.isEmpty()) {
      throw TaskValidationException.emptyPatch();
    }
    Optional<String> title = patch.title().map(TaskTitles::normalize);
    TaskPatch normalized = new TaskPatch(title, patch.done());

    return tx.execute(() -> {
      TaskResponse task = taskRepository.update(taskId, normalized, now())
          .orElseThrow(TaskNotFoundException::new);
      log.info("task updated id={} titleChanged={} done={}", taskId, title.isPresent(), patch.done().orElse(null));
      return task;
    });
  }

  public void delete(String taskId) {
    tx.run(() -> {
      if (!taskRepository.delete(taskId)) {
        throw new TaskNotFoundException();
      }
      log.info("task deleted id={}", taskId);
    });
  }

  // the store keeps microseconds; truncating keeps returned values equal to what a later read returns
  private OffsetDateTime now() {
    return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
  }
}
