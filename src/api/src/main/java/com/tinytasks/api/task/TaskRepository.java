package com.tinytasks.api.task;

import com.tinytasks.api.task.dto.TaskResponse;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class TaskRepository {

  private static final String COLUMNS = "id, title, done, created_at, updated_at";

  private static final RowMapper<TaskResponse> TASK_ROW = (rs, rowNum) -> new TaskResponse(
      rs.getString("id"),
      rs.getString("title"),
      rs.getBoolean("done"),
      rs.getObject("created_at", OffsetDateTime.class),
      rs.getObject("updated_at", OffsetDateTime.class)
  );

  private final JdbcTemplate jdbc;

  public TaskRepository(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  public void insert(TaskResponse task) {
    jdbc.update(
        """
        insert into tasks(id, title, done, created_at, updated_at)
        values (?,?,?,?,?)
        """,
        task.id(),
        task.title(),
        task.done(),
        task.createdAt(),
        task.updatedAt()
    );
  }

  public Optional<TaskResponse> findById(String taskId) {
    List<TaskResponse> rows = jdbc.query("select " + COLUMNS + " from tasks where id = ?", TASK_ROW, taskId);
    return rows.stream().findFirst();
  }

  /**
   * One page of tasks, newest first. {@code id} breaks ties on {@code created_at} so that
   * consecutive offset windows over an unchanged table neither overlap nor skip rows.
   */
  public List<TaskResponse> list(Boolean done, int limit, int offset) {
    StringBuilder sql = new StringBuilder("select " + COLUMNS + " from tasks");
    List<Object> args = new ArrayList<>();

    if (done != null) {
      sql.append(" where done = ?");
      args.add(done);
    }

    sql.append(" order by created_at desc, id desc limit ? offset ?");
    args.add(limit);
    args.add(offset);

    return jdbc.query(sql.toString(), TASK_ROW, args.toArray());
  }

  /**
   * Applies the present fields of {@code patch} in a single statement and returns the new row,
   * or empty when no task has that id. Concurrent updates of one id serialize on the row lock.
   */
  public Optional<TaskResponse> update(String taskId, TaskPatch patch, OffsetDateTime updatedAt) {
    // created_at bounds updated_at from below even if the clock stepped back since the insert
    StringBuilder sql = new StringBuilder("update tasks set updated_at = greatest(?, created_at)");
    List<Object> args = new ArrayList<>();
    args.add(updatedAt);

    patch.title().ifPresent(title -> {
      sql.append(", title = ?");
      args.add(title);
    });
    patch.done().ifPresent(done -> {
      sql.append(", done = ?");
      args.add(done);
    });

    sql.append(" where id = ? returning ").append(COLUMNS);
    args.add(taskId);

    return jdbc.query(sql.toString(), TASK_ROW, args.toArray()).stream().findFirst();
  }

  public boolean delete(String taskId) {
    return jdbc.update("delete from tasks where id = ?", taskId) > 0;
  }
}
