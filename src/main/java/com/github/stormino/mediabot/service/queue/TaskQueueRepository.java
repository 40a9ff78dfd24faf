package com.github.stormino.mediabot.service.queue;

import com.github.stormino.mediabot.model.DownloadTask;
import com.github.stormino.mediabot.model.TaskPriority;
import com.github.stormino.mediabot.model.TaskStatus;
import com.github.stormino.mediabot.model.TimeRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to the {@code task_queue} mirror table.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class TaskQueueRepository {

    private static final RowMapper<DownloadTask> TASK_MAPPER = (rs, rowNum) -> DownloadTask.builder()
            .id(rs.getString("id"))
            .chatId(rs.getLong("chat_id"))
            .url(rs.getString("url"))
            .format(rs.getString("format"))
            .video(rs.getBoolean("is_video"))
            .videoQuality(rs.getString("video_quality"))
            .audioBitrate(rs.getString("audio_bitrate"))
            .timeRange(timeRange(rs))
            .messageId(nullableInt(rs, "message_id"))
            .queueMessageId(nullableInt(rs, "queue_message_id"))
            .priority(TaskPriority.fromLevel(rs.getInt("priority")))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Retryable(retryFor = DataAccessException.class, maxAttempts = 3, backoff = @Backoff(delay = 200, multiplier = 2))
    public void upsertPending(DownloadTask task) {
        TimeRange range = task.getTimeRange();
        jdbcTemplate.update("""
                MERGE INTO task_queue (id, chat_id, url, format, is_video, video_quality, audio_bitrate,
                                       time_range_start, time_range_end, message_id, queue_message_id,
                                       priority, status, created_at, updated_at)
                KEY (id)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
                """,
                task.getId(), task.getChatId(), task.getUrl(), task.getFormat(), task.isVideo(),
                task.getVideoQuality(), task.getAudioBitrate(),
                range != null ? range.getStart() : null, range != null ? range.getEnd() : null,
                task.getMessageId(), task.getQueueMessageId(), task.getPriority().getLevel(),
                TaskStatus.PENDING.getDbValue(), Timestamp.from(task.getCreatedAt()));
    }

    @Retryable(retryFor = DataAccessException.class, maxAttempts = 3, backoff = @Backoff(delay = 200, multiplier = 2))
    public int updateStatus(String taskId, TaskStatus status) {
        return jdbcTemplate.update(
                "UPDATE task_queue SET status = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                status.getDbValue(), taskId);
    }

    @Retryable(retryFor = DataAccessException.class, maxAttempts = 3, backoff = @Backoff(delay = 200, multiplier = 2))
    public int markFailed(String taskId, String errorMessage) {
        return jdbcTemplate.update("""
                UPDATE task_queue
                SET status = ?, error_message = ?, retry_count = retry_count + 1, updated_at = CURRENT_TIMESTAMP
                WHERE id = ?
                """,
                TaskStatus.FAILED.getDbValue(), truncate(errorMessage), taskId);
    }

    /**
     * Rows left pending or processing by a previous run, oldest first.
     */
    public List<DownloadTask> findRecoverable() {
        return jdbcTemplate.query(
                "SELECT * FROM task_queue WHERE status IN (?, ?) ORDER BY created_at, id",
                TASK_MAPPER, TaskStatus.PENDING.getDbValue(), TaskStatus.PROCESSING.getDbValue());
    }

    public Optional<TaskStatus> findStatus(String taskId) {
        List<String> statuses = jdbcTemplate.queryForList(
                "SELECT status FROM task_queue WHERE id = ?", String.class, taskId);
        return statuses.stream().findFirst().map(TaskStatus::fromDbValue);
    }

    public int findRetryCount(String taskId) {
        List<Integer> counts = jdbcTemplate.queryForList(
                "SELECT retry_count FROM task_queue WHERE id = ?", Integer.class, taskId);
        return counts.isEmpty() ? 0 : counts.get(0);
    }

    private static TimeRange timeRange(ResultSet rs) throws SQLException {
        String start = rs.getString("time_range_start");
        String end = rs.getString("time_range_end");
        return start != null && end != null ? TimeRange.of(start, end) : null;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 4000) {
            return message;
        }
        return message.substring(message.length() - 4000);
    }
}
