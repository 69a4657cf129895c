package com.work.archive.indexer.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.archive.indexer.repository.entity.RecoveryTaskEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;
import java.util.List;

public interface RecoveryTaskMapper extends BaseMapper<RecoveryTaskEntity> {

    /**
     * enqueue 每行绑定的参数个数（payload 与 now 在每行重复绑定）。
     */
    int COLUMNS = 5;

    @Insert({"<script>",
            "INSERT INTO recovery_tasks (target_height, status, attempt_count, payload, next_run_at, created_at, updated_at) VALUES",
            "<foreach collection='heights' item='h' separator=','>",
            "(#{h}, 'PENDING', 0, CAST(#{payload} AS jsonb), #{now}, #{now}, #{now})",
            "</foreach>",
            "ON CONFLICT (target_height) DO NOTHING",
            "</script>"})
    int enqueue(@Param("heights") List<Long> heights,
                @Param("payload") String payload,
                @Param("now") Instant now);

    /**
     * 领取到期的 PENDING 任务并置为 RUNNING（SKIP LOCKED，多实例安全）。
     */
    @Select({"UPDATE recovery_tasks SET status = 'RUNNING', attempt_count = attempt_count + 1,",
            "       last_run_at = #{now}, updated_at = #{now}",
            " WHERE id IN (SELECT id FROM recovery_tasks",
            "               WHERE status = 'PENDING' AND (next_run_at IS NULL OR next_run_at <= #{now})",
            "               ORDER BY target_height LIMIT #{limit} FOR UPDATE SKIP LOCKED)",
            " RETURNING id, target_height, status, attempt_count, CAST(payload AS text) AS payload,",
            "           last_error, last_run_at, next_run_at, created_at, updated_at"})
    @Options(flushCache = Options.FlushCachePolicy.TRUE, useCache = false)
    List<RecoveryTaskEntity> claim(@Param("limit") int limit, @Param("now") Instant now);

    @Update("UPDATE recovery_tasks SET status = 'DONE', last_error = NULL, next_run_at = NULL, updated_at = #{now} "
            + "WHERE id = #{id} AND status = 'RUNNING'")
    int markDone(@Param("id") long id, @Param("now") Instant now);

    /**
     * nextRunAt 非空：可重试失败；为空：永久失败。
     */
    @Update("UPDATE recovery_tasks SET status = 'FAILED', last_error = #{error}, "
            + "next_run_at = #{nextRunAt,jdbcType=TIMESTAMP}, updated_at = #{now} "
            + "WHERE id = #{id} AND status = 'RUNNING'")
    int markFailed(@Param("id") long id,
                   @Param("error") String error,
                   @Param("nextRunAt") Instant nextRunAt,
                   @Param("now") Instant now);

    @Update("UPDATE recovery_tasks SET status = 'PENDING', updated_at = #{now} "
            + "WHERE status = 'FAILED' AND next_run_at IS NOT NULL AND next_run_at <= #{now}")
    int requeueDueFailures(@Param("now") Instant now);

    @Update("UPDATE recovery_tasks SET status = 'PENDING', next_run_at = #{now}, updated_at = #{now} "
            + "WHERE status = 'RUNNING'")
    int resetOrphans(@Param("now") Instant now);

    /**
     * 人工重试：FAILED -> PENDING，attempt_count 清零。
     */
    @Update("UPDATE recovery_tasks SET status = 'PENDING', attempt_count = 0, next_run_at = #{now}, updated_at = #{now} "
            + "WHERE id = #{id} AND status = 'FAILED'")
    int retry(@Param("id") long id, @Param("now") Instant now);

    @Select({"SELECT id, target_height, status, attempt_count, CAST(payload AS text) AS payload,",
            "       last_error, last_run_at, next_run_at, created_at, updated_at",
            "  FROM recovery_tasks WHERE status = 'FAILED' AND next_run_at IS NULL",
            " ORDER BY target_height LIMIT #{limit}"})
    List<RecoveryTaskEntity> listPermanentlyFailed(@Param("limit") int limit);

    @Select("SELECT target_height FROM recovery_tasks WHERE status = 'FAILED' AND next_run_at IS NULL "
            + "ORDER BY target_height LIMIT #{limit}")
    List<Long> selectPermanentlyFailedHeights(@Param("limit") int limit);

    @Select("SELECT COUNT(*) FROM recovery_tasks WHERE status = #{status}")
    long countByStatus(@Param("status") String status);

    /**
     * 清理过期的 DONE 任务，仅限其块已有 storage 行（否则删除后会重新成为缺口）。
     */
    @Delete({"DELETE FROM recovery_tasks t WHERE t.status = 'DONE' AND t.updated_at < #{cutoff}",
            " AND EXISTS (SELECT 1 FROM storage s WHERE s.block_num = t.target_height)"})
    int deleteDoneBefore(@Param("cutoff") Instant cutoff);
}
