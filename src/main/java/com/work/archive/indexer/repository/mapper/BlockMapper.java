package com.work.archive.indexer.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.archive.indexer.repository.entity.BlockEntity;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface BlockMapper extends BaseMapper<BlockEntity> {

    /**
     * insertBatch 每行绑定的参数个数。
     */
    int COLUMNS = 8;

    /**
     * 返回本次真正插入（非冲突）的高度。
     */
    @Select({"<script>",
            "INSERT INTO blocks (hash, parent_hash, block_num, state_root, extrinsics_root, digest, ext, spec, created_at) VALUES",
            "<foreach collection='rows' item='r' separator=','>",
            "(#{r.hash}, #{r.parentHash}, #{r.blockNum}, #{r.stateRoot}, #{r.extrinsicsRoot},",
            " #{r.digest,jdbcType=BINARY}, #{r.ext,jdbcType=BINARY}, #{r.spec}, now())",
            "</foreach>",
            "ON CONFLICT DO NOTHING RETURNING block_num",
            "</script>"})
    @Options(flushCache = Options.FlushCachePolicy.TRUE, useCache = false)
    List<Long> insertBatch(@Param("rows") List<BlockEntity> rows);

    @Select("SELECT hash, block_num, spec, created_at FROM blocks WHERE block_num = #{height}")
    BlockEntity selectByHeight(@Param("height") long height);

    /**
     * floor 及以上、最低的一个未索引高度：floor 本身缺失则为 floor，
     * 否则为“下一高度不存在”的最小 block_num + 1。
     */
    @Select({"SELECT CASE WHEN NOT EXISTS (SELECT 1 FROM blocks WHERE block_num = #{floor}) THEN #{floor}",
            " ELSE (SELECT MIN(b.block_num) + 1 FROM blocks b WHERE b.block_num >= #{floor}",
            "       AND NOT EXISTS (SELECT 1 FROM blocks n WHERE n.block_num = b.block_num + 1)) END"})
    Long selectLowestUnindexed(@Param("floor") long floor);

    @Select("SELECT block_num FROM blocks WHERE block_num BETWEEN #{from} AND #{to} ORDER BY block_num")
    List<Long> selectHeightsInRange(@Param("from") long from, @Param("to") long to);

    /**
     * 已有块但既无 storage 行、也没有 DONE 或永久 FAILED 恢复任务的高度。
     */
    @Select({"SELECT b.block_num FROM blocks b",
            " WHERE b.block_num >= #{floor}",
            "   AND NOT EXISTS (SELECT 1 FROM storage s WHERE s.block_hash = b.hash)",
            "   AND NOT EXISTS (SELECT 1 FROM recovery_tasks t WHERE t.target_height = b.block_num",
            "                   AND (t.status = 'DONE' OR (t.status = 'FAILED' AND t.next_run_at IS NULL)))",
            " ORDER BY b.block_num LIMIT #{limit}"})
    List<Long> selectHeightsMissingStorage(@Param("floor") long floor, @Param("limit") int limit);

    @Select("SELECT MAX(block_num) FROM blocks")
    Long selectMaxHeight();

    @Select("SELECT COUNT(*) FROM blocks")
    long countBlocks();
}
