package com.work.archive.indexer.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.archive.indexer.repository.entity.DecodeErrorEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.Instant;
import java.util.List;

public interface DecodeErrorMapper extends BaseMapper<DecodeErrorEntity> {

    @Insert({"INSERT INTO decode_errors (block_num, spec, error, attempts, updated_at)",
            " VALUES (#{blockNum}, #{spec,jdbcType=INTEGER}, #{error}, 1, #{now})",
            " ON CONFLICT (block_num) DO UPDATE SET spec = EXCLUDED.spec, error = EXCLUDED.error,",
            " attempts = decode_errors.attempts + 1, updated_at = EXCLUDED.updated_at"})
    int upsert(@Param("blockNum") long blockNum,
               @Param("spec") Integer spec,
               @Param("error") String error,
               @Param("now") Instant now);

    @Delete({"<script>",
            "DELETE FROM decode_errors WHERE block_num IN",
            "<foreach collection='heights' item='h' open='(' separator=',' close=')'>#{h}</foreach>",
            "</script>"})
    int deleteByHeights(@Param("heights") List<Long> heights);

    @Select("SELECT block_num, spec, error, attempts, updated_at FROM decode_errors ORDER BY block_num LIMIT #{limit}")
    List<DecodeErrorEntity> listRecent(@Param("limit") int limit);

    @Select("SELECT COUNT(*) FROM decode_errors")
    long countAll();
}
