package com.work.archive.indexer.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.archive.indexer.repository.entity.StorageEntryEntity;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface StorageMapper extends BaseMapper<StorageEntryEntity> {

    int COLUMNS = 5;

    /**
     * 唯一约束为表达式索引 (block_hash, key, coalesce(md5(data), ''))，不指定冲突目标。
     * 每个真正插入的行返回其 block_num。
     */
    @Select({"<script>",
            "INSERT INTO storage (block_hash, block_num, is_full, key, data) VALUES",
            "<foreach collection='rows' item='r' separator=','>",
            "(#{r.blockHash}, #{r.blockNum}, #{r.full}, #{r.key}, #{r.data,jdbcType=BINARY})",
            "</foreach>",
            "ON CONFLICT DO NOTHING RETURNING block_num",
            "</script>"})
    @Options(flushCache = Options.FlushCachePolicy.TRUE, useCache = false)
    List<Long> insertBatch(@Param("rows") List<StorageEntryEntity> rows);
}
