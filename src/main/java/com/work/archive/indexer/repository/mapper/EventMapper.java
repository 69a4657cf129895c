package com.work.archive.indexer.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.archive.indexer.repository.entity.EventEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;

import java.util.List;

public interface EventMapper extends BaseMapper<EventEntity> {

    int COLUMNS = 6;

    @Insert({"<script>",
            "INSERT INTO events (block_hash, idx, block_num, module, event_name, parameters) VALUES",
            "<foreach collection='rows' item='r' separator=','>",
            "(#{r.blockHash}, #{r.idx}, #{r.blockNum}, #{r.module}, #{r.eventName}, CAST(#{r.parameters} AS jsonb))",
            "</foreach>",
            "ON CONFLICT (block_hash, idx) DO NOTHING",
            "</script>"})
    int insertBatch(@Param("rows") List<EventEntity> rows);
}
