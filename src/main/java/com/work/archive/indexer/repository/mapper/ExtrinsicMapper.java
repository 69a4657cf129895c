package com.work.archive.indexer.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.archive.indexer.repository.entity.ExtrinsicEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;

import java.util.List;

public interface ExtrinsicMapper extends BaseMapper<ExtrinsicEntity> {

    int COLUMNS = 7;

    @Insert({"<script>",
            "INSERT INTO extrinsics (block_hash, idx, block_num, module, call_name, signature, args) VALUES",
            "<foreach collection='rows' item='r' separator=','>",
            "(#{r.blockHash}, #{r.idx}, #{r.blockNum}, #{r.module}, #{r.callName},",
            " #{r.signature,jdbcType=BINARY}, CAST(#{r.args} AS jsonb))",
            "</foreach>",
            "ON CONFLICT (block_hash, idx) DO NOTHING",
            "</script>"})
    int insertBatch(@Param("rows") List<ExtrinsicEntity> rows);
}
