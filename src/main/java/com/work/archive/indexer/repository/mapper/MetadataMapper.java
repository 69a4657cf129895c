package com.work.archive.indexer.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.archive.indexer.repository.entity.MetadataEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface MetadataMapper extends BaseMapper<MetadataEntity> {

    @Insert("INSERT INTO metadata (version, first_height, meta, created_at) "
            + "VALUES (#{version}, #{firstHeight}, #{meta}, now()) ON CONFLICT (version) DO NOTHING")
    int insertIfAbsent(@Param("version") int version,
                       @Param("firstHeight") long firstHeight,
                       @Param("meta") byte[] meta);

    /**
     * 只取断点列，不加载 metadata blob。
     */
    @Select("SELECT version, first_height FROM metadata ORDER BY first_height, version")
    List<MetadataEntity> selectBreakpoints();

    @Select("SELECT version, first_height, meta, created_at FROM metadata WHERE version = #{version}")
    MetadataEntity selectByVersion(@Param("version") int version);
}
