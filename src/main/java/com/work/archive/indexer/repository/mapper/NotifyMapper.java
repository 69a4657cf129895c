package com.work.archive.indexer.repository.mapper;

import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * PostgreSQL LISTEN/NOTIFY 发送端。
 */
public interface NotifyMapper {

    @Select("SELECT COUNT(*) FROM (SELECT pg_notify(#{channel}, #{payload})) n")
    int notify(@Param("channel") String channel, @Param("payload") String payload);
}
