package com.stockscan.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface UniverseMapper {
    @Delete("DELETE FROM universe")
    int deleteAll();

    @Insert({
            "<script>",
            "INSERT INTO universe(code, name, status, updated_at) VALUES ",
            "<foreach collection='rows' item='r' separator=','>",
            "(#{r.code}, #{r.name}, #{r.status}, now())",
            "</foreach>",
            "</script>"
    })
    int insertAll(@Param("rows") List<UniverseRow> rows);

    @Select("SELECT code, name, status FROM universe ORDER BY code ASC")
    List<UniverseRow> listAll();
}
