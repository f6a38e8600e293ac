package com.example.audiobookfinder.infrastructure.persistence.mapper;

import com.example.audiobookfinder.infrastructure.persistence.entity.DownloadHistoryEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface DownloadHistoryMapper {

    @Insert("INSERT INTO download_history(book_title, author, youtube_title, youtube_url, download_path, "
            + "added_at, status, progress, total_size, downloaded_size) "
            + "VALUES(#{bookTitle}, #{author}, #{youtubeTitle}, #{youtubeUrl}, #{downloadPath}, "
            + "#{addedAt}, #{status}, #{progress}, #{totalSize}, #{downloadedSize})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(DownloadHistoryEntity entity);

    @Select("SELECT id, book_title, author, youtube_title, youtube_url, download_path, added_at, "
            + "status, progress, total_size, downloaded_size "
            + "FROM download_history WHERE id = #{id}")
    DownloadHistoryEntity selectById(@Param("id") Long id);

    @Select("SELECT id, book_title, author, youtube_title, youtube_url, download_path, added_at, "
            + "status, progress, total_size, downloaded_size "
            + "FROM download_history ORDER BY id DESC LIMIT #{limit}")
    List<DownloadHistoryEntity> selectLatest(@Param("limit") int limit);

    /**
     * Writes the non-null columns of {@code patch}. When {@code expectedStatuses} is not empty the
     * row is only touched while its current status is one of them, which is how the download
     * state machine keeps terminal rows from being overwritten.
     *
     * @return affected rows, 0 when the id is unknown or the status guard rejected the write
     */
    @Update("<script>"
            + "UPDATE download_history "
            + "<set>"
            + "<if test='patch.bookTitle != null'>book_title = #{patch.bookTitle},</if>"
            + "<if test='patch.author != null'>author = #{patch.author},</if>"
            + "<if test='patch.youtubeTitle != null'>youtube_title = #{patch.youtubeTitle},</if>"
            + "<if test='patch.youtubeUrl != null'>youtube_url = #{patch.youtubeUrl},</if>"
            + "<if test='patch.downloadPath != null'>download_path = #{patch.downloadPath},</if>"
            + "<if test='patch.status != null'>status = #{patch.status},</if>"
            + "<if test='patch.progress != null'>progress = #{patch.progress},</if>"
            + "<if test='patch.totalSize != null'>total_size = #{patch.totalSize},</if>"
            + "<if test='patch.downloadedSize != null'>downloaded_size = #{patch.downloadedSize},</if>"
            + "</set>"
            + "WHERE id = #{id}"
            + "<if test='expectedStatuses != null and expectedStatuses.size() > 0'>"
            + " AND status IN "
            + "<foreach item='expected' collection='expectedStatuses' open='(' separator=',' close=')'>"
            + "#{expected}"
            + "</foreach>"
            + "</if>"
            + "</script>")
    int updateSelective(@Param("id") Long id,
                        @Param("patch") DownloadHistoryEntity patch,
                        @Param("expectedStatuses") List<String> expectedStatuses);

    @Delete("DELETE FROM download_history WHERE id = #{id}")
    int deleteById(@Param("id") Long id);

    @Update("TRUNCATE TABLE download_history RESTART IDENTITY")
    void truncate();
}
