package com.chatsync.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.chatsync.domain.entity.MessageMarkEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;

/**
 * 覆盖层写入依赖唯一键 (message_id, user_id, mark_type)：
 * 幂等写用 insert ignore，替换写用 on duplicate key update，不靠捕获重复键异常。
 */
public interface MessageMarkMapper extends BaseMapper<MessageMarkEntity> {

    @Insert("""
            insert ignore into t_message_mark (id, message_id, user_id, mark_type, emoji, created_at)
            values (#{m.id}, #{m.messageId}, #{m.userId}, #{m.markType}, #{m.emoji}, #{m.createdAt})
            """)
    int insertIgnore(@Param("m") MessageMarkEntity mark);

    @Insert("""
            insert into t_message_mark (id, message_id, user_id, mark_type, emoji, created_at)
            values (#{m.id}, #{m.messageId}, #{m.userId}, #{m.markType}, #{m.emoji}, #{m.createdAt})
            on duplicate key update emoji = values(emoji), created_at = values(created_at)
            """)
    int upsert(@Param("m") MessageMarkEntity mark);
}
