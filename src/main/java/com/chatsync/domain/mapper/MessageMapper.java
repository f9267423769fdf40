package com.chatsync.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.chatsync.domain.entity.MessageEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface MessageMapper extends BaseMapper<MessageEntity> {

    /**
     * 用户发出的单聊消息头（走 idx_msg_sender_receiver）。
     */
    @Select("""
            <script>
            select id, sender_id, receiver_id, group_id, created_at
            from t_message
            where sender_id = #{userId}
              and receiver_id is not null
            <if test="since != null">
              and created_at &gt;= #{since}
            </if>
            order by created_at desc, id desc
            limit #{cap}
            </script>
            """)
    List<MessageEntity> selectSentHeads(@Param("userId") long userId,
                                        @Param("since") LocalDateTime since,
                                        @Param("cap") int cap);

    /**
     * 用户收到的单聊消息头（走 idx_msg_receiver_sender）。
     */
    @Select("""
            <script>
            select id, sender_id, receiver_id, group_id, created_at
            from t_message
            where receiver_id = #{userId}
            <if test="since != null">
              and created_at &gt;= #{since}
            </if>
            order by created_at desc, id desc
            limit #{cap}
            </script>
            """)
    List<MessageEntity> selectReceivedHeads(@Param("userId") long userId,
                                            @Param("since") LocalDateTime since,
                                            @Param("cap") int cap);

    /**
     * 每个群 created_at 最大的消息头；同毫秒可能返回多条，由调用方按 id 取最大。
     */
    @Select("""
            <script>
            select m.id, m.sender_id, m.receiver_id, m.group_id, m.created_at
            from t_message m
            join (
              select group_id, max(created_at) as max_at
              from t_message
              where group_id in
              <foreach collection="groupIds" item="gid" open="(" separator="," close=")">
                #{gid}
              </foreach>
              group by group_id
            ) x
              on m.group_id = x.group_id
             and m.created_at = x.max_at
            </script>
            """)
    List<MessageEntity> selectLatestGroupHeads(@Param("groupIds") Collection<Long> groupIds);
}
