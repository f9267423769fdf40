package com.chatsync.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.chatsync.domain.entity.MessageAttachmentEntity;

public interface MessageAttachmentMapper extends BaseMapper<MessageAttachmentEntity> {
}
