package com.chatsync.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.chatsync.domain.entity.GroupEntity;

public interface GroupMapper extends BaseMapper<GroupEntity> {
}
