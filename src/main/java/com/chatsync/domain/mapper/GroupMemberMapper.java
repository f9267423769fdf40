package com.chatsync.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.chatsync.domain.entity.GroupMemberEntity;

public interface GroupMemberMapper extends BaseMapper<GroupMemberEntity> {
}
