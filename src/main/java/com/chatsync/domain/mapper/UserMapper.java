package com.chatsync.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.chatsync.domain.entity.UserEntity;

public interface UserMapper extends BaseMapper<UserEntity> {
}
