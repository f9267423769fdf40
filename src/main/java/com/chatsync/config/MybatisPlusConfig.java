package com.chatsync.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@MapperScan("com.chatsync.**.mapper")
public class MybatisPlusConfig {
}
