package com.example.audiobookfinder.common.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@MapperScan("com.example.audiobookfinder.infrastructure.persistence.mapper")
public class MybatisConfig {
}
