package com.ministation.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@MapperScan("com.ministation.**.mapper")
public class MybatisPlusConfig {
}
