package com.goormthonuniv.derigo.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

/**
 * 배포 환경별 덮어쓰기(derigo.* 튜닝 값 등). 파일이 없으면 무시.
 */
@Configuration
@PropertySource(
        value = "classpath:properties/env.properties",
        ignoreResourceNotFound = true
)
public class PropertyConfig {

}
