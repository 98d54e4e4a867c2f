package com.goormthonuniv.modelsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.PropertySource;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
// 로컬 전용 오버라이드(어댑터 endpoint, DB 경로 등). 없으면 application.yml 만 사용
@PropertySource(value = "classpath:properties/env.properties", ignoreResourceNotFound = true)
public class ModelSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelSearchApplication.class, args);
    }
}
