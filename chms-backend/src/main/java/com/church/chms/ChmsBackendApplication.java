package com.church.chms;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // 审计日志清理、限流清理、消息投递等定时任务
@ConfigurationPropertiesScan
public class ChmsBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChmsBackendApplication.class, args);
    }

}
