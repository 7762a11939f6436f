package com.example.ps3update;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动类
 * <p>
 * PS3 游戏更新查询与多线程下载服务入口
 * </p>
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan("com.example.ps3update")
public class Ps3UpdateApplication {

    /**
     * 主方法入口
     *
     * @param args 命令行参数
     */
    public static void main(String[] args) {
        SpringApplication.run(Ps3UpdateApplication.class, args);
    }
}
