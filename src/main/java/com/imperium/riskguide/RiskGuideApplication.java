package com.imperium.riskguide;

import com.imperium.riskguide.config.DotenvLoader;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@MapperScan("com.imperium.riskguide.mapper")
public class RiskGuideApplication {

    public static void main(String[] args) {
        DotenvLoader.load(); // 加载 .env 到系统属性，供 application.yaml 中的 ${VAR} 使用
        SpringApplication.run(RiskGuideApplication.class, args);
    }
}
