package com.imperium.riskguide.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * 接口文档分两组：对话/流水线入口与审计查询。
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI riskGuideOpenApi(@Value("${server.port:8000}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("RiskGuide API")
                        .description("设备排期风险多智能体分析：对话轮次、自动化工作流、审计日志与风险报告")
                        .version("v1"))
                .servers(List.of(new Server().url("http://localhost:" + port).description("Local")));
    }

    @Bean
    public GroupedOpenApi pipelineApi() {
        return GroupedOpenApi.builder()
                .group("pipeline")
                .pathsToMatch("/api/chat/**", "/api/chat", "/api/workflow/**")
                .build();
    }

    @Bean
    public GroupedOpenApi auditApi() {
        return GroupedOpenApi.builder()
                .group("audit")
                .pathsToMatch("/api/sessions/**", "/api/sessions", "/api/session-ids", "/api/thinking-log*/**",
                        "/api/thinking-logs", "/api/thinking-log-ids", "/api/conversations/**", "/api/heatmap",
                        "/api/reports/**", "/api/reports")
                .build();
    }
}
