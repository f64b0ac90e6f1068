package com.imperium.riskguide.model.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 自动化排期分析的一次运行结果。失败时 status = error，只带 error 与 workflowRunId。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkflowRunResponse {

    private String status;
    private String report;
    private String error;
    private String workflowRunId;
    private String sessionId;
    private String conversationId;
    private String timestamp;
}
