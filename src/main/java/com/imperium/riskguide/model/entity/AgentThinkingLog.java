package com.imperium.riskguide.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 智能体思考过程日志，对应 dim_agent_thinking_log 表。只追加，不更新、不删除。
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@TableName("dim_agent_thinking_log")
public class AgentThinkingLog {

    @TableId(value = "thinking_id", type = IdType.AUTO)
    private Long thinkingId;

    @TableField("agent_name")
    private String agentName;

    /** 思考阶段：analysis_start | data_review | risk_calculation | complete_response | error ... */
    @TableField("thinking_stage")
    private String thinkingStage;

    @TableField("thought_content")
    private String thoughtContent;

    @TableField("thinking_stage_output")
    private String thinkingStageOutput;

    @TableField("agent_output")
    private String agentOutput;

    @TableField("conversation_id")
    private String conversationId;

    @TableField("session_id")
    private String sessionId;

    @TableField("model_deployment_name")
    private String modelDeploymentName;

    @TableField("user_query")
    private String userQuery;

    /** success | error */
    private String status;

    @TableField("created_date")
    private LocalDateTime createdDate;
}
