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
 * 智能体事件日志，对应 dim_agent_event_log 表。
 * <p>
 * 每个阶段完成后写一条（动作 + 完整输出），读接口据此重建会话视图。
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@TableName("dim_agent_event_log")
public class AgentEventLog {

    @TableId(value = "log_id", type = IdType.AUTO)
    private Long logId;

    @TableField("event_id")
    private String eventId;

    @TableField("agent_name")
    private String agentName;

    @TableField("event_time")
    private LocalDateTime eventTime;

    private String action;

    @TableField("result_summary")
    private String resultSummary;

    @TableField("user_query")
    private String userQuery;

    @TableField("agent_output")
    private String agentOutput;

    @TableField("conversation_id")
    private String conversationId;

    @TableField("session_id")
    private String sessionId;

    @TableField("created_date")
    private LocalDateTime createdDate;
}
