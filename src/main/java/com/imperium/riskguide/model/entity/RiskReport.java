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
 * 汇总报告记录，对应 fact_risk_report 表。每次完成的报告阶段写且只写一条。
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@TableName("fact_risk_report")
public class RiskReport {

    @TableId(value = "report_id", type = IdType.AUTO)
    private Long reportId;

    @TableField("session_id")
    private String sessionId;

    @TableField("conversation_id")
    private String conversationId;

    private String filename;

    /** 报告文件的持久化地址 */
    @TableField("blob_url")
    private String blobUrl;

    /** comprehensive | schedule | ... */
    @TableField("report_type")
    private String reportType;

    @TableField("created_date")
    private LocalDateTime createdDate;
}
