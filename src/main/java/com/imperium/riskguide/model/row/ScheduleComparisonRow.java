package com.imperium.riskguide.model.row;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * get_schedule_comparison_data() 返回的一行：P6 计划 vs 设备里程碑交付对比。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleComparisonRow {

    private Integer projectId;
    private String projectName;
    private String projectCode;
    private String projectCountry;
    private String projectLocation;

    private Integer equipmentId;
    private String equipmentCode;
    private String equipmentName;
    private String equipmentType;

    private String workPackageCode;
    private String workPackageName;
    private String milestoneActivity;

    private LocalDate p6ScheduleDueDate;
    private LocalDate equipmentMilestoneDueDate;
    /** 交付日期 - P6 到期日 */
    private Integer daysVariance;
    /** P6 到期日 - 今天 */
    private Integer daysUntilP6Due;

    private String supplierName;
    private String supplierNumber;
    private String purchaseOrderNumber;
    private String lineItem;
    private BigDecimal amount;
    private Integer supplierLeadTime;

    private String manufacturingLocation;
    private String shippingPort;
    private String receivingPort;
    private String logisticsMethod;
    private String alternativeSuppliers;
}
