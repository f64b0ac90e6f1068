package com.imperium.riskguide.model.schedule;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.imperium.riskguide.model.row.ScheduleComparisonRow;
import com.imperium.riskguide.policy.RiskScoringPolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * 设备排期条目（只读输入）+ 派生的风险字段。
 * <p>
 * 风险百分比与风险等级是纯派生值，没有独立标识。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EquipmentScheduleItem {

    private String equipmentCode;
    private String equipmentName;
    private String equipmentType;

    private LocalDate p6ScheduleDueDate;
    /** 设备交付到场日期 */
    private LocalDate deliveryDate;

    private String manufacturingLocation;
    private String projectCountry;

    private Integer daysVariance;
    private Integer daysUntilDue;
    private Double riskPercentage;
    /** Low Risk / Medium Risk / High Risk */
    private String riskFlag;
    private Integer riskPoints;

    private String projectName;
    private String projectCode;
    private String workPackageName;
    private String milestoneActivity;
    private String supplierName;
    private String purchaseOrderNumber;
    private BigDecimal amount;
    private Integer supplierLeadTime;
    private String shippingPort;
    private String receivingPort;
    private String logisticsMethod;
    private String alternativeSuppliers;

    /**
     * 由数据库行构造。days_variance / days_until_p6_due 缺失时按日期补算；
     * 日期也缺失时风险字段留空。
     */
    public static EquipmentScheduleItem from(ScheduleComparisonRow row, LocalDate today) {
        Integer variance = row.getDaysVariance();
        if (variance == null && row.getP6ScheduleDueDate() != null && row.getEquipmentMilestoneDueDate() != null) {
            variance = (int) ChronoUnit.DAYS.between(row.getP6ScheduleDueDate(), row.getEquipmentMilestoneDueDate());
        }
        Integer untilDue = row.getDaysUntilP6Due();
        if (untilDue == null && row.getP6ScheduleDueDate() != null) {
            untilDue = (int) ChronoUnit.DAYS.between(today, row.getP6ScheduleDueDate());
        }

        EquipmentScheduleItemBuilder builder = EquipmentScheduleItem.builder()
                .equipmentCode(row.getEquipmentCode())
                .equipmentName(row.getEquipmentName())
                .equipmentType(row.getEquipmentType())
                .p6ScheduleDueDate(row.getP6ScheduleDueDate())
                .deliveryDate(row.getEquipmentMilestoneDueDate())
                .manufacturingLocation(row.getManufacturingLocation())
                .projectCountry(row.getProjectCountry())
                .daysVariance(variance)
                .daysUntilDue(untilDue)
                .projectName(row.getProjectName())
                .projectCode(row.getProjectCode())
                .workPackageName(row.getWorkPackageName())
                .milestoneActivity(row.getMilestoneActivity())
                .supplierName(row.getSupplierName())
                .purchaseOrderNumber(row.getPurchaseOrderNumber())
                .amount(row.getAmount())
                .supplierLeadTime(row.getSupplierLeadTime())
                .shippingPort(row.getShippingPort())
                .receivingPort(row.getReceivingPort())
                .logisticsMethod(row.getLogisticsMethod())
                .alternativeSuppliers(row.getAlternativeSuppliers());

        if (variance != null && untilDue != null) {
            double percentage = RiskScoringPolicy.riskPercentage(variance, untilDue);
            RiskCategory category = RiskScoringPolicy.categorize(percentage);
            builder.riskPercentage(percentage)
                    .riskFlag(category.getFlag())
                    .riskPoints(category.getPoints());
        }
        return builder.build();
    }
}
