package com.imperium.riskguide.service;

import com.imperium.riskguide.model.schedule.EquipmentScheduleItem;

import java.util.List;

/**
 * 排期数据源：调用 get_schedule_comparison_data() 取全部设备排期条目。
 */
public interface ScheduleDataService {

    /**
     * 读取当前全部排期条目并补齐派生风险字段。无数据时返回空列表，不返回 null。
     * 重试用尽后抛出最后一次的错误。
     */
    List<EquipmentScheduleItem> fetchScheduleItems();
}
