package com.imperium.riskguide.ai.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.riskguide.model.schedule.EquipmentScheduleItem;
import com.imperium.riskguide.service.ScheduleDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Spring AI Tool: 设备排期对比数据。
 */
@Component
public class ScheduleDataTool {

    private static final Logger log = LoggerFactory.getLogger(ScheduleDataTool.class);

    private final ScheduleDataService scheduleDataService;
    private final ObjectMapper objectMapper;

    public ScheduleDataTool(ScheduleDataService scheduleDataService, ObjectMapper objectMapper) {
        this.scheduleDataService = scheduleDataService;
        this.objectMapper = objectMapper;
    }

    @Tool(name = "get_schedule_comparison_data",
            description = "Retrieves equipment schedule comparison data for analysis: P6 due date vs delivery date, "
                    + "days variance, days until due, risk percentage and risk flag, plus supplier, manufacturing "
                    + "location and logistics details. Returns a JSON array.")
    public String getScheduleComparisonData() {
        try {
            List<EquipmentScheduleItem> items = scheduleDataService.fetchScheduleItems();
            return items.isEmpty() ? "[]" : objectMapper.writeValueAsString(items);
        } catch (Exception e) {
            log.warn("get_schedule_comparison_data failed: {}", e.getMessage());
            return errorJson(e);
        }
    }

    private String errorJson(Exception e) {
        try {
            return objectMapper.writeValueAsString(Map.of("error", String.valueOf(e.getMessage())));
        } catch (JsonProcessingException ex) {
            return "{\"error\":\"schedule data unavailable\"}";
        }
    }
}
