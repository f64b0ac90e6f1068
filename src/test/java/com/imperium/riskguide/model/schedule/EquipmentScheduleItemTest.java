package com.imperium.riskguide.model.schedule;

import com.imperium.riskguide.model.row.ScheduleComparisonRow;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class EquipmentScheduleItemTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 4, 1);

    @Test
    public void shouldDeriveRiskFromRowValues() {
        EquipmentScheduleItem item = EquipmentScheduleItem.from(ScheduleComparisonRow.builder()
                .equipmentCode("EQ-100")
                .daysVariance(12)
                .daysUntilP6Due(80)
                .build(), TODAY);

        assertEquals(15.0, item.getRiskPercentage());
        assertEquals("High Risk", item.getRiskFlag());
        assertEquals(5, item.getRiskPoints());
    }

    @Test
    public void shouldComputeMissingDayCountsFromDates() {
        EquipmentScheduleItem item = EquipmentScheduleItem.from(ScheduleComparisonRow.builder()
                .p6ScheduleDueDate(TODAY.plusDays(100))
                .equipmentMilestoneDueDate(TODAY.plusDays(95))
                .build(), TODAY);

        assertEquals(-5, item.getDaysVariance());
        assertEquals(100, item.getDaysUntilDue());
        assertEquals(5.0, item.getRiskPercentage());
        assertEquals("Medium Risk", item.getRiskFlag());
        assertEquals(TODAY.plusDays(95), item.getDeliveryDate());
    }

    @Test
    public void shouldTreatPastDueItemAsFullRisk() {
        EquipmentScheduleItem item = EquipmentScheduleItem.from(ScheduleComparisonRow.builder()
                .p6ScheduleDueDate(TODAY.minusDays(3))
                .equipmentMilestoneDueDate(TODAY.minusDays(3))
                .build(), TODAY);

        assertEquals(0, item.getDaysVariance());
        assertEquals(100.0, item.getRiskPercentage());
        assertEquals("High Risk", item.getRiskFlag());
    }

    @Test
    public void shouldLeaveRiskEmptyWithoutDates() {
        EquipmentScheduleItem item = EquipmentScheduleItem.from(ScheduleComparisonRow.builder()
                .equipmentCode("EQ-200")
                .build(), TODAY);

        assertNull(item.getRiskPercentage());
        assertNull(item.getRiskFlag());
    }
}
