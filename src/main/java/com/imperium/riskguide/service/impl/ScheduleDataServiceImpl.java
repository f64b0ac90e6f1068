package com.imperium.riskguide.service.impl;

import com.imperium.riskguide.mapper.RiskAnalyticsMapper;
import com.imperium.riskguide.model.row.ScheduleComparisonRow;
import com.imperium.riskguide.model.schedule.EquipmentScheduleItem;
import com.imperium.riskguide.policy.StoreRetryPolicy;
import com.imperium.riskguide.service.ScheduleDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Service
public class ScheduleDataServiceImpl implements ScheduleDataService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleDataServiceImpl.class);

    private final RiskAnalyticsMapper riskAnalyticsMapper;
    private final StoreRetryPolicy retryPolicy;
    private final Clock clock;

    @Autowired
    public ScheduleDataServiceImpl(RiskAnalyticsMapper riskAnalyticsMapper, StoreRetryPolicy retryPolicy) {
        this(riskAnalyticsMapper, retryPolicy, Clock.systemDefaultZone());
    }

    ScheduleDataServiceImpl(RiskAnalyticsMapper riskAnalyticsMapper, StoreRetryPolicy retryPolicy, Clock clock) {
        this.riskAnalyticsMapper = riskAnalyticsMapper;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
    }

    @Override
    public List<EquipmentScheduleItem> fetchScheduleItems() {
        List<ScheduleComparisonRow> rows = retryPolicy.execute("rpc get_schedule_comparison_data",
                riskAnalyticsMapper::selectScheduleComparison);
        if (rows == null || rows.isEmpty()) {
            log.info("Schedule comparison returned 0 rows");
            return List.of();
        }
        LocalDate today = LocalDate.now(clock);
        log.info("Schedule comparison returned {} rows", rows.size());
        return rows.stream()
                .map(row -> EquipmentScheduleItem.from(row, today))
                .toList();
    }
}
