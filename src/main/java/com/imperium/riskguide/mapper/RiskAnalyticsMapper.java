package com.imperium.riskguide.mapper;

import com.imperium.riskguide.model.row.CountryRiskRow;
import com.imperium.riskguide.model.row.RecentConversationRow;
import com.imperium.riskguide.model.row.ScheduleComparisonRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * 数据库函数调用（RPC 风格的聚合读），函数定义见 db/schema.sql。
 */
@Mapper
public interface RiskAnalyticsMapper {

    @Select("SELECT * FROM get_schedule_comparison_data()")
    List<ScheduleComparisonRow> selectScheduleComparison();

    @Select("SELECT * FROM get_country_risk_heatmap_data(#{conversationId}, #{sessionId})")
    List<CountryRiskRow> selectCountryRiskHeatmap(@Param("conversationId") String conversationId,
                                                  @Param("sessionId") String sessionId);

    @Select("SELECT * FROM get_recent_conversations(#{rowLimit})")
    List<RecentConversationRow> selectRecentConversations(@Param("rowLimit") int rowLimit);
}
