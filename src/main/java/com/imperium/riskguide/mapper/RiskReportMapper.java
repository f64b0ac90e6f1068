package com.imperium.riskguide.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.riskguide.model.entity.RiskReport;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface RiskReportMapper extends BaseMapper<RiskReport> {
}
