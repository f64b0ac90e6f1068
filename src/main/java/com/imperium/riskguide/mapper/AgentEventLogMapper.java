package com.imperium.riskguide.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.riskguide.model.entity.AgentEventLog;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface AgentEventLogMapper extends BaseMapper<AgentEventLog> {
}
