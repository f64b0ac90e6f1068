package com.imperium.riskguide.ai.routing;

/**
 * 一次路由决策。requested 为分类结果，next 为实际进入的状态
 * （风险类请求被重定向到 SCHEDULER 时两者不同）。
 */
public record RoutingDecision(PipelineState from, PipelineState requested, PipelineState next) {

    public static RoutingDecision direct(PipelineState from, PipelineState next) {
        return new RoutingDecision(from, next, next);
    }

    public boolean redirected() {
        return requested != next;
    }
}
