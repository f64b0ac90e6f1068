package com.imperium.riskguide.service;

import com.imperium.riskguide.model.dto.search.SearchResult;

import java.util.List;

/**
 * 网页搜索，供政治/关税/物流风险阶段检索公开资讯。
 */
public interface WebSearchService {

    /**
     * @param query 搜索关键词
     * @return 至多 app.search.max-results 条结果；查询为空或请求失败时返回空列表
     */
    List<SearchResult> search(String query);
}
