package com.imperium.riskguide.model.dto.search;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一条网页搜索结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResult {

    private String title;
    /** 来源站点或出版方 */
    private String source;
    private String url;
    private String snippet;
}
