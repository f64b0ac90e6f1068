package com.imperium.riskguide.model.dto.search;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * web_search 工具返回给模型的结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebSearchToolResult {

    private String query;
    @Builder.Default
    private List<SearchResult> results = new ArrayList<>();
    /** 未执行搜索时的说明（如超出本阶段调用次数） */
    private String message;

    public static WebSearchToolResult skipped(String query, String message) {
        return WebSearchToolResult.builder().query(query).message(message).build();
    }
}
