package com.imperium.riskguide.ai.tools;

import com.imperium.riskguide.model.political.Citation;
import com.imperium.riskguide.model.political.PoliticalRiskAnalysis;
import com.imperium.riskguide.model.political.PoliticalRiskEntry;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 解析政治风险阶段输出的 markdown。
 * <p>
 * 风险表为 9 列：Country | Political Type | Risk Information | Likelihood (0-5) | Likelihood Reasoning |
 * Publication Date | Citation Title | Citation Name | URL。第 4 列必须是整数，表头行和分隔行因此被跳过。
 */
@Component
public class PoliticalRiskParser {

    private static final int TABLE_COLUMNS = 9;
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private static final Pattern QUERY = Pattern.compile("query:\\s*\"([^\"]+)\"", Pattern.CASE_INSENSITIVE);
    private static final Pattern RESULTS_COUNT = Pattern.compile("A total of (\\d+) search results");
    private static final Pattern EQUIPMENT_IMPACT = section("Equipment Impact Analysis");
    private static final Pattern MITIGATION = section("Mitigation Recommendations");
    private static final Pattern ANALYSIS_DESCRIPTION = section("Analysis Description");

    public PoliticalRiskAnalysis parse(String riskAnalysis) {
        String text = riskAnalysis != null ? riskAnalysis : "";
        PoliticalRiskAnalysis result = PoliticalRiskAnalysis.builder()
                .politicalRisks(parseTable(text))
                .timestamp(LocalDateTime.now().toString())
                .build();

        Matcher query = QUERY.matcher(text);
        if (query.find()) {
            result.setSearchQuery(query.group(1));
        }
        Matcher count = RESULTS_COUNT.matcher(text);
        if (count.find()) {
            result.setSearchResultsCount(Integer.parseInt(count.group(1)));
        }
        result.setEquipmentImpact(extractSection(EQUIPMENT_IMPACT, text));
        result.setMitigationRecommendations(extractSection(MITIGATION, text));
        result.setAnalysisDescription(extractSection(ANALYSIS_DESCRIPTION, text));
        return result;
    }

    /**
     * 从风险表提取引用，按 url + title 去重，保持出现顺序。
     */
    public List<Citation> extractCitations(String riskAnalysis) {
        List<Citation> citations = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (PoliticalRiskEntry entry : parseTable(riskAnalysis != null ? riskAnalysis : "")) {
            String key = entry.getCitationUrl() + "\u0000" + entry.getCitationTitle();
            if (!seen.add(key)) {
                continue;
            }
            citations.add(Citation.builder()
                    .title(entry.getCitationTitle())
                    .source(entry.getCitationName())
                    .url(entry.getCitationUrl())
                    .publicationDate(entry.getPublicationDate())
                    .country(entry.getCountry())
                    .riskType(entry.getPoliticalType())
                    .riskInfo(entry.getRiskInformation())
                    .build());
        }
        return citations;
    }

    List<PoliticalRiskEntry> parseTable(String text) {
        List<PoliticalRiskEntry> entries = new ArrayList<>();
        for (String rawLine : text.split("\\R")) {
            String line = rawLine.trim();
            if (!line.startsWith("|")) continue;

            List<String> cells = cells(line);
            if (cells.size() < TABLE_COLUMNS || !DIGITS.matcher(cells.get(3)).matches()) {
                continue;
            }
            if (isHeader(cells)) continue;

            entries.add(PoliticalRiskEntry.builder()
                    .country(cells.get(0))
                    .politicalType(cells.get(1))
                    .riskInformation(cells.get(2))
                    .likelihood(parseLikelihood(cells.get(3)))
                    .likelihoodReasoning(cells.get(4))
                    .publicationDate(cells.get(5))
                    .citationTitle(cells.get(6))
                    .citationName(cells.get(7))
                    .citationUrl(cells.get(8))
                    .build());
        }
        return entries;
    }

    private static List<String> cells(String line) {
        String body = line.substring(1);
        if (body.endsWith("|")) {
            body = body.substring(0, body.length() - 1);
        }
        List<String> cells = new ArrayList<>();
        for (String cell : body.split("\\|", -1)) {
            cells.add(cell.trim());
        }
        return cells;
    }

    private static boolean isHeader(List<String> cells) {
        return cells.get(0).equalsIgnoreCase("country")
                && cells.get(1).toLowerCase(Locale.ROOT).contains("political type");
    }

    private static int parseLikelihood(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String extractSection(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group(1).strip() : null;
    }

    /** 标题之后到下一个 "###" 或文末的内容 */
    private static Pattern section(String heading) {
        return Pattern.compile(Pattern.quote(heading) + "([\\s\\S]*?)(?=###|\\z)");
    }
}
