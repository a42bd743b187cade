package com.deepansh.react.tool.impl;

import com.deepansh.react.tool.AgentTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Simulated web search backed by a fixed set of canned results.
 *
 * Unknown queries get a generic "found something" answer so the model is nudged
 * towards refining its query instead of stalling.
 */
@Component
@Slf4j
public class SearchTool implements AgentTool {

    private static final Map<String, String> RESULTS = Map.of(
            "olivia wilde boyfriend",
            "Olivia Wilde was engaged to Jason Sudeikis for several years. After they separated, she started dating Harry Styles.",
            "harry styles age",
            "29 years old",
            "colorado orogeny",
            "The Colorado orogeny was an episode of mountain building in Colorado and surrounding areas.",
            "eastern sector",
            "The eastern sector extends into the High Plains and is called the Central Plains orogeny.",
            "high plains",
            "High Plains refers to one of two distinct land regions.",
            "high plains (united states)",
            "The High Plains are a subregion of the Great Plains. From east to west, the High Plains rise in elevation from around 1,800 to 7,000 ft (550 to 2,130 m)."
    );

    @Override
    public String getName() {
        return "search";
    }

    @Override
    public String getDescription() {
        return "Search for related information and knowledge";
    }

    @Override
    public String getUsage() {
        return "search[query]";
    }

    @Override
    public List<String> getExamples() {
        return List.of("search[Olivia Wilde boyfriend]", "search[Colorado orogeny]");
    }

    @Override
    public String invoke(String input) {
        String query = input == null ? "" : input.trim();
        log.debug("Search: query='{}'", query);

        String hit = RESULTS.get(query.toLowerCase());
        if (hit != null) {
            return hit;
        }
        return "Results for \"" + query + "\": found related information, but further queries are needed for specific details.";
    }
}
