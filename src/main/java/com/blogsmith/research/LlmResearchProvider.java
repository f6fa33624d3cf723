package com.blogsmith.research;

import com.blogsmith.config.BlogsmithProperties;
import com.blogsmith.core.collab.ResearchProvider;
import com.blogsmith.core.llm.LlmService;
import com.blogsmith.core.model.ResearchSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Researches a topic: plans search queries with the LLM, runs them against Brave search,
 * de-duplicates the hits and asks the LLM for a cited research brief.
 */
@Component
public class LlmResearchProvider implements ResearchProvider {

    private static final Logger log = LoggerFactory.getLogger(LlmResearchProvider.class);

    static final String QUERY_PROMPT = """
            You plan web research for a long-form technical blog post.
            Produce distinct, specific search queries that together cover: fundamentals,
            recent developments, best practices, real-world use cases and common pitfalls.
            Respond with JSON only.
            """;

    static final String SYNTHESIS_PROMPT = """
            You are a meticulous research analyst preparing a brief for a writer.
            Using ONLY the numbered sources provided, write a structured research brief:
            key concepts, recent developments, best practices, use cases, statistics and
            notable quotes. Cite sources inline as [n] matching the source numbers so the
            writer can turn them into inline links. Do not invent sources or URLs.
            """;

    /** LLM output shape for query planning. */
    record ResearchQueries(List<String> queries) {}

    private final LlmService llmService;
    private final BraveSearchClient searchClient;
    private final int queryCount;

    public LlmResearchProvider(LlmService llmService, BraveSearchClient searchClient,
                               BlogsmithProperties properties) {
        this.llmService = llmService;
        this.searchClient = searchClient;
        this.queryCount = properties.getSearch().getQueries();
    }

    @Override
    public ResearchSummary research(String topic) {
        List<String> queries = planQueries(topic);
        Map<String, SearchResult> sources = gather(queries);
        if (sources.isEmpty()) {
            throw new SearchException("No search results for any of " + queries.size() + " queries on: " + topic);
        }

        String brief = llmService.textCall(SYNTHESIS_PROMPT, synthesisPrompt(topic, sources.values()));
        log.info("Research brief ready: {} chars from {} source(s)", brief.length(), sources.size());
        return new ResearchSummary(brief, List.copyOf(sources.keySet()));
    }

    List<String> planQueries(String topic) {
        var queries = new ArrayList<String>();
        queries.add(topic);
        try {
            var planned = llmService.structuredCall(QUERY_PROMPT,
                    "Topic: " + topic + "\nNumber of queries: " + queryCount, ResearchQueries.class);
            if (planned != null && planned.queries() != null) {
                planned.queries().stream()
                        .filter(q -> q != null && !q.isBlank())
                        .map(String::trim)
                        .filter(q -> !queries.contains(q))
                        .limit(queryCount)
                        .forEach(queries::add);
            }
        } catch (RuntimeException e) {
            log.warn("Query planning failed, using default queries: {}", e.getMessage());
        }
        if (queries.size() == 1) {
            queries.addAll(List.of(
                    topic + " best practices",
                    topic + " use cases",
                    topic + " latest developments"));
        }
        return queries;
    }

    /**
     * Runs every query; a failing query is skipped. Sources keep first-seen order.
     */
    Map<String, SearchResult> gather(List<String> queries) {
        var byUrl = new LinkedHashMap<String, SearchResult>();
        for (String query : queries) {
            try {
                for (SearchResult hit : searchClient.search(query)) {
                    byUrl.putIfAbsent(hit.url(), hit);
                }
            } catch (SearchException e) {
                log.warn("Search failed for '{}': {}", query, e.getMessage());
            }
        }
        return byUrl;
    }

    private static String synthesisPrompt(String topic, Iterable<SearchResult> sources) {
        var sb = new StringBuilder("Topic: ").append(topic).append("\n\nSources:\n");
        int n = 1;
        for (SearchResult source : sources) {
            sb.append('[').append(n++).append("] ").append(source.title())
                    .append("\n    URL: ").append(source.url())
                    .append("\n    ").append(source.description()).append('\n');
        }
        return sb.toString();
    }
}
