package com.blogsmith.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks credentials and thresholds before a run starts. Every problem is collected so the
 * operator sees them all at once.
 */
@Component
public class ConfigurationValidator {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationValidator.class);

    private static final Pattern GHOST_ADMIN_KEY = Pattern.compile("^[^:\\s]+:(?:[0-9a-fA-F]{2}){32,}$");

    private final BlogsmithProperties properties;

    public ConfigurationValidator(BlogsmithProperties properties) {
        this.properties = properties;
    }

    /**
     * Validates everything a full pipeline run needs.
     *
     * @throws ConfigurationException listing every problem found
     */
    public void validate(PipelineConfig config) {
        var problems = new ArrayList<String>();
        checkLlm(problems);
        checkSearch(problems);
        checkGhost(problems);
        checkWebhook(problems);
        checkRun(config, problems);
        raiseIfAny(problems);
    }

    /**
     * Validates what re-sending an archived post needs: only the publishing target.
     */
    public void validatePublishing() {
        var problems = new ArrayList<String>();
        checkGhost(problems);
        raiseIfAny(problems);
    }

    private void checkLlm(List<String> problems) {
        if (!properties.getLlm().hasApiKey()) {
            problems.add("blogsmith.llm.api-key is not set (OPENAI_API_KEY)");
        }
    }

    private void checkSearch(List<String> problems) {
        var search = properties.getSearch();
        if (isBlank(search.getBraveApiKey())) {
            problems.add("blogsmith.search.brave-api-key is not set (BRAVE_API_KEY)");
        }
        if (search.getMaxResults() <= 0) {
            problems.add("blogsmith.search.max-results must be positive, was " + search.getMaxResults());
        }
        if (search.getQueries() <= 0) {
            problems.add("blogsmith.search.queries must be positive, was " + search.getQueries());
        }
    }

    private void checkGhost(List<String> problems) {
        var ghost = properties.getGhost();
        if (isBlank(ghost.getApiUrl())) {
            problems.add("blogsmith.ghost.api-url is not set (GHOST_API_URL)");
        } else if (!ghost.getApiUrl().startsWith("http://") && !ghost.getApiUrl().startsWith("https://")) {
            problems.add("blogsmith.ghost.api-url must be an http(s) URL, was " + ghost.getApiUrl());
        }
        if (isBlank(ghost.getAdminApiKey())) {
            problems.add("blogsmith.ghost.admin-api-key is not set (GHOST_ADMIN_API_KEY)");
        } else if (!GHOST_ADMIN_KEY.matcher(ghost.getAdminApiKey()).matches()) {
            problems.add("blogsmith.ghost.admin-api-key must have the form <id>:<hex secret of at least 32 bytes>");
        }
    }

    private void checkWebhook(List<String> problems) {
        var webhook = properties.getWebhook();
        if (webhook.isEnabled() && isBlank(webhook.getUrl())) {
            problems.add("blogsmith.webhook.url is required when blogsmith.webhook.enabled is true");
        }
    }

    private void checkRun(PipelineConfig config, List<String> problems) {
        var t = config.thresholds();
        if (t.minWordCount() <= 0) {
            problems.add("minimum word count must be positive, was " + t.minWordCount());
        }
        if (t.minInlineLinks() <= 0) {
            problems.add("blogsmith.gate.min-inline-links must be positive, was " + t.minInlineLinks());
        }
        if (t.minSections() <= 0) {
            problems.add("blogsmith.gate.min-sections must be positive, was " + t.minSections());
        }
        if (config.maxRevisions() < 0) {
            problems.add("blogsmith.gate.max-revisions must not be negative, was " + config.maxRevisions());
        }
        if (config.stageTimeout().isNegative() || config.stageTimeout().isZero()) {
            problems.add("blogsmith.pipeline.stage-timeout must be positive, was " + config.stageTimeout());
        }
    }

    private static void raiseIfAny(List<String> problems) {
        if (!problems.isEmpty()) {
            log.error("Configuration invalid ({} problem(s))", problems.size());
            throw new ConfigurationException(problems);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
