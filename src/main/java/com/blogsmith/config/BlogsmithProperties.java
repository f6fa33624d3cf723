package com.blogsmith.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * All {@code blogsmith.*} settings, bound from {@code application.yml} and the environment.
 * Validated by {@link ConfigurationValidator} before any run starts.
 */
@Component
@ConfigurationProperties(prefix = "blogsmith")
public class BlogsmithProperties {

    private final Gate gate = new Gate();
    private final Content content = new Content();
    private final Pipeline pipeline = new Pipeline();
    private final Publish publish = new Publish();
    private final Ghost ghost = new Ghost();
    private final Search search = new Search();
    private final Webhook webhook = new Webhook();
    private final Llm llm = new Llm();

    public Gate getGate() {
        return gate;
    }

    public Content getContent() {
        return content;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public Publish getPublish() {
        return publish;
    }

    public Ghost getGhost() {
        return ghost;
    }

    public Search getSearch() {
        return search;
    }

    public Webhook getWebhook() {
        return webhook;
    }

    public Llm getLlm() {
        return llm;
    }

    public static class Gate {
        private int minWordCount = 3500;
        private int minInlineLinks = 10;
        private int minSections = 4;
        private int maxRevisions = 3;

        public int getMinWordCount() { return minWordCount; }
        public void setMinWordCount(int minWordCount) { this.minWordCount = minWordCount; }

        public int getMinInlineLinks() { return minInlineLinks; }
        public void setMinInlineLinks(int minInlineLinks) { this.minInlineLinks = minInlineLinks; }

        public int getMinSections() { return minSections; }
        public void setMinSections(int minSections) { this.minSections = minSections; }

        public int getMaxRevisions() { return maxRevisions; }
        public void setMaxRevisions(int maxRevisions) { this.maxRevisions = maxRevisions; }
    }

    public static class Content {
        private String tone = "professional and informative";
        private String instructions = "";

        public String getTone() { return tone; }
        public void setTone(String tone) { this.tone = tone; }

        public String getInstructions() { return instructions; }
        public void setInstructions(String instructions) { this.instructions = instructions; }
    }

    public static class Pipeline {
        private Duration stageTimeout = Duration.ofMinutes(5);

        public Duration getStageTimeout() { return stageTimeout; }
        public void setStageTimeout(Duration stageTimeout) { this.stageTimeout = stageTimeout; }
    }

    public static class Publish {
        private boolean draft = true;
        private String outputDir = "output";
        private boolean archiveEnabled = true;
        private List<String> defaultTags = new ArrayList<>(List.of("blog", "auto-generated"));

        public boolean isDraft() { return draft; }
        public void setDraft(boolean draft) { this.draft = draft; }

        public String getOutputDir() { return outputDir; }
        public void setOutputDir(String outputDir) { this.outputDir = outputDir; }

        public boolean isArchiveEnabled() { return archiveEnabled; }
        public void setArchiveEnabled(boolean archiveEnabled) { this.archiveEnabled = archiveEnabled; }

        public List<String> getDefaultTags() { return defaultTags; }
        public void setDefaultTags(List<String> defaultTags) { this.defaultTags = defaultTags; }
    }

    public static class Ghost {
        private String apiUrl = "";
        /** Admin API key in Ghost's {@code <id>:<hex secret>} form. */
        private String adminApiKey = "";
        private String authorId = "";

        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }

        public String getAdminApiKey() { return adminApiKey; }
        public void setAdminApiKey(String adminApiKey) { this.adminApiKey = adminApiKey; }

        public String getAuthorId() { return authorId; }
        public void setAuthorId(String authorId) { this.authorId = authorId; }
    }

    public static class Search {
        private String braveApiKey = "";
        private String braveUrl = "https://api.search.brave.com/res/v1/web/search";
        private int maxResults = 10;
        private int queries = 3;

        public String getBraveApiKey() { return braveApiKey; }
        public void setBraveApiKey(String braveApiKey) { this.braveApiKey = braveApiKey; }

        public String getBraveUrl() { return braveUrl; }
        public void setBraveUrl(String braveUrl) { this.braveUrl = braveUrl; }

        public int getMaxResults() { return maxResults; }
        public void setMaxResults(int maxResults) { this.maxResults = maxResults; }

        public int getQueries() { return queries; }
        public void setQueries(int queries) { this.queries = queries; }
    }

    public static class Webhook {
        private boolean enabled = false;
        private String url = "";
        private Duration timeout = Duration.ofSeconds(30);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Llm {
        private String apiKey = "";

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank() && !"not-configured".equals(apiKey);
        }
    }
}
