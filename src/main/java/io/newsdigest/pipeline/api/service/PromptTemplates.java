package io.newsdigest.pipeline.api.service;

import dev.langchain4j.model.input.PromptTemplate;
import io.newsdigest.pipeline.api.util.TextExcerpts;
import io.newsdigest.pipeline.config.AnalysisProperties;
import io.newsdigest.pipeline.model.Article;
import io.newsdigest.pipeline.model.SummaryKind;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class PromptTemplates {

    private static final PromptTemplate SUMMARY = PromptTemplate.from("""
            Summarize the following news article. Write a {{profile}} summary in plain prose.
            Stick to facts stated in the article and do not add opinions.

            Title: {{title}}
            Source: {{source}}

            {{content}}
            """);

    private static final PromptTemplate MULTI_ANALYSIS = PromptTemplate.from("""
            You are comparing how several news articles cover the same subject.
            Focus of the analysis: {{focus}}

            {{articles}}

            Describe where the articles agree, where they differ in facts or framing,
            and what each source emphasizes. Refer to articles by their number.
            """);

    private static final PromptTemplate HIGHLIGHT = PromptTemplate.from("""
            In one or two sentences, explain what the article below says that is relevant to the search "{{query}}".

            Title: {{title}}
            {{content}}
            """);

    private static final int SUMMARY_CONTENT_CHARS = 12_000;
    private static final int HIGHLIGHT_CONTENT_CHARS = 2_000;

    private final int contentCharsPerArticle;

    public PromptTemplates(AnalysisProperties analysis) {
        this.contentCharsPerArticle = analysis.contentCharsPerArticle();
    }

    public String summary(Article article, SummaryKind kind) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("profile", kind.instructionProfile());
        variables.put("title", article.getTitle());
        variables.put("source", article.getSource());
        variables.put("content", TextExcerpts.head(article.getContent(), SUMMARY_CONTENT_CHARS));

        return SUMMARY.apply(variables).text();
    }

    public String multiAnalysis(List<Article> articles, String focus) {
        StringBuilder block = new StringBuilder();
        for (int i = 0; i < articles.size(); i++) {
            Article article = articles.get(i);
            block.append("Article ").append(i + 1).append(" (").append(article.getSource()).append(")\n")
                    .append("Title: ").append(article.getTitle()).append('\n')
                    .append(TextExcerpts.head(article.getContent(), contentCharsPerArticle))
                    .append("\n\n");
        }

        Map<String, Object> variables = new HashMap<>();
        variables.put("focus", focus);
        variables.put("articles", block.toString().trim());

        return MULTI_ANALYSIS.apply(variables).text();
    }

    public String highlight(String query, Article article) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("query", query);
        variables.put("title", article.getTitle());
        variables.put("content", TextExcerpts.head(article.getContent(), HIGHLIGHT_CONTENT_CHARS));

        return HIGHLIGHT.apply(variables).text();
    }
}
