package io.newsdigest.pipeline.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LangChainConfig {

    private static final Logger logger = LoggerFactory.getLogger(LangChainConfig.class);

    @Bean
    public ChatModel chatModel(LlmProperties llm) {
        logger.info("Chat model: {} (temperature {}, timeout {})",
                llm.modelName(), llm.temperature(), llm.timeout());

        return OpenAiChatModel.builder()
                .baseUrl(llm.baseUrl())
                .apiKey(llm.apiKey())
                .modelName(llm.modelName())
                .temperature(llm.temperature())
                .timeout(llm.timeout())
                .build();
    }

    @Bean
    public EmbeddingModel embeddingModel(EmbeddingProperties embedding) {
        logger.info("Embedding model: {}", embedding.modelName());

        return OpenAiEmbeddingModel.builder()
                .baseUrl(embedding.baseUrl())
                .apiKey(embedding.apiKey())
                .modelName(embedding.modelName())
                .timeout(embedding.timeout())
                .build();
    }
}
