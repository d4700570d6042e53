package com.eainde.extraction.config;

import com.eainde.extraction.adapter.CachingExtractionCallAdapter;
import com.eainde.extraction.adapter.ChatModelExtractionService;
import com.eainde.extraction.adapter.DefaultExtractionCallAdapter;
import com.eainde.extraction.adapter.ExtractionCallAdapter;
import com.eainde.extraction.adapter.ExtractionResponseParser;
import com.eainde.extraction.adapter.ExtractionService;
import com.eainde.extraction.pipeline.ExtractionPipeline;
import com.eainde.extraction.pipeline.PipelineSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Wires the extraction pipeline. The langchain4j {@link ChatModel} is supplied by
 * the deployment; a custom {@link ExtractionService} bean replaces the chat-model one.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ExtractionProperties.class)
public class ExtractionConfiguration {

    @Bean
    public PipelineSettings pipelineSettings(ExtractionProperties properties) {
        PipelineSettings settings = properties.toSettings();
        log.info("Lease extraction configured: target={} max={} overlap={} concurrency={} passes={}",
                settings.segmentation().targetChars(), settings.segmentation().maxChars(),
                settings.segmentation().overlapChars(), settings.orchestration().concurrency(),
                settings.passes().names());
        return settings;
    }

    @Bean
    @ConditionalOnMissingBean(ExtractionService.class)
    public ExtractionService extractionService(ChatModel chatModel, ObjectProvider<ObjectMapper> objectMapper) {
        return new ChatModelExtractionService(chatModel, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean(destroyMethod = "close")
    public DefaultExtractionCallAdapter defaultExtractionCallAdapter(ExtractionService extractionService,
                                                                     ExtractionProperties properties,
                                                                     ObjectProvider<ObjectMapper> objectMapper) {
        return new DefaultExtractionCallAdapter(extractionService,
                new ExtractionResponseParser(objectMapper.getIfAvailable(ObjectMapper::new)),
                properties.getAdapter().getMaxRequestChars());
    }

    @Bean
    @Primary
    public ExtractionCallAdapter extractionCallAdapter(DefaultExtractionCallAdapter defaultExtractionCallAdapter,
                                                       ExtractionProperties properties) {
        ExtractionProperties.Cache cache = properties.getAdapter().getCache();
        if (!cache.isEnabled()) {
            return defaultExtractionCallAdapter;
        }
        return new CachingExtractionCallAdapter(defaultExtractionCallAdapter, cache.getTtl(), cache.getMaximumSize());
    }

    @Bean
    public ExtractionPipeline extractionPipeline(ExtractionCallAdapter extractionCallAdapter,
                                                 PipelineSettings pipelineSettings) {
        return new ExtractionPipeline(extractionCallAdapter, pipelineSettings);
    }
}
