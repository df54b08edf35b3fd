package com.myorg.docinsight.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.docinsight.service.FragmentExtractor;
import com.myorg.docinsight.service.implementation.DocumentLoader;
import com.myorg.docinsight.service.implementation.InsightPipeline;
import com.myorg.docinsight.service.implementation.PdfBoxFragmentExtractor;
import com.myorg.docinsight.service.ranking.PersonaVocabulary;
import com.myorg.docinsight.service.ranking.PersonaVocabularyLoader;
import com.myorg.docinsight.service.text.SimpleTextTokenizer;
import com.myorg.docinsight.service.text.TextTokenizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/** Wires the engine from {@link InsightProperties}. */
@Configuration
@EnableConfigurationProperties(InsightProperties.class)
public class InsightConfig {

    @Bean(name = "structuringExecutor")
    public ThreadPoolTaskExecutor structuringExecutor(InsightProperties props) {
        int threads = Math.max(1, props.getPipeline().getWorkerThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(100);
        // a full queue runs the document on the submitting thread instead of failing the collection
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("doc-struct-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TextTokenizer textTokenizer() {
        return new SimpleTextTokenizer();
    }

    @Bean
    public PersonaVocabulary personaVocabulary(InsightProperties props, ObjectMapper mapper,
                                               ResourceLoader resourceLoader) throws IOException {
        return new PersonaVocabularyLoader(mapper, resourceLoader).load(props.getPersona().getVocabularyLocation());
    }

    @Bean
    public FragmentExtractor fragmentExtractor() {
        return new PdfBoxFragmentExtractor();
    }

    @Bean
    public DocumentLoader documentLoader(FragmentExtractor extractor) {
        return new DocumentLoader(extractor);
    }

    @Bean
    public InsightPipeline insightPipeline(InsightProperties props, Executor structuringExecutor,
                                           TextTokenizer tokenizer, PersonaVocabulary vocabulary, Clock clock) {
        return InsightPipeline.create(props, structuringExecutor, tokenizer, vocabulary, clock);
    }
}
