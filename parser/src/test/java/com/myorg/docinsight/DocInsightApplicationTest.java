package com.myorg.docinsight;

import com.myorg.docinsight.config.InsightProperties;
import com.myorg.docinsight.controller.DocumentInsightController;
import com.myorg.docinsight.model.HeadingLevel;
import com.myorg.docinsight.service.implementation.InsightPipeline;
import com.myorg.docinsight.service.ranking.PersonaVocabulary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "docinsight.synthesis.top-sections=7")
@DisplayName("DocInsightApplication Tests")
class DocInsightApplicationTest {

    @Autowired
    private InsightProperties properties;

    @Autowired
    private InsightPipeline pipeline;

    @Autowired
    private PersonaVocabulary vocabulary;

    @Autowired
    private DocumentInsightController controller;

    @Test
    @DisplayName("should start the context with the engine wired")
    void shouldLoadContext() {
        assertThat(controller).isNotNull();
        assertThat(pipeline.getIndexHolder().current().isEmpty()).isTrue();
        assertThat(vocabulary.getCategories()).isNotEmpty();
    }

    @Test
    @DisplayName("should bind docinsight properties from configuration")
    void shouldBindProperties() {
        assertThat(properties.getSynthesis().getTopSections()).isEqualTo(7);
        assertThat(properties.getRanking().multiplierFor(HeadingLevel.H2)).isEqualTo(0.9);
        assertThat(properties.getPersona().getVocabularyLocation()).isEqualTo("classpath:persona-vocabulary.json");
        assertThat(properties.getPipeline().getDeadlineMs()).isEqualTo(60_000);
    }
}
