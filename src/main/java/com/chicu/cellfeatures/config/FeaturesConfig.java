package com.chicu.cellfeatures.config;

import com.chicu.cellfeatures.dataset.params.DirectoryProtocolParameterStore;
import com.chicu.cellfeatures.dataset.params.ProtocolParameterStore;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(CellFeaturesProperties.class)
public class FeaturesConfig {

    /**
     * Прогоны со стадии структурирования пишут NaN голым токеном: читаем и пишем так же.
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer nanTolerantJson() {
        return builder -> builder
                .featuresToEnable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS.mappedFeature())
                .featuresToDisable(JsonWriteFeature.WRITE_NAN_AS_STRINGS.mappedFeature());
    }

    @Bean
    @ConditionalOnMissingBean
    public ProtocolParameterStore protocolParameterStore(CellFeaturesProperties props) {
        return new DirectoryProtocolParameterStore(Path.of(props.getStorage().getParametersDir()));
    }

    /**
     * Тот же формат JSON без Spring-контекста.
     */
    public static ObjectMapper jsonMapper() {
        return JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }
}
