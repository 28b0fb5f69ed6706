package com.nutritioninsights.dietanalysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.Clock;

/**
 * 파이프라인 공용 Bean 설정.
 *
 * <p>{@link CsvMapper}도 {@link ObjectMapper} 타입이므로 Boot 자동 설정의 ObjectMapper가 등록되지 않는다.
 * 그래서 JSON용 ObjectMapper를 Boot의 {@link Jackson2ObjectMapperBuilder}로 직접 만들고
 * {@link Primary}로 지정한다.</p>
 */
@Configuration
@EnableConfigurationProperties(DietAnalysisProperties.class)
public class DietAnalysisConfig {

    /** JSON 문서 매퍼 ({@code spring.jackson.*} 설정 적용) */
    @Bean
    @Primary
    ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        return builder.build();
    }

    /** CSV 읽기/쓰기 공용 매퍼 */
    @Bean
    CsvMapper csvMapper() {
        return new CsvMapper();
    }

    /** run_metadata.json의 생성 시각 */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
