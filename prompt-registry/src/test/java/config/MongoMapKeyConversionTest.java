package config;

import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lite.registry.config.MongoReactiveConfig;
import org.lite.registry.entity.BenchmarkResult;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.NoOpDbRefResolver;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MongoMapKeyConversionTest {

    private MappingMongoConverter converter;

    @BeforeEach
    void setUp() {
        converter = new MappingMongoConverter(NoOpDbRefResolver.INSTANCE, new MongoMappingContext());
        MongoReactiveConfig.configureMapKeys(converter);
        converter.afterPropertiesSet();
    }

    private BenchmarkResult roundTrip(BenchmarkResult result) {
        Document document = new Document();
        converter.write(result, document);
        return converter.read(BenchmarkResult.class, document);
    }

    @Test
    void testDimensionNamesSurvivePersistence() {
        // Given
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("token_efficiency", 90.0);
        scores.put("safety.v2", 75.0);
        scores.put("clarity", 88.0);
        BenchmarkResult result = BenchmarkResult.builder()
                .promptId("prompt-1")
                .versionId("version-1")
                .dimensionScores(scores)
                .weights(Map.of("token_efficiency", 2.0))
                .overallScore(85.0)
                .executedAt(Instant.parse("2026-03-10T12:00:00Z"))
                .build();

        // When
        BenchmarkResult read = roundTrip(result);

        // Then
        assertEquals(scores, read.getDimensionScores(), "Dimension names must come back unchanged");
        assertEquals(Map.of("token_efficiency", 2.0), read.getWeights());
    }

    @Test
    void testDottedDimensionNamesAreEscapedInStorage() {
        Document document = new Document();
        converter.write(BenchmarkResult.builder().dimensionScores(Map.of("safety.v2", 75.0)).build(), document);

        Map<?, ?> stored = (Map<?, ?>) document.get("dimensionScores");
        assertEquals(Map.of("safety" + MongoReactiveConfig.MAP_KEY_DOT_REPLACEMENT + "v2", 75.0), stored);
    }
}
