package org.lite.registry.config;

import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.ReactiveMongoDatabaseFactory;
import org.springframework.data.mongodb.ReactiveMongoTransactionManager;
import org.springframework.data.mongodb.config.AbstractReactiveMongoConfiguration;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;
import org.springframework.data.mongodb.repository.config.EnableReactiveMongoRepositories;
import org.springframework.lang.NonNull;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

import java.time.Clock;

@Configuration
@EnableReactiveMongoRepositories(basePackages = "org.lite.registry.repository")
@Slf4j
public class MongoReactiveConfig extends AbstractReactiveMongoConfiguration {

    /**
     * Stands in for {@code '.'} in stored map keys. Reads turn every occurrence back into a dot, so map keys
     * written through the registry must never contain it.
     */
    public static final String MAP_KEY_DOT_REPLACEMENT = "\uFF0E";

    @Value("${spring.data.mongodb.uri}")
    private String mongoUri;

    @Value("${spring.data.mongodb.database}")
    private String databaseName;

    @Override
    protected @NonNull String getDatabaseName() {
        return databaseName;
    }

    @Override
    @Bean
    public @NonNull MongoClient reactiveMongoClient() {
        log.info("Connecting to MongoDB database '{}'", databaseName);
        return MongoClients.create(mongoUri);
    }

    // Unique indexes on slug and (promptId, versionString) back the version store's conflict detection
    @Override
    protected boolean autoIndexCreation() {
        return true;
    }

    @Bean
    @Override
    public @NonNull MappingMongoConverter mappingMongoConverter(
            @NonNull ReactiveMongoDatabaseFactory databaseFactory,
            @NonNull MongoCustomConversions customConversions,
            @NonNull MongoMappingContext mappingContext) {

        MappingMongoConverter converter = super.mappingMongoConverter(databaseFactory, customConversions,
                mappingContext);
        configureMapKeys(converter);
        return converter;
    }

    // Dimension names may contain dots
    public static void configureMapKeys(MappingMongoConverter converter) {
        converter.setMapKeyDotReplacement(MAP_KEY_DOT_REPLACEMENT);
    }

    @Bean
    public ReactiveTransactionManager transactionManager(ReactiveMongoDatabaseFactory factory) {
        return new ReactiveMongoTransactionManager(factory);
    }

    @Bean
    public TransactionalOperator transactionalOperator(ReactiveTransactionManager transactionManager) {
        return TransactionalOperator.create(transactionManager);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
