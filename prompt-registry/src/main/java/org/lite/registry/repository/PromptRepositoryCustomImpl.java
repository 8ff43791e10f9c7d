package org.lite.registry.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.registry.entity.Prompt;
import org.lite.registry.enums.PromptStatus;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import reactor.core.publisher.Mono;

import java.time.Instant;

@RequiredArgsConstructor
@Slf4j
public class PromptRepositoryCustomImpl implements PromptRepositoryCustom {

    private final ReactiveMongoTemplate reactiveMongoTemplate;

    @Override
    public Mono<Prompt> compareAndSetHead(String promptId, String expectedHeadVersion,
                                          String newHeadVersion, long newHeadSequence, Instant updatedAt) {
        // is(null) also matches a missing field, which covers prompts written before the first version
        Query query = Query.query(Criteria.where("_id").is(promptId)
                .and("headVersion").is(expectedHeadVersion));
        Update update = new Update()
                .set("headVersion", newHeadVersion)
                .set("headSequence", newHeadSequence)
                .set("updatedAt", updatedAt);

        return reactiveMongoTemplate.findAndModify(query, update, FindAndModifyOptions.options().returnNew(true), Prompt.class)
                .doOnNext(prompt -> log.debug("Moved head of prompt {} from {} to {}", promptId, expectedHeadVersion, newHeadVersion));
    }

    @Override
    public Mono<Prompt> updateStatus(String promptId, PromptStatus status, String statusVersion, Instant updatedAt) {
        Query query = Query.query(Criteria.where("_id").is(promptId));
        Update update = new Update()
                .set("status", status)
                .set("statusVersion", statusVersion)
                .set("updatedAt", updatedAt);

        return reactiveMongoTemplate.findAndModify(query, update, FindAndModifyOptions.options().returnNew(true), Prompt.class);
    }
}
