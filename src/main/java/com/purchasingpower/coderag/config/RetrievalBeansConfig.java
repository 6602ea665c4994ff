package com.purchasingpower.coderag.config;

import com.purchasingpower.coderag.chunking.Chunker;
import com.purchasingpower.coderag.chunking.impl.UniversalChunker;
import com.purchasingpower.coderag.configuration.CodeRagProperties;
import com.purchasingpower.coderag.configuration.LockProperties;
import com.purchasingpower.coderag.configuration.SearchProperties;
import com.purchasingpower.coderag.lock.RepoLock;
import com.purchasingpower.coderag.lock.impl.FileRepoLock;
import com.purchasingpower.coderag.lock.impl.InMemoryRepoLock;
import com.purchasingpower.coderag.lock.impl.RedisRepoLock;
import com.purchasingpower.coderag.search.QueryTokenizer;
import com.purchasingpower.coderag.search.ReciprocalRankFusion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.JedisPool;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Beans for the retrieval core that are plain objects rather than components.
 */
@Slf4j
@Configuration
public class RetrievalBeansConfig {

    @Bean
    public Chunker chunker(CodeRagProperties properties) {
        return new UniversalChunker(properties.getChunker());
    }

    @Bean
    public QueryTokenizer queryTokenizer(CodeRagProperties properties) {
        return new QueryTokenizer(properties.getSearch().getTokenizePattern());
    }

    @Bean
    public ReciprocalRankFusion reciprocalRankFusion(CodeRagProperties properties) {
        SearchProperties search = properties.getSearch();
        return new ReciprocalRankFusion(search.getRrfK(), search.getVectorWeight(), search.getLexicalWeight());
    }

    @Bean
    public RepoLock repoLock(CodeRagProperties properties) {
        LockProperties lock = properties.getLock();
        switch (lock.getBackend()) {
            case DISTRIBUTED:
                log.info("🔐 Using Redis repository lock at {}:{}", lock.getRedisHost(), lock.getRedisPort());
                return new RedisRepoLock(new JedisPool(lock.getRedisHost(), lock.getRedisPort()),
                        Duration.ofSeconds(lock.getLeaseSeconds()));
            case FILE:
                log.info("🔐 Using file repository lock in {}", lock.getDir());
                return new FileRepoLock(Path.of(lock.getDir()));
            case IN_PROCESS:
            default:
                log.info("🔐 Using in-process repository lock");
                return new InMemoryRepoLock();
        }
    }
}
