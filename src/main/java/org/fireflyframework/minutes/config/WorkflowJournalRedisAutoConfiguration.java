/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.minutes.config;

import org.fireflyframework.minutes.collection.DocumentMapper;
import org.fireflyframework.minutes.persistence.WorkflowJournal;
import org.fireflyframework.minutes.persistence.impl.RedisWorkflowJournal;
import org.fireflyframework.minutes.persistence.serialization.JsonTransitionSerializer;
import org.fireflyframework.minutes.persistence.serialization.TransitionRecordSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Clock;

/**
 * Auto-configuration for the Redis transition journal.
 * <p>
 * Only loaded when Redis classes are available on the classpath and
 * {@code firefly.minutes.journal.provider=redis}. The Redis journal is registered as
 * {@code @Primary}, taking precedence over the in-memory default.
 */
@AutoConfiguration(before = RedisAutoConfiguration.class)
@EnableConfigurationProperties(MinutesWorkflowProperties.class)
@ConditionalOnClass({RedisConnectionFactory.class, ReactiveRedisTemplate.class})
@ConditionalOnProperty(name = "firefly.minutes.journal.provider", havingValue = "redis")
public class WorkflowJournalRedisAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WorkflowJournalRedisAutoConfiguration.class);

    /**
     * Connection factory built from {@code firefly.minutes.journal.redis.*}.
     * Only created when no custom connection factory is provided.
     */
    @Bean
    @ConditionalOnMissingBean(RedisConnectionFactory.class)
    public LettuceConnectionFactory minutesJournalRedisConnectionFactory(MinutesWorkflowProperties properties) {
        MinutesWorkflowProperties.RedisProperties redis = properties.getJournal().getRedis();

        log.info("Configuring Redis connection factory for the transition journal: {}:{}",
                redis.getHost(), redis.getPort());

        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(redis.getHost(), redis.getPort());
        standalone.setDatabase(redis.getDatabase());
        if (redis.getPassword() != null) {
            standalone.setPassword(RedisPassword.of(redis.getPassword()));
        }
        LettuceConnectionFactory factory = new LettuceConnectionFactory(standalone);
        factory.setValidateConnection(true);
        return factory;
    }

    @Bean
    @ConditionalOnMissingBean(name = "minutesJournalRedisTemplate")
    public ReactiveRedisTemplate<String, byte[]> minutesJournalRedisTemplate(ReactiveRedisConnectionFactory connectionFactory) {
        RedisSerializationContext<String, byte[]> context = RedisSerializationContext
                .<String, byte[]>newSerializationContext()
                .key(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .value(RedisSerializationContext.SerializationPair.fromSerializer(RedisSerializer.byteArray()))
                .hashKey(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .hashValue(RedisSerializationContext.SerializationPair.fromSerializer(RedisSerializer.byteArray()))
                .build();

        return new ReactiveRedisTemplate<>(connectionFactory, context);
    }

    @Bean
    @ConditionalOnMissingBean
    public TransitionRecordSerializer transitionRecordSerializer() {
        return new JsonTransitionSerializer(DocumentMapper.createDefaultObjectMapper());
    }

    @Bean
    @Primary
    @ConditionalOnProperty(name = "firefly.minutes.journal.enabled", havingValue = "true", matchIfMissing = true)
    public WorkflowJournal redisWorkflowJournal(ReactiveRedisTemplate<String, byte[]> minutesJournalRedisTemplate,
                                                TransitionRecordSerializer serializer,
                                                MinutesWorkflowProperties properties,
                                                ObjectProvider<Clock> clock) {
        MinutesWorkflowProperties.RedisProperties redis = properties.getJournal().getRedis();
        log.info("Configuring Redis transition journal with key prefix: {}", redis.getKeyPrefix());
        return new RedisWorkflowJournal(minutesJournalRedisTemplate, serializer, redis,
                clock.getIfAvailable(Clock::systemUTC));
    }
}
