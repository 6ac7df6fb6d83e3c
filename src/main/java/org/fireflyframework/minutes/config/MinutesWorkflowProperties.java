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

import org.fireflyframework.minutes.collection.ExecutionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the minutes workflow.
 * These properties can be configured via application.properties or application.yml.
 *
 * Example configuration:
 * <pre>
 * firefly.minutes.mail.enabled=true
 * firefly.minutes.mail.default-sender-address=noreply@example.org
 * firefly.minutes.collections.execution-mode=DEFERRED
 * firefly.minutes.journal.enabled=true
 * firefly.minutes.journal.provider=redis
 * firefly.minutes.journal.max-transition-age=PT5M
 * firefly.minutes.journal.redis.host=localhost
 * firefly.minutes.journal.redis.port=6379
 * firefly.minutes.journal.redis.key-prefix=firefly:minutes:
 * firefly.minutes.observability.metrics-enabled=true
 * </pre>
 */
@ConfigurationProperties(prefix = "firefly.minutes")
public class MinutesWorkflowProperties {

    private MailProperties mail = new MailProperties();

    private CollectionsProperties collections = new CollectionsProperties();

    private JournalProperties journal = new JournalProperties();

    private ObservabilityProperties observability = new ObservabilityProperties();

    public MailProperties getMail() {
        return mail;
    }

    public void setMail(MailProperties mail) {
        this.mail = mail;
    }

    public CollectionsProperties getCollections() {
        return collections;
    }

    public void setCollections(CollectionsProperties collections) {
        this.collections = collections;
    }

    public JournalProperties getJournal() {
        return journal;
    }

    public void setJournal(JournalProperties journal) {
        this.journal = journal;
    }

    public ObservabilityProperties getObservability() {
        return observability;
    }

    public void setObservability(ObservabilityProperties observability) {
        this.observability = observability;
    }

    /**
     * Finalize notification settings.
     */
    public static class MailProperties {
        /**
         * Whether finalize mails are sent at all.
         */
        private boolean enabled = false;

        /**
         * Sender used when the finalizing user has no mail address.
         */
        private String defaultSenderAddress;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDefaultSenderAddress() {
            return defaultSenderAddress;
        }

        public void setDefaultSenderAddress(String defaultSenderAddress) {
            this.defaultSenderAddress = defaultSenderAddress;
        }
    }

    public static class CollectionsProperties {
        /**
         * Where collection writes complete: on the calling thread or on a scheduler.
         */
        private ExecutionMode executionMode = ExecutionMode.IMMEDIATE;

        public ExecutionMode getExecutionMode() {
            return executionMode;
        }

        public void setExecutionMode(ExecutionMode executionMode) {
            this.executionMode = executionMode;
        }
    }

    /**
     * Transition journal settings.
     */
    public static class JournalProperties {
        private boolean enabled = true;

        /**
         * Journal backend: {@code in-memory} or {@code redis}.
         */
        private String provider = "in-memory";

        /**
         * In-flight transitions not updated for this long are reported as stale.
         */
        private Duration maxTransitionAge = Duration.ofMinutes(5);

        /**
         * Completed transitions older than this are purged.
         */
        private Duration retention = Duration.ofHours(24);

        private RedisProperties redis = new RedisProperties();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public Duration getMaxTransitionAge() {
            return maxTransitionAge;
        }

        public void setMaxTransitionAge(Duration maxTransitionAge) {
            this.maxTransitionAge = maxTransitionAge;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public RedisProperties getRedis() {
            return redis;
        }

        public void setRedis(RedisProperties redis) {
            this.redis = redis;
        }
    }

    public static class RedisProperties {
        private String host = "localhost";

        private int port = 6379;

        private int database = 0;

        private String password;

        private String keyPrefix = "firefly:minutes:";

        /**
         * TTL applied to journal keys; unset means keys live until purged.
         */
        private Duration keyTtl;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getDatabase() {
            return database;
        }

        public void setDatabase(int database) {
            this.database = database;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getKeyTtl() {
            return keyTtl;
        }

        public void setKeyTtl(Duration keyTtl) {
            this.keyTtl = keyTtl;
        }
    }

    public static class ObservabilityProperties {
        private boolean metricsEnabled = true;

        private boolean eventLoggingEnabled = true;

        public boolean isMetricsEnabled() {
            return metricsEnabled;
        }

        public void setMetricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
        }

        public boolean isEventLoggingEnabled() {
            return eventLoggingEnabled;
        }

        public void setEventLoggingEnabled(boolean eventLoggingEnabled) {
            this.eventLoggingEnabled = eventLoggingEnabled;
        }
    }
}
