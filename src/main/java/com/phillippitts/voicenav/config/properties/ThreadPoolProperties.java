package com.phillippitts.voicenav.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The event pool runs utterances submitted over REST and from hotkeys. It is
 * single-threaded by default so utterances execute in arrival order.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private EventPoolProperties event = new EventPoolProperties();

    public EventPoolProperties getEvent() {
        return event;
    }

    public void setEvent(EventPoolProperties event) {
        this.event = event;
    }

    /**
     * Utterance executor pool configuration.
     */
    public static class EventPoolProperties {
        private int corePoolSize = 1;
        private int maxPoolSize = 1;
        private int queueCapacity = 20;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "utterance-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
