package org.example.smartlearn.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "quiz")
public class QuizProperties {

    private boolean enabled = true;
    private boolean seedDemoData = false;
    private Session session = new Session();
    private Sampling sampling = new Sampling();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isSeedDemoData() {
        return seedDemoData;
    }

    public void setSeedDemoData(boolean seedDemoData) {
        this.seedDemoData = seedDemoData;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session == null ? new Session() : session;
    }

    public Sampling getSampling() {
        return sampling;
    }

    public void setSampling(Sampling sampling) {
        this.sampling = sampling == null ? new Sampling() : sampling;
    }

    public static class Session {
        private int defaultQuestionCount = 5;
        private int maxQuestionCount = 50;

        public int getDefaultQuestionCount() {
            return defaultQuestionCount;
        }

        public void setDefaultQuestionCount(int defaultQuestionCount) {
            this.defaultQuestionCount = defaultQuestionCount;
        }

        public int getMaxQuestionCount() {
            return maxQuestionCount;
        }

        public void setMaxQuestionCount(int maxQuestionCount) {
            this.maxQuestionCount = maxQuestionCount;
        }
    }

    public static class Sampling {
        // Fixed seed for reproducible question order; unset means a fresh seed per start.
        private Long seed;

        public Long getSeed() {
            return seed;
        }

        public void setSeed(Long seed) {
            this.seed = seed;
        }
    }
}
