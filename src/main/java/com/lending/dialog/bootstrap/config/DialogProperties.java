package com.lending.dialog.bootstrap.config;

import java.math.BigDecimal;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dialog")
public class DialogProperties {

    private final SessionSettings session = new SessionSettings();
    private final Offers offers = new Offers();
    private final Decision decision = new Decision();
    private final Gateway gateway = new Gateway();
    private final Concurrency concurrency = new Concurrency();
    private final Kafka kafka = new Kafka();
    private final Redis redis = new Redis();
    private final Links links = new Links();
    private final Support support = new Support();

    public SessionSettings getSession() {
        return session;
    }

    public Offers getOffers() {
        return offers;
    }

    public Decision getDecision() {
        return decision;
    }

    public Gateway getGateway() {
        return gateway;
    }

    public Concurrency getConcurrency() {
        return concurrency;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Redis getRedis() {
        return redis;
    }

    public Links getLinks() {
        return links;
    }

    public Support getSupport() {
        return support;
    }

    public static class SessionSettings {
        private Duration inactivityThreshold = Duration.ofMinutes(30);
        private int minAge = 18;
        private int maxAge = 75;

        public Duration getInactivityThreshold() {
            return inactivityThreshold;
        }

        public void setInactivityThreshold(Duration inactivityThreshold) {
            this.inactivityThreshold = inactivityThreshold;
        }

        public int getMinAge() {
            return minAge;
        }

        public void setMinAge(int minAge) {
            this.minAge = minAge;
        }

        public int getMaxAge() {
            return maxAge;
        }

        public void setMaxAge(int maxAge) {
            this.maxAge = maxAge;
        }
    }

    public static class Offers {
        private int presentationCap = 3;
        private int maxOptionsPerPrompt = 3;

        public int getPresentationCap() {
            return presentationCap;
        }

        public void setPresentationCap(int presentationCap) {
            this.presentationCap = presentationCap;
        }

        public int getMaxOptionsPerPrompt() {
            return maxOptionsPerPrompt;
        }

        public void setMaxOptionsPerPrompt(int maxOptionsPerPrompt) {
            this.maxOptionsPerPrompt = maxOptionsPerPrompt;
        }
    }

    public static class Decision {
        private BigDecimal minMonthlyIncome = new BigDecimal("15000");

        public BigDecimal getMinMonthlyIncome() {
            return minMonthlyIncome;
        }

        public void setMinMonthlyIncome(BigDecimal minMonthlyIncome) {
            this.minMonthlyIncome = minMonthlyIncome;
        }
    }

    public static class Gateway {
        private Duration timeout = Duration.ofSeconds(5);
        private int poolSize = 8;
        private int queueCapacity = 64;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    public static class Concurrency {
        private Duration lockTimeout = Duration.ofSeconds(10);

        public Duration getLockTimeout() {
            return lockTimeout;
        }

        public void setLockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
        }
    }

    public static class Kafka {
        private final Topics topics = new Topics();
        private String groupId = "loan-dialog";
        private int partitions = 10;
        private int replicationFactor = 1;
        private Duration publishAckTimeout = Duration.ofSeconds(3);

        public Topics getTopics() {
            return topics;
        }

        public String getGroupId() {
            return groupId;
        }

        public void setGroupId(String groupId) {
            this.groupId = groupId;
        }

        public int getPartitions() {
            return partitions;
        }

        public void setPartitions(int partitions) {
            this.partitions = partitions;
        }

        public int getReplicationFactor() {
            return replicationFactor;
        }

        public void setReplicationFactor(int replicationFactor) {
            this.replicationFactor = replicationFactor;
        }

        public Duration getPublishAckTimeout() {
            return publishAckTimeout;
        }

        public void setPublishAckTimeout(Duration publishAckTimeout) {
            this.publishAckTimeout = publishAckTimeout;
        }
    }

    public static class Topics {
        private String inbound = "dialog-inbound";
        private String outbound = "dialog-outbound";
        private String dlq = "dialog-inbound-dlq";

        public String getInbound() {
            return inbound;
        }

        public void setInbound(String inbound) {
            this.inbound = inbound;
        }

        public String getOutbound() {
            return outbound;
        }

        public void setOutbound(String outbound) {
            this.outbound = outbound;
        }

        public String getDlq() {
            return dlq;
        }

        public void setDlq(String dlq) {
            this.dlq = dlq;
        }
    }

    public static class Redis {
        private String sessionPrefix = "dialog:session:";
        private Duration sessionTtl = Duration.ofDays(30);

        public String getSessionPrefix() {
            return sessionPrefix;
        }

        public void setSessionPrefix(String sessionPrefix) {
            this.sessionPrefix = sessionPrefix;
        }

        public Duration getSessionTtl() {
            return sessionTtl;
        }

        public void setSessionTtl(Duration sessionTtl) {
            this.sessionTtl = sessionTtl;
        }
    }

    public static class Links {
        private String agreementUrl = "https://example.com/docs/loan-agreement.pdf";
        private String statementUrl = "https://example.com/docs/loan-statement.pdf";
        private String appUrl = "https://play.google.com/store/apps/details?id=com.citrus.citruspay&hl=en_IN";
        private String repayUrl = "https://example.com/repay";
        private String supportEmail = "care@payufin.com";

        public String getAgreementUrl() {
            return agreementUrl;
        }

        public void setAgreementUrl(String agreementUrl) {
            this.agreementUrl = agreementUrl;
        }

        public String getStatementUrl() {
            return statementUrl;
        }

        public void setStatementUrl(String statementUrl) {
            this.statementUrl = statementUrl;
        }

        public String getAppUrl() {
            return appUrl;
        }

        public void setAppUrl(String appUrl) {
            this.appUrl = appUrl;
        }

        public String getRepayUrl() {
            return repayUrl;
        }

        public void setRepayUrl(String repayUrl) {
            this.repayUrl = repayUrl;
        }

        public String getSupportEmail() {
            return supportEmail;
        }

        public void setSupportEmail(String supportEmail) {
            this.supportEmail = supportEmail;
        }
    }

    public static class Support {
        private String handoffQueue = "payu-finance-support";
        private final Llm llm = new Llm();

        public String getHandoffQueue() {
            return handoffQueue;
        }

        public void setHandoffQueue(String handoffQueue) {
            this.handoffQueue = handoffQueue;
        }

        public Llm getLlm() {
            return llm;
        }
    }

    public static class Llm {
        private boolean enabled;
        private String apiKey;
        private String model = "gpt-4o-mini";
        private String url = "https://api.openai.com/v1/chat/completions";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }
    }
}
