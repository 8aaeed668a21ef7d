package com.tenderwatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Locale;

@ConfigurationProperties(prefix = "tender")
public class TenderMonitorProperties {
    private static final String DEFAULT_USER_AGENT = "tender-monitor/0.1 (+contact)";

    private Collector collector = new Collector();
    private Store store = new Store();
    private Notifier notifier = new Notifier();
    private Whatsapp whatsapp = new Whatsapp();
    private Email email = new Email();
    private RunLock runLock = new RunLock();
    private Cli cli = new Cli();

    public Collector getCollector() {
        return collector;
    }

    public void setCollector(Collector collector) {
        this.collector = collector;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Notifier getNotifier() {
        return notifier;
    }

    public void setNotifier(Notifier notifier) {
        this.notifier = notifier;
    }

    public Whatsapp getWhatsapp() {
        return whatsapp;
    }

    public void setWhatsapp(Whatsapp whatsapp) {
        this.whatsapp = whatsapp;
    }

    public Email getEmail() {
        return email;
    }

    public void setEmail(Email email) {
        this.email = email;
    }

    public RunLock getRunLock() {
        return runLock;
    }

    public void setRunLock(RunLock runLock) {
        this.runLock = runLock;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Collector {
        private String listingUrl = "https://ppra.gov.pk/#/tenders/activetenders";
        private String renderer = "browser";
        private boolean headless = true;
        private String userAgent;
        private int timeoutSeconds = 30;
        private int graceSeconds = 10;

        public String getListingUrl() {
            return listingUrl;
        }

        public void setListingUrl(String listingUrl) {
            this.listingUrl = listingUrl;
        }

        /** {@code browser} renders the page in headless Chrome; {@code static} reads the served HTML as is. */
        public String getRenderer() {
            return renderer == null || renderer.isBlank() ? "browser" : renderer.trim().toLowerCase(Locale.ROOT);
        }

        public void setRenderer(String renderer) {
            this.renderer = renderer;
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getGraceSeconds() {
            return Math.max(0, graceSeconds);
        }

        public void setGraceSeconds(int graceSeconds) {
            this.graceSeconds = Math.max(0, graceSeconds);
        }
    }

    public static class Store {
        private String type = "jdbc";
        private String file = "data/tenders.json";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }
    }

    public static class Notifier {
        private int concurrency = 2;
        private int minSendIntervalMs = 1000;
        private int pacingThreshold = 3;
        private int maxRetries = 2;
        private int retryBaseDelayMs = 500;
        private int retryMaxDelayMs = 8000;
        private int sendTimeoutSeconds = 60;

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public int getMinSendIntervalMs() {
            return Math.max(0, minSendIntervalMs);
        }

        public void setMinSendIntervalMs(int minSendIntervalMs) {
            this.minSendIntervalMs = Math.max(0, minSendIntervalMs);
        }

        public int getPacingThreshold() {
            return Math.max(0, pacingThreshold);
        }

        public void setPacingThreshold(int pacingThreshold) {
            this.pacingThreshold = Math.max(0, pacingThreshold);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getRetryBaseDelayMs() {
            return retryBaseDelayMs;
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = retryBaseDelayMs;
        }

        public int getRetryMaxDelayMs() {
            return retryMaxDelayMs;
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = retryMaxDelayMs;
        }

        public int getSendTimeoutSeconds() {
            return Math.max(1, sendTimeoutSeconds);
        }

        public void setSendTimeoutSeconds(int sendTimeoutSeconds) {
            this.sendTimeoutSeconds = Math.max(1, sendTimeoutSeconds);
        }
    }

    public static class Whatsapp {
        private boolean enabled;
        private String to;
        private String from;
        private String accountSid;
        private String authToken;
        private String apiBaseUrl = "https://api.twilio.com";
        private int requestTimeoutSeconds = 20;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getTo() {
            return to;
        }

        public void setTo(String to) {
            this.to = to;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public String getAccountSid() {
            return accountSid;
        }

        public void setAccountSid(String accountSid) {
            this.accountSid = accountSid;
        }

        public String getAuthToken() {
            return authToken;
        }

        public void setAuthToken(String authToken) {
            this.authToken = authToken;
        }

        public String getApiBaseUrl() {
            return apiBaseUrl;
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public boolean hasCredentials() {
            return notBlank(accountSid) && notBlank(authToken) && notBlank(from);
        }
    }

    public static class Email {
        private boolean enabled;
        private String to;
        private String from;
        private String subjectPrefix = "New Tender Alert";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getTo() {
            return to;
        }

        public void setTo(String to) {
            this.to = to;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public String getSubjectPrefix() {
            return subjectPrefix;
        }

        public void setSubjectPrefix(String subjectPrefix) {
            this.subjectPrefix = subjectPrefix;
        }
    }

    public static class RunLock {
        private boolean enabled;
        private String file = "data/tender-monitor.lock";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }
    }

    public static class Cli {
        private boolean run = true;
        private String mode = "monitor";
        private String city = "";
        private String exportPath = "";
        private boolean exitAfterRun = true;
        private int shutdownWaitSeconds = 15;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getCity() {
            return city;
        }

        public void setCity(String city) {
            this.city = city;
        }

        public String getExportPath() {
            return exportPath;
        }

        public void setExportPath(String exportPath) {
            this.exportPath = exportPath;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }

        public int getShutdownWaitSeconds() {
            return Math.max(0, shutdownWaitSeconds);
        }

        public void setShutdownWaitSeconds(int shutdownWaitSeconds) {
            this.shutdownWaitSeconds = Math.max(0, shutdownWaitSeconds);
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
