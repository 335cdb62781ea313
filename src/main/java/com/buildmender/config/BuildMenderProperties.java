package com.buildmender.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * All tunables of the repair loop in one place.
 *
 * The timeouts, attempt cap and generation settings are plain fields here so a
 * single RepairOrchestrator serves every deployment; nothing is hardcoded per
 * variant.
 */
@ConfigurationProperties(prefix = "buildmender")
public class BuildMenderProperties {

    private String workspacePath = "temp_projects";
    private Repair repair = new Repair();
    private Build build = new Build();
    private Oracle oracle = new Oracle();
    private Http http = new Http();
    private Source source = new Source();

    public static class Repair {
        private int maxAttempts = 3;
        private Duration buildTimeout = Duration.ofMinutes(10);
        private Duration oracleTimeout = Duration.ofMinutes(2);
        /** 0 disables the repeated-timeout abort. */
        private int maxConsecutiveBuildTimeouts = 2;
        private int excerptBudget = 1500;
        private int excerptTailLines = 50;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getBuildTimeout() { return buildTimeout; }
        public void setBuildTimeout(Duration buildTimeout) { this.buildTimeout = buildTimeout; }
        public Duration getOracleTimeout() { return oracleTimeout; }
        public void setOracleTimeout(Duration oracleTimeout) { this.oracleTimeout = oracleTimeout; }
        public int getMaxConsecutiveBuildTimeouts() { return maxConsecutiveBuildTimeouts; }
        public void setMaxConsecutiveBuildTimeouts(int maxConsecutiveBuildTimeouts) {
            this.maxConsecutiveBuildTimeouts = maxConsecutiveBuildTimeouts;
        }
        public int getExcerptBudget() { return excerptBudget; }
        public void setExcerptBudget(int excerptBudget) { this.excerptBudget = excerptBudget; }
        public int getExcerptTailLines() { return excerptTailLines; }
        public void setExcerptTailLines(int excerptTailLines) { this.excerptTailLines = excerptTailLines; }
    }

    public static class Build {
        private String wrapperName = "gradlew";
        private String globalCommand = "gradle";
        private List<String> arguments = new ArrayList<>(List.of("build", "--stacktrace"));

        public String getWrapperName() { return wrapperName; }
        public void setWrapperName(String wrapperName) { this.wrapperName = wrapperName; }
        public String getGlobalCommand() { return globalCommand; }
        public void setGlobalCommand(String globalCommand) { this.globalCommand = globalCommand; }
        public List<String> getArguments() { return arguments; }
        public void setArguments(List<String> arguments) { this.arguments = arguments; }
    }

    public static class Oracle {
        private double temperature = 0.7;
        private int maxTokens = 2048;
        private int contextWindow = 4096;

        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }
        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
        public int getContextWindow() { return contextWindow; }
        public void setContextWindow(int contextWindow) { this.contextWindow = contextWindow; }
    }

    public static class Http {
        private int maxOutputChars = 4000;

        public int getMaxOutputChars() { return maxOutputChars; }
        public void setMaxOutputChars(int maxOutputChars) { this.maxOutputChars = maxOutputChars; }
    }

    public static class Source {
        private String gitCommand = "git";
        private boolean updateExisting = false;
        private Duration timeout = Duration.ofMinutes(5);

        public String getGitCommand() { return gitCommand; }
        public void setGitCommand(String gitCommand) { this.gitCommand = gitCommand; }
        public boolean isUpdateExisting() { return updateExisting; }
        public void setUpdateExisting(boolean updateExisting) { this.updateExisting = updateExisting; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public String getWorkspacePath() {
        return workspacePath;
    }

    public void setWorkspacePath(String workspacePath) {
        this.workspacePath = workspacePath;
    }

    public Repair getRepair() {
        return repair;
    }

    public void setRepair(Repair repair) {
        this.repair = repair;
    }

    public Build getBuild() {
        return build;
    }

    public void setBuild(Build build) {
        this.build = build;
    }

    public Oracle getOracle() {
        return oracle;
    }

    public void setOracle(Oracle oracle) {
        this.oracle = oracle;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Source getSource() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }
}
