package org.learningjava.settingscan.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "settingscan")
public class SettingScanProperties {

    public enum ParserMode { LOCAL, REMOTE }

    private String serviceEndpoint = "http://localhost:9432";
    private ParserMode parser = ParserMode.LOCAL;
    private String rootDirectory = "";
    private String fileExtensionFilter = ".java";
    private String outputPath = "settings.json";
    private String settingTypeName = "Setting";
    private String propertyAnchorName = "Property";
    private boolean runOnStartup = false;
    private Remote remote = new Remote();

    public String getServiceEndpoint() { return serviceEndpoint; }
    public void setServiceEndpoint(String v) { this.serviceEndpoint = v; }
    public ParserMode getParser() { return parser; }
    public void setParser(ParserMode v) { this.parser = v; }
    public String getRootDirectory() { return rootDirectory; }
    public void setRootDirectory(String v) { this.rootDirectory = v; }
    public String getFileExtensionFilter() { return fileExtensionFilter; }
    public void setFileExtensionFilter(String v) { this.fileExtensionFilter = v; }
    public String getOutputPath() { return outputPath; }
    public void setOutputPath(String v) { this.outputPath = v; }
    public String getSettingTypeName() { return settingTypeName; }
    public void setSettingTypeName(String v) { this.settingTypeName = v; }
    public String getPropertyAnchorName() { return propertyAnchorName; }
    public void setPropertyAnchorName(String v) { this.propertyAnchorName = v; }
    public boolean isRunOnStartup() { return runOnStartup; }
    public void setRunOnStartup(boolean v) { this.runOnStartup = v; }
    public Remote getRemote() { return remote; }
    public void setRemote(Remote v) { this.remote = v; }

    // HTTP tree producer
    public static class Remote {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private double multiplier = 2.0;

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration v) { this.connectTimeout = v; }
        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration v) { this.readTimeout = v; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int v) { this.maxAttempts = v; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration v) { this.initialBackoff = v; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double v) { this.multiplier = v; }
    }
}
