package com.example.echocheck.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the remote stance classifier, bound from {@code echocheck.classifier.*}.
 */
@ConfigurationProperties(prefix = "echocheck.classifier")
public class ClassifierProperties {
    private String url = "http://localhost:8081/predict";
    private String modelName = "alxdev/echocheck-political-stance";
    private String apiToken;
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(30);

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getModelName() { return modelName; }
    public void setModelName(String modelName) { this.modelName = modelName; }
    public String getApiToken() { return apiToken; }
    public void setApiToken(String apiToken) { this.apiToken = apiToken; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
}
