package com.example.echocheck.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Location of the token verification endpoint, bound from {@code echocheck.auth.*}.
 */
@ConfigurationProperties(prefix = "echocheck.auth")
public class AuthProperties {
    private String verifyUrl = "http://localhost:8082/auth/me";
    private Duration timeout = Duration.ofSeconds(5);

    public String getVerifyUrl() { return verifyUrl; }
    public void setVerifyUrl(String verifyUrl) { this.verifyUrl = verifyUrl; }
    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }
}
