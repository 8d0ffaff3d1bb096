package com.oracle.optmcts.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "optmcts.sandbox")
@Data
public class SandboxConfig {
    private String interpreter = "python3";
    private String scriptSuffix = ".py";
    private int maxExecutionTimeSeconds = 120;
    private String workDirPrefix = "optmcts_run_";
    private boolean keepWorkDirs = false;
    private int maxOutputChars = 20_000;
}
