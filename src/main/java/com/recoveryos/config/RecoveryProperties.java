package com.recoveryos.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "recovery")
public class RecoveryProperties {

    private String riskScoreVersion = "0.1.0";
    private String promptVersion = "0.1.0";
    private String pseudonymSalt = "";
}
