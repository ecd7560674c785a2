package com.gdin.inspection.erpvector.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.ai.odoo")
@Component
public class OdooProperties implements Serializable {
    private String url;
    private String db;
    private String username;
    /** 密码或 API key */
    private String password;
    private Long timeoutSeconds = 60L;
    /** 内网自签名证书时置为 true */
    private boolean trustAllCertificates = false;
}
