package com.sandcastle.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "sandcastle.security")
public class SecurityProperties {

    private List<String> allowedBuiltins = new ArrayList<>(BuiltinAllowlist.DEFAULT_NAMES);

    public List<String> getAllowedBuiltins() {
        return allowedBuiltins;
    }

    public void setAllowedBuiltins(List<String> allowedBuiltins) {
        this.allowedBuiltins = allowedBuiltins;
    }
}
