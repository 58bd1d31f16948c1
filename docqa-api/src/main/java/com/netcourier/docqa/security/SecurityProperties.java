package com.netcourier.docqa.security;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rag.security")
public class SecurityProperties {

    /**
     * Optional static bearer token used to authenticate requests when configured.
     */
    private String staticToken;

    /**
     * JWT claim that carries the owner id of the caller.
     */
    private String ownerClaim = "sub";

    public String getStaticToken() {
        return staticToken;
    }

    public void setStaticToken(String staticToken) {
        this.staticToken = staticToken;
    }

    public boolean hasStaticToken() {
        return staticToken != null && !staticToken.isBlank();
    }

    public String getOwnerClaim() {
        return ownerClaim;
    }

    public void setOwnerClaim(String ownerClaim) {
        this.ownerClaim = ownerClaim;
    }
}
