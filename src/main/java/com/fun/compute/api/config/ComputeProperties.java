package com.fun.compute.api.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.compute")
public class ComputeProperties {

    @NotBlank
    private String baseUrl = "http://127.0.0.1:8774/internal/v1";
    @NotBlank
    private String requestedBy = "fun-compute-api";
    private boolean allowAdminApi = false;
    private boolean allowInstanceSnapshots = true;
    @Min(1)
    private int passwordLength = 12;
    /** Seconds a deleted instance stays reclaimable; zero means delete immediately. */
    @Min(0)
    private int reclaimInstanceInterval = 0;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getRequestedBy() {
        return requestedBy;
    }

    public void setRequestedBy(String requestedBy) {
        this.requestedBy = requestedBy;
    }

    public boolean isAllowAdminApi() {
        return allowAdminApi;
    }

    public void setAllowAdminApi(boolean allowAdminApi) {
        this.allowAdminApi = allowAdminApi;
    }

    public boolean isAllowInstanceSnapshots() {
        return allowInstanceSnapshots;
    }

    public void setAllowInstanceSnapshots(boolean allowInstanceSnapshots) {
        this.allowInstanceSnapshots = allowInstanceSnapshots;
    }

    public int getPasswordLength() {
        return passwordLength;
    }

    public void setPasswordLength(int passwordLength) {
        this.passwordLength = passwordLength;
    }

    public int getReclaimInstanceInterval() {
        return reclaimInstanceInterval;
    }

    public void setReclaimInstanceInterval(int reclaimInstanceInterval) {
        this.reclaimInstanceInterval = reclaimInstanceInterval;
    }
}
