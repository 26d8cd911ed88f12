package com.example.mediacatalog_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "catalog.service")
public class ServiceInfoProperties {
    private String name = "mediacatalog";
    private String description = "Catalog and segment index for time-addressable media";
    private String version = "0.0.1";
    private String mediaStoreType = "http_object_store";

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public String getMediaStoreType() { return mediaStoreType; }
    public void setMediaStoreType(String mediaStoreType) { this.mediaStoreType = mediaStoreType; }
}
