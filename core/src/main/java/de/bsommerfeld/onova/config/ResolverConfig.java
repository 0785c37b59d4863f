package de.bsommerfeld.onova.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where packages come from. An empty {@code type} means the resolver is
 * supplied in code.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResolverConfig {

    @JsonProperty("type")
    private String type = "";

    @JsonProperty("location")
    private String location = "";

    @JsonProperty("asset-pattern")
    private String assetPattern = "*.onv";

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getAssetPattern() {
        return assetPattern;
    }

    public void setAssetPattern(String assetPattern) {
        this.assetPattern = assetPattern;
    }
}
