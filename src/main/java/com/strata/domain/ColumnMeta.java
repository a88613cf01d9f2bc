package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Name and backend type of one result column.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ColumnMeta {

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private String type;

    public ColumnMeta() {
    }

    public ColumnMeta(String name, String type) {
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }
}
