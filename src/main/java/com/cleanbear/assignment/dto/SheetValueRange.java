package com.cleanbear.assignment.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Google Sheets v4 {@code ValueRange}: rows of cell strings, first row is the header.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SheetValueRange {

    @JsonProperty("range")
    private String range;

    @JsonProperty("majorDimension")
    private String majorDimension;

    @JsonProperty("values")
    private List<List<String>> values;

    public String getRange() { return range; }
    public void setRange(String range) { this.range = range; }

    public String getMajorDimension() { return majorDimension; }
    public void setMajorDimension(String majorDimension) { this.majorDimension = majorDimension; }

    public List<List<String>> getValues() { return values; }
    public void setValues(List<List<String>> values) { this.values = values; }
}
