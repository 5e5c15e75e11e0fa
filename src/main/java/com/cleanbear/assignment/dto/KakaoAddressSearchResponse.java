package com.cleanbear.assignment.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class KakaoAddressSearchResponse {

    @JsonProperty("documents")
    private List<Document> documents;

    public List<Document> getDocuments() { return documents; }
    public void setDocuments(List<Document> documents) { this.documents = documents; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Document {

        @JsonProperty("address_name")
        private String addressName;

        @JsonProperty("x")
        private String x;  // longitude

        @JsonProperty("y")
        private String y;  // latitude

        public String getAddressName() { return addressName; }
        public void setAddressName(String addressName) { this.addressName = addressName; }

        public String getX() { return x; }
        public void setX(String x) { this.x = x; }

        public String getY() { return y; }
        public void setY(String y) { this.y = y; }
    }
}
