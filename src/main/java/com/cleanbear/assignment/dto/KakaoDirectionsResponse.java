package com.cleanbear.assignment.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Subset of the Kakao Mobility directions response that the distance lookup reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class KakaoDirectionsResponse {

    @JsonProperty("routes")
    private List<Route> routes;

    public List<Route> getRoutes() { return routes; }
    public void setRoutes(List<Route> routes) { this.routes = routes; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Route {

        @JsonProperty("result_code")
        private Integer resultCode;

        @JsonProperty("result_msg")
        private String resultMsg;

        @JsonProperty("summary")
        private Summary summary;

        public Integer getResultCode() { return resultCode; }
        public void setResultCode(Integer resultCode) { this.resultCode = resultCode; }

        public String getResultMsg() { return resultMsg; }
        public void setResultMsg(String resultMsg) { this.resultMsg = resultMsg; }

        public Summary getSummary() { return summary; }
        public void setSummary(Summary summary) { this.summary = summary; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Summary {

        @JsonProperty("distance")
        private long distance;   // meters

        @JsonProperty("duration")
        private long duration;   // seconds

        public long getDistance() { return distance; }
        public void setDistance(long distance) { this.distance = distance; }

        public long getDuration() { return duration; }
        public void setDuration(long duration) { this.duration = duration; }
    }
}
