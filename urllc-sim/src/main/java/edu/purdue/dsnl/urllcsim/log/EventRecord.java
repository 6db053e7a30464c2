package edu.purdue.dsnl.urllcsim.log;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.Data;
import lombok.experimental.Accessors;

/**
 * One row of the analysis event stream. Device and packet ids are {@code -1} for global records. Metric fields are
 * left {@code null} when they do not apply and serialize as empty cells.
 */
@Data
@Accessors(chain = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({ "time", "device_id", "packet_id", "event", "latency", "percentile_latency", "throughput",
        "reliability", "aoi", "sinr", "fairness", "data_rate", "bits" })
public class EventRecord {
    private final double time;

    private final int deviceId;

    private final long packetId;

    @JsonIgnore
    private final EventTag tag;

    private Double latency;

    private Double percentileLatency;

    private Double throughput;

    private Double reliability;

    private Double aoi;

    private Double sinr;

    private Double fairness;

    private Double dataRate;

    private Double bits;

    public String getEvent() {
        return tag.getTag();
    }
}
