package edu.purdue.dsnl.urllcsim.config;

import edu.purdue.dsnl.urllcsim.policy.PolicyType;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

/**
 * Reads a {@link SimulationConfig} from JSON. Keys are the snake_case field names; absent keys keep their defaults.
 */
public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static SimulationConfig load(File file) {
        String content;
        try {
            content = Files.readString(file.toPath());
        } catch (IOException e) {
            throw new ConfigException("Cannot read configuration " + file, e);
        }
        try {
            return fromJson(new JSONObject(content));
        } catch (JSONException e) {
            throw new ConfigException("Malformed configuration " + file + ": " + e.getMessage(), e);
        }
    }

    public static SimulationConfig fromJson(JSONObject json) {
        var b = SimulationConfig.builder();
        try {
            if (json.has("sim_duration")) {
                b.simDuration(json.getDouble("sim_duration"));
            }
            if (json.has("num_devices")) {
                b.numDevices(json.getInt("num_devices"));
            }
            if (json.has("arrival_rate")) {
                b.arrivalRate(json.getDouble("arrival_rate"));
            }
            if (json.has("packet_size")) {
                b.packetSize(json.getDouble("packet_size"));
            }
            if (json.has("num_resource_blocks")) {
                b.numResourceBlocks(json.getInt("num_resource_blocks"));
            }
            if (json.has("slot_duration")) {
                b.slotDuration(json.getDouble("slot_duration"));
            }
            if (json.has("subcarriers")) {
                b.subcarriers(json.getInt("subcarriers"));
            }
            if (json.has("data_rate_base")) {
                b.dataRateBase(json.getDouble("data_rate_base"));
            }
            if (json.has("priority_levels")) {
                JSONArray levels = json.getJSONArray("priority_levels");
                for (int i = 0; i < levels.length(); i++) {
                    b.priorityLevel(levels.getInt(i));
                }
            }
            if (json.has("max_latency")) {
                b.maxLatency(json.getDouble("max_latency"));
            }
            if (json.has("interference_rate")) {
                b.interferenceRate(json.getDouble("interference_rate"));
            }
            if (json.has("interference_min")) {
                b.interferenceMin(json.getDouble("interference_min"));
            }
            if (json.has("interference_max")) {
                b.interferenceMax(json.getDouble("interference_max"));
            }
            if (json.has("interference_baseline")) {
                b.interferenceBaseline(json.getDouble("interference_baseline"));
            }
            if (json.has("interference_burst_duration")) {
                b.interferenceBurstDuration(json.getDouble("interference_burst_duration"));
            }
            if (json.has("path_loss_exponent")) {
                b.pathLossExponent(json.getDouble("path_loss_exponent"));
            }
            if (json.has("time_varying")) {
                b.timeVarying(json.getBoolean("time_varying"));
            }
            if (json.has("variation_period")) {
                b.variationPeriod(json.getDouble("variation_period"));
            }
            if (json.has("variation_amplitude")) {
                b.variationAmplitude(json.getDouble("variation_amplitude"));
            }
            if (json.has("noise_power")) {
                b.noisePower(json.getDouble("noise_power"));
            }
            if (json.has("transmission_power")) {
                b.transmissionPower(json.getDouble("transmission_power"));
            }
            if (json.has("channel_bandwidth")) {
                b.channelBandwidth(json.getDouble("channel_bandwidth"));
            }
            if (json.has("subcarrier_bandwidth")) {
                b.subcarrierBandwidth(json.getDouble("subcarrier_bandwidth"));
            }
            if (json.has("sinr_threshold")) {
                b.sinrThreshold(json.getDouble("sinr_threshold"));
            }
            if (json.has("sinr_floor")) {
                b.sinrFloor(json.isNull("sinr_floor") ? null : json.getDouble("sinr_floor"));
            }
            if (json.has("random_seeds")) {
                JSONArray seeds = json.getJSONArray("random_seeds");
                for (int i = 0; i < seeds.length(); i++) {
                    b.randomSeed(seeds.getLong(i));
                }
            }
            if (json.has("scheduling_policy")) {
                b.schedulingPolicy(PolicyType.fromName(json.getString("scheduling_policy")));
            }
            if (json.has("device_configs")) {
                JSONArray classes = json.getJSONArray("device_configs");
                for (int i = 0; i < classes.length(); i++) {
                    b.deviceConfig(deviceClass(classes.getJSONObject(i), json));
                }
            }
            if (json.has("preemption_penalty")) {
                b.preemptionPenalty(json.getDouble("preemption_penalty"));
            }
            if (json.has("rr_quantum")) {
                b.rrQuantum(json.getDouble("rr_quantum"));
            }
            if (json.has("urgency_threshold")) {
                b.urgencyThreshold(json.getDouble("urgency_threshold"));
            }
            if (json.has("pf_window")) {
                b.pfWindow(json.getInt("pf_window"));
            }
            if (json.has("device_distance_min")) {
                b.deviceDistanceMin(json.getDouble("device_distance_min"));
            }
            if (json.has("device_distance_max")) {
                b.deviceDistanceMax(json.getDouble("device_distance_max"));
            }
        } catch (JSONException e) {
            throw new ConfigException("Invalid configuration value: " + e.getMessage(), e);
        }
        return b.build().validate();
    }

    // Class fields fall back to the top-level homogeneous values
    private static DeviceClass deviceClass(JSONObject json, JSONObject parent) {
        var defaults = SimulationConfig.defaults();
        return DeviceClass.builder()
                .count(json.getInt("count"))
                .arrivalRate(json.optDouble("arrival_rate",
                        parent.optDouble("arrival_rate", defaults.getArrivalRate())))
                .packetSize(json.optDouble("packet_size",
                        parent.optDouble("packet_size", defaults.getPacketSize())))
                .priority(json.optInt("priority", 2))
                .maxLatency(json.has("max_latency") ? json.getDouble("max_latency") : null)
                .build();
    }
}
