package edu.purdue.dsnl.urllcsim.config;

import edu.purdue.dsnl.urllcsim.policy.PolicyType;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Everything one run needs. Times are in seconds, sizes in bits, powers in dBm, rates in bits per second unless a
 * field says otherwise. The defaults describe ten devices sharing three resource blocks.
 */
@Data
@Builder(toBuilder = true)
public class SimulationConfig {
    @Builder.Default
    private final double simDuration = 10;

    @Builder.Default
    private final int numDevices = 10;

    @Builder.Default
    private final double arrivalRate = 10;

    @Builder.Default
    private final double packetSize = 1024;

    @Builder.Default
    private final int numResourceBlocks = 3;

    /** Milliseconds. */
    @Builder.Default
    private final double slotDuration = 0.125;

    @Builder.Default
    private final int subcarriers = 12;

    /** Upper bound on the achievable rate of one block; non-positive disables the cap. */
    @Builder.Default
    private final double dataRateBase = 20_000_000;

    @Singular
    private final List<Integer> priorityLevels;

    @Builder.Default
    private final double maxLatency = 0.005;

    @Builder.Default
    private final double interferenceRate = 1;

    @Builder.Default
    private final double interferenceMin = -90;

    @Builder.Default
    private final double interferenceMax = -80;

    @Builder.Default
    private final double interferenceBaseline = -90;

    @Builder.Default
    private final double interferenceBurstDuration = 0.05;

    /** Coefficient of the distance term is ten times this value; 3.76 gives the 3GPP urban 37.6. */
    @Builder.Default
    private final double pathLossExponent = 3.76;

    @Builder.Default
    private final boolean timeVarying = false;

    @Builder.Default
    private final double variationPeriod = 1.0;

    @Builder.Default
    private final double variationAmplitude = 0.2;

    /** dBm/Hz. */
    @Builder.Default
    private final double noisePower = -174;

    @Builder.Default
    private final double transmissionPower = 23;

    /** Hz, used for the thermal noise floor. */
    @Builder.Default
    private final double channelBandwidth = 100e6;

    /** Hz per subcarrier, used for the Shannon rate of a block. */
    @Builder.Default
    private final double subcarrierBandwidth = 30e3;

    @Builder.Default
    private final double sinrThreshold = 3.0;

    /** Lower clamp on computed SINR in dB; {@code null} leaves SINR unclamped. */
    @Builder.Default
    private final Double sinrFloor = 0.1;

    @Singular
    private final List<Long> randomSeeds;

    @Builder.Default
    private final PolicyType schedulingPolicy = PolicyType.HYBRID_EDF_PREEMPTIVE;

    @Singular
    private final List<DeviceClass> deviceConfigs;

    @Builder.Default
    private final double preemptionPenalty = 1e-4;

    @Builder.Default
    private final double rrQuantum = 0.001;

    @Builder.Default
    private final double urgencyThreshold = 0.001;

    @Builder.Default
    private final int pfWindow = 10;

    @Builder.Default
    private final double deviceDistanceMin = 10;

    @Builder.Default
    private final double deviceDistanceMax = 100;

    public static SimulationConfig defaults() {
        return builder().build();
    }

    /** Priority levels to draw from; {@code [1, 2, 3]} when none were given. */
    public List<Integer> effectivePriorityLevels() {
        return priorityLevels.isEmpty() ? List.of(1, 2, 3) : priorityLevels;
    }

    public List<Long> effectiveSeeds() {
        return randomSeeds.isEmpty() ? List.of(42L, 43L, 44L, 45L, 46L) : randomSeeds;
    }

    public boolean isHeterogeneous() {
        return !deviceConfigs.isEmpty();
    }

    public int totalDevices() {
        return isHeterogeneous() ? deviceConfigs.stream().mapToInt(DeviceClass::getCount).sum() : numDevices;
    }

    public SimulationConfig validate() {
        positive("sim_duration", simDuration);
        positive("arrival_rate", arrivalRate);
        positive("packet_size", packetSize);
        positive("max_latency", maxLatency);
        positive("subcarrier_bandwidth", subcarrierBandwidth);
        positive("channel_bandwidth", channelBandwidth);
        positive("rr_quantum", rrQuantum);
        positive("variation_period", variationPeriod);
        if (numResourceBlocks < 1) {
            throw new ConfigException("num_resource_blocks must be at least 1, got " + numResourceBlocks);
        }
        if (subcarriers < 1) {
            throw new ConfigException("subcarriers must be at least 1, got " + subcarriers);
        }
        if (numDevices < 0) {
            throw new ConfigException("num_devices must not be negative, got " + numDevices);
        }
        if (interferenceRate < 0) {
            throw new ConfigException("interference_rate must not be negative, got " + interferenceRate);
        }
        if (interferenceMin > interferenceMax) {
            throw new ConfigException(String.format("interference_min %f exceeds interference_max %f",
                    interferenceMin, interferenceMax));
        }
        if (interferenceBurstDuration < 0) {
            throw new ConfigException(
                    "interference_burst_duration must not be negative, got " + interferenceBurstDuration);
        }
        if (preemptionPenalty < 0) {
            throw new ConfigException("preemption_penalty must not be negative, got " + preemptionPenalty);
        }
        if (pfWindow < 1) {
            throw new ConfigException("pf_window must be at least 1, got " + pfWindow);
        }
        if (deviceDistanceMin <= 0 || deviceDistanceMin > deviceDistanceMax) {
            throw new ConfigException(String.format("device distance range [%f, %f] is invalid", deviceDistanceMin,
                    deviceDistanceMax));
        }
        if (schedulingPolicy == null) {
            throw new ConfigException("scheduling_policy is required");
        }
        for (var dc : deviceConfigs) {
            if (dc.getCount() < 0) {
                throw new ConfigException("device_configs count must not be negative, got " + dc.getCount());
            }
            positive("device_configs arrival_rate", dc.getArrivalRate());
            positive("device_configs packet_size", dc.getPacketSize());
            if (dc.getMaxLatency() != null) {
                positive("device_configs max_latency", dc.getMaxLatency());
            }
        }
        return this;
    }

    private static void positive(String key, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new ConfigException(key + " must be a positive number, got " + value);
        }
    }
}
