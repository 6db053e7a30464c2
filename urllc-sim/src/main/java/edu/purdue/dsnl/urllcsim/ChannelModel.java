package edu.purdue.dsnl.urllcsim;

import edu.purdue.dsnl.urllcsim.config.SimulationConfig;

import lombok.Getter;
import lombok.Setter;

/**
 * Uplink channel between a device and the base station.
 *
 * <p>Path loss follows the 3GPP urban macro form {@code 35.3 + 10 n log10(d)}; with the default exponent of 3.76
 * this is {@code 35.3 + 37.6 log10(d)}. When time variation is enabled the exponent swings sinusoidally around its
 * base value with the configured period and amplitude. Interference and thermal noise are combined in the linear
 * domain. Rates are Shannon capacity over the bandwidth of the block's subcarriers.
 */
public class ChannelModel {
    private static final double PATH_LOSS_INTERCEPT_DB = 35.3;

    private final Simulator simulator;

    @Getter
    private final double txPowerDbm;

    @Getter
    private final double noisePowerDbmPerHz;

    @Getter
    private final double basePathLossExponent;

    @Getter
    private final boolean timeVarying;

    private final double variationPeriod;

    private final double variationAmplitude;

    @Getter
    private final double sinrThreshold;

    /** NaN when SINR is not clamped. */
    private final double sinrFloor;

    private final double noiseBandwidthHz;

    private final double subcarrierBandwidthHz;

    private final double maxDataRate;

    @Getter
    @Setter
    private double interferenceLevelDbm;

    public ChannelModel(SimulationConfig config, Simulator simulator) {
        this.simulator = simulator;
        this.txPowerDbm = config.getTransmissionPower();
        this.noisePowerDbmPerHz = config.getNoisePower();
        this.basePathLossExponent = config.getPathLossExponent();
        this.timeVarying = config.isTimeVarying();
        this.variationPeriod = config.getVariationPeriod();
        this.variationAmplitude = config.getVariationAmplitude();
        this.sinrThreshold = config.getSinrThreshold();
        this.sinrFloor = config.getSinrFloor() == null ? Double.NaN : config.getSinrFloor();
        this.noiseBandwidthHz = config.getChannelBandwidth();
        this.subcarrierBandwidthHz = config.getSubcarrierBandwidth();
        this.maxDataRate = config.getDataRateBase();
        this.interferenceLevelDbm = config.getInterferenceBaseline();
    }

    public double pathLossExponent() {
        if (!timeVarying) {
            return basePathLossExponent;
        }
        return basePathLossExponent
                + variationAmplitude * Math.sin(2 * Math.PI * simulator.getTime() / variationPeriod);
    }

    public double pathLossDb(double distanceM) {
        if (!(distanceM > 0) || Double.isInfinite(distanceM)) {
            throw new ChannelException("Distance must be positive and finite, got " + distanceM);
        }
        return PATH_LOSS_INTERCEPT_DB + 10 * pathLossExponent() * Math.log10(distanceM);
    }

    public double noiseFloorDb() {
        return noisePowerDbmPerHz + 10 * Math.log10(noiseBandwidthHz);
    }

    public double sinrDb(Device device) {
        return sinrDb(device.getLocation());
    }

    public double sinrDb(double distanceM) {
        double signalDb = txPowerDbm - pathLossDb(distanceM);
        double totalNoiseDb = 10 * Math.log10(
                Math.pow(10, interferenceLevelDbm / 10) + Math.pow(10, noiseFloorDb() / 10));
        double sinr = signalDb - totalNoiseDb;
        if (!Double.isFinite(sinr)) {
            throw new ChannelException(String.format("SINR is not finite at distance %f", distanceM));
        }
        if (!Double.isNaN(sinrFloor)) {
            sinr = Math.max(sinr, sinrFloor);
        }
        return sinr;
    }

    /** Achievable rate of a block with {@code subcarriers} subcarriers, in bits per second. */
    public double dataRate(double sinrDb, int subcarriers) {
        double bandwidth = subcarriers * subcarrierBandwidthHz;
        double rate = bandwidth * log2(1 + Math.pow(10, sinrDb / 10));
        if (maxDataRate > 0) {
            rate = Math.min(rate, maxDataRate);
        }
        if (!(rate > 0) || Double.isInfinite(rate)) {
            throw new ChannelException(String.format("Data rate %f at SINR %f dB is unusable", rate, sinrDb));
        }
        return rate;
    }

    private static double log2(double x) {
        return Math.log(x) / Math.log(2);
    }
}
