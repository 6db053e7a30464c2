package edu.purdue.dsnl.urllcsim;

import edu.purdue.dsnl.urllcsim.config.SimulationConfig;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ChannelModelTest {
    private static final SimulationConfig UNCLAMPED = SimulationConfig.builder()
            .transmissionPower(23)
            .interferenceBaseline(-90)
            .noisePower(-174)
            .channelBandwidth(100e6)
            .sinrFloor(null)
            .build();

    @Test
    public void testSinrAtFiftyMetres() {
        var channel = new ChannelModel(UNCLAMPED, new Simulator());
        assertEquals(-94.0, channel.noiseFloorDb(), 1e-9);
        assertEquals(99.18127216303431, channel.pathLossDb(50), 1e-9);
        assertEquals(12.36332320587276, channel.sinrDb(50), 1e-6);
    }

    @Test
    public void testInterferenceLowersSinr() {
        var channel = new ChannelModel(UNCLAMPED, new Simulator());
        double quiet = channel.sinrDb(50);
        channel.setInterferenceLevelDbm(-80);
        assertTrue(channel.sinrDb(50) < quiet - 5);
    }

    @Test
    public void testSinrFloorClampsFarDevices() {
        var clamped = new ChannelModel(SimulationConfig.defaults(), new Simulator());
        assertEquals(0.1, clamped.sinrDb(100_000), 0.0);

        var unclamped = new ChannelModel(UNCLAMPED, new Simulator());
        assertTrue(unclamped.sinrDb(100_000) < 0);
    }

    @Test
    public void testShannonRateAndCap() {
        var channel = new ChannelModel(SimulationConfig.defaults(), new Simulator());
        assertEquals(12 * 30e3, channel.dataRate(0, 12), 1e-6);
        assertEquals(20e6, channel.dataRate(200, 12), 0.0);

        var uncapped = new ChannelModel(SimulationConfig.builder().dataRateBase(0).build(), new Simulator());
        assertTrue(uncapped.dataRate(200, 12) > 20e6);
    }

    @Test
    public void testInvalidDistanceRejected() {
        var channel = new ChannelModel(SimulationConfig.defaults(), new Simulator());
        assertThrows(ChannelException.class, () -> channel.sinrDb(0));
        assertThrows(ChannelException.class, () -> channel.sinrDb(-5));
        assertThrows(ChannelException.class, () -> channel.pathLossDb(Double.NaN));
    }

    @Test
    public void testUnusableRateRejected() {
        var channel = new ChannelModel(SimulationConfig.defaults(), new Simulator());
        assertThrows(ChannelException.class, () -> channel.dataRate(Double.NaN, 12));
        assertThrows(ChannelException.class, () -> channel.dataRate(-400, 12));
    }

    @Test
    public void testTimeVaryingExponentFollowsSine() {
        var sim = new Simulator();
        var config = SimulationConfig.builder().timeVarying(true).variationPeriod(1.0).variationAmplitude(0.2).build();
        var channel = new ChannelModel(config, sim);
        assertEquals(3.76, channel.pathLossExponent(), 1e-12);

        sim.call(0.25, () -> {
        });
        sim.doAllEvents();
        assertEquals(3.96, channel.pathLossExponent(), 1e-12);

        sim.call(0.75, () -> {
        });
        sim.doAllEvents();
        assertEquals(3.56, channel.pathLossExponent(), 1e-12);
    }
}
