package edu.purdue.dsnl.urllcsim;

import edu.purdue.dsnl.urllcsim.log.EventRecord;
import edu.purdue.dsnl.urllcsim.log.EventTag;
import edu.purdue.dsnl.urllcsim.policy.EdfPolicy;
import edu.purdue.dsnl.urllcsim.policy.FixedPriorityQciPolicy;
import edu.purdue.dsnl.urllcsim.policy.HybridEdfPreemptivePolicy;
import edu.purdue.dsnl.urllcsim.policy.NonPreemptivePriorityPolicy;
import edu.purdue.dsnl.urllcsim.policy.PreemptivePriorityPolicy;
import edu.purdue.dsnl.urllcsim.policy.ProportionalFairPolicy;
import edu.purdue.dsnl.urllcsim.policy.RoundRobinPolicy;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BaseStationTest {
    private static final double EPS = 1e-12;

    private static List<Integer> startOrder(TestBench bench) {
        return bench.records(EventTag.TRANSMISSION_START).stream().map(EventRecord::getDeviceId).toList();
    }

    @Test
    public void testHigherPriorityServedFirstOnSingleBlock() {
        var bench = new TestBench(new PreemptivePriorityPolicy(), 1);
        var urgent = bench.device(0.0002, 1, 1.0);
        var normal = bench.device(0.0002, 2, 1.0);
        bench.sendAt(0, urgent);
        bench.sendAt(0, normal);
        bench.simulator.doAllEvents();

        assertEquals(List.of(urgent.getId(), normal.getId()), startOrder(bench));
        assertEquals(0, bench.station.getPreemptions());
        double urgentEnd = bench.first(urgent, EventTag.TRANSMISSION_END).getTime();
        assertEquals(urgentEnd, bench.first(normal, EventTag.TRANSMISSION_START).getTime(), EPS);
        assertEquals(1, urgent.getPacketsSent());
        assertEquals(1, normal.getPacketsSent());
    }

    @Test
    public void testHigherPriorityPreemptsAndVictimRequeuesAfterPenalty() {
        var bench = new TestBench(new PreemptivePriorityPolicy(), 1);
        var normal = bench.device(0.0002, 2, 1.0);
        var urgent = bench.device(0.0002, 1, 1.0);
        bench.sendAt(0, normal);
        bench.sendAt(0, urgent);
        bench.simulator.doAllEvents();

        assertEquals(1, bench.station.getPreemptions());
        assertEquals(0.0, bench.first(normal, EventTag.PREEMPTED).getTime());
        assertEquals(bench.config.getPreemptionPenalty(), bench.first(normal, EventTag.REQUEUED).getTime(), EPS);
        assertEquals(List.of(normal.getId(), urgent.getId(), normal.getId()), startOrder(bench));

        double urgentEnd = bench.first(urgent, EventTag.TRANSMISSION_END).getTime();
        var restarts = bench.recordsFor(normal, EventTag.TRANSMISSION_START);
        assertEquals(urgentEnd, restarts.get(1).getTime(), EPS);
        assertEquals(0.0004, bench.first(normal, EventTag.TRANSMISSION_END).getLatency(), 1e-9);
        assertEquals(1, normal.getPacketsSent());
        assertEquals(0, normal.getPacketsDropped());
    }

    @Test
    public void testPreemptedPacketKeepsItsDeadline() {
        var bench = new TestBench(new PreemptivePriorityPolicy(), 1);
        var normal = bench.device(0.0002, 2, 0.0003);
        var urgent = bench.device(0.0002, 1, 1.0);
        bench.sendAt(0, normal);
        bench.sendAt(0, urgent);
        bench.simulator.doAllEvents();

        // restarts at 0.0002, needs until 0.0004, deadline 0.0003
        assertEquals(1, normal.getPacketsDropped());
        assertEquals(1, normal.getDeadlineMisses());
        assertEquals(0.0003, bench.first(normal, EventTag.DROPPED_DEADLINE).getTime(), EPS);
        assertEquals(1, bench.recordsFor(normal, EventTag.LATE_RELEASE).size());
        assertTrue(bench.recordsFor(normal, EventTag.TRANSMISSION_END).isEmpty());
    }

    @Test
    public void testNonPreemptiveNeverEvicts() {
        var bench = new TestBench(new NonPreemptivePriorityPolicy(), 1);
        var normal = bench.device(0.0002, 2, 1.0);
        var urgent = bench.device(0.0002, 1, 1.0);
        var other = bench.device(0.0002, 3, 1.0);
        bench.sendAt(0, normal);
        bench.sendAt(0, other);
        bench.sendAt(0, urgent);
        bench.simulator.doAllEvents();

        assertEquals(0, bench.station.getPreemptions());
        assertEquals(List.of(normal.getId(), urgent.getId(), other.getId()), startOrder(bench));
    }

    @Test
    public void testEdfDispatchesEarliestDeadlineRegardlessOfPriority() {
        var bench = new TestBench(new EdfPolicy(), 1);
        var blocker = bench.device(0.0003, 1, 1.0);
        var relaxed = bench.device(0.0001, 1, 0.002);
        var tight = bench.device(0.0001, 3, 0.001);
        bench.sendAt(0, blocker);
        bench.sendAt(0, relaxed);
        bench.sendAt(0, tight);
        bench.simulator.doAllEvents();

        assertEquals(List.of(blocker.getId(), tight.getId(), relaxed.getId()), startOrder(bench));
        assertEquals(1, tight.getPacketsSent());
        assertEquals(1, relaxed.getPacketsSent());
    }

    @Test
    public void testStaticPriorityOrdersTheSameArrivalsDifferently() {
        var bench = new TestBench(new NonPreemptivePriorityPolicy(), 1);
        var blocker = bench.device(0.0003, 1, 1.0);
        var relaxed = bench.device(0.0001, 1, 0.002);
        var tight = bench.device(0.0001, 3, 0.001);
        bench.sendAt(0, blocker);
        bench.sendAt(0, relaxed);
        bench.sendAt(0, tight);
        bench.simulator.doAllEvents();

        assertEquals(List.of(blocker.getId(), relaxed.getId(), tight.getId()), startOrder(bench));
    }

    @Test
    public void testRoundRobinSplitsLongPacketIntoContinuations() {
        var bench = new TestBench(new RoundRobinPolicy(0.001), 1);
        var device = bench.device(0.0025, 2, 1.0);
        bench.sendAt(0, device);
        bench.simulator.doAllEvents();

        var fragments = bench.recordsFor(device, EventTag.FRAGMENT);
        assertEquals(2, fragments.size());
        assertEquals(2, bench.station.getFragments());
        assertEquals(0.001, fragments.get(0).getTime(), 1e-9);
        assertEquals(0.002, fragments.get(1).getTime(), 1e-9);

        var end = bench.first(device, EventTag.TRANSMISSION_END);
        assertEquals(0.0025, end.getTime(), 1e-9);
        assertEquals(end.getTime(), end.getLatency(), EPS);

        double carried = end.getBits();
        for (var f : fragments) {
            carried += f.getBits();
        }
        assertEquals(device.getPacketSize(), carried, device.getPacketSize() * 1e-9);
        assertEquals(1, device.getPacketsSent());
        assertEquals(device.getPacketSize(), device.getBitsDelivered());
    }

    @Test
    public void testRoundRobinRequeuesRemainderBehindWaitingPackets() {
        var bench = new TestBench(new RoundRobinPolicy(0.001), 1);
        var longer = bench.device(0.0025, 1, 1.0);
        var shorter = bench.device(0.0005, 1, 1.0);
        bench.sendAt(0, longer);
        bench.sendAt(0, shorter);
        bench.simulator.doAllEvents();

        assertEquals(List.of(longer.getId(), shorter.getId(), longer.getId(), longer.getId()), startOrder(bench));
        assertEquals(0.0015, bench.first(shorter, EventTag.TRANSMISSION_END).getLatency(), 1e-9);
        assertEquals(0.003, bench.first(longer, EventTag.TRANSMISSION_END).getLatency(), 1e-9);
    }

    @Test
    public void testHybridEvictsSlackestForUrgentPacket() {
        var bench = new TestBench(new HybridEdfPreemptivePolicy(0.001), 1);
        var relaxed = bench.device(0.0005, 1, 1.0);
        var urgent = bench.device(0.0001, 3, 0.0008);
        bench.sendAt(0, relaxed);
        bench.sendAt(0, urgent);
        bench.simulator.doAllEvents();

        assertEquals(1, bench.station.getPreemptions());
        assertEquals(1, bench.recordsFor(relaxed, EventTag.PREEMPTED).size());
        assertEquals(0.0001, bench.first(urgent, EventTag.TRANSMISSION_END).getLatency(), 1e-9);
        assertEquals(1, urgent.getPacketsSent());
        assertEquals(1, relaxed.getPacketsSent());
    }

    @Test
    public void testHybridFallsBackToPriorityWhenNotUrgent() {
        var bench = new TestBench(new HybridEdfPreemptivePolicy(0.001), 1);
        var relaxed = bench.device(0.0005, 1, 1.0);
        var patient = bench.device(0.0001, 3, 0.5);
        bench.sendAt(0, relaxed);
        bench.sendAt(0, patient);
        bench.simulator.doAllEvents();

        assertEquals(0, bench.station.getPreemptions());
        assertEquals(List.of(relaxed.getId(), patient.getId()), startOrder(bench));
    }

    @Test
    public void testQciDeratesTransmissionRate() {
        var bench = new TestBench(new FixedPriorityQciPolicy(), 2);
        var qci3 = bench.device(0.0002, 3, 1.0);
        var clamped = bench.device(0.0002, 12, 1.0);
        bench.sendAt(0, qci3);
        bench.sendAt(0, clamped);
        bench.simulator.doAllEvents();

        double rate = bench.rate();
        assertEquals(rate * 0.9, bench.first(qci3, EventTag.TRANSMISSION_START).getDataRate(), rate * 1e-12);
        assertEquals(rate * 0.6, bench.first(clamped, EventTag.TRANSMISSION_START).getDataRate(), rate * 1e-12);
        assertEquals(0.0002 / 0.9, bench.first(qci3, EventTag.TRANSMISSION_END).getLatency(), 1e-9);
    }

    @Test
    public void testProportionalFairOrdersByWeight() {
        var bench = new TestBench(new ProportionalFairPolicy(), 1);
        var blocker = bench.device(0.0003, 1, 1.0);
        var fresh = bench.device(0.0001, 2, 1.0);
        var served = bench.device(0.0001, 2, 1.0);
        served.recordMetrics(new Packet(1000, served.getId(), 0, 1000, 2, 1.0), 0.001, true, 0);

        bench.sendAt(0, blocker);
        bench.sendAt(0, fresh);
        bench.sendAt(0, served);
        bench.simulator.doAllEvents();

        assertEquals(List.of(blocker.getId(), served.getId(), fresh.getId()), startOrder(bench));
    }

    @Test
    public void testBlocksAndActiveTransmissionsStayConsistent() {
        var bench = new TestBench(new PreemptivePriorityPolicy(), 2);
        for (int i = 0; i < 6; i++) {
            var d = bench.device(0.0001 * (i + 1), 1 + i % 3, 1.0);
            bench.sendAt(0.00005 * i, d);
        }
        for (int i = 1; i < 40; i++) {
            bench.simulator.call(0.00003 * i, () -> {
                assertTrue(bench.station.isConsistent());
                assertTrue(bench.station.getActiveTransmissionCount() <= 2);
            });
        }
        bench.simulator.doAllEvents();

        assertTrue(bench.station.isConsistent());
        assertEquals(0, bench.station.getActiveTransmissionCount());
        assertEquals(2, bench.station.getPeakActiveTransmissions());
        assertEquals(6, bench.records(EventTag.TRANSMISSION_END).size());
    }
}
