package edu.purdue.dsnl.urllcsim;

import edu.purdue.dsnl.urllcsim.log.EventLog;
import edu.purdue.dsnl.urllcsim.log.EventTag;
import edu.purdue.dsnl.urllcsim.policy.SchedulingPolicy;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Binds packets to resource blocks under a {@link SchedulingPolicy} and parks the rest in a waiting set.
 *
 * <p>A block id is in {@code activeTransmissions} exactly when that block has an occupant. All mutation happens
 * synchronously inside {@link #dispatch}, {@link #release} and the re-entry of preempted packets.
 */
public class BaseStation {
    private static final Logger logger = LogManager.getLogger(BaseStation.class);

    private final Simulator simulator;

    private final EventLog log;

    @Getter
    private final ChannelModel channel;

    @Getter
    private final SchedulingPolicy policy;

    @Getter
    private final List<ResourceBlock> resourceBlocks;

    private final TreeMap<Integer, TransmissionHandle> activeTransmissions = new TreeMap<>();

    private final TreeSet<WaitingEntry> waitingSet;

    private final double preemptionPenalty;

    private long waitingSequence = 0;

    @Getter
    private int preemptions = 0;

    @Getter
    private int fragments = 0;

    @Getter
    private int peakActiveTransmissions = 0;

    public BaseStation(SimulationContext ctx, ChannelModel channel, SchedulingPolicy policy, int numResourceBlocks,
            int subcarriers, double slotDuration, double preemptionPenalty) {
        this.simulator = ctx.getSimulator();
        this.log = ctx.getLog();
        this.channel = channel;
        this.policy = policy;
        this.preemptionPenalty = preemptionPenalty;
        var blocks = new ArrayList<ResourceBlock>();
        for (int i = 0; i < numResourceBlocks; i++) {
            blocks.add(new ResourceBlock(i, subcarriers, slotDuration));
        }
        this.resourceBlocks = Collections.unmodifiableList(blocks);
        this.waitingSet = new TreeSet<>(policy.waitingOrder().thenComparingLong(WaitingEntry::getSequence));
    }

    /**
     * Allocates a free block to {@code packet}, or evicts a victim chosen by the policy, or queues the packet.
     *
     * @throws PacketProcessingException if the packet cannot be scheduled; no state has changed in that case
     */
    public void dispatch(Device device, Packet packet, PacketRace race) {
        double now = simulator.getTime();
        assignKey(device, packet, now);
        log.emit(device.getId(), packet.getId(), EventTag.REQUEST);

        var free = firstFreeBlock();
        if (free.isPresent()) {
            allocate(free.get(), device, packet, race);
            return;
        }
        var victim = policy.selectVictim(packet, activeTransmissions.values(), now);
        if (victim.isPresent()) {
            var block = victim.get().getBlock();
            preempt(victim.get());
            allocate(block, device, packet, race);
            return;
        }
        enqueue(device, packet, race);
        logger.debug("t={} device {} packet {} queued, {} waiting", now, device.getId(), packet.getId(),
                waitingSet.size());
    }

    /** Ends a transmission: either its quantum ran out or the whole packet went through. */
    public void release(TransmissionHandle handle) {
        var block = handle.getBlock();
        var device = handle.getDevice();
        var packet = handle.getPacket();
        var race = handle.getRace();
        double now = simulator.getTime();
        unbind(block);

        if (!handle.isFinalFragment()) {
            fragments++;
            log.emit(log.at(device.getId(), packet.getId(), EventTag.FRAGMENT)
                    .setBits(handle.getBits())
                    .setDataRate(handle.getDataRate())
                    .setSinr(block.getCurrentSinr()));
            if (!race.isDecided()) {
                var rest = packet.continuation(packet.getSizeBits() - handle.getBits());
                try {
                    assignKey(device, rest, now);
                    enqueue(device, rest, race);
                } catch (PacketProcessingException e) {
                    race.abort(e);
                }
            }
        } else {
            double latency = now - packet.getCreationTime();
            boolean inTime = now <= packet.getDeadline();
            boolean usable = block.getCurrentSinr() >= channel.getSinrThreshold();
            if (race.complete(latency, inTime && usable)) {
                if (inTime && usable) {
                    log.emit(log.at(device.getId(), packet.getId(), EventTag.TRANSMISSION_END)
                            .setLatency(latency)
                            .setAoi(device.getAoi())
                            .setSinr(block.getCurrentSinr())
                            .setDataRate(handle.getDataRate())
                            .setBits(handle.getBits()));
                } else {
                    if (!inTime) {
                        device.markDeadlineMiss();
                    }
                    log.emit(log.at(device.getId(), packet.getId(),
                            inTime ? EventTag.DROPPED_SINR : EventTag.DROPPED_DEADLINE)
                            .setLatency(latency)
                            .setSinr(block.getCurrentSinr()));
                }
            } else {
                log.emit(log.at(device.getId(), packet.getId(), EventTag.LATE_RELEASE)
                        .setLatency(latency)
                        .setSinr(block.getCurrentSinr())
                        .setBits(handle.getBits()));
            }
            logger.debug("t={} device {} released block {}, latency {}", now, device.getId(), block.getId(),
                    latency);
        }
        serveWaiting();
    }

    /** Re-evaluates SINR on every occupied block against the current channel state. */
    public void refreshSinr() {
        for (var h : activeTransmissions.values()) {
            var block = h.getBlock();
            block.setCurrentSinr(channel.sinrDb(h.getDevice()));
            log.emit(log.at(h.getDeviceId(), h.getPacket().getId(), EventTag.INTERFERENCE)
                    .setSinr(block.getCurrentSinr()));
        }
    }

    public Collection<TransmissionHandle> getActiveTransmissions() {
        return Collections.unmodifiableCollection(activeTransmissions.values());
    }

    public int getActiveTransmissionCount() {
        return activeTransmissions.size();
    }

    /** Entries still in the waiting set, including ones whose packet has since been dropped. */
    public int getWaitingCount() {
        return waitingSet.size();
    }

    /** True when occupied blocks and the active-transmission map agree. */
    public boolean isConsistent() {
        if (activeTransmissions.size() > resourceBlocks.size()) {
            return false;
        }
        for (var block : resourceBlocks) {
            var active = activeTransmissions.get(block.getId());
            var occupant = block.getOccupant().orElse(null);
            if (active != occupant) {
                return false;
            }
        }
        return true;
    }

    private void assignKey(Device device, Packet packet, double now) {
        if (!(packet.getSizeBits() > 0) || Double.isInfinite(packet.getSizeBits())) {
            throw new PacketProcessingException(packet.getId(),
                    String.format("packet size %f is not a positive finite number", packet.getSizeBits()));
        }
        double key = policy.dispatchKey(packet, device, now);
        if (!Double.isFinite(key)) {
            throw new PacketProcessingException(packet.getId(),
                    String.format("%s produced dispatch key %f", policy.getType().getConfigName(), key));
        }
        packet.setDispatchKey(key);
    }

    private Optional<ResourceBlock> firstFreeBlock() {
        return resourceBlocks.stream().filter(ResourceBlock::isFree).findFirst();
    }

    private void allocate(ResourceBlock block, Device device, Packet packet, PacketRace race) {
        double now = simulator.getTime();
        block.setCurrentSinr(channel.sinrDb(device));
        double rate = channel.dataRate(block.getCurrentSinr(), block.getSubcarriers()) * policy.rateFactor(packet);
        double airtime = packet.getSizeBits() / rate;
        double bits = packet.getSizeBits();
        var quantum = policy.quantum();
        if (quantum.isPresent() && airtime > quantum.getAsDouble()) {
            double sent = rate * quantum.getAsDouble();
            if (sent < bits) {
                airtime = quantum.getAsDouble();
                bits = sent;
            }
        }

        var handle = new TransmissionHandle(this, device, packet, race, block, now, rate, bits);
        block.bind(handle);
        activeTransmissions.put(block.getId(), handle);
        peakActiveTransmissions = Math.max(peakActiveTransmissions, activeTransmissions.size());
        race.setInFlight(handle);
        simulator.schedule(handle, now + airtime);

        log.emit(log.at(device.getId(), packet.getId(), EventTag.TRANSMISSION_START)
                .setSinr(block.getCurrentSinr())
                .setDataRate(rate)
                .setBits(bits));
        logger.debug("t={} device {} packet {} on block {} for {}s", now, device.getId(), packet.getId(),
                block.getId(), airtime);
    }

    private void unbind(ResourceBlock block) {
        var h = block.unbind();
        activeTransmissions.remove(block.getId());
        if (h != null) {
            h.getRace().setInFlight(null);
        }
    }

    private void preempt(TransmissionHandle victim) {
        double now = simulator.getTime();
        simulator.removeEvent(victim);
        unbind(victim.getBlock());
        preemptions++;
        log.emit(log.at(victim.getDeviceId(), victim.getPacket().getId(), EventTag.PREEMPTED)
                .setSinr(victim.getBlock().getCurrentSinr()));
        logger.debug("t={} preempted packet {} of device {} on block {}", now, victim.getPacket().getId(),
                victim.getDeviceId(), victim.getBlock().getId());
        simulator.call(now + preemptionPenalty,
                () -> reenter(victim.getDevice(), victim.getPacket(), victim.getRace()));
    }

    private void reenter(Device device, Packet packet, PacketRace race) {
        if (race.isDecided()) {
            return;
        }
        try {
            assignKey(device, packet, simulator.getTime());
        } catch (PacketProcessingException e) {
            race.abort(e);
            return;
        }
        enqueue(device, packet, race);
        log.emit(device.getId(), packet.getId(), EventTag.REQUEUED);
        serveWaiting();
    }

    private void enqueue(Device device, Packet packet, PacketRace race) {
        waitingSet.add(new WaitingEntry(device, packet, race, packet.getDispatchKey(), waitingSequence++));
    }

    /** Hands free blocks to the head of the waiting set, skipping packets that were dropped while queued. */
    private void serveWaiting() {
        while (!waitingSet.isEmpty()) {
            var free = firstFreeBlock();
            if (free.isEmpty()) {
                break;
            }
            var entry = waitingSet.pollFirst();
            if (entry.getRace().isDecided()) {
                continue;
            }
            allocate(free.get(), entry.getDevice(), entry.getPacket(), entry.getRace());
        }
    }
}
