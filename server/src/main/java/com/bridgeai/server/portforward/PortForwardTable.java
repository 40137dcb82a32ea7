package com.bridgeai.server.portforward;

import com.bridgeai.server.error.BridgeException;
import com.bridgeai.server.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Forwarding rules and the drivers allowed to push packets through them.
 * Rule ids start at 1 and are never reused. Listener and packet callbacks run
 * outside the table lock.
 */
public class PortForwardTable {
    private static final Logger logger = LoggerFactory.getLogger(PortForwardTable.class);

    private final Object lock = new Object();
    private final PortForwardConfig config;
    private final LongSupplier nanoClock;

    private final List<ForwardRule> rules = new ArrayList<>();
    private final Map<Integer, Object> drivers = new LinkedHashMap<>();
    private int nextRuleId = 1;

    private long totalPackets;
    private long totalBytes;
    private long droppedPackets;
    private long errors;

    private volatile PacketCallback packetCallback;
    private volatile RuleEventListener eventListener;

    public PortForwardTable(PortForwardConfig config) {
        this(config, System::nanoTime);
    }

    public PortForwardTable(PortForwardConfig config, LongSupplier nanoClock) {
        if (config == null) {
            throw new IllegalArgumentException("Port forward config is required");
        }
        config.validate();
        this.config = config;
        this.nanoClock = nanoClock;
    }

    public int addRule(ForwardRule rule) {
        ForwardRule stored = validated(rule);
        int id;
        synchronized (lock) {
            if (rules.size() >= config.maxRules) {
                throw new BridgeException(ErrorCode.CAPACITY_EXCEEDED,
                        "Rule table is full (" + config.maxRules + " rules)");
            }
            id = nextRuleId++;
            stored.setId(id);
            stored.resetCounters();
            rules.add(stored);
        }
        logger.info("Added forward rule {}", stored);
        fire(id, RuleEvent.RULE_ADDED);
        return id;
    }

    public void removeRule(int ruleId) {
        synchronized (lock) {
            rules.remove(require(ruleId));
        }
        logger.info("Removed forward rule {}", ruleId);
        fire(ruleId, RuleEvent.RULE_REMOVED);
    }

    /**
     * Replaces the rule's settings. The id and the traffic counters carry over.
     */
    public void updateRule(int ruleId, ForwardRule rule) {
        ForwardRule replacement = validated(rule);
        synchronized (lock) {
            ForwardRule existing = require(ruleId);
            existing.setName(replacement.getName());
            existing.setSrcAddr(replacement.getSrcAddr());
            existing.setSrcPort(replacement.getSrcPort());
            existing.setDstAddr(replacement.getDstAddr());
            existing.setDstPort(replacement.getDstPort());
            existing.setProtocol(replacement.getProtocol());
            existing.setFlags(replacement.getFlags());
            existing.setDriverId(replacement.getDriverId());
        }
        fire(ruleId, RuleEvent.RULE_UPDATED);
    }

    public ForwardRule getRule(int ruleId) {
        synchronized (lock) {
            return require(ruleId).copy();
        }
    }

    /** Copies of the first {@code max} rules, in insertion order. */
    public List<ForwardRule> listRules(int max) {
        if (max < 0) {
            throw new BridgeException(ErrorCode.INVALID_ARGUMENT, "max must not be negative");
        }
        synchronized (lock) {
            int n = Math.min(max, rules.size());
            List<ForwardRule> out = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                out.add(rules.get(i).copy());
            }
            return out;
        }
    }

    public List<ForwardRule> listRules() {
        return listRules(Integer.MAX_VALUE);
    }

    public void enableRule(int ruleId) {
        synchronized (lock) {
            ForwardRule rule = require(ruleId);
            rule.setFlags(rule.getFlags() | ForwardRule.FLAG_ENABLED);
        }
        fire(ruleId, RuleEvent.RULE_ENABLED);
    }

    public void disableRule(int ruleId) {
        synchronized (lock) {
            ForwardRule rule = require(ruleId);
            rule.setFlags(rule.getFlags() & ~ForwardRule.FLAG_ENABLED);
        }
        fire(ruleId, RuleEvent.RULE_DISABLED);
    }

    public PortForwardStats getStats() {
        synchronized (lock) {
            return new PortForwardStats(rules.size(), totalPackets, totalBytes, droppedPackets, errors);
        }
    }

    /** Zeroes table and per-rule counters; the rule count is kept. */
    public void resetStats() {
        synchronized (lock) {
            totalPackets = 0;
            totalBytes = 0;
            droppedPackets = 0;
            errors = 0;
            for (ForwardRule rule : rules) {
                rule.resetCounters();
            }
        }
        logger.info("Port forward statistics reset");
    }

    public void setPacketCallback(PacketCallback callback) {
        this.packetCallback = callback;
    }

    public void setEventListener(RuleEventListener listener) {
        this.eventListener = listener;
    }

    public void registerDriver(int driverId, Object driverContext) {
        synchronized (lock) {
            if (drivers.containsKey(driverId)) {
                throw new BridgeException(ErrorCode.INVALID_ARGUMENT, "Driver " + driverId + " is already registered");
            }
            if (drivers.size() >= config.maxDrivers) {
                throw new BridgeException(ErrorCode.CAPACITY_EXCEEDED,
                        "Driver table is full (" + config.maxDrivers + " drivers)");
            }
            drivers.put(driverId, driverContext);
        }
        logger.info("Registered driver {} for port forwarding", driverId);
    }

    public void unregisterDriver(int driverId) {
        synchronized (lock) {
            if (!drivers.containsKey(driverId)) {
                throw new BridgeException(ErrorCode.NOT_FOUND, "Unknown driver " + driverId);
            }
            drivers.remove(driverId);
        }
        logger.info("Unregistered driver {}", driverId);
    }

    public int getDriverCount() {
        synchronized (lock) {
            return drivers.size();
        }
    }

    /**
     * Counts the packet against the table and against every enabled rule bound
     * to the driver, then hands it to the packet callback.
     *
     * @return 0 when accepted, otherwise the callback's drop code
     */
    public int forwardPacket(int driverId, byte[] packet) {
        if (packet == null || packet.length == 0) {
            throw new BridgeException(ErrorCode.INVALID_ARGUMENT, "Packet must not be empty");
        }
        synchronized (lock) {
            if (!drivers.containsKey(driverId)) {
                throw new BridgeException(ErrorCode.NOT_FOUND, "Unknown driver " + driverId);
            }
            totalPackets++;
            totalBytes += packet.length;
            long now = nanoClock.getAsLong();
            for (ForwardRule rule : rules) {
                if (rule.isEnabled() && rule.getDriverId() == driverId) {
                    rule.recordTraffic(packet.length, now);
                }
            }
        }

        PacketCallback callback = packetCallback;
        if (callback == null) {
            return 0;
        }
        int code;
        try {
            code = callback.onPacket(driverId, packet);
        } catch (RuntimeException e) {
            synchronized (lock) {
                errors++;
            }
            throw e;
        }
        if (code != 0) {
            synchronized (lock) {
                droppedPackets++;
            }
            logger.debug("Packet of {} bytes from driver {} dropped (code {})", packet.length, driverId, code);
        }
        return code;
    }

    private ForwardRule require(int ruleId) {
        for (ForwardRule rule : rules) {
            if (rule.getId() == ruleId) {
                return rule;
            }
        }
        throw new BridgeException(ErrorCode.NOT_FOUND, "Unknown forward rule " + ruleId);
    }

    private static ForwardRule validated(ForwardRule rule) {
        if (rule == null) {
            throw new BridgeException(ErrorCode.INVALID_ARGUMENT, "rule is required");
        }
        ForwardRule copy = rule.copy();
        try {
            copy.validate();
        } catch (IllegalArgumentException e) {
            throw new BridgeException(ErrorCode.INVALID_ARGUMENT, e.getMessage(), e);
        }
        return copy;
    }

    private void fire(int ruleId, RuleEvent event) {
        RuleEventListener listener = eventListener;
        if (listener != null) {
            listener.onRuleEvent(ruleId, event);
        }
    }
}
