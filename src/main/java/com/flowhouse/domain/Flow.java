package com.flowhouse.domain;

import java.net.InetAddress;
import java.time.Instant;

/**
 * A single sampled flow record as stored in the {@code flows} table.
 *
 * Prefix addresses are optional: flows collected without routing information
 * carry no source or destination prefix.
 */
public class Flow {

    private InetAddress agent;
    private long intIn;
    private long intOut;
    private InetAddress srcAddr;
    private InetAddress dstAddr;
    private InetAddress srcPrefixAddr;
    private int srcPrefixLength;
    private InetAddress dstPrefixAddr;
    private int dstPrefixLength;
    private long srcAsn;
    private long dstAsn;
    private int protocol;
    private int srcPort;
    private int dstPort;
    private Instant timestamp;
    private long size;
    private long packets;
    private long sampleRate;

    public InetAddress getAgent() {
        return agent;
    }

    public long getIntIn() {
        return intIn;
    }

    public long getIntOut() {
        return intOut;
    }

    public InetAddress getSrcAddr() {
        return srcAddr;
    }

    public InetAddress getDstAddr() {
        return dstAddr;
    }

    public InetAddress getSrcPrefixAddr() {
        return srcPrefixAddr;
    }

    public int getSrcPrefixLength() {
        return srcPrefixLength;
    }

    public InetAddress getDstPrefixAddr() {
        return dstPrefixAddr;
    }

    public int getDstPrefixLength() {
        return dstPrefixLength;
    }

    public long getSrcAsn() {
        return srcAsn;
    }

    public long getDstAsn() {
        return dstAsn;
    }

    public int getProtocol() {
        return protocol;
    }

    public int getSrcPort() {
        return srcPort;
    }

    public int getDstPort() {
        return dstPort;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getSize() {
        return size;
    }

    public long getPackets() {
        return packets;
    }

    public long getSampleRate() {
        return sampleRate;
    }

    /**
     * Builder pattern for creating Flow instances
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Flow flow;

        public Builder() {
            this.flow = new Flow();
        }

        public Builder agent(InetAddress agent) {
            flow.agent = agent;
            return this;
        }

        public Builder intIn(long intIn) {
            flow.intIn = intIn;
            return this;
        }

        public Builder intOut(long intOut) {
            flow.intOut = intOut;
            return this;
        }

        public Builder srcAddr(InetAddress srcAddr) {
            flow.srcAddr = srcAddr;
            return this;
        }

        public Builder dstAddr(InetAddress dstAddr) {
            flow.dstAddr = dstAddr;
            return this;
        }

        public Builder srcPrefix(InetAddress addr, int length) {
            flow.srcPrefixAddr = addr;
            flow.srcPrefixLength = length;
            return this;
        }

        public Builder dstPrefix(InetAddress addr, int length) {
            flow.dstPrefixAddr = addr;
            flow.dstPrefixLength = length;
            return this;
        }

        public Builder srcAsn(long srcAsn) {
            flow.srcAsn = srcAsn;
            return this;
        }

        public Builder dstAsn(long dstAsn) {
            flow.dstAsn = dstAsn;
            return this;
        }

        public Builder protocol(int protocol) {
            flow.protocol = protocol;
            return this;
        }

        public Builder srcPort(int srcPort) {
            flow.srcPort = srcPort;
            return this;
        }

        public Builder dstPort(int dstPort) {
            flow.dstPort = dstPort;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            flow.timestamp = timestamp;
            return this;
        }

        public Builder size(long size) {
            flow.size = size;
            return this;
        }

        public Builder packets(long packets) {
            flow.packets = packets;
            return this;
        }

        public Builder sampleRate(long sampleRate) {
            flow.sampleRate = sampleRate;
            return this;
        }

        public Flow build() {
            return flow;
        }
    }
}
