package com.flowhouse.storage;

import com.flowhouse.domain.Flow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/**
 * Writes flow records into the ClickHouse flows table
 */
@Repository
public class FlowRepository {
    private static final Logger logger = LoggerFactory.getLogger(FlowRepository.class);

    static final String INSERT_SQL = """
        INSERT INTO flows (
            agent, int_in, int_out, src_ip_addr, dst_ip_addr,
            src_ip_pfx_addr, src_ip_pfx_len, dst_ip_pfx_addr, dst_ip_pfx_len,
            src_asn, dst_asn, ip_protocol, src_port, dst_port,
            timestamp, size, packets, samplerate
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    static final String UNSPECIFIED_ADDRESS = "::";

    private final JdbcTemplate jdbcTemplate;

    public FlowRepository(@Qualifier("clickHouseJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Insert flows as a single batch
     *
     * @param flows flows to insert
     * @return number of flows sent
     */
    public int insertFlows(List<Flow> flows) {
        if (flows == null || flows.isEmpty()) {
            return 0;
        }

        long startInsert = System.currentTimeMillis();
        jdbcTemplate.batchUpdate(INSERT_SQL, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                bind(ps, flows.get(i));
            }

            @Override
            public int getBatchSize() {
                return flows.size();
            }
        });
        long duration = System.currentTimeMillis() - startInsert;

        logger.debug("Inserted {} flows in {} ms", flows.size(), duration);
        return flows.size();
    }

    private static void bind(PreparedStatement ps, Flow flow) throws SQLException {
        ps.setString(1, toIPv6String(flow.getAgent()));
        ps.setLong(2, flow.getIntIn());
        ps.setLong(3, flow.getIntOut());
        ps.setString(4, toIPv6String(flow.getSrcAddr()));
        ps.setString(5, toIPv6String(flow.getDstAddr()));
        ps.setString(6, toIPv6String(flow.getSrcPrefixAddr()));
        ps.setInt(7, flow.getSrcPrefixAddr() == null ? 0 : flow.getSrcPrefixLength());
        ps.setString(8, toIPv6String(flow.getDstPrefixAddr()));
        ps.setInt(9, flow.getDstPrefixAddr() == null ? 0 : flow.getDstPrefixLength());
        ps.setLong(10, flow.getSrcAsn());
        ps.setLong(11, flow.getDstAsn());
        ps.setInt(12, flow.getProtocol());
        ps.setInt(13, flow.getSrcPort());
        ps.setInt(14, flow.getDstPort());
        ps.setLong(15, flow.getTimestamp().getEpochSecond());
        ps.setLong(16, flow.getSize());
        ps.setLong(17, flow.getPackets());
        ps.setLong(18, flow.getSampleRate());
    }

    /**
     * IPv6 column text for an address; IPv4 addresses are stored IPv4-mapped
     */
    static String toIPv6String(InetAddress address) {
        if (address == null) {
            return UNSPECIFIED_ADDRESS;
        }
        if (address instanceof Inet4Address) {
            return "::ffff:" + address.getHostAddress();
        }
        return address.getHostAddress();
    }
}
