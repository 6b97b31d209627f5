package io.blockring.core.ring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.blockring.core.PeerInfo;
import io.blockring.core.PeerInfoList;
import io.blockring.core.RingType;

import java.util.List;
import java.util.Objects;

/**
 * Serializable definition of a ring: everything needed to rebuild it.
 * <p>
 * This is both the input of {@link Rings#create(RingDescriptor)} and the JSON
 * payload produced by {@code Ring.marshal()}. {@code vnodes} only matters to
 * ketama rings; 0 selects {@link HashRing#DEFAULT_VNODES}.
 */
public record RingDescriptor(
        RingType type,
        int version,
        int replicationFactor,
        int vnodes,
        List<PeerInfo> peers
) {

    @JsonCreator
    public RingDescriptor(
            @JsonProperty("type") RingType type,
            @JsonProperty("version") int version,
            @JsonProperty("replicationFactor") int replicationFactor,
            @JsonProperty("vnodes") int vnodes,
            @JsonProperty("peers") List<PeerInfo> peers
    ) {
        this.type = Objects.requireNonNull(type, "type");
        this.version = version;
        this.replicationFactor = replicationFactor;
        this.vnodes = vnodes;
        this.peers = peers == null ? List.of() : List.copyOf(peers);
    }

    public static RingDescriptor of(RingType type, int version, int replicationFactor, PeerInfoList peers) {
        return new RingDescriptor(type, version, replicationFactor, 0, peers.asList());
    }

    public PeerInfoList peerInfos() {
        return PeerInfoList.copyOf(peers);
    }
}
