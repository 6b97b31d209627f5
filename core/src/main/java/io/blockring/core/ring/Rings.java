package io.blockring.core.ring;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.blockring.core.PeerInfoList;
import io.blockring.core.Ring;
import io.blockring.core.RingConstructionException;
import io.blockring.core.RingException;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ring factory and codec.
 * <p>
 * The encoded form of a ring is the JSON of its {@link RingDescriptor}; placement
 * is a pure function of the descriptor, so decoding rebuilds an equivalent ring.
 */
public final class Rings {
    private static final Logger log = Logger.getLogger(Rings.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Rings() {
        // utility
    }

    /**
     * Build the ring a descriptor describes.
     *
     * @throws RingConstructionException if the peers or replication do not suit the ring type
     */
    public static Ring create(RingDescriptor d) throws RingException {
        PeerInfoList peers = d.peerInfos();
        Ring ring = switch (d.type()) {
            case EMPTY -> {
                if (!peers.isEmpty()) {
                    throw new RingConstructionException("empty ring cannot have peers, got " + peers.size());
                }
                yield new EmptyRing(d.version(), d.replicationFactor());
            }
            case SINGLE -> {
                if (peers.size() != 1) {
                    throw new RingConstructionException("single ring needs exactly one peer, got " + peers.size());
                }
                yield new SingleRing(d.version(), peers.get(0));
            }
            case MOD -> new ModRing(d.version(), d.replicationFactor(), peers);
            case KETAMA -> HashRing.build(
                    d.version(),
                    d.replicationFactor(),
                    peers,
                    d.vnodes() > 0 ? d.vnodes() : HashRing.DEFAULT_VNODES);
        };
        log.log(Level.FINE, "created {0}", ring.describe());
        return ring;
    }

    /** Rebuild a ring from the output of {@link Ring#marshal()}. */
    public static Ring unmarshal(byte[] data) throws RingException {
        RingDescriptor d;
        try {
            d = MAPPER.readValue(data, RingDescriptor.class);
        } catch (IOException e) {
            throw new RingConstructionException("cannot decode ring: " + e.getMessage(), e);
        }
        if (d == null) {
            throw new RingConstructionException("cannot decode ring: empty document");
        }
        return create(d);
    }

    static byte[] encode(RingDescriptor d) throws RingException {
        try {
            return MAPPER.writeValueAsBytes(d);
        } catch (IOException e) {
            throw new RingException("cannot encode " + d.type().label() + " ring v" + d.version(), e);
        }
    }
}
