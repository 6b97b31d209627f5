package io.blockring.bench;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.blockring.core.PeerInfo;
import io.blockring.core.PeerInfoList;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON peer list for ringtool, for simulating clusters with unequal disks:
 * <pre>
 * {
 *   "peers": [
 *     {"peerId": "disk-a", "totalBlocks": 409600},
 *     {"peerId": "disk-b", "totalBlocks": 819200}
 *   ]
 * }
 * </pre>
 * The first {@code --nodes} entries form the starting ring; the following ones
 * are the peers that join (or, for a shrink, the tail of the starting ring leaves).
 */
public class PeerFile {
    public List<JsonPeer> peers;

    public static class JsonPeer {
        public String peerId;
        public long totalBlocks;
    }

    public static PeerInfoList load(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            PeerFile file = mapper.readValue(path.toFile(), PeerFile.class);
            if (file.peers == null || file.peers.isEmpty()) {
                throw new CliException("no peers listed in " + path);
            }
            List<PeerInfo> out = new ArrayList<>(file.peers.size());
            for (JsonPeer p : file.peers) {
                if (p == null || p.peerId == null) {
                    throw new CliException("peer without peerId in " + path);
                }
                out.add(new PeerInfo(p.peerId, p.totalBlocks));
            }
            return PeerInfoList.copyOf(out);
        } catch (IOException e) {
            throw new CliException("failed to load peers from " + path + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new CliException("invalid peer in " + path + ": " + e.getMessage(), e);
        }
    }
}
