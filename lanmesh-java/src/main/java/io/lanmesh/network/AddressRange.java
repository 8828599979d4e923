package io.lanmesh.network;

import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Contiguous candidate range {@code prefix + start .. prefix + (start + count - 1)},
 * e.g. {@code 10.102.251.1 .. 10.102.251.20}.
 */
public record AddressRange(String prefix, int start, int count) {

    public AddressRange {
        if (prefix == null || prefix.isEmpty()) {
            throw new IllegalArgumentException("prefix must not be empty");
        }
        if (start < 0 || count < 0) {
            throw new IllegalArgumentException("start and count must be non-negative");
        }
    }

    public List<String> addresses() {
        List<String> result = new ArrayList<>(count);
        for (int i = start; i < start + count; i++) {
            result.add(prefix + i);
        }
        return result;
    }

    public boolean contains(String address) {
        if (address == null || !address.startsWith(prefix)) {
            return false;
        }
        try {
            int suffix = Integer.parseInt(address.substring(prefix.length()));
            return suffix >= start && suffix < start + count;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Addresses that belong to this host for the purpose of candidate exclusion.
     * A specific bind address is the only own address; a wildcard bind means every
     * interface address plus the loopback address.
     */
    public static Set<String> ownAddresses(String bindHost) {
        Set<String> own = new LinkedHashSet<>();
        if (bindHost != null && !isWildcard(bindHost)) {
            own.add(normalize(bindHost));
            return own;
        }
        own.add("127.0.0.1");
        try {
            for (NetworkInterface nic : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                for (InetAddress addr : Collections.list(nic.getInetAddresses())) {
                    own.add(addr.getHostAddress());
                }
            }
        } catch (SocketException e) {
            // interfaces unavailable: fall back to the hostname address
            try {
                own.add(InetAddress.getLocalHost().getHostAddress());
            } catch (UnknownHostException ignored) {
                own.add("127.0.0.1");
            }
        }
        return own;
    }

    public static boolean isWildcard(String host) {
        return host.isEmpty() || "0.0.0.0".equals(host) || "::".equals(host) || "*".equals(host);
    }

    private static String normalize(String host) {
        return "localhost".equalsIgnoreCase(host) ? "127.0.0.1" : host;
    }
}
