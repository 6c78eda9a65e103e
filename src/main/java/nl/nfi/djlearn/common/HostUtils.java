package nl.nfi.djlearn.common;

import java.net.InetAddress;
import java.net.UnknownHostException;

public final class HostUtils {

    private HostUtils() {
    }

    public static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (final UnknownHostException e) {
            return "localhost";
        }
    }
}
