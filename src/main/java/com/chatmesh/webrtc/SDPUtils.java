package com.chatmesh.webrtc;

/**
 * Small SDP rewrites applied to locally generated descriptions.
 */
public final class SDPUtils {

    private static final String CRLF = "\r\n";

    private SDPUtils() {
    }

    /**
     * Force the given media type to have 'sendrecv' direction.
     * Corrects early offers where a track is not registered yet but is about to be sent,
     * which otherwise ends as one-way media.
     */
    public static String enforceSendRecv(String sdp, String mediaType) {
        if (sdp == null || !sdp.contains("m=" + mediaType)) {
            return sdp;
        }

        StringBuilder sb = new StringBuilder(sdp.length());
        boolean inMediaSection = false;

        for (String line : sdp.split(CRLF)) {
            if (line.startsWith("m=")) {
                inMediaSection = line.startsWith("m=" + mediaType);
            }
            if (inMediaSection
                && (line.equals("a=recvonly") || line.equals("a=sendonly") || line.equals("a=inactive"))) {
                sb.append("a=sendrecv").append(CRLF);
                continue;
            }
            sb.append(line).append(CRLF);
        }

        return sb.toString();
    }
}
