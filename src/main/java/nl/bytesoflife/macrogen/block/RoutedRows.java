package nl.bytesoflife.macrogen.block;

import java.util.Map;

/**
 * Result of routing a schematic into two device rows.
 *
 * @param nmosChannelY Via1 row above the NMOS devices
 * @param pmosChannelY Via1 row below the PMOS devices
 * @param tracks       Metal3 track centre per routed net
 * @param usedWidth    x just past the last device column
 * @param top          upper edge of the shared NWell
 */
public record RoutedRows(int trackCount, int nmosChannelY, int pmosChannelY, Map<String, Integer> tracks,
                         int usedWidth, int top) {

    public int track(String net) {
        Integer y = tracks.get(net);
        if (y == null) {
            throw new MissingConnectionException(net, "Net " + net + " has no routing track");
        }
        return y;
    }
}
