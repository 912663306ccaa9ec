package com.koni.tracking.domain.model;

import com.koni.tracking.domain.exception.ProtocolFormatException;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Spatial position of a beacon, in millimetres.
 * Beacon identifiers carry their own coordinates at fixed offsets.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class BeaconCoordinates {

    static final int X_OFFSET = 12;
    static final int Y_OFFSET = 24;
    static final int COORDINATE_LENGTH = 8;
    static final int MIN_UUID_LENGTH = Y_OFFSET + COORDINATE_LENGTH;

    private final int x;
    private final int y;

    /**
     * Decodes the coordinates embedded in a beacon uuid.
     *
     * @param uuid the beacon identifier
     * @return the decoded coordinates
     * @throws ProtocolFormatException if the uuid is too short or the coordinate digits are not numeric
     */
    public static BeaconCoordinates fromUuid(String uuid) {
        if (uuid == null || uuid.length() < MIN_UUID_LENGTH) {
            throw new ProtocolFormatException("Beacon uuid too short to carry coordinates: " + uuid);
        }
        return new BeaconCoordinates(
                parseCoordinate(uuid, X_OFFSET),
                parseCoordinate(uuid, Y_OFFSET)
        );
    }

    private static int parseCoordinate(String uuid, int offset) {
        String digits = uuid.substring(offset, offset + COORDINATE_LENGTH);
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new ProtocolFormatException("Invalid coordinate '" + digits + "' in beacon uuid " + uuid, e);
        }
    }
}
