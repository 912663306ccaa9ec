package com.koni.tracking.domain.service;

import com.koni.tracking.domain.model.TagPlacement;

import java.time.Duration;

/**
 * Room and danger-area rules of location monitoring.
 */
public class LocationRules {

    /**
     * @return true if the tag's current beacon is in a room other than the one its object is assigned to
     */
    public boolean isOutsideAssignedRoom(TagPlacement placement) {
        return placement.getAssignedRoom() != null
                && placement.getCurrentRoom() != null
                && !placement.getAssignedRoom().equals(placement.getCurrentRoom());
    }

    /**
     * @return true if the tag has stayed in a danger area longer than the policy allows
     */
    public boolean isLongStayInDanger(TagPlacement placement) {
        if (!placement.isDangerArea() || placement.getFirstSeen() == null || placement.getLastSeen() == null) {
            return false;
        }
        long stayedMinutes = Duration.between(placement.getFirstSeen(), placement.getLastSeen()).toMinutes();
        return stayedMinutes > placement.getStayDurationMinutes();
    }
}
