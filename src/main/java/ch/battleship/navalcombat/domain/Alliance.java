package ch.battleship.navalcombat.domain;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Named team of players sharing one win/loss outcome.
 */
@Getter
public class Alliance {

    private final String id;

    private final String name;

    /**
     * Area this alliance places its ships in, {@code null} for the whole board.
     */
    private final PlacementZone placementZone;

    private final List<UUID> memberIds = new ArrayList<>();

    public Alliance(String id, String name, PlacementZone placementZone) {
        this.id = id;
        this.name = name;
        this.placementZone = placementZone;
    }

    public List<UUID> getMemberIds() {
        return Collections.unmodifiableList(memberIds);
    }

    public void addMember(UUID playerId) {
        if (!memberIds.contains(playerId)) {
            memberIds.add(playerId);
        }
    }

    public boolean hasMember(UUID playerId) {
        return memberIds.contains(playerId);
    }

    public boolean isEmpty() {
        return memberIds.isEmpty();
    }
}
