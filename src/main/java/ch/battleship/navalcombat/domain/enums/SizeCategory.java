package ch.battleship.navalcombat.domain.enums;

/**
 * Coarse ship size disclosed by a {@link RevealLevel#SIZE_HINT}.
 */
public enum SizeCategory {
    SMALL,
    MEDIUM,
    LARGE;

    public static SizeCategory ofSize(int size) {
        if (size <= 2) {
            return SMALL;
        }
        return size <= 3 ? MEDIUM : LARGE;
    }
}
