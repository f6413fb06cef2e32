package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.ai.TargetingStrategies;
import ch.battleship.navalcombat.domain.ai.TargetingStrategy;
import ch.battleship.navalcombat.domain.enums.AiStrategy;
import ch.battleship.navalcombat.domain.enums.PlayerType;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.Optional;
import java.util.Random;
import java.util.UUID;

/**
 * Computer-controlled turn participant.
 *
 * <p>Target selection depends only on the board, the player's own dont-shoot set, the strategy
 * and the difficulty. Selecting a target does not change any game state.
 */
@Getter
public class AiPlayer extends Player {

    private final AiStrategy strategy;

    /**
     * Difficulty scalar. Above 1.0 enables hunting around open hits; also the score multiplier
     * for humans that hit this player's ships.
     */
    private final double difficulty;

    @Getter(AccessLevel.NONE)
    private final TargetingStrategy targeting;

    @Getter(AccessLevel.NONE)
    private final Random random;

    public AiPlayer(UUID id, String name, AiStrategy strategy, double difficulty) {
        this(id, name, strategy, difficulty, new Random());
    }

    public AiPlayer(UUID id, String name, AiStrategy strategy, double difficulty, Random random) {
        super(id, name);
        this.strategy = strategy;
        this.difficulty = difficulty;
        this.targeting = TargetingStrategies.forPlayer(strategy, difficulty);
        this.random = random;
    }

    @Override
    public PlayerType getType() {
        return PlayerType.AI;
    }

    /**
     * @return next target, empty when no valid target is left
     */
    public Optional<Coordinate> selectTarget(Board board) {
        return targeting.selectTarget(board, getDontShoot(), getId(), random);
    }
}
