package ch.battleship.navalcombat.repository;

import ch.battleship.navalcombat.domain.Game;

import java.util.Collection;
import java.util.Optional;

/**
 * Owner of all running {@link Game} instances. Matches live in memory only.
 */
public interface GameRepository {

    Game save(Game game);

    Optional<Game> findByGameCode(String gameCode);

    Collection<Game> findAll();

    boolean deleteByGameCode(String gameCode);
}
