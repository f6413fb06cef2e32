package ch.battleship.navalcombat.repository;

import ch.battleship.navalcombat.domain.Game;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryGameRepository implements GameRepository {

    private final Map<String, Game> gameStore = new ConcurrentHashMap<>();

    @Override
    public Game save(Game game) {
        gameStore.put(game.getGameCode(), game);
        return game;
    }

    @Override
    public Optional<Game> findByGameCode(String gameCode) {
        return Optional.ofNullable(gameStore.get(gameCode));
    }

    @Override
    public Collection<Game> findAll() {
        return List.copyOf(gameStore.values());
    }

    @Override
    public boolean deleteByGameCode(String gameCode) {
        return gameStore.remove(gameCode) != null;
    }
}
