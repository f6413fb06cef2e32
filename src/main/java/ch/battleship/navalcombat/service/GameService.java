package ch.battleship.navalcombat.service;

import ch.battleship.navalcombat.domain.ActionResult;
import ch.battleship.navalcombat.domain.AiPlayer;
import ch.battleship.navalcombat.domain.Alliance;
import ch.battleship.navalcombat.domain.Coordinate;
import ch.battleship.navalcombat.domain.EraConfiguration;
import ch.battleship.navalcombat.domain.EventLogEntry;
import ch.battleship.navalcombat.domain.Game;
import ch.battleship.navalcombat.domain.GameAction;
import ch.battleship.navalcombat.domain.HumanPlayer;
import ch.battleship.navalcombat.domain.Player;
import ch.battleship.navalcombat.domain.enums.ActionType;
import ch.battleship.navalcombat.domain.enums.AiStrategy;
import ch.battleship.navalcombat.domain.enums.GameState;
import ch.battleship.navalcombat.domain.enums.PlayerType;
import ch.battleship.navalcombat.domain.exception.GameStateException;
import ch.battleship.navalcombat.domain.exception.GameValidationException;
import ch.battleship.navalcombat.domain.exception.TargetRequestCancelledException;
import ch.battleship.navalcombat.repository.GameRepository;
import ch.battleship.navalcombat.web.api.dto.ActionRequest;
import ch.battleship.navalcombat.web.api.dto.ActionResultDto;
import ch.battleship.navalcombat.web.api.dto.CreateGameResponseDto;
import ch.battleship.navalcombat.web.api.dto.GameEventDto;
import ch.battleship.navalcombat.web.api.dto.GameStateDto;
import ch.battleship.navalcombat.web.api.dto.GameStatsDto;
import ch.battleship.navalcombat.web.api.dto.JoinGameRequest;
import ch.battleship.navalcombat.web.api.dto.JoinGameResponseDto;
import ch.battleship.navalcombat.web.api.dto.PlaceShipRequest;
import ch.battleship.navalcombat.web.api.dto.PlayerDto;
import ch.battleship.navalcombat.web.api.dto.ShipDto;
import ch.battleship.navalcombat.web.api.dto.TargetSubmissionRequest;
import ch.battleship.navalcombat.web.api.dto.ValidAttackDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * Application service around {@link Game}: creates matches from eras, maps requests onto domain
 * actions, publishes notifications and drives the turn loop (deferred AI moves, human target
 * requests).
 */
@Service
@Slf4j
public class GameService {

    private static final int RECENT_LOG_SIZE = 20;

    private final GameRepository gameRepository;
    private final EraCatalog eraCatalog;
    private final GameEventPublisher eventPublisher;
    private final AiTurnScheduler aiTurnScheduler;
    private final long humanTargetTimeoutMs;

    public GameService(GameRepository gameRepository,
                       EraCatalog eraCatalog,
                       GameEventPublisher eventPublisher,
                       AiTurnScheduler aiTurnScheduler,
                       @Value("${naval.human.target-timeout-ms:120000}") long humanTargetTimeoutMs) {
        this.gameRepository = gameRepository;
        this.eraCatalog = eraCatalog;
        this.eventPublisher = eventPublisher;
        this.aiTurnScheduler = aiTurnScheduler;
        this.humanTargetTimeoutMs = humanTargetTimeoutMs;
    }

    public Game createGame(String eraId) {
        EraConfiguration era = eraCatalog.get(eraId == null || eraId.isBlank() ? EraCatalog.DEFAULT_ERA : eraId);
        Game game = new Game(UUID.randomUUID().toString(), era);
        game.setActionListener(result -> onActionResolved(game, result));
        log.info("Game {} created from era {}", game.getGameCode(), era.id());
        return gameRepository.save(game);
    }

    public CreateGameResponseDto createGamePublic(String eraId) {
        Game game = createGame(eraId);
        return new CreateGameResponseDto(
                game.getGameCode(),
                game.getEra().id(),
                game.getState(),
                game.getAlliances().stream().map(Alliance::getName).toList()
        );
    }

    public Game getGame(String gameCode) {
        return gameRepository.findByGameCode(gameCode)
                .orElseThrow(() -> new NoSuchElementException("Game not found: " + gameCode));
    }

    public JoinGameResponseDto joinGame(String gameCode, JoinGameRequest request) {
        Game game = getGame(gameCode);
        if (request.playerName() == null || request.playerName().isBlank()) {
            throw new GameValidationException("Player name is required");
        }

        Player player;
        if (request.type() == PlayerType.AI) {
            AiStrategy strategy = request.strategy() != null ? request.strategy() : AiStrategy.RANDOM;
            double difficulty = request.difficulty() != null ? request.difficulty() : 1.0;
            player = game.addAiPlayer(request.playerName(), strategy, difficulty, request.allianceName());
        } else {
            player = game.addHumanPlayer(request.playerName(), request.allianceName());
        }

        eventPublisher.publish(GameEventDto.playerJoined(game, player));
        return new JoinGameResponseDto(
                game.getGameCode(),
                player.getId(),
                player.getName(),
                player.getType(),
                player.getAllianceId(),
                game.getState()
        );
    }

    public GameStateDto beginPlacement(String gameCode) {
        Game game = getGame(gameCode);
        game.beginPlacement();
        eventPublisher.publish(GameEventDto.placementStarted(game));
        return toStateDto(game, null);
    }

    public ActionResultDto placeShip(String gameCode, int shipId, PlaceShipRequest request) {
        Game game = getGame(gameCode);
        ActionResult result = game.placeShip(request.playerId(), shipId,
                Coordinate.of(request.row(), request.col()), request.rowDelta(), request.colDelta());
        return ActionResultDto.from(result);
    }

    public ActionResultDto autoPlace(String gameCode, UUID playerId) {
        Game game = getGame(gameCode);
        return ActionResultDto.from(game.autoPlace(playerId));
    }

    public GameStateDto startBattle(String gameCode) {
        Game game = getGame(gameCode);
        game.startBattle();
        Player first = game.getCurrentPlayer();
        eventPublisher.publish(GameEventDto.gameStarted(game, first));
        continueTurnLoop(game, null);
        return toStateDto(game, null);
    }

    /**
     * Maps a request onto a domain action and applies it.
     */
    public ActionResultDto processAction(String gameCode, ActionRequest request) {
        Game game = getGame(gameCode);
        if (request.type() == null) {
            throw new GameValidationException("Action type is required");
        }
        GameAction action = toAction(request);

        ActionResult result = game.processAction(action);
        if (action.type() == ActionType.FIRE) {
            // an accepted direct fire replaces the open target request
            game.findPlayer(action.playerId())
                    .filter(HumanPlayer.class::isInstance)
                    .map(HumanPlayer.class::cast)
                    .ifPresent(h -> h.cancelPendingRequest("Superseded by a direct action"));
            continueTurnLoop(game, result);
        }
        return ActionResultDto.from(result);
    }

    private GameAction toAction(ActionRequest request) {
        Coordinate target = request.row() != null && request.col() != null
                ? Coordinate.of(request.row(), request.col())
                : null;
        return new GameAction(request.type(), request.playerId(), target, request.munition(),
                request.shipId(), request.rowDelta(), request.colDelta());
    }

    /**
     * Answers the pending target request of a human player.
     *
     * @throws GameValidationException if the target may not be attacked by that player
     * @throws GameStateException if no target request is pending
     */
    public void submitTarget(String gameCode, TargetSubmissionRequest request) {
        Game game = getGame(gameCode);
        if (!game.isValidAttack(request.playerId(), request.row(), request.col())) {
            throw new GameValidationException("Invalid target (" + request.row() + "," + request.col() + ")");
        }
        if (!game.supplyHumanTarget(request.playerId(), Coordinate.of(request.row(), request.col()))) {
            throw new GameStateException("No target request pending for player " + request.playerId());
        }
    }

    public GameStateDto getState(String gameCode, UUID playerId) {
        return toStateDto(getGame(gameCode), playerId);
    }

    public GameStatsDto getStats(String gameCode) {
        Game game = getGame(gameCode);
        synchronized (game) {
            return GameStatsDto.from(game.getGameStats(), game.getMatchResults());
        }
    }

    public ValidAttackDto isValidAttack(String gameCode, UUID playerId, int row, int col) {
        Game game = getGame(gameCode);
        boolean valid = playerId != null
                ? game.isValidAttack(playerId, row, col)
                : game.isValidAttack(row, col);
        return new ValidAttackDto(playerId, row, col, valid);
    }

    public GameStateDto resetGame(String gameCode) {
        Game game = getGame(gameCode);
        game.reset();
        eventPublisher.publish(GameEventDto.gameReset(game));
        return toStateDto(game, null);
    }

    // ----------------- turn loop -----------------

    /**
     * Decides what happens after a battle action: schedule the next AI move or ask the human
     * whose turn it is for a target.
     *
     * <p>In simultaneous mode AIs answer every human action with one volley. Without an active
     * human the volleys follow each other until the match ends.
     */
    void continueTurnLoop(Game game, ActionResult lastResult) {
        if (game.getState() != GameState.PLAYING) {
            return;
        }
        if (game.getRules().simultaneousFire()) {
            boolean humanActed = lastResult != null && game.findPlayer(lastResult.playerId())
                    .map(p -> p.getType() == PlayerType.HUMAN)
                    .orElse(false);
            if (lastResult == null || humanActed || !hasActiveHuman(game)) {
                scheduleAiTurn(game);
            }
            return;
        }

        Player current = game.getCurrentPlayer();
        if (current instanceof AiPlayer) {
            scheduleAiTurn(game);
        } else if (current instanceof HumanPlayer human) {
            openTargetRequest(game, human);
        }
    }

    private void scheduleAiTurn(Game game) {
        aiTurnScheduler.scheduleNextTurn(game, results -> {
            if (!results.isEmpty()) {
                continueTurnLoop(game, results.get(results.size() - 1));
            } else if (!game.getRules().simultaneousFire()) {
                continueTurnLoop(game, null);
            }
        });
    }

    private static boolean hasActiveHuman(Game game) {
        return game.getPlayers().stream()
                .anyMatch(p -> p.getType() == PlayerType.HUMAN && !p.isEliminated());
    }

    private void openTargetRequest(Game game, HumanPlayer human) {
        if (human.hasPendingRequest()) {
            return;
        }
        CompletableFuture<Coordinate> request =
                game.requestHumanTarget(human.getId(), Duration.ofMillis(humanTargetTimeoutMs));
        eventPublisher.publish(GameEventDto.targetRequested(game, human, humanTargetTimeoutMs));

        request.whenComplete((target, error) -> {
            if (error != null) {
                onRequestClosed(game, human, error);
                return;
            }
            try {
                ActionResult result = game.processAction(GameAction.fire(human.getId(), target));
                continueTurnLoop(game, result);
            } catch (IllegalArgumentException | IllegalStateException e) {
                log.warn("Target {} from {} in game {} rejected: {}",
                        target, human.getName(), game.getGameCode(), e.getMessage());
                continueTurnLoop(game, null);
            }
        });
    }

    /**
     * A timed-out request is announced and opened again while it is still that human's turn.
     */
    private void onRequestClosed(Game game, HumanPlayer human, Throwable error) {
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            log.info("Target request for {} in game {} timed out", human.getName(), game.getGameCode());
            eventPublisher.publish(GameEventDto.targetTimedOut(game, human));
            continueTurnLoop(game, null);
        } else if (cause instanceof TargetRequestCancelledException) {
            log.debug("Target request for {} in game {} closed: {}", human.getName(), game.getGameCode(), cause.getMessage());
        } else {
            log.warn("Target request for {} in game {} failed", human.getName(), game.getGameCode(), cause);
        }
    }

    private void onActionResolved(Game game, ActionResult result) {
        eventPublisher.publish(GameEventDto.actionResolved(game, result));

        Optional<Player> actor = game.findPlayer(result.playerId());
        switch (result.type()) {
            case PLACE_SHIP -> actor.ifPresent(p -> eventPublisher.publish(GameEventDto.shipPlaced(game, p,
                    result.logEntries().isEmpty() ? "" : result.logEntries().get(0).message())));
            case AUTO_PLACE -> actor.ifPresent(p -> eventPublisher.publish(GameEventDto.fleetPlaced(game, p)));
            case FIRE -> {
                if (result.state() == GameState.FINISHED) {
                    String winnerName = game.getAlliance(game.getWinner())
                            .map(game::allianceDisplayName)
                            .orElse(null);
                    eventPublisher.publish(GameEventDto.gameFinished(game, winnerName));
                } else if (result.turnChanged() && game.getCurrentPlayer() != null) {
                    eventPublisher.publish(GameEventDto.turnChanged(game, game.getCurrentPlayer(), result));
                }
            }
        }
    }

    // ----------------- mapping -----------------

    private GameStateDto toStateDto(Game game, UUID playerId) {
        synchronized (game) {
            return buildStateDto(game, playerId);
        }
    }

    private GameStateDto buildStateDto(Game game, UUID playerId) {
        Player current = game.getCurrentPlayer();
        Optional<Player> viewer = playerId == null ? Optional.empty() : game.findPlayer(playerId);
        if (playerId != null && viewer.isEmpty()) {
            throw new GameValidationException("Player does not belong to this game: " + playerId);
        }

        List<EventLogEntry> eventLog = game.getEventLog();
        List<String> recent = eventLog.subList(Math.max(0, eventLog.size() - RECENT_LOG_SIZE), eventLog.size()).stream()
                .map(EventLogEntry::message)
                .toList();

        boolean yourTurn = viewer.isPresent()
                && game.getState() == GameState.PLAYING
                && !viewer.get().isEliminated()
                && (game.getRules().simultaneousFire() || viewer.get().equals(current));

        return new GameStateDto(
                game.getGameCode(),
                game.getEra().id(),
                game.getState(),
                game.getBoard().getRows(),
                game.getBoard().getCols(),
                game.getTurnNumber(),
                current == null ? null : current.getId(),
                current == null ? null : current.getName(),
                game.getWinner(),
                game.getPlayers().stream().map(PlayerDto::from).toList(),
                game.getAlliances().stream()
                        .map(a -> new GameStateDto.AllianceDto(a.getId(), a.getName(),
                                a.isEmpty() ? a.getName() : game.allianceDisplayName(a), a.getMemberIds()))
                        .toList(),
                viewer.map(p -> p.getFleet().getShips().stream().map(ShipDto::from).toList()).orElse(List.of()),
                yourTurn,
                recent
        );
    }
}
