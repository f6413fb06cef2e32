package ch.battleship.navalcombat.domain;

import ch.battleship.navalcombat.domain.enums.ActionType;
import ch.battleship.navalcombat.domain.enums.AiStrategy;
import ch.battleship.navalcombat.domain.enums.GameState;
import ch.battleship.navalcombat.domain.enums.MunitionType;
import ch.battleship.navalcombat.domain.enums.PlayerType;
import ch.battleship.navalcombat.domain.enums.ShotResult;
import ch.battleship.navalcombat.domain.exception.GameStateException;
import ch.battleship.navalcombat.domain.exception.GameValidationException;
import ch.battleship.navalcombat.domain.exception.ResourceExhaustedException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Represents one match.
 *
 * <p>The game aggregates the shared board, the players, their alliances and the ship arena,
 * and drives the lifecycle {@code SETUP -> PLACEMENT -> PLAYING -> FINISHED}. Every discrete
 * action goes through {@link #processAction(GameAction)}, is applied completely (board, ships,
 * players, battle log, win evaluation) and then reported to the registered listener.
 *
 * <p>Every public operation and query synchronizes on the game instance, so board, ship and
 * turn changes of one action are never observed half-applied. Callers that combine several
 * queries into one view hold the game monitor themselves ({@code synchronized (game)}). A busy
 * flag rejects actions submitted from inside an action, e.g. by the listener, with a
 * {@link GameStateException}.
 */
@Slf4j
@Getter
public class Game {

    /**
     * Public game identifier used in URLs and topics.
     */
    private final String gameCode;

    private final EraConfiguration era;

    private final GameRules rules;

    private final Board board;

    private volatile GameState state = GameState.SETUP;

    @Getter(AccessLevel.NONE)
    private final List<Player> players = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final Map<String, Alliance> alliances = new LinkedHashMap<>();

    @Getter(AccessLevel.NONE)
    private final Map<String, AllianceDefinition> allianceDefinitions = new LinkedHashMap<>();

    /**
     * Ship arena: index == ship id.
     */
    @Getter(AccessLevel.NONE)
    private final List<Ship> ships = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<Player> shipOwners = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<EventLogEntry> eventLog = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<PlayerMatchResult> matchResults = new ArrayList<>();

    private volatile int turnIndex;

    /**
     * Number of the current fire action, starting at 1 when the battle begins.
     */
    private volatile int turnNumber;

    /**
     * Winning alliance id, {@code null} while running or after a draw.
     */
    private volatile String winner;

    private UUID firstPlayerId;

    private volatile Instant startedAt;

    private volatile Instant finishedAt;

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean busy = new AtomicBoolean(false);

    @Getter(AccessLevel.NONE)
    private Consumer<ActionResult> actionListener;

    @Getter(AccessLevel.NONE)
    private final PlacementEngine placementEngine;

    @Getter(AccessLevel.NONE)
    private final CombatResolver combatResolver;

    public Game(String gameCode, EraConfiguration era) {
        this(gameCode, era, new Random());
    }

    /**
     * Creates a game in {@link GameState#SETUP} with one alliance per era alliance definition.
     *
     * @param gameCode public game identifier
     * @param era era configuration
     * @param random randomness source for automated placement
     */
    public Game(String gameCode, EraConfiguration era, Random random) {
        this.gameCode = gameCode;
        this.era = era;
        this.rules = era.rules();
        this.board = new Board(era.terrain());
        this.placementEngine = new PlacementEngine(board, rules.overlapRule(), rules.placementAttempts(), random);
        this.combatResolver = new CombatResolver(this);

        int index = 1;
        for (AllianceDefinition definition : era.alliances()) {
            String allianceId = "alliance-" + index++;
            alliances.put(allianceId, new Alliance(allianceId, definition.name(), definition.placementZone()));
            allianceDefinitions.put(allianceId, definition);
        }
    }

    // ----------------- setup -----------------

    /**
     * Adds a human player.
     *
     * <p>When the rules allow choosing an alliance and {@code allianceName} is given, the player
     * joins that alliance; otherwise the first configured alliance.
     *
     * @throws GameStateException if the game is not in SETUP
     * @throws GameValidationException if the alliance name is unknown
     */
    public synchronized HumanPlayer addHumanPlayer(String name, String allianceName) {
        Alliance alliance = rules.chooseAlliance() && allianceName != null
                ? findAllianceByName(allianceName)
                : firstAlliance();
        HumanPlayer player = new HumanPlayer(UUID.randomUUID(), name);
        addPlayer(player, alliance);
        return player;
    }

    /**
     * Adds an AI player.
     *
     * <p>Without an explicit alliance name the AI joins the opposing alliance: the first
     * configured alliance whose name differs from the first human's alliance (or from the
     * first alliance if no human has joined).
     */
    public AiPlayer addAiPlayer(String name, AiStrategy strategy, double difficulty, String allianceName) {
        return addAiPlayer(name, strategy, difficulty, allianceName, new Random());
    }

    public synchronized AiPlayer addAiPlayer(String name, AiStrategy strategy, double difficulty, String allianceName, Random random) {
        Alliance alliance = allianceName != null ? findAllianceByName(allianceName) : opposingAlliance();
        AiPlayer player = new AiPlayer(UUID.randomUUID(), name, strategy, difficulty, random);
        addPlayer(player, alliance);
        return player;
    }

    private void addPlayer(Player player, Alliance alliance) {
        requireState(GameState.SETUP, "add players");
        if (players.stream().anyMatch(p -> p.getName().equals(player.getName()))) {
            throw new GameValidationException("Player name already exists in this game: " + player.getName());
        }

        player.setAllianceId(alliance.getId());
        alliance.addMember(player.getId());
        for (ShipDefinition definition : allianceDefinitions.get(alliance.getId()).fleet()) {
            Ship ship = new Ship(ships.size(), definition.name(), definition.shipClass(), definition.size(),
                    definition.allowedTerrain(), definition.torpedoes());
            ships.add(ship);
            shipOwners.add(player);
            player.getFleet().addShip(ship);
        }
        players.add(player);
        log.info("Player {} ({}) joined game {} in alliance {}",
                player.getName(), player.getType(), gameCode, alliance.getName());
    }

    private Alliance firstAlliance() {
        return alliances.values().iterator().next();
    }

    private Alliance opposingAlliance() {
        Alliance home = players.stream()
                .filter(p -> p.getType() == PlayerType.HUMAN)
                .findFirst()
                .map(p -> alliances.get(p.getAllianceId()))
                .orElse(firstAlliance());
        return alliances.values().stream()
                .filter(a -> !a.getName().equals(home.getName()))
                .findFirst()
                .orElseThrow(() -> new GameValidationException("Era has no opposing alliance"));
    }

    private Alliance findAllianceByName(String allianceName) {
        return alliances.values().stream()
                .filter(a -> a.getName().equalsIgnoreCase(allianceName))
                .findFirst()
                .orElseThrow(() -> new GameValidationException("Unknown alliance: " + allianceName));
    }

    /**
     * Designates the player who fires first. Defaults to the first human, else the first player.
     */
    public synchronized void setFirstPlayer(UUID playerId) {
        if (state == GameState.PLAYING || state == GameState.FINISHED) {
            throw new GameStateException("First player can only be chosen before the battle");
        }
        this.firstPlayerId = requirePlayer(playerId).getId();
    }

    /**
     * SETUP -> PLACEMENT. Requires at least two players in at least two alliances.
     */
    public synchronized void beginPlacement() {
        requireState(GameState.SETUP, "begin placement");
        if (players.size() < 2) {
            throw new GameStateException("At least two players are required");
        }
        long populated = alliances.values().stream().filter(a -> !a.isEmpty()).count();
        if (populated < 2) {
            throw new GameStateException("At least two alliances need members");
        }
        state = GameState.PLACEMENT;
        appendLog("Placement started");
        log.info("Game {} entered placement with {} players", gameCode, players.size());
    }

    // ----------------- actions -----------------

    public synchronized void setActionListener(Consumer<ActionResult> actionListener) {
        this.actionListener = actionListener;
    }

    /**
     * Applies one action atomically and notifies the listener.
     *
     * @throws GameStateException if another action is in progress, the phase is wrong or it is
     *                            not the player's turn
     * @throws GameValidationException if the target or placement is invalid
     * @throws ResourceExhaustedException if a munition or torpedo is used up
     */
    public synchronized ActionResult processAction(GameAction action) {
        Objects.requireNonNull(action, "action must not be null");
        if (!busy.compareAndSet(false, true)) {
            throw new GameStateException("Another action is still being processed");
        }
        ActionResult result;
        try {
            result = switch (action.type()) {
                case PLACE_SHIP -> applyPlaceShip(action);
                case AUTO_PLACE -> applyAutoPlace(action);
                case FIRE -> applyFire(action);
            };
        } finally {
            busy.set(false);
        }
        notifyListener(result);
        return result;
    }

    public ActionResult placeShip(UUID playerId, int shipId, Coordinate start, int rowDelta, int colDelta) {
        return processAction(GameAction.placeShip(playerId, shipId, start, rowDelta, colDelta));
    }

    public ActionResult autoPlace(UUID playerId) {
        return processAction(GameAction.autoPlace(playerId));
    }

    public ActionResult fire(UUID playerId, Coordinate target, MunitionType munition) {
        return processAction(GameAction.fire(playerId, target, munition));
    }

    private ActionResult applyPlaceShip(GameAction action) {
        requireState(GameState.PLACEMENT, "place ships");
        Player player = requirePlayer(action.playerId());
        if (action.shipId() == null || action.target() == null) {
            throw new GameValidationException("Ship id and start cell are required");
        }
        Ship ship = player.getFleet().getShip(action.shipId())
                .orElseThrow(() -> new GameValidationException("Ship " + action.shipId() + " does not belong to " + player.getName()));

        List<Coordinate> run = placementEngine.placeManual(player.getFleet(), zoneOf(player), ship,
                action.target(), action.rowDelta(), action.colDelta());

        EventLogEntry entry = appendLog(String.format("%s placed %s at %s-%s",
                player.getName(), ship.getName(), run.get(0).toCellName(), run.get(run.size() - 1).toCellName()));
        return placementResult(action, player, run, entry);
    }

    private ActionResult applyAutoPlace(GameAction action) {
        requireState(GameState.PLACEMENT, "place ships");
        Player player = requirePlayer(action.playerId());
        placementEngine.autoPlace(player.getFleet(), zoneOf(player));
        EventLogEntry entry = appendLog(player.getName() + " placed the fleet automatically");
        List<Coordinate> cells = player.getFleet().getShips().stream()
                .flatMap(s -> s.getCells().stream())
                .toList();
        return placementResult(action, player, cells, entry);
    }

    private ActionResult placementResult(GameAction action, Player player, List<Coordinate> cells, EventLogEntry entry) {
        List<CellOutcome> outcomes = cells.stream()
                .map(CellOutcome::placed)
                .toList();
        return new ActionResult(action.type(), player.getId(), null, null, outcomes, List.of(entry),
                state, null, false, null);
    }

    /**
     * Removes every ship of a player's fleet from the board (re-arrange during placement).
     */
    public synchronized void clearFleet(UUID playerId) {
        requireState(GameState.PLACEMENT, "clear a fleet");
        placementEngine.clear(requirePlayer(playerId).getFleet());
    }

    /**
     * PLACEMENT -> PLAYING.
     *
     * <p>AI fleets that are not complete are placed automatically. Every human fleet must be
     * complete. Munition balances are assigned per player from the number of opponents.
     */
    public synchronized void startBattle() {
        requireState(GameState.PLACEMENT, "start the battle");
        for (Player player : players) {
            if (player.getType() == PlayerType.AI && !player.getFleet().isComplete()) {
                placementEngine.autoPlace(player.getFleet(), zoneOf(player));
            }
        }
        List<String> incomplete = players.stream()
                .filter(p -> !p.getFleet().isComplete())
                .map(Player::getName)
                .toList();
        if (!incomplete.isEmpty()) {
            throw new GameStateException("Fleets not complete: " + String.join(", ", incomplete));
        }

        for (Player player : players) {
            long opponents = players.stream()
                    .filter(p -> !Objects.equals(p.getAllianceId(), player.getAllianceId()))
                    .count();
            for (MunitionAllowance allowance : era.munitions()) {
                player.setMunitions(allowance.type(), allowance.balanceFor((int) opponents));
            }
        }

        Player first = firstPlayerId != null
                ? requirePlayer(firstPlayerId)
                : players.stream().filter(p -> p.getType() == PlayerType.HUMAN).findFirst().orElse(players.get(0));
        turnIndex = players.indexOf(first);
        turnNumber = 1;
        startedAt = Instant.now();
        state = GameState.PLAYING;
        appendLog("Battle started, " + first.getName() + " fires first");
        log.info("Game {} started, first player {}", gameCode, first.getName());
    }

    private ActionResult applyFire(GameAction action) {
        requireState(GameState.PLAYING, "fire");
        Player attacker = requirePlayer(action.playerId());
        if (attacker.isEliminated()) {
            throw new GameStateException(attacker.getName() + " has been eliminated");
        }
        if (!rules.simultaneousFire() && !attacker.getId().equals(players.get(turnIndex).getId())) {
            throw new GameStateException("It is not " + attacker.getName() + "'s turn");
        }

        if (action.target() == null) {
            throw new GameValidationException("Target is required");
        }

        MunitionType munition = action.munitionOrShot();
        CombatResolver.Resolution resolution =
                combatResolver.resolve(attacker, action.target(), munition, action.shipId(), turnNumber);

        List<EventLogEntry> entries = new ArrayList<>();
        resolution.messages().forEach(m -> entries.add(appendLog(m)));

        ShotResult overall = ActionResult.summarize(resolution.cells());
        log.debug("Game {} turn {}: {} fired {} at {} -> {}",
                gameCode, turnNumber, attacker.getName(), munition, action.target(), overall);

        entries.addAll(evaluateWinner());

        boolean turnChanged = false;
        if (state == GameState.PLAYING) {
            if (!rules.simultaneousFire()) {
                boolean keepTurn = overall.isHit() ? rules.turnOnHit() : rules.turnOnMiss();
                if (!keepTurn) {
                    turnChanged = advanceTurn();
                }
            }
            turnNumber++;
        }

        Player current = getCurrentPlayer();
        return new ActionResult(ActionType.FIRE, attacker.getId(), munition, overall, resolution.cells(), entries,
                state, current == null ? null : current.getId(), turnChanged, winner);
    }

    /**
     * Moves the turn pointer round-robin to the next player that is not eliminated.
     *
     * @return {@code true} if the pointer moved to a different player
     */
    private boolean advanceTurn() {
        int size = players.size();
        for (int step = 1; step <= size; step++) {
            int candidate = (turnIndex + step) % size;
            if (!players.get(candidate).isEliminated()) {
                boolean changed = candidate != turnIndex;
                turnIndex = candidate;
                return changed;
            }
        }
        return false;
    }

    /**
     * Eliminates defeated players and finishes the match once at most one alliance stands.
     */
    private List<EventLogEntry> evaluateWinner() {
        List<EventLogEntry> entries = new ArrayList<>();
        for (Player player : players) {
            if (!player.isEliminated() && player.getFleet().isDefeated()) {
                player.eliminate();
                entries.add(appendLog(String.format("t%d-%s has been eliminated", turnNumber, player.getName())));
            }
        }

        List<Alliance> standing = alliances.values().stream()
                .filter(a -> !a.isEmpty())
                .filter(a -> a.getMemberIds().stream().map(this::requirePlayer).anyMatch(p -> !p.isEliminated()))
                .toList();

        if (standing.size() == 1) {
            finish(standing.get(0), entries);
        } else if (standing.isEmpty()) {
            finish(null, entries);
        }
        return entries;
    }

    private void finish(Alliance winningAlliance, List<EventLogEntry> entries) {
        state = GameState.FINISHED;
        finishedAt = Instant.now();
        winner = winningAlliance == null ? null : winningAlliance.getId();

        String message = winningAlliance == null
                ? "Draw: no alliance remains"
                : "Victory: " + allianceDisplayName(winningAlliance) + " wins";
        entries.add(appendLog(String.format("t%d-%s", turnNumber, message)));

        for (Player player : players) {
            if (player instanceof HumanPlayer human) {
                human.cancelPendingRequest("Game finished");
                matchResults.add(new PlayerMatchResult(player.getId(), player.getName(), era.id(),
                        player.getShots(), player.getHits(), player.getMisses(), player.getSunk(),
                        player.getAccuracy(), player.getScore(),
                        winner != null && winner.equals(player.getAllianceId())));
            }
        }
        log.info("Game {} finished after {} turns: {}", gameCode, turnNumber, message);
    }

    // ----------------- AI turns -----------------

    /**
     * Plays the current AI player's turn, if it is one.
     *
     * @return result of the AI action, empty when it is not an AI's turn or the game is not running
     * @throws ResourceExhaustedException if the AI has no target left
     */
    public synchronized Optional<ActionResult> advanceOneAiTurn() {
        if (state != GameState.PLAYING || rules.simultaneousFire()) {
            return Optional.empty();
        }
        Player current = players.get(turnIndex);
        if (!(current instanceof AiPlayer ai)) {
            return Optional.empty();
        }
        return Optional.of(fireAsAi(ai));
    }

    /**
     * Plays AI turns until a human is to move or the game ends.
     *
     * <p>In simultaneous mode every active AI fires once. Each move is applied atomically; readers
     * may observe the game between two moves.
     */
    public List<ActionResult> advanceAiTurns() {
        List<ActionResult> results = new ArrayList<>();
        if (rules.simultaneousFire()) {
            for (Player player : getPlayers()) {
                if (player instanceof AiPlayer ai) {
                    fireIfActive(ai).ifPresent(results::add);
                }
            }
            return results;
        }
        Optional<ActionResult> next;
        while ((next = advanceOneAiTurn()).isPresent()) {
            results.add(next.get());
        }
        return results;
    }

    private synchronized Optional<ActionResult> fireIfActive(AiPlayer ai) {
        if (state != GameState.PLAYING || ai.isEliminated()) {
            return Optional.empty();
        }
        return Optional.of(fireAsAi(ai));
    }

    private ActionResult fireAsAi(AiPlayer ai) {
        Coordinate target = ai.selectTarget(board)
                .orElseThrow(() -> new ResourceExhaustedException(ai.getName() + " has no targets left"));
        return processAction(GameAction.fire(ai.getId(), target));
    }

    // ----------------- human targets -----------------

    /**
     * Opens a target request for a human player. Resolving it does not change the game; the
     * caller submits the chosen coordinate as a FIRE action.
     */
    public synchronized CompletableFuture<Coordinate> requestHumanTarget(UUID playerId, Duration timeout) {
        requireState(GameState.PLAYING, "request a target");
        Player player = requirePlayer(playerId);
        if (!(player instanceof HumanPlayer human)) {
            throw new GameValidationException(player.getName() + " is not a human player");
        }
        return human.requestTarget(timeout);
    }

    public synchronized boolean supplyHumanTarget(UUID playerId, Coordinate target) {
        Player player = requirePlayer(playerId);
        return player instanceof HumanPlayer human && human.supplyTarget(target);
    }

    // ----------------- queries -----------------

    /**
     * @return player whose turn it is, {@code null} when the battle is not running
     */
    public synchronized Player getCurrentPlayer() {
        return state == GameState.PLAYING ? players.get(turnIndex) : null;
    }

    /**
     * Whether the current player may fire a plain shot at the cell.
     */
    public synchronized boolean isValidAttack(int row, int col) {
        Player current = getCurrentPlayer();
        return current != null && current.canShootAt(board, row, col);
    }

    public synchronized boolean isValidAttack(UUID playerId, int row, int col) {
        return state == GameState.PLAYING && requirePlayer(playerId).canShootAt(board, row, col);
    }

    public synchronized List<Player> getPlayers() {
        return List.copyOf(players);
    }

    public synchronized List<Alliance> getAlliances() {
        return List.copyOf(alliances.values());
    }

    public synchronized Optional<Alliance> getAlliance(String allianceId) {
        return Optional.ofNullable(alliances.get(allianceId));
    }

    public synchronized Optional<Player> findPlayer(UUID playerId) {
        return players.stream().filter(p -> p.getId().equals(playerId)).findFirst();
    }

    public synchronized List<EventLogEntry> getEventLog() {
        return List.copyOf(eventLog);
    }

    public synchronized List<PlayerMatchResult> getMatchResults() {
        return List.copyOf(matchResults);
    }

    /**
     * Single-member alliances are shown under the member's name.
     */
    public synchronized String allianceDisplayName(Alliance alliance) {
        if (alliance.getMemberIds().size() == 1) {
            return requirePlayer(alliance.getMemberIds().get(0)).getName();
        }
        return alliance.getName();
    }

    public synchronized GameStats getGameStats() {
        Duration duration = Duration.ZERO;
        if (startedAt != null) {
            duration = Duration.between(startedAt, finishedAt != null ? finishedAt : Instant.now());
        }
        String winnerName = winner == null ? null : allianceDisplayName(alliances.get(winner));
        int totalTurns = startedAt == null ? 0 : (state == GameState.FINISHED ? turnNumber : turnNumber - 1);
        return new GameStats(state, duration, totalTurns, winner, winnerName,
                players.stream().map(PlayerStats::of).toList());
    }

    Ship shipById(int shipId) {
        return ships.get(shipId);
    }

    Player ownerOfShip(int shipId) {
        return shipOwners.get(shipId);
    }

    // ----------------- reset -----------------

    /**
     * Returns the game to SETUP with the same players and alliances: clears the board index and
     * shot history, unplaces all ships, clears statistics and the battle log.
     */
    public synchronized void reset() {
        if (busy.get()) {
            throw new GameStateException("Cannot reset while an action is being processed");
        }
        for (Player player : players) {
            if (player instanceof HumanPlayer human) {
                human.cancelPendingRequest("Game reset");
            }
            player.resetForNewMatch();
        }
        board.clear();
        eventLog.clear();
        matchResults.clear();
        turnIndex = 0;
        turnNumber = 0;
        winner = null;
        startedAt = null;
        finishedAt = null;
        state = GameState.SETUP;
        log.info("Game {} reset", gameCode);
    }

    // ----------------- helpers -----------------

    private PlacementZone zoneOf(Player player) {
        return alliances.get(player.getAllianceId()).getPlacementZone();
    }

    private Player requirePlayer(UUID playerId) {
        return findPlayer(playerId)
                .orElseThrow(() -> new GameValidationException("Player does not belong to this game: " + playerId));
    }

    private void requireState(GameState expected, String action) {
        if (state != expected) {
            throw new GameStateException("Cannot " + action + " while game is " + state);
        }
    }

    private EventLogEntry appendLog(String message) {
        EventLogEntry entry = EventLogEntry.of(turnNumber, message);
        eventLog.add(entry);
        return entry;
    }

    private void notifyListener(ActionResult result) {
        if (actionListener == null) {
            return;
        }
        try {
            actionListener.accept(result);
        } catch (RuntimeException e) {
            log.warn("Action listener failed for game {}: {}", gameCode, e.getMessage(), e);
        }
    }
}
