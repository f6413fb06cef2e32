package ch.battleship.navalcombat.web.api.controller;

import ch.battleship.navalcombat.service.GameService;
import ch.battleship.navalcombat.web.api.dto.*;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.NoSuchElementException;
import java.util.UUID;

@RestController
@RequestMapping("/api/games")
public class GameController {

    private final GameService gameService;

    public GameController(GameService gameService) {
        this.gameService = gameService;
    }

    @Operation(summary = "Create a new game from a built-in era")
    @PostMapping
    public ResponseEntity<CreateGameResponseDto> createGame(@RequestBody(required = false) CreateGameRequest request) {
        try {
            String eraId = request == null ? null : request.eraId();
            return ResponseEntity.ok(gameService.createGamePublic(eraId));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Add a human or AI player (SETUP only)")
    @PostMapping("/{gameCode}/players")
    public ResponseEntity<JoinGameResponseDto> joinGame(@PathVariable String gameCode,
                                                        @RequestBody JoinGameRequest request) {
        try {
            return ResponseEntity.ok(gameService.joinGame(gameCode, request));
        } catch (NoSuchElementException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Close the lobby and start fleet placement")
    @PostMapping("/{gameCode}/placement")
    public ResponseEntity<GameStateDto> beginPlacement(@PathVariable String gameCode) {
        try {
            return ResponseEntity.ok(gameService.beginPlacement(gameCode));
        } catch (NoSuchElementException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Place one ship from a start cell and a drag direction (PLACEMENT only)")
    @PostMapping("/{gameCode}/ships/{shipId}")
    public ResponseEntity<ActionResultDto> placeShip(@PathVariable String gameCode,
                                                     @PathVariable int shipId,
                                                     @RequestBody PlaceShipRequest request) {
        try {
            return ResponseEntity.ok(gameService.placeShip(gameCode, shipId, request));
        } catch (NoSuchElementException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Place the remaining ships of a player's fleet at random (PLACEMENT only)")
    @PostMapping("/{gameCode}/players/{playerId}/auto-place")
    public ResponseEntity<ActionResultDto> autoPlace(@PathVariable String gameCode,
                                                     @PathVariable UUID playerId) {
        try {
            return ResponseEntity.ok(gameService.autoPlace(gameCode, playerId));
        } catch (NoSuchElementException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Start the battle once every fleet is placed (AI fleets are placed automatically)")
    @PostMapping("/{gameCode}/start")
    public ResponseEntity<GameStateDto> startBattle(@PathVariable String gameCode) {
        try {
            return ResponseEntity.ok(gameService.startBattle(gameCode));
        } catch (NoSuchElementException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Process an action (place ship, auto-place, fire a munition)")
    @PostMapping("/{gameCode}/actions")
    public ResponseEntity<ActionResultDto> processAction(@PathVariable String gameCode,
                                                         @RequestBody ActionRequest request) {
        try {
            return ResponseEntity.ok(gameService.processAction(gameCode, request));
        } catch (NoSuchElementException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Answer a pending target request of a human player")
    @PostMapping("/{gameCode}/targets")
    public ResponseEntity<Void> submitTarget(@PathVariable String gameCode,
                                             @RequestBody TargetSubmissionRequest request) {
        try {
            gameService.submitTarget(gameCode, request);
            return ResponseEntity.accepted().build();
        } catch (NoSuchElementException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Get the game state, optionally from one player's perspective")
    @GetMapping("/{gameCode}")
    public ResponseEntity<GameStateDto> getGame(@PathVariable String gameCode,
                                                @RequestParam(required = false) UUID playerId) {
        try {
            return ResponseEntity.ok(gameService.getState(gameCode, playerId));
        } catch (NoSuchElementException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Get match statistics and, once finished, the per-player match results")
    @GetMapping("/{gameCode}/stats")
    public ResponseEntity<GameStatsDto> getStats(@PathVariable String gameCode) {
        try {
            return ResponseEntity.ok(gameService.getStats(gameCode));
        } catch (NoSuchElementException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(summary = "Check whether a cell may be attacked (by the given player or the current player)")
    @GetMapping("/{gameCode}/valid-attack")
    public ResponseEntity<ValidAttackDto> isValidAttack(@PathVariable String gameCode,
                                                        @RequestParam(required = false) UUID playerId,
                                                        @RequestParam int row,
                                                        @RequestParam int col) {
        try {
            return ResponseEntity.ok(gameService.isValidAttack(gameCode, playerId, row, col));
        } catch (NoSuchElementException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Reset the game to SETUP keeping players and alliances")
    @PostMapping("/{gameCode}/reset")
    public ResponseEntity<GameStateDto> resetGame(@PathVariable String gameCode) {
        try {
            return ResponseEntity.ok(gameService.resetGame(gameCode));
        } catch (NoSuchElementException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }
}
