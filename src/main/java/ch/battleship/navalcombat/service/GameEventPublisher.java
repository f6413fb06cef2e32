package ch.battleship.navalcombat.service;

import ch.battleship.navalcombat.web.api.dto.GameEventDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Sends game notifications to the per-game STOMP topic.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GameEventPublisher {

    private final SimpMessagingTemplate messagingTemplate;

    public static String destination(String gameCode) {
        return "/topic/games/" + gameCode + "/events";
    }

    public void publish(GameEventDto event) {
        if (messagingTemplate == null) return;
        messagingTemplate.convertAndSend(destination(event.gameCode()), event);
        log.debug("Published {} for game {}", event.type(), event.gameCode());
    }
}
