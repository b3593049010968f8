package org.trump304.dto.game;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.trump304.model.game.Card;
import org.trump304.model.game.ErrorCode;
import org.trump304.service.game.command.Command;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ActionMsgTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void json_bidWithSeq() throws Exception {
        ActionMsg msg = mapper.readValue(
                "{\"player_id\":\"p1\",\"action\":\"bid\",\"amount\":170,\"seq\":4}", ActionMsg.class);

        assertThat(msg.getPlayerId()).isEqualTo("p1");
        assertThat(msg.toCommand()).isEqualTo(new Command.PlaceBid(170, 4L));
    }

    @Test
    void selectTrump_parsesSuitAndCard() {
        ActionMsg msg = ActionMsg.builder().action("select_trump").suit("hearts").card("J_hearts").build();

        assertThat(msg.toCommand())
                .isEqualTo(new Command.SelectTrump(Card.Suit.HEARTS, Card.fromId("J_hearts"), null));
    }

    @Test
    void exchangeCards_parsesList() {
        ActionMsg msg = ActionMsg.builder().action("exchange_cards").cards(List.of("7_clubs", "A_spades")).build();

        Command.ExchangeCards cmd = (Command.ExchangeCards) msg.toCommand();

        assertThat(cmd.cards()).containsExactly(Card.fromId("7_clubs"), Card.fromId("A_spades"));
    }

    @Test
    void simpleActions_mapToTheirCommand() {
        assertThat(ActionMsg.builder().action("PASS").build().toCommand()).isInstanceOf(Command.Pass.class);
        assertThat(ActionMsg.builder().action("ask_trump").build().toCommand().type())
                .isEqualTo(Command.ActionType.ASK_TRUMP);
        assertThat(ActionMsg.builder().action("reveal_trump").build().toCommand().type())
                .isEqualTo(Command.ActionType.REVEAL_TRUMP);
        assertThat(ActionMsg.builder().action("start_game").build().toCommand().type())
                .isEqualTo(Command.ActionType.START_GAME);
        assertThat(ActionMsg.builder().action("skip_exchange").build().toCommand().type())
                .isEqualTo(Command.ActionType.SKIP_EXCHANGE);
    }

    @Test
    void unknownAction_rejected() {
        assertThatThrownBy(() -> ActionMsg.builder().action("double").build().toCommand())
                .extracting("code").isEqualTo(ErrorCode.UNKNOWN_ACTION);
    }

    @Test
    void bidWithoutAmount_rejected() {
        assertThatThrownBy(() -> ActionMsg.builder().action("bid").build().toCommand())
                .extracting("code").isEqualTo(ErrorCode.INVALID_BID_AMOUNT);
    }

    @Test
    void playUnknownCard_rejected() {
        assertThatThrownBy(() -> ActionMsg.builder().action("play_card").card("Z_hearts").build().toCommand())
                .extracting("code").isEqualTo(ErrorCode.UNKNOWN_CARD);
    }
}
