package org.snek.cli.commands;

import org.snek.runtime.GameController;
import org.snek.runtime.GameState;
import org.snek.runtime.model.Direction;
import org.snek.runtime.model.TurnOutcome;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Tag("unit")
class ReplayScriptTest {

    @Test
    void parsesTurnsAdvancesAndRepeats() {
        ReplayScript script = ReplayScript.parse("R, t0.25*3 down,T1.5");

        assertThat(script.steps()).containsExactly(
            new ReplayScript.Step(Direction.RIGHT, 0.0),
            new ReplayScript.Step(null, 0.25),
            new ReplayScript.Step(null, 0.25),
            new ReplayScript.Step(null, 0.25),
            new ReplayScript.Step(Direction.DOWN, 0.0),
            new ReplayScript.Step(null, 1.5));
    }

    @Test
    void emptyScriptHasNoSteps() {
        assertThat(ReplayScript.parse("").steps()).isEmpty();
        assertThat(ReplayScript.parse(null).steps()).isEmpty();
    }

    @Test
    void rejectsMalformedTokens() {
        assertThatThrownBy(() -> ReplayScript.parse("tx")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReplayScript.parse("t-1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReplayScript.parse("R*0")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReplayScript.parse("R*z")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReplayScript.parse("Q")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void capsRepeatCount() {
        assertThat(ReplayScript.parse("t0.25*" + ReplayScript.MAX_REPEAT).steps()).hasSize(ReplayScript.MAX_REPEAT);
        assertThatThrownBy(() -> ReplayScript.parse("t0.25*" + (ReplayScript.MAX_REPEAT + 1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("between 1 and");
        assertThatThrownBy(() -> ReplayScript.parse("t0.25*2000000000")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void feedsStepsInOrder() {
        GameController controller = mock(GameController.class);
        when(controller.requestDirection(Direction.UP)).thenReturn(TurnOutcome.ACCEPTED);
        when(controller.requestDirection(Direction.DOWN)).thenReturn(TurnOutcome.REJECTED_OPPOSITE);

        int refused = ReplayScript.parse("U t0.5 D").playOn(controller);

        assertThat(refused).isEqualTo(1);
        InOrder order = inOrder(controller);
        order.verify(controller).requestDirection(Direction.UP);
        order.verify(controller).advance(0.5);
        order.verify(controller).requestDirection(Direction.DOWN);
    }

    @Test
    void drivesARealGame() {
        GameController controller = new GameController(3, 3);

        ReplayScript.parse("t1").playOn(controller);

        assertThat(controller.state()).isEqualTo(GameState.START);
    }
}
