package org.snek.runtime.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DirectionTest {

    @Test
    void onlyExactReversalsAreOpposite() {
        assertThat(Direction.LEFT.isOpposite(Direction.RIGHT)).isTrue();
        assertThat(Direction.UP.isOpposite(Direction.DOWN)).isTrue();
        assertThat(Direction.LEFT.isOpposite(Direction.UP)).isFalse();
        assertThat(Direction.LEFT.isOpposite(Direction.LEFT)).isFalse();
        assertThat(Direction.NONE.isOpposite(Direction.NONE)).isFalse();
        assertThat(Direction.NONE.isOpposite(Direction.LEFT)).isFalse();
    }

    @Test
    void translateAndBehindAreInverse() {
        Position p = new Position(2, 2);
        for (Direction d : Direction.values()) {
            assertThat(p.translate(d).behind(d)).isEqualTo(p);
        }
        assertThat(p.translate(Direction.UP)).isEqualTo(new Position(2, 1));
        assertThat(p.translate(Direction.NONE)).isEqualTo(p);
    }

    @Test
    void parsesTokens() {
        assertThat(Direction.fromToken("l")).isEqualTo(Direction.LEFT);
        assertThat(Direction.fromToken("Down")).isEqualTo(Direction.DOWN);
        assertThatThrownBy(() -> Direction.fromToken("none")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Direction.fromToken("x")).isInstanceOf(IllegalArgumentException.class);
    }
}
