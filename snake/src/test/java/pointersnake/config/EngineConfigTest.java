package pointersnake.config;

import org.junit.jupiter.api.Test;
import pointersnake.core.Margins;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    @Test
    void defaultsAreValid() {
        EngineConfig cfg = EngineConfig.defaults().validate();

        assertThat(cfg.tickMs()).isEqualTo(120);
        assertThat(cfg.pauseAfterMs()).isEqualTo(600);
        assertThat(cfg.maxCatchUp()).isEqualTo(3);
        assertThat(cfg.growPerFood()).isEqualTo(2);
        assertThat(cfg.margins().bottom()).isEqualTo(Margins.SIDE + Margins.HAND_SPACE);
        assertThat(cfg.deadzonePx()).isCloseTo(26 * 0.55, org.assertj.core.data.Offset.offset(1e-9));
    }

    @Test
    void negativeCellSizeIsRejected() {
        EngineConfig cfg = EngineConfig.defaults().withPlayfield(1280, 720, Margins.defaults(), -4);

        assertThatThrownBy(cfg::validate)
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("cellSize");
    }

    @Test
    void negativeMarginIsRejected() {
        EngineConfig cfg = EngineConfig.defaults().withPlayfield(1280, 720, new Margins(-1, 0, 0, 0), 26);

        assertThatThrownBy(cfg::validate).isInstanceOf(ConfigException.class).hasMessageContaining("margins");
    }

    @Test
    void zeroCatchUpIsRejected() {
        EngineConfig d = EngineConfig.defaults();
        EngineConfig cfg = new EngineConfig(d.pixelWidth(), d.pixelHeight(), d.margins(), d.cellSize(),
                d.foodCells(), d.tickMs(), d.deadzoneFraction(), d.pauseAfterMs(), 0, d.growPerFood(), d.eatFlashMs());

        assertThatThrownBy(cfg::validate).isInstanceOf(ConfigException.class).hasMessageContaining("maxCatchUp");
    }

    @Test
    void nanDeadzoneIsRejected() {
        EngineConfig d = EngineConfig.defaults();
        EngineConfig cfg = new EngineConfig(d.pixelWidth(), d.pixelHeight(), d.margins(), d.cellSize(),
                d.foodCells(), d.tickMs(), Double.NaN, d.pauseAfterMs(), d.maxCatchUp(), d.growPerFood(), d.eatFlashMs());

        assertThatThrownBy(cfg::validate).isInstanceOf(ConfigException.class).hasMessageContaining("deadzone");
    }
}
