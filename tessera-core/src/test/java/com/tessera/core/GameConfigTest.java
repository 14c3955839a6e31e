package com.tessera.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class GameConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(GameConfig.RADIUS_PROPERTY);
        System.clearProperty(GameConfig.COPIES_PROPERTY);
    }

    @Test
    void defaultsDescribeSingleCopyRadiusSixBoard() {
        GameConfig config = GameConfig.defaults();

        assertEquals(6, config.boardRadius());
        assertEquals(1, config.copiesPerTile());
        assertEquals(63, config.handSize());
        assertEquals(63, config.initialHand().size());
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty(GameConfig.RADIUS_PROPERTY, "4");
        System.setProperty(GameConfig.COPIES_PROPERTY, "2");

        GameConfig config = GameConfig.fromSystemProperties();

        assertEquals(new GameConfig(4, 2), config);
        assertEquals(126, config.handSize());
    }

    @Test
    void missingPropertiesFallBackToDefaults() {
        assertEquals(GameConfig.defaults(), GameConfig.fromSystemProperties());
    }

    @Test
    void withersValidate() {
        GameConfig config = GameConfig.defaults().withBoardRadius(2).withCopiesPerTile(3);
        assertEquals(new GameConfig(2, 3), config);

        assertThrows(IllegalArgumentException.class, () -> config.withBoardRadius(0));
        assertThrows(IllegalArgumentException.class, () -> config.withBoardRadius(GameConfig.MAX_RADIUS + 1));
        assertThrows(IllegalArgumentException.class, () -> config.withCopiesPerTile(0));
        assertThrows(IllegalArgumentException.class, () -> config.withCopiesPerTile(GameConfig.MAX_COPIES + 1));
    }
}
