package com.chess.ingest.pgn;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PlayerNamesTest {

    @Test
    void naturalKeyIgnoresCaseAndWhitespace() {
        assertThat(PlayerNames.naturalKey("  Magnus   Carlsen ")).isEqualTo("magnus carlsen");
        assertThat(PlayerNames.naturalKey("MAGNUS CARLSEN")).isEqualTo(PlayerNames.naturalKey("magnus carlsen"));
    }

    @Test
    void displayNameKeepsCase() {
        assertThat(PlayerNames.displayName(" Hikaru\tNakamura ")).isEqualTo("Hikaru Nakamura");
    }

    @Test
    void titleTagWins() {
        assertThat(PlayerNames.title("im", "GM_Someone")).contains("IM");
    }

    @Test
    void titleFromUsernameMarker() {
        assertThat(PlayerNames.title(null, "GM_Hikaru")).contains("GM");
        assertThat(PlayerNames.title(null, "someone-IM")).contains("IM");
        assertThat(PlayerNames.title("-", "WGM_Anna")).contains("WGM");
    }

    @Test
    void noTitleWithoutMarker() {
        assertThat(PlayerNames.title(null, "gmail_fan")).isEmpty();
        assertThat(PlayerNames.title("", "alice")).isEmpty();
    }
}
