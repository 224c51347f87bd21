package com.example.musictaste.domain.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.musictaste.domain.model.EraRange;
import com.example.musictaste.domain.model.PreferenceProfile;
import com.example.musictaste.domain.model.Song;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import org.junit.jupiter.api.Test;

class HardFilterTest {

    private final PreferenceProfile profile = new PreferenceProfile(
            Collections.singletonList("en"),
            Collections.singletonList(new EraRange(1990, 1999)),
            Collections.<Long>emptyList());

    private final Song english90s = song(1L, "en", 1995);
    private final Song spanish90s = song(2L, "es", 1995);
    private final Song english00s = song(3L, "en", 2005);
    private final Song englishUndated = song(4L, "en", null);
    private final Song english99 = song(5L, "en", 1999);

    @Test
    void shouldRejectWrongLanguageOrEra() {
        assertTrue(HardFilter.admits(english90s, profile));
        assertTrue(HardFilter.admits(english99, profile));
        assertFalse(HardFilter.admits(spanish90s, profile));
        assertFalse(HardFilter.admits(english00s, profile));
        assertFalse(HardFilter.admits(englishUndated, profile));
    }

    @Test
    void emptyPreferencesShouldAdmitEverything() {
        List<Song> all = Arrays.asList(english90s, spanish90s, english00s, englishUndated);

        assertEquals(all, HardFilter.apply(all, PreferenceProfile.empty()));
    }

    @Test
    void applyShouldBeIdempotentAndKeepInputOrder() {
        List<Song> all = Arrays.asList(english99, spanish90s, english90s, english00s, englishUndated);

        List<Song> once = HardFilter.apply(all, profile);
        List<Song> twice = HardFilter.apply(once, profile);

        assertEquals(Arrays.asList(english99, english90s), once);
        assertEquals(once, twice);
    }

    @Test
    void admittedSetShouldNotDependOnInputOrder() {
        List<Song> all = new ArrayList<>(Arrays.asList(english99, spanish90s, english90s, english00s, englishUndated));
        List<Song> reversed = new ArrayList<>(all);
        Collections.reverse(reversed);

        assertEquals(new HashSet<>(HardFilter.apply(all, profile)), new HashSet<>(HardFilter.apply(reversed, profile)));
    }

    private static Song song(long id, String language, Integer year) {
        return new Song(id, 1L, "song-" + id, Collections.singletonList("rock"), language, year, 0.5D);
    }
}
